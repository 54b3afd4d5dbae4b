package com.example.brsr.repository;

import com.example.brsr.model.Company;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface CompanyRepository extends MongoRepository<Company, String> {

    Optional<Company> findFirstByCompanyNameIgnoreCaseOrSymbolIgnoreCase(String companyName, String symbol);
}
