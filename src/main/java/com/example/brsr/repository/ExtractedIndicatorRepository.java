package com.example.brsr.repository;

import com.example.brsr.model.ExtractedIndicator;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ExtractedIndicatorRepository extends MongoRepository<ExtractedIndicator, String> {

    boolean existsByDocumentKey(String documentKey);

    List<ExtractedIndicator> findByDocumentKey(String documentKey);
}
