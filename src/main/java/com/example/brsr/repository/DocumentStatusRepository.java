package com.example.brsr.repository;

import com.example.brsr.model.DocumentStatusRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DocumentStatusRepository extends MongoRepository<DocumentStatusRecord, String> {
}
