package com.example.brsr.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Lifecycle state of a document, read by the monitoring layer (collection ingestion_metadata).
 */
@Document(collection = "ingestion_metadata")
public record DocumentStatusRecord(
        @Id String objectKey,
        DocumentStatus status,
        String errorMessage,
        Instant updatedAt
) {}
