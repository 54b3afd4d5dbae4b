package com.example.brsr.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Listed company, looked up by name or trading symbol (collection company_catalog).
 */
@Document(collection = "company_catalog")
public record Company(
        @Id String id,
        long companyId,
        String companyName,
        String symbol
) {}
