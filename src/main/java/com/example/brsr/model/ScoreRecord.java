package com.example.brsr.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Aggregate ESG score of one company for one report year (collection esg_scores).
 * Recalculation replaces the whole record.
 */
@Document(collection = "esg_scores")
@CompoundIndex(name = "company_year", def = "{'companyId': 1, 'reportYear': 1}", unique = true)
public record ScoreRecord(
        @Id String id,
        long companyId,
        int reportYear,
        double environmentalScore,
        double socialScore,
        double governanceScore,
        double overallScore,
        CalculationMetadata calculationMetadata,
        Instant calculatedAt
) {
    public double pillarScore(Pillar pillar) {
        return switch (pillar) {
            case ENVIRONMENTAL -> environmentalScore;
            case SOCIAL -> socialScore;
            case GOVERNANCE -> governanceScore;
        };
    }
}
