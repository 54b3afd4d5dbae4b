package com.example.brsr.model;

import java.util.Map;

/**
 * Everything needed to explain a {@link ScoreRecord} back to individual indicators.
 *
 * @param pillarWeights weight of each pillar in the overall score, keyed by pillar code (E, S, G)
 */
public record CalculationMetadata(
        PillarBreakdown environmental,
        PillarBreakdown social,
        PillarBreakdown governance,
        Map<String, Double> pillarWeights,
        String calculationMethod,
        int totalIndicatorsConsidered
) {
    public PillarBreakdown breakdown(Pillar pillar) {
        return switch (pillar) {
            case ENVIRONMENTAL -> environmental;
            case SOCIAL -> social;
            case GOVERNANCE -> governance;
        };
    }
}
