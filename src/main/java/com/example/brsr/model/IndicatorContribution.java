package com.example.brsr.model;

import java.util.List;

/**
 * How a single indicator fed into its pillar score, with the citation that grounds it.
 *
 * @param normalizedValue raw value mapped onto 0-100
 * @param contribution    normalizedValue * weight
 */
public record IndicatorContribution(
        String indicatorCode,
        String parameterName,
        double rawValue,
        String unit,
        double normalizedValue,
        double weight,
        double contribution,
        double confidence,
        List<Integer> sourcePages,
        List<String> sourceChunkIds
) {
    public IndicatorContribution {
        sourcePages = sourcePages != null ? List.copyOf(sourcePages) : List.of();
        sourceChunkIds = sourceChunkIds != null ? List.copyOf(sourceChunkIds) : List.of();
    }
}
