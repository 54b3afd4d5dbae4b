package com.example.brsr.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-pillar provenance: which indicators were used and with which weight.
 * An empty breakdown (score 0, no codes) is recorded for pillars without any scorable indicator.
 */
public record PillarBreakdown(
        double score,
        List<String> indicatorCodes,
        Map<String, Double> weights,
        List<IndicatorContribution> contributions,
        double totalWeight,
        double weightedSum
) {
    public PillarBreakdown {
        indicatorCodes = List.copyOf(indicatorCodes);
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        contributions = List.copyOf(contributions);
    }

    public static PillarBreakdown empty() {
        return new PillarBreakdown(0.0, List.of(), Map.of(), List.of(), 0.0, 0.0);
    }
}
