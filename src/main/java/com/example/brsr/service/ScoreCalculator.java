package com.example.brsr.service;

import com.example.brsr.config.ExtractionProperties;
import com.example.brsr.config.ExtractionProperties.PillarWeights;
import com.example.brsr.model.CalculationMetadata;
import com.example.brsr.model.ExtractedIndicator;
import com.example.brsr.model.IndicatorContribution;
import com.example.brsr.model.IndicatorDefinition;
import com.example.brsr.model.Pillar;
import com.example.brsr.model.PillarBreakdown;
import com.example.brsr.model.ScoreRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates validated indicators into pillar scores and an overall ESG score.
 * <p>
 * Pillar score: weighted average of normalized values (see {@link IndicatorNormalizer}) over the
 * pillar's VALID indicators with a numeric value, weighted by each definition's weight.
 * A pillar with nothing to score is 0. Overall score: weighted average of the three pillar
 * scores under the configured pillar weights.
 */
@Service
public class ScoreCalculator {

    private static final Logger log = LoggerFactory.getLogger(ScoreCalculator.class);

    private final PillarWeights pillarWeights;

    @Autowired
    public ScoreCalculator(ExtractionProperties properties) {
        this(properties.scoring().pillarWeights());
    }

    public ScoreCalculator(PillarWeights pillarWeights) {
        this.pillarWeights = pillarWeights;
    }

    public ScoreRecord calculate(long companyId, int reportYear, List<ExtractedIndicator> indicators,
                                 Collection<IndicatorDefinition> definitions) {
        Map<String, IndicatorDefinition> byCode = new HashMap<>();
        for (IndicatorDefinition d : definitions) {
            byCode.putIfAbsent(d.indicatorCode(), d);
        }

        Map<Pillar, PillarBreakdown> breakdowns = new EnumMap<>(Pillar.class);
        int considered = 0;
        for (Pillar pillar : Pillar.values()) {
            PillarBreakdown breakdown = scorePillar(pillar, indicators, byCode);
            breakdowns.put(pillar, breakdown);
            considered += breakdown.indicatorCodes().size();
        }

        double weightedSum = 0.0;
        double weightTotal = 0.0;
        Map<String, Double> weightsUsed = new LinkedHashMap<>();
        for (Pillar pillar : Pillar.values()) {
            double w = pillarWeights.weightFor(pillar);
            weightedSum += breakdowns.get(pillar).score() * w;
            weightTotal += w;
            weightsUsed.put(pillar.code(), w);
        }
        // configured weights may sum to 1 +- 0.01
        double overall = Math.max(0.0, Math.min(100.0, weightedSum / weightTotal));

        CalculationMetadata metadata = new CalculationMetadata(
                breakdowns.get(Pillar.ENVIRONMENTAL),
                breakdowns.get(Pillar.SOCIAL),
                breakdowns.get(Pillar.GOVERNANCE),
                weightsUsed,
                describeMethod(),
                considered);

        log.info("Scores for company {} year {}: E={} S={} G={} overall={} ({} indicators)",
                companyId, reportYear,
                round(breakdowns.get(Pillar.ENVIRONMENTAL).score()),
                round(breakdowns.get(Pillar.SOCIAL).score()),
                round(breakdowns.get(Pillar.GOVERNANCE).score()),
                round(overall), considered);

        return new ScoreRecord(null, companyId, reportYear,
                breakdowns.get(Pillar.ENVIRONMENTAL).score(),
                breakdowns.get(Pillar.SOCIAL).score(),
                breakdowns.get(Pillar.GOVERNANCE).score(),
                overall, metadata, Instant.now());
    }

    private PillarBreakdown scorePillar(Pillar pillar, List<ExtractedIndicator> indicators,
                                        Map<String, IndicatorDefinition> byCode) {
        List<String> codes = new ArrayList<>();
        Map<String, Double> weights = new LinkedHashMap<>();
        List<IndicatorContribution> contributions = new ArrayList<>();
        double totalWeight = 0.0;
        double weightedSum = 0.0;

        for (ExtractedIndicator indicator : indicators) {
            if (!indicator.isScorable()) continue;
            IndicatorDefinition definition = byCode.get(indicator.indicatorCode());
            if (definition == null) {
                log.warn("No definition for {}, left out of scoring", indicator.indicatorCode());
                continue;
            }
            if (definition.pillar() != pillar) continue;

            double raw = indicator.numericValue();
            double normalized = IndicatorNormalizer.normalize(raw, definition.measurementUnit());
            double weight = definition.weight();
            double contribution = normalized * weight;

            codes.add(definition.indicatorCode());
            weights.put(definition.indicatorCode(), weight);
            contributions.add(new IndicatorContribution(
                    definition.indicatorCode(), definition.parameterName(), raw, definition.measurementUnit(),
                    normalized, weight, contribution, indicator.confidenceScore(),
                    indicator.sourcePages(), indicator.sourceChunkIds()));
            totalWeight += weight;
            weightedSum += contribution;
        }

        if (codes.isEmpty()) {
            log.debug("No scorable indicators for pillar {}", pillar.code());
            return PillarBreakdown.empty();
        }
        double score = Math.max(0.0, Math.min(100.0, weightedSum / totalWeight));
        return new PillarBreakdown(score, codes, weights, contributions, totalWeight, weightedSum);
    }

    private String describeMethod() {
        return "Pillar score = sum(normalized value * indicator weight) / sum(indicator weight) over VALID "
                + "indicators with a numeric value (0 when none). Overall = (%s*E + %s*S + %s*G) / sum(pillar weights).".formatted(
                IndicatorValidator.format(pillarWeights.environmental()),
                IndicatorValidator.format(pillarWeights.social()),
                IndicatorValidator.format(pillarWeights.governance()));
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
