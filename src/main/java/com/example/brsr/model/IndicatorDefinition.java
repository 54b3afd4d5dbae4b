package com.example.brsr.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * BRSR Core indicator from the reference catalog (collection brsr_indicators).
 *
 * @param indicatorCode         Unique code (e.g. GHG_SCOPE1_TOTAL)
 * @param attributeNumber       BRSR attribute group, 1 to 9
 * @param parameterName         Display name of the parameter
 * @param measurementUnit       Expected unit, {@code null} for qualitative indicators
 * @param pillar                Pillar the indicator scores into
 * @param weight                Relative weight inside its pillar (positive)
 * @param brsrReference         Where the indicator appears in the BRSR form
 */
@Document(collection = "brsr_indicators")
public record IndicatorDefinition(
        @Id String id,
        @Indexed(unique = true) String indicatorCode,
        int attributeNumber,
        String parameterName,
        String description,
        String measurementUnit,
        Pillar pillar,
        double weight,
        String dataAssuranceApproach,
        String brsrReference
) {
    public IndicatorDefinition {
        if (indicatorCode == null || indicatorCode.isBlank()) {
            throw new IllegalArgumentException("indicatorCode is required");
        }
        if (attributeNumber < 1 || attributeNumber > 9) {
            throw new IllegalArgumentException("attributeNumber must be 1-9 for " + indicatorCode);
        }
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be positive for " + indicatorCode);
        }
    }

    public boolean hasUnit() {
        return measurementUnit != null && !measurementUnit.isBlank();
    }
}
