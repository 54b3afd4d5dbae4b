package com.example.brsr.service;

import com.example.brsr.model.NumericRange;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plausible value range per indicator code, loaded from an external JSON table.
 * <p>
 * Codes missing from the table fall back to a rule: percentage-typed indicators
 * ({@code %} unit or {@code _PERCENT} code) get [0, 100], everything else is non-negative and unbounded.
 */
public final class NumericRangeTable {

    private final Map<String, NumericRange> ranges;

    public NumericRangeTable(Map<String, NumericRange> ranges) {
        this.ranges = Map.copyOf(ranges);
    }

    public static NumericRangeTable load(Resource resource, ObjectMapper mapper) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            RangeFile file = mapper.readValue(in, RangeFile.class);
            Map<String, NumericRange> ranges = new HashMap<>();
            if (file.ranges() != null) {
                for (RangeEntry e : file.ranges()) {
                    ranges.put(e.indicatorCode(), new NumericRange(e.min(), e.max(), e.allowZero()));
                }
            }
            return new NumericRangeTable(ranges);
        }
    }

    public NumericRange rangeFor(String indicatorCode, String unit) {
        NumericRange explicit = ranges.get(indicatorCode);
        if (explicit != null) {
            return explicit;
        }
        return isPercentageTyped(indicatorCode, unit) ? NumericRange.PERCENTAGE : NumericRange.NON_NEGATIVE;
    }

    public static boolean isPercentageTyped(String indicatorCode, String unit) {
        return (unit != null && unit.trim().equals("%"))
                || (indicatorCode != null && indicatorCode.toUpperCase(Locale.ROOT).endsWith("_PERCENT"));
    }

    public int size() {
        return ranges.size();
    }

    record RangeFile(List<RangeEntry> ranges) {}

    record RangeEntry(String indicatorCode, Double min, Double max, boolean allowZero) {}
}
