package com.example.brsr.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Known spellings of the units used in BRSR disclosures.
 */
public final class UnitVariations {

    private static final Map<String, List<String>> VARIATIONS = new LinkedHashMap<>();

    static {
        VARIATIONS.put("%", List.of("%", "percent", "percentage", "pct"));
        VARIATIONS.put("mt", List.of("mt", "metric ton", "metric tons", "metric tonne", "tonne", "tonnes", "tons"));
        VARIATIONS.put("kg", List.of("kg", "kgs", "kilogram", "kilograms"));
        VARIATIONS.put("kl", List.of("kl", "kiloliter", "kiloliters", "kilolitre", "kilolitres"));
        VARIATIONS.put("lt", List.of("lt", "litre", "litres", "liter", "liters"));
        VARIATIONS.put("joule", List.of("joule", "joules", "gj", "tj", "mj", "mwh", "kwh", "gwh"));
        VARIATIONS.put("co2", List.of("co2", "co2e", "co2eq", "carbon dioxide"));
        VARIATIONS.put("count", List.of("count", "number", "total", "nos", "#"));
        VARIATIONS.put("day", List.of("day", "days"));
        VARIATIONS.put("per million", List.of("per million", "per 1000000", "/million", "/1000000"));
    }

    private UnitVariations() {
    }

    /**
     * Whether the text contains the expected unit or one of its known spellings.
     * Short tokens (mt, kg, gj...) only match as whole words.
     */
    public static boolean textMentionsUnit(String text, String expectedUnit) {
        if (text == null || expectedUnit == null || expectedUnit.isBlank()) {
            return false;
        }
        String t = text.toLowerCase(Locale.ROOT);
        String unit = expectedUnit.toLowerCase(Locale.ROOT).trim();
        if (t.contains(unit)) {
            return true;
        }
        for (Map.Entry<String, List<String>> entry : VARIATIONS.entrySet()) {
            if (!unit.contains(entry.getKey())) continue;
            for (String variation : entry.getValue()) {
                if (mentions(t, variation)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean mentions(String haystack, String token) {
        if (token.length() > 3 || !Character.isLetter(token.charAt(0))) {
            return haystack.contains(token);
        }
        return Pattern.compile("(?<![a-z])" + Pattern.quote(token) + "(?![a-z])").matcher(haystack).find();
    }
}
