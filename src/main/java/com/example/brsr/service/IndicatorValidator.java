package com.example.brsr.service;

import com.example.brsr.model.ExtractedIndicator;
import com.example.brsr.model.IndicatorDefinition;
import com.example.brsr.model.IndicatorExtractionOutput;
import com.example.brsr.model.NumericRange;
import com.example.brsr.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based checks on an extracted indicator against its definition.
 * <ol>
 *   <li>Confidence bound (error)</li>
 *   <li>Required fields (error)</li>
 *   <li>Numeric vs qualitative type (warning)</li>
 *   <li>Numeric range from {@link NumericRangeTable} (error, extreme magnitude is a warning)</li>
 *   <li>Unit mentioned in the raw text (warning)</li>
 * </ol>
 * Stateless: the verdict depends only on the two arguments.
 */
@Component
public class IndicatorValidator {

    private static final Logger log = LoggerFactory.getLogger(IndicatorValidator.class);

    static final Set<String> QUALITATIVE_UNITS = Set.of("n/a", "na", "text", "qualitative");
    static final double EXTREME_MAGNITUDE = 1e15;
    static final int MIN_REPORT_YEAR = 2000;

    private static final Pattern NUMBER = Pattern.compile("-?\\d+\\.?\\d*");

    private final NumericRangeTable rangeTable;

    public IndicatorValidator(NumericRangeTable rangeTable) {
        this.rangeTable = rangeTable;
    }

    public ValidationResult validate(ExtractedIndicator extracted, IndicatorDefinition definition) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        checkConfidence(extracted, errors);
        checkRequiredFields(extracted, definition, errors);
        checkType(extracted, definition, warnings);
        if (extracted.numericValue() != null) {
            checkRange(extracted.numericValue(), definition, errors, warnings);
        }
        checkUnit(extracted, definition, warnings);

        ValidationResult result = ValidationResult.of(errors, warnings);
        if (!result.isValid()) {
            log.debug("{} is INVALID: {}", definition.indicatorCode(), errors);
        }
        return result;
    }

    private void checkConfidence(ExtractedIndicator extracted, List<String> errors) {
        double c = extracted.confidenceScore();
        if (Double.isNaN(c) || c < 0.0 || c > 1.0) {
            errors.add("Confidence score " + c + " is outside [0.0, 1.0] for " + extracted.indicatorCode());
        }
    }

    private void checkRequiredFields(ExtractedIndicator extracted, IndicatorDefinition definition,
                                     List<String> errors) {
        if (isBlank(extracted.extractedValue())) {
            errors.add("Extracted value is empty");
        }
        if (isBlank(extracted.indicatorCode())) {
            errors.add("Indicator code is missing");
        } else if (!extracted.indicatorCode().equals(definition.indicatorCode())) {
            errors.add("Indicator code " + extracted.indicatorCode()
                    + " does not match definition " + definition.indicatorCode());
        }
        if (extracted.companyId() <= 0) {
            errors.add("Invalid company id: " + extracted.companyId());
        }
        if (extracted.reportYear() < MIN_REPORT_YEAR) {
            errors.add("Invalid report year: " + extracted.reportYear());
        }
        if (isBlank(extracted.documentKey())) {
            errors.add("Document key is missing");
        }
    }

    private void checkType(ExtractedIndicator extracted, IndicatorDefinition definition, List<String> warnings) {
        boolean numericExpected = expectsNumeric(definition);
        if (numericExpected && extracted.numericValue() == null) {
            StringBuilder msg = new StringBuilder("Expected a numeric value for ")
                    .append(definition.indicatorCode())
                    .append(" (unit '").append(definition.measurementUnit()).append("') but none was parsed");
            String found = firstNumberIn(extracted.extractedValue());
            if (found != null) {
                msg.append("; the text contains ").append(found);
            }
            warnings.add(msg.toString());
        } else if (!numericExpected && extracted.numericValue() != null) {
            warnings.add("Numeric value " + format(extracted.numericValue()) + " given for qualitative indicator "
                    + definition.indicatorCode());
        }
    }

    private void checkRange(double value, IndicatorDefinition definition, List<String> errors,
                            List<String> warnings) {
        String code = definition.indicatorCode();
        NumericRange range = rangeTable.rangeFor(code, definition.measurementUnit());

        if (range.min() != null && value < range.min()) {
            errors.add("Value " + format(value) + " is below minimum " + format(range.min()) + " for " + code);
        }
        if (range.max() != null && value > range.max()) {
            errors.add("Value " + format(value) + " exceeds maximum " + format(range.max()) + " for " + code);
        }
        if (!range.allowZero() && value == 0.0) {
            errors.add("Value is zero for " + code + ": zero not allowed");
        }
        if (Math.abs(value) > EXTREME_MAGNITUDE) {
            warnings.add("Value " + format(value) + " is extremely large for " + code
                    + "; check it is not an extraction error");
        }
    }

    private void checkUnit(ExtractedIndicator extracted, IndicatorDefinition definition, List<String> warnings) {
        if (!expectsNumeric(definition) || isBlank(extracted.extractedValue())) {
            return;
        }
        if (IndicatorExtractionOutput.NOT_FOUND.equalsIgnoreCase(extracted.extractedValue().trim())) {
            return;
        }
        if (!UnitVariations.textMentionsUnit(extracted.extractedValue(), definition.measurementUnit())) {
            warnings.add("Expected unit '" + definition.measurementUnit() + "' not found in extracted value '"
                    + abbreviate(extracted.extractedValue()) + "'");
        }
    }

    static boolean expectsNumeric(IndicatorDefinition definition) {
        return definition.hasUnit()
                && !QUALITATIVE_UNITS.contains(definition.measurementUnit().trim().toLowerCase(Locale.ROOT));
    }

    private static String firstNumberIn(String text) {
        if (text == null) return null;
        Matcher m = NUMBER.matcher(text.replace(",", ""));
        return m.find() ? m.group() : null;
    }

    static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String abbreviate(String s) {
        return s.length() > 60 ? s.substring(0, 57) + "..." : s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
