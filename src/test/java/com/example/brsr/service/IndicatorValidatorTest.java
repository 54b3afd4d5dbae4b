package com.example.brsr.service;

import com.example.brsr.model.ExtractedIndicator;
import com.example.brsr.model.IndicatorDefinition;
import com.example.brsr.model.Pillar;
import com.example.brsr.model.ValidationResult;
import com.example.brsr.model.ValidationStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.time.Instant;
import java.util.List;

import static com.example.brsr.TestFixtures.definition;
import static com.example.brsr.TestFixtures.extracted;
import static com.example.brsr.TestFixtures.ghgScope1;
import static org.assertj.core.api.Assertions.assertThat;

class IndicatorValidatorTest {

    private IndicatorValidator validator;

    private final IndicatorDefinition renewablePercent =
            definition("ENERGY_RENEWABLE_PERCENT", 3, "%", Pillar.ENVIRONMENTAL, 1.0);
    private final IndicatorDefinition paymentDays =
            definition("SUPPLIER_PAYMENT_DAYS", 8, "days", Pillar.GOVERNANCE, 1.0);

    @BeforeEach
    void setUp() throws Exception {
        validator = new IndicatorValidator(
                NumericRangeTable.load(new ClassPathResource("brsr/numeric-ranges.json"), new ObjectMapper()));
    }

    @Nested
    @DisplayName("Numeric range")
    class NumericRangeTests {

        @Test
        @DisplayName("percentage of 150 is invalid and exceeds maximum 100")
        void percentageAboveHundredIsInvalid() {
            ValidationResult result = validator.validate(
                    extracted("ENERGY_RENEWABLE_PERCENT", "150%", 150.0, 0.9), renewablePercent);

            assertThat(result.isValid()).isFalse();
            assertThat(result.status()).isEqualTo(ValidationStatus.INVALID);
            assertThat(result.errors()).anyMatch(e -> e.contains("exceeds maximum 100"));
        }

        @Test
        @DisplayName("percentage of 0 is valid")
        void zeroPercentIsValid() {
            ValidationResult result = validator.validate(
                    extracted("ENERGY_RENEWABLE_PERCENT", "0%", 0.0, 0.9), renewablePercent);

            assertThat(result.isValid()).isTrue();
            assertThat(result.errors()).isEmpty();
        }

        @Test
        @DisplayName("payment days of 0 is invalid: zero not allowed")
        void zeroPaymentDaysIsInvalid() {
            ValidationResult result = validator.validate(
                    extracted("SUPPLIER_PAYMENT_DAYS", "0 days", 0.0, 0.9), paymentDays);

            assertThat(result.isValid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.contains("zero not allowed"));
        }

        @Test
        @DisplayName("percentage codes missing from the table still get [0, 100]")
        void unknownPercentageCodeFallsBackToPercentRange() {
            IndicatorDefinition newMetric = definition("NEW_METRIC_PERCENT", 7, "%", Pillar.SOCIAL, 1.0);

            ValidationResult result = validator.validate(
                    extracted("NEW_METRIC_PERCENT", "101%", 101.0, 0.9), newMetric);

            assertThat(result.errors()).containsExactly("Value 101 exceeds maximum 100 for NEW_METRIC_PERCENT");
        }

        @Test
        void negativeEmissionsAreBelowMinimum() {
            ValidationResult result = validator.validate(
                    extracted("GHG_SCOPE1_TOTAL", "-5 MT CO2e", -5.0, 0.9), ghgScope1());

            assertThat(result.errors()).containsExactly("Value -5 is below minimum 0 for GHG_SCOPE1_TOTAL");
        }

        @Test
        @DisplayName("implausibly large values warn but stay valid")
        void extremeMagnitudeIsOnlyAWarning() {
            ValidationResult result = validator.validate(
                    extracted("GHG_SCOPE1_TOTAL", "2000000000000000 MT CO2e", 2e15, 0.9), ghgScope1());

            assertThat(result.isValid()).isTrue();
            assertThat(result.warnings()).anyMatch(w -> w.contains("extremely large"));
        }
    }

    @Nested
    @DisplayName("Confidence and required fields")
    class RequiredFieldTests {

        @Test
        void confidenceOutsideUnitIntervalIsAnError() {
            ValidationResult result = validator.validate(
                    extracted("GHG_SCOPE1_TOTAL", "1250 MT CO2e", 1250.0, 1.2), ghgScope1());

            assertThat(result.isValid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.startsWith("Confidence score 1.2"));
        }

        @Test
        void missingIdentifiersAreErrors() {
            ExtractedIndicator broken = ExtractedIndicator.pending("", 0, 1999, "GHG_SCOPE1_TOTAL",
                    " ", 10.0, 0.5, List.of(1), List.of(), Instant.now());

            ValidationResult result = validator.validate(broken, ghgScope1());

            assertThat(result.errors()).contains(
                    "Extracted value is empty",
                    "Invalid company id: 0",
                    "Invalid report year: 1999",
                    "Document key is missing");
        }

        @Test
        void indicatorCodeMustMatchDefinition() {
            ValidationResult result = validator.validate(
                    extracted("GHG_SCOPE2_TOTAL", "10 MT CO2e", 10.0, 0.9), ghgScope1());

            assertThat(result.errors()).anyMatch(e -> e.contains("does not match definition"));
        }
    }

    @Nested
    @DisplayName("Type and unit consistency")
    class ConsistencyTests {

        @Test
        @DisplayName("missing numeric value warns and reports the number seen in the text")
        void missingNumericValueWarns() {
            ValidationResult result = validator.validate(
                    extracted("GHG_SCOPE1_TOTAL", "approximately 1,250 tonnes", null, 0.6), ghgScope1());

            assertThat(result.isValid()).isTrue();
            assertThat(result.warnings()).anyMatch(w -> w.contains("Expected a numeric value") && w.contains("1250"));
        }

        @Test
        void numericValueForQualitativeIndicatorWarns() {
            IndicatorDefinition qualitative = definition("POLICY_DISCLOSED", 9, "text", Pillar.GOVERNANCE, 0.5);

            ValidationResult result = validator.validate(
                    extracted("POLICY_DISCLOSED", "Yes", 1.0, 0.9), qualitative);

            assertThat(result.isValid()).isTrue();
            assertThat(result.warnings()).anyMatch(w -> w.contains("qualitative"));
        }

        @Test
        @DisplayName("bare numbers without the unit only warn")
        void absentUnitIsAdvisory() {
            ValidationResult result = validator.validate(
                    extracted("GHG_SCOPE1_TOTAL", "1250", 1250.0, 0.9), ghgScope1());

            assertThat(result.isValid()).isTrue();
            assertThat(result.warnings()).anyMatch(w -> w.contains("Expected unit 'MT CO2e'"));
        }

        @Test
        void unitSynonymsAreAccepted() {
            ValidationResult result = validator.validate(
                    extracted("GHG_SCOPE1_TOTAL", "1,250 tonnes of CO2e", 1250.0, 0.9), ghgScope1());

            assertThat(result.warnings()).isEmpty();
        }
    }

    @Test
    @DisplayName("validating twice gives the same verdict and leaves the record untouched")
    void validationIsIdempotent() {
        ExtractedIndicator indicator = extracted("ENERGY_RENEWABLE_PERCENT", "150%", 150.0, 0.9);
        ExtractedIndicator copy = extracted("ENERGY_RENEWABLE_PERCENT", "150%", 150.0, 0.9);

        ValidationResult first = validator.validate(indicator, renewablePercent);
        ValidationResult second = validator.validate(indicator, renewablePercent);

        assertThat(second).isEqualTo(first);
        assertThat(indicator).isEqualTo(copy);
        assertThat(indicator.validationStatus()).isEqualTo(ValidationStatus.PENDING);
    }
}
