package com.example.brsr.service;

import com.example.brsr.exception.MalformedDocumentKeyException;
import com.example.brsr.exception.PreconditionFailedException;
import com.example.brsr.model.DocumentKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentKeyParserTest {

    @Test
    void parsesYearPrefixedKey() {
        DocumentKey key = DocumentKeyParser.parse("RELIANCE/2024_BRSR.pdf");

        assertThat(key.companyName()).isEqualTo("RELIANCE");
        assertThat(key.reportYear()).isEqualTo(2024);
        assertThat(key.reportType()).isEqualTo("BRSR");
        assertThat(key.extension()).isEqualTo("pdf");
        assertThat(key.objectKey()).isEqualTo("RELIANCE/2024_BRSR.pdf");
    }

    @Test
    void fiscalYearFolderUsesFirstYear() {
        DocumentKey key = DocumentKeyParser.parse("TCS/2023_2024/Annual_BRSR.PDF");

        assertThat(key.companyName()).isEqualTo("TCS");
        assertThat(key.reportYear()).isEqualTo(2023);
        assertThat(key.reportType()).isEqualTo("Annual_BRSR");
        assertThat(key.extension()).isEqualTo("pdf");
    }

    @ParameterizedTest
    @ValueSource(strings = {"RELIANCE/report.pdf", "RELIANCE/24_BRSR.pdf", "2024_BRSR.pdf", "RELIANCE/2024_BRSR",
            "A/B/2024_BRSR.pdf", " "})
    void rejectsMalformedKeysAsPreconditionFailure(String key) {
        assertThatThrownBy(() -> DocumentKeyParser.parse(key))
                .isInstanceOf(MalformedDocumentKeyException.class)
                .isInstanceOf(PreconditionFailedException.class);
    }
}
