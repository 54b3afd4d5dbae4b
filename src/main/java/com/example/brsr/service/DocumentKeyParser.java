package com.example.brsr.service;

import com.example.brsr.exception.MalformedDocumentKeyException;
import com.example.brsr.model.DocumentKey;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses document object keys.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>{@code RELIANCE/2024_BRSR.pdf}: company, report year, report type</li>
 *   <li>{@code RELIANCE/2023_2024/BRSR.pdf}: fiscal-year folder, the first year is the report year</li>
 * </ul>
 */
public final class DocumentKeyParser {

    private static final Pattern YEAR_PREFIXED =
            Pattern.compile("^([^/]+)/(\\d{4})_([^/]+)\\.([A-Za-z0-9]+)$");
    private static final Pattern FISCAL_FOLDER =
            Pattern.compile("^([^/]+)/(\\d{4})_\\d{4}/([^/]+)\\.([A-Za-z0-9]+)$");

    private DocumentKeyParser() {
    }

    /**
     * @throws MalformedDocumentKeyException if the key matches neither form
     */
    public static DocumentKey parse(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new MalformedDocumentKeyException(String.valueOf(objectKey));
        }
        String key = objectKey.trim();
        Matcher m = YEAR_PREFIXED.matcher(key);
        if (!m.matches()) {
            m = FISCAL_FOLDER.matcher(key);
        }
        if (!m.matches()) {
            throw new MalformedDocumentKeyException(key);
        }
        String company = m.group(1).trim();
        if (company.isEmpty()) {
            throw new MalformedDocumentKeyException(key);
        }
        return new DocumentKey(key, company, Integer.parseInt(m.group(2)), m.group(3), m.group(4).toLowerCase());
    }
}
