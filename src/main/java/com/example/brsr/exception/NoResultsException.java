package com.example.brsr.exception;

/**
 * The filtered similarity search returned nothing relevant for the query.
 */
public class NoResultsException extends EsgPipelineException {

    public NoResultsException(String companyName, int reportYear, String query) {
        super("No relevant chunks for %s %d (query: '%s')".formatted(
                companyName, reportYear, query.length() > 80 ? query.substring(0, 80) + "..." : query));
    }
}
