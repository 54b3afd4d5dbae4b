package com.example.brsr.exception;

public class MalformedDocumentKeyException extends PreconditionFailedException {

    private final String documentKey;

    public MalformedDocumentKeyException(String documentKey) {
        super("Invalid document key format: '" + documentKey
                + "'. Expected {companyName}/{reportYear}_{reportType}.{ext}");
        this.documentKey = documentKey;
    }

    public String getDocumentKey() {
        return documentKey;
    }
}
