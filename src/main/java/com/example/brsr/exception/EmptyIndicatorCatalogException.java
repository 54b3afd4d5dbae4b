package com.example.brsr.exception;

public class EmptyIndicatorCatalogException extends PreconditionFailedException {

    public EmptyIndicatorCatalogException() {
        super("No BRSR indicator definitions available");
    }
}
