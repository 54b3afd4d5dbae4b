package com.example.brsr.exception;

public class CompanyNotFoundException extends PreconditionFailedException {

    public CompanyNotFoundException(String companyName) {
        super("Company not found in catalog: " + companyName);
    }
}
