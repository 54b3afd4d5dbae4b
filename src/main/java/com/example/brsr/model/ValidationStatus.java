package com.example.brsr.model;

public enum ValidationStatus {
    PENDING,
    VALID,
    INVALID
}
