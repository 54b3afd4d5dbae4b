package com.example.brsr.model;

public enum DocumentStatus {
    PROCESSING,
    SUCCESS,
    FAILED
}
