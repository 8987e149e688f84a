package com.paperless.rest.model;

public enum DocumentStatus {
    OCR_PENDING,   // OCR command published, no result yet
    OCR_COMPLETED,
    OCR_FAILED
}
