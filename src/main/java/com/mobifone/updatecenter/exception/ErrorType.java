package com.mobifone.updatecenter.exception;

// Cause discriminator surfaced with every rejected operation
public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    SUBMISSION,
    POLLING_TIMEOUT,
    RECONCILIATION_MISMATCH,
    EXTERNAL_SERVICE,
    UNCATEGORIZED
}
