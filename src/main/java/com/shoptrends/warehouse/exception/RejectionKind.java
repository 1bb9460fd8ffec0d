package com.shoptrends.warehouse.exception;

/**
 * Why a flat record was excluded from the fact set, or flagged during extraction.
 */
public enum RejectionKind {
    VALIDATION_ERROR,
    DUPLICATE_FACT_KEY,
    MISSING_DIMENSION_REFERENCE,
    CONSISTENCY_VIOLATION
}
