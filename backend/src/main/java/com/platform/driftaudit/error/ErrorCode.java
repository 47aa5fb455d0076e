package com.platform.driftaudit.error;

/**
 * Standardized error codes for the drift audit engine.
 * Each error has a unique code that callers can use to take specific actions.
 * 
 * Format: DA-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation and decoding errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    MISSING_REQUIRED_FIELD("DA-102", ErrorCategory.RECOVERABLE),
    MALFORMED_CONFIGURATION("DA-103", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    SERIALIZATION_ERROR("DA-903", ErrorCategory.FATAL);
    
    private final String code;
    private final ErrorCategory category;
    
    ErrorCode(String code, ErrorCategory category) {
        this.code = code;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - caller can fix the input and retry.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the engine is misconfigured or broken.
         */
        FATAL
    }
}
