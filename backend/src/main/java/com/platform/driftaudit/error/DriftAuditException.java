package com.platform.driftaudit.error;

/**
 * Base exception for all drift audit exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class DriftAuditException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected DriftAuditException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected DriftAuditException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
