package com.platform.driftaudit.error;

/**
 * A resource handed to the engine is missing a field it cannot work without.
 */
public class ValidationException extends DriftAuditException {
    
    private final String field;
    
    public ValidationException(String field, String message) {
        super(ErrorCode.MISSING_REQUIRED_FIELD, String.format("Missing required field '%s': %s", field, message));
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
