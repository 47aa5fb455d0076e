package com.platform.driftaudit.error;

/**
 * Thrown when a configuration document is not valid JSON or cannot be represented as a config tree.
 */
public class ConfigDecodingException extends DriftAuditException {
    
    private final String document;
    
    public ConfigDecodingException(String document, Throwable cause) {
        super(ErrorCode.MALFORMED_CONFIGURATION,
            String.format("Failed to parse %s config: %s", document, cause.getMessage()), cause);
        this.document = document;
    }
    
    public ConfigDecodingException(ErrorCode errorCode, String document, String message) {
        super(errorCode, String.format("Failed to convert %s config: %s", document, message));
        this.document = document;
    }
    
    /**
     * Which document failed, e.g. "baseline" or "current".
     */
    public String getDocument() {
        return document;
    }
}
