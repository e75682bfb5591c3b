package com.engagesphere.booster.domain.exception;

/**
 * Base type for user-correctable failures raised by the workflows.
 */
public abstract class EngagementException extends RuntimeException {

    private final String code;

    protected EngagementException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
