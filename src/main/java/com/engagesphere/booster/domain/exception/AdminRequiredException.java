package com.engagesphere.booster.domain.exception;

public class AdminRequiredException extends EngagementException {

    public AdminRequiredException() {
        super("ADMIN_REQUIRED", "The user does not have administrative privileges");
    }
}
