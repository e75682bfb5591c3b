package com.engagesphere.booster.domain.exception;

public class AuthenticationRequiredException extends EngagementException {

    public AuthenticationRequiredException() {
        super("LOGIN_REQUIRED", "A known user id must be supplied for this operation");
    }
}
