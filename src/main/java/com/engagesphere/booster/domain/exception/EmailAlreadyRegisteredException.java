package com.engagesphere.booster.domain.exception;

public class EmailAlreadyRegisteredException extends EngagementException {

    public EmailAlreadyRegisteredException(String email) {
        super("EMAIL_TAKEN", "Email already registered: " + email);
    }
}
