package com.engagesphere.booster.domain.exception;

public class UserNotFoundException extends EngagementException {

    public UserNotFoundException(long userId) {
        super("USER_NOT_FOUND", "User not found: " + userId);
    }
}
