package com.engagesphere.booster.infrastructure.web;

import com.engagesphere.booster.application.ManageUsers;
import com.engagesphere.booster.domain.exception.AdminRequiredException;
import com.engagesphere.booster.domain.exception.AuthenticationRequiredException;
import com.engagesphere.booster.domain.model.User;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns the {@value #USER_ID_HEADER} request header into the calling user.
 * An absent header or an unknown id is an anonymous caller.
 */
@Component
public class CallerResolver {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final ManageUsers manageUsers;

    public CallerResolver(ManageUsers manageUsers) {
        this.manageUsers = manageUsers;
    }

    public Optional<User> resolve(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return manageUsers.findById(userId);
    }

    public User require(Long userId) {
        return resolve(userId).orElseThrow(AuthenticationRequiredException::new);
    }

    public User requireAdmin(Long userId) {
        User caller = require(userId);
        if (!caller.admin()) {
            throw new AdminRequiredException();
        }
        return caller;
    }
}
