package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.model.User;
import java.util.Optional;

public interface ManageUsers {

    /**
     * Creates a user. The first user ever created is granted admin rights.
     *
     * @throws com.engagesphere.booster.domain.exception.EmailAlreadyRegisteredException if the email is taken
     */
    User create(User user);

    /**
     * Returns the user stored under the same email, or creates one from the given profile
     */
    User findOrCreate(User user);

    Optional<User> findById(long userId);

    User updateContact(long userId, String preferredContactMethod, String phoneNumber);
}
