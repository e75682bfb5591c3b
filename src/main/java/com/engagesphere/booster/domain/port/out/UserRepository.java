package com.engagesphere.booster.domain.port.out;

import com.engagesphere.booster.domain.model.User;
import java.util.Optional;
import java.util.Set;

/**
 * Repository port for users
 */
public interface UserRepository {

    Optional<User> findById(long userId);

    Optional<User> findByEmail(String email);

    long count();

    User save(User user);

    void updateInterests(long userId, Set<String> interests);

    void updateContact(long userId, String preferredContactMethod, String phoneNumber);
}
