package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.model.Registration;
import com.engagesphere.booster.domain.port.out.RegistrationRepository;
import com.engagesphere.booster.domain.port.out.UserRepository;
import java.time.Instant;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable part of a registration. The merged interests and the registration
 * row are written in one transaction, so a rejected insert leaves the user's
 * interests untouched.
 */
@Component
public class RegistrationWriter {

    private final UserRepository userRepository;
    private final RegistrationRepository registrationRepository;

    public RegistrationWriter(UserRepository userRepository, RegistrationRepository registrationRepository) {
        this.userRepository = userRepository;
        this.registrationRepository = registrationRepository;
    }

    /**
     * @throws com.engagesphere.booster.domain.exception.AlreadyRegisteredException if a concurrent request
     *                                                                           inserted the pair first
     */
    @Transactional
    public Registration write(long userId, long eventId, Set<String> interests, Instant registrationTime) {
        userRepository.updateInterests(userId, interests);
        return registrationRepository.create(userId, eventId, registrationTime);
    }
}
