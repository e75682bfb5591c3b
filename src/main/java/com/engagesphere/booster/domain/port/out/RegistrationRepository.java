package com.engagesphere.booster.domain.port.out;

import com.engagesphere.booster.domain.model.Registration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository port for registrations. Each call is its own transaction.
 */
public interface RegistrationRepository {

    Optional<Registration> find(long userId, long eventId);

    List<Registration> findByEventId(long eventId);

    /**
     * @throws com.engagesphere.booster.domain.exception.AlreadyRegisteredException if the pair is already stored
     */
    Registration create(long userId, long eventId, Instant registrationTime);

    /**
     * @return true if a row was removed
     */
    boolean delete(long userId, long eventId);
}
