package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.port.out.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CancellationUseCase implements CancelRegistration {

    private static final Logger logger = LoggerFactory.getLogger(CancellationUseCase.class);

    private final RegistrationRepository registrationRepository;
    private final CommunicationScheduler communicationScheduler;

    public CancellationUseCase(RegistrationRepository registrationRepository,
                               CommunicationScheduler communicationScheduler) {
        this.registrationRepository = registrationRepository;
        this.communicationScheduler = communicationScheduler;
    }

    @Override
    public boolean cancel(long userId, long eventId) {
        if (registrationRepository.find(userId, eventId).isEmpty()) {
            logger.debug("No registration for user {} and event {}", userId, eventId);
            return false;
        }

        int cancelledJobs = communicationScheduler.cancelAll(userId, eventId);
        registrationRepository.delete(userId, eventId);

        logger.info("Cancelled registration of user {} for event {} ({} pending jobs removed)",
                userId, eventId, cancelledJobs);
        return true;
    }
}
