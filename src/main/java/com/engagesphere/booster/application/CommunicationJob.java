package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.DeliveryLedger;
import com.engagesphere.booster.domain.port.out.EventRepository;
import com.engagesphere.booster.domain.port.out.MessageComposer;
import com.engagesphere.booster.domain.port.out.MessageSender;
import com.engagesphere.booster.domain.port.out.UserRepository;
import com.engagesphere.booster.domain.scheduling.PlannedJob;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Task run by the scheduler when a planned communication is due.
 * Content is composed at fire time from the current user and event rows.
 */
class CommunicationJob implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(CommunicationJob.class);

    private final PlannedJob plannedJob;
    private final long userId;
    private final long eventId;
    private final UserRepository userRepository;
    private final EventRepository eventRepository;
    private final MessageComposer messageComposer;
    private final MessageSender messageSender;
    private final DeliveryLedger deliveryLedger;

    CommunicationJob(PlannedJob plannedJob, long userId, long eventId,
                     UserRepository userRepository, EventRepository eventRepository,
                     MessageComposer messageComposer, MessageSender messageSender,
                     DeliveryLedger deliveryLedger) {
        this.plannedJob = plannedJob;
        this.userId = userId;
        this.eventId = eventId;
        this.userRepository = userRepository;
        this.eventRepository = eventRepository;
        this.messageComposer = messageComposer;
        this.messageSender = messageSender;
        this.deliveryLedger = deliveryLedger;
    }

    @Override
    public void run() {
        Optional<User> user = userRepository.findById(userId);
        Optional<Event> event = eventRepository.findById(eventId);
        if (user.isEmpty() || event.isEmpty()) {
            logger.warn("Job {} fired for a missing user or event, skipping", plannedJob.jobId());
            return;
        }

        // Claimed only once both rows are loaded; a failed lookup leaves the occurrence deliverable
        if (!deliveryLedger.claim(plannedJob.jobId(), plannedJob.dueTime())) {
            logger.info("Job {} was already delivered, skipping", plannedJob.jobId());
            return;
        }

        String content = messageComposer.compose(user.get(), event.get(), plannedJob.kind().messageType());
        messageSender.send(userId, content);
        logger.info("Delivered {} for user {} and event {}", plannedJob.kind().value(), userId, eventId);
    }

    PlannedJob plannedJob() {
        return plannedJob;
    }
}
