package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.DeliveryLedger;
import com.engagesphere.booster.domain.port.out.EventRepository;
import com.engagesphere.booster.domain.port.out.JobScheduler;
import com.engagesphere.booster.domain.port.out.MessageComposer;
import com.engagesphere.booster.domain.port.out.MessageSender;
import com.engagesphere.booster.domain.port.out.UserRepository;
import com.engagesphere.booster.domain.scheduling.CommunicationPlanner;
import com.engagesphere.booster.domain.scheduling.JobIdentity;
import com.engagesphere.booster.domain.scheduling.PlannedJob;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bridges the planner and the job scheduler for one registration.
 */
@Service
public class CommunicationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CommunicationScheduler.class);

    private final CommunicationPlanner planner;
    private final JobScheduler jobScheduler;
    private final Clock clock;
    private final UserRepository userRepository;
    private final EventRepository eventRepository;
    private final MessageComposer messageComposer;
    private final MessageSender messageSender;
    private final DeliveryLedger deliveryLedger;

    public CommunicationScheduler(CommunicationPlanner planner, JobScheduler jobScheduler, Clock clock,
                                  UserRepository userRepository, EventRepository eventRepository,
                                  MessageComposer messageComposer, MessageSender messageSender,
                                  DeliveryLedger deliveryLedger) {
        this.planner = planner;
        this.jobScheduler = jobScheduler;
        this.clock = clock;
        this.userRepository = userRepository;
        this.eventRepository = eventRepository;
        this.messageComposer = messageComposer;
        this.messageSender = messageSender;
        this.deliveryLedger = deliveryLedger;
    }

    /**
     * @return the jobs that were accepted by the scheduler
     */
    public List<PlannedJob> scheduleAll(User user, Event event) {
        List<PlannedJob> accepted = new ArrayList<>();
        for (PlannedJob job : planner.plan(user.id(), event, clock.instant())) {
            CommunicationJob task = new CommunicationJob(job, user.id(), event.id(),
                    userRepository, eventRepository, messageComposer, messageSender, deliveryLedger);
            if (jobScheduler.schedule(job.jobId(), job.dueTime(), task)) {
                accepted.add(job);
            }
        }
        logger.info("Scheduled {} communications for {} and event '{}'",
                accepted.size(), user.email(), event.name());
        return accepted;
    }

    /**
     * Cancels every kind for the pair; kinds that are not pending are ignored.
     *
     * @return number of jobs actually removed
     */
    public int cancelAll(long userId, long eventId) {
        int cancelled = 0;
        for (String jobId : JobIdentity.allFor(userId, eventId)) {
            if (jobScheduler.cancel(jobId)) {
                cancelled++;
            }
        }
        logger.debug("Cancelled {} pending jobs for user {} and event {}", cancelled, userId, eventId);
        return cancelled;
    }
}
