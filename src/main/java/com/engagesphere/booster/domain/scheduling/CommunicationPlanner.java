package com.engagesphere.booster.domain.scheduling;

import com.engagesphere.booster.domain.model.Event;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes due times for each job kind relative to an event's start and
 * drops the ones that are already past due.
 */
@Component
public class CommunicationPlanner {

    private static final Logger logger = LoggerFactory.getLogger(CommunicationPlanner.class);

    public Instant dueTime(JobKind kind, Instant eventTime) {
        return eventTime.plus(kind.offset());
    }

    /**
     * Jobs worth scheduling for this registration, in timeline order.
     * A kind is kept when its due time is strictly after {@code now}; the
     * follow-up is always kept.
     */
    public List<PlannedJob> plan(long userId, Event event, Instant now) {
        return Arrays.stream(JobKind.values())
                .map(kind -> new PlannedJob(kind, JobIdentity.jobId(kind, userId, event.id()),
                        dueTime(kind, event.eventTime())))
                .filter(job -> {
                    if (job.kind().skipWhenPastDue() && !job.dueTime().isAfter(now)) {
                        logger.debug("Skipping {} for event {}: due {} is not after {}",
                                job.kind().value(), event.id(), job.dueTime(), now);
                        return false;
                    }
                    return true;
                })
                .toList();
    }
}
