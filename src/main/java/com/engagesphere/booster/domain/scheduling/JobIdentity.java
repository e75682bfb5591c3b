package com.engagesphere.booster.domain.scheduling;

import java.util.Arrays;
import java.util.List;

/**
 * Deterministic job naming. Scheduling and cancellation both derive ids
 * here, so a job can be found again from (kind, user, event) alone.
 */
public final class JobIdentity {

    private static final char SEPARATOR = ':';

    private JobIdentity() {
    }

    /**
     * @return e.g. {@code reminder_24h:7:42}
     */
    public static String jobId(JobKind kind, long userId, long eventId) {
        return kind.value() + SEPARATOR + userId + SEPARATOR + eventId;
    }

    /**
     * Ids of every kind for one registration, in timeline order
     */
    public static List<String> allFor(long userId, long eventId) {
        return Arrays.stream(JobKind.values())
                .map(kind -> jobId(kind, userId, eventId))
                .toList();
    }
}
