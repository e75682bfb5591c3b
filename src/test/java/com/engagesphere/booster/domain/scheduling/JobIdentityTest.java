package com.engagesphere.booster.domain.scheduling;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobIdentityTest {

    @Test
    void shouldFormatKindUserAndEvent() {
        assertThat(JobIdentity.jobId(JobKind.REMINDER_24H, 7, 42)).isEqualTo("reminder_24h:7:42");
        assertThat(JobIdentity.jobId(JobKind.FOLLOW_UP, 1, 2)).isEqualTo("follow_up:1:2");
    }

    @Test
    void shouldReturnSameIdForSameTriple() {
        assertThat(JobIdentity.jobId(JobKind.START, 3, 9))
                .isEqualTo(JobIdentity.jobId(JobKind.START, 3, 9));
    }

    @Test
    void shouldNotCollideWhenDigitsCouldBeRegrouped() {
        // Given - pairs whose concatenated digits are equal
        String first = JobIdentity.jobId(JobKind.PREVIEW, 1, 23);
        String second = JobIdentity.jobId(JobKind.PREVIEW, 12, 3);

        // Then
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void shouldProduceDistinctIdsAcrossKindsUsersAndEvents() {
        Set<String> ids = new HashSet<>();
        int triples = 0;
        for (JobKind kind : JobKind.values()) {
            for (long user = 1; user <= 12; user++) {
                for (long event = 1; event <= 12; event++) {
                    ids.add(JobIdentity.jobId(kind, user, event));
                    triples++;
                }
            }
        }

        assertThat(ids).hasSize(triples);
    }

    @Test
    void shouldListAllFiveKindsForRegistration() {
        assertThat(JobIdentity.allFor(7, 42)).containsExactly(
                "preview:7:42",
                "reminder_24h:7:42",
                "reminder_1h:7:42",
                "start:7:42",
                "follow_up:7:42");
    }
}
