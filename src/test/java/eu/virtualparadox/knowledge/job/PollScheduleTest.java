package eu.virtualparadox.knowledge.job;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PollScheduleTest {

    private static final Instant SUBMITTED = Instant.parse("2026-01-01T10:00:00Z");

    private static IngestionProperties.Poll poll() {
        IngestionProperties.Poll poll = new IngestionProperties.Poll();
        poll.setBaseDelay(Duration.ofSeconds(1));
        poll.setFactor(2.0);
        poll.setMaxDelay(Duration.ofSeconds(8));
        poll.setJitter(0.2);
        poll.setMaxWait(Duration.ofSeconds(30));
        return poll;
    }

    @Test
    @DisplayName("Nominal delay grows geometrically up to the cap")
    void nominalDelay() {
        PollSchedule schedule = new PollSchedule(poll(), () -> 0.5);

        assertEquals(Duration.ofSeconds(1), schedule.nominalDelay(0));
        assertEquals(Duration.ofSeconds(2), schedule.nominalDelay(1));
        assertEquals(Duration.ofSeconds(4), schedule.nominalDelay(2));
        assertEquals(Duration.ofSeconds(8), schedule.nominalDelay(3));
        assertEquals(Duration.ofSeconds(8), schedule.nominalDelay(10));
    }

    @Test
    @DisplayName("Jitter scales the delay within the configured band")
    void jitter() {
        assertEquals(Duration.ofMillis(800), new PollSchedule(poll(), () -> 0.0).delay(0));
        assertEquals(Duration.ofMillis(1000), new PollSchedule(poll(), () -> 0.5).delay(0));
        assertEquals(Duration.ofMillis(1200), new PollSchedule(poll(), () -> 1.0).delay(0));
    }

    @Test
    @DisplayName("Next poll never lands after the deadline")
    void clippedToDeadline() {
        PollSchedule schedule = new PollSchedule(poll(), () -> 0.5);
        Instant deadline = SUBMITTED.plusSeconds(30);

        assertEquals(deadline, schedule.deadline(SUBMITTED));
        assertEquals(deadline, schedule.nextPollAt(SUBMITTED, SUBMITTED.plusSeconds(29), 4));
        assertEquals(SUBMITTED.plusSeconds(2), schedule.nextPollAt(SUBMITTED, SUBMITTED, 1));

        assertFalse(schedule.isExpired(SUBMITTED, deadline.minusMillis(1)));
        assertTrue(schedule.isExpired(SUBMITTED, deadline));
    }

    @Test
    @DisplayName("Polling with the shortest delays stays within maxPolls")
    void boundedPolls() {
        PollSchedule schedule = new PollSchedule(poll(), () -> 0.0);
        assertEquals(7, schedule.maxPolls());

        Instant now = SUBMITTED;
        int polls = 0;
        while (!schedule.isExpired(SUBMITTED, now)) {
            now = schedule.nextPollAt(SUBMITTED, now, polls);
            polls++;
        }
        assertTrue(polls <= schedule.maxPolls(), polls + " polls");
    }

    @Test
    @DisplayName("Invalid poll settings are rejected")
    void invalidSettings() {
        IngestionProperties.Poll zeroBase = poll();
        zeroBase.setBaseDelay(Duration.ZERO);
        assertThrows(IllegalArgumentException.class, () -> new PollSchedule(zeroBase, () -> 0.5));

        IngestionProperties.Poll fullJitter = poll();
        fullJitter.setJitter(1.0);
        assertThrows(IllegalArgumentException.class, () -> new PollSchedule(fullJitter, () -> 0.5));
    }
}
