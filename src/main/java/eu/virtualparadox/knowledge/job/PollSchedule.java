package eu.virtualparadox.knowledge.job;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Backoff between polls of an external transcription job.
 * <p>
 * The delay before poll {@code n + 1} is {@code min(base * factor^n, maxDelay)} scaled by a random
 * factor in {@code [1 - jitter, 1 + jitter]}. Every poll is scheduled no later than the deadline
 * {@code submittedAt + maxWait}, so the number of polls is bounded by {@link #maxPolls()}.
 * </p>
 */
@Component
public class PollSchedule {

    private final Duration baseDelay;
    private final double factor;
    private final Duration maxDelay;
    private final double jitter;
    private final Duration maxWait;
    private final DoubleSupplier random;

    @Autowired
    public PollSchedule(final IngestionProperties properties) {
        this(properties.getPoll(), () -> ThreadLocalRandom.current().nextDouble());
    }

    public PollSchedule(final IngestionProperties.Poll poll, final DoubleSupplier random) {
        if (poll.getBaseDelay().isZero() || poll.getBaseDelay().isNegative()) {
            throw new IllegalArgumentException("Poll base delay must be positive");
        }
        if (poll.getJitter() < 0.0 || poll.getJitter() >= 1.0) {
            throw new IllegalArgumentException("Poll jitter must be in [0, 1)");
        }
        this.baseDelay = poll.getBaseDelay();
        this.factor = Math.max(1.0, poll.getFactor());
        this.maxDelay = poll.getMaxDelay().compareTo(baseDelay) < 0 ? baseDelay : poll.getMaxDelay();
        this.jitter = poll.getJitter();
        this.maxWait = poll.getMaxWait();
        this.random = random;
    }

    /**
     * Delay before the next poll, without jitter.
     *
     * @param pollsDone polls performed so far
     */
    public Duration nominalDelay(final int pollsDone) {
        final double millis = baseDelay.toMillis() * Math.pow(factor, Math.max(0, pollsDone));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Delay before the next poll, with jitter applied.
     */
    public Duration delay(final int pollsDone) {
        final double scale = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.round(nominalDelay(pollsDone).toMillis() * scale));
    }

    /**
     * When to poll next, clipped to the deadline.
     */
    public Instant nextPollAt(final Instant submittedAt, final Instant now, final int pollsDone) {
        final Instant next = now.plus(delay(pollsDone));
        final Instant deadline = deadline(submittedAt);
        return next.isAfter(deadline) ? deadline : next;
    }

    public Instant deadline(final Instant submittedAt) {
        return submittedAt.plus(maxWait);
    }

    public boolean isExpired(final Instant submittedAt, final Instant now) {
        return !now.isBefore(deadline(submittedAt));
    }

    /**
     * Upper bound on the number of polls before the deadline is reached, assuming every delay
     * comes out at its shortest. The poll at the deadline itself is included.
     */
    public int maxPolls() {
        long elapsed = 0;
        int polls = 0;
        final long limit = maxWait.toMillis();
        while (elapsed < limit) {
            elapsed += Math.max(1L, (long) Math.floor(nominalDelay(polls).toMillis() * (1.0 - jitter)));
            polls++;
        }
        return polls;
    }
}
