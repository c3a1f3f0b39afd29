package io.trackimport.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tells the pipeline to stop starting new rounds once less than {@code reserve} is left before the
 * invocation's hard deadline.
 */
@RequiredArgsConstructor
public class TimeBudgetGuard {
    public static final Duration DEFAULT_RESERVE = Duration.ofMinutes(3);

    private final Supplier<Duration> remainingTime;
    @Getter
    private final Duration reserve;

    public boolean shouldStop() {
        return remainingTime.get().compareTo(reserve) < 0;
    }

    public static TimeBudgetGuard untilDeadline(Clock clock, Instant deadline, Duration reserve) {
        return new TimeBudgetGuard(() -> Duration.between(clock.instant(), deadline), reserve);
    }

    public static TimeBudgetGuard unlimited() {
        return new TimeBudgetGuard(() -> Duration.ofSeconds(Long.MAX_VALUE), Duration.ZERO);
    }
}
