package com.safepocket.categorizer.ai;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Call budget for the classification service: a sliding one-minute window and a daily counter whose
 * cycle starts with the first call and lasts 24 hours. Shared by every categorization running in the
 * process.
 */
public class AiRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(AiRateLimiter.class);

    static final Duration WINDOW = Duration.ofMinutes(1);
    static final Duration DAY = Duration.ofHours(24);

    private final int requestsPerMinute;
    private final int requestsPerDay;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Object lock = new Object();
    private final Deque<Instant> window = new ArrayDeque<>();
    private Instant dayCycleStart;
    private int usedToday;

    public AiRateLimiter(int requestsPerMinute, int requestsPerDay) {
        this(requestsPerMinute, requestsPerDay, Clock.systemUTC(), Sleeper.threadSleep());
    }

    public AiRateLimiter(int requestsPerMinute, int requestsPerDay, Clock clock, Sleeper sleeper) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive");
        }
        if (requestsPerDay <= 0) {
            throw new IllegalArgumentException("requestsPerDay must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.requestsPerDay = requestsPerDay;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a call may be made and records it.
     *
     * @throws DailyQuotaExceededException when the daily budget is spent; never waits for the reset
     */
    public void awaitSlot() {
        while (true) {
            Duration wait;
            synchronized (lock) {
                Instant now = clock.instant();
                rollDayCycle(now);
                if (usedToday >= requestsPerDay) {
                    throw new DailyQuotaExceededException(requestsPerDay, dayCycleStart.plus(DAY));
                }
                evictExpired(now);
                if (window.size() < requestsPerMinute) {
                    window.addLast(now);
                    if (dayCycleStart == null) {
                        dayCycleStart = now;
                    }
                    usedToday++;
                    return;
                }
                wait = Duration.between(now, window.peekFirst().plus(WINDOW));
            }
            log.debug("Per-minute classification budget of {} reached; waiting {} ms", requestsPerMinute, wait.toMillis());
            pause(wait);
        }
    }

    int windowSize() {
        synchronized (lock) {
            evictExpired(clock.instant());
            return window.size();
        }
    }

    int usedToday() {
        synchronized (lock) {
            rollDayCycle(clock.instant());
            return usedToday;
        }
    }

    private void rollDayCycle(Instant now) {
        if (dayCycleStart != null && !now.isBefore(dayCycleStart.plus(DAY))) {
            log.info("Daily classification budget reset after {} calls", usedToday);
            dayCycleStart = null;
            usedToday = 0;
        }
    }

    private void evictExpired(Instant now) {
        while (!window.isEmpty() && Duration.between(window.peekFirst(), now).compareTo(WINDOW) >= 0) {
            window.removeFirst();
        }
    }

    private void pause(Duration wait) {
        if (wait.isNegative() || wait.isZero()) {
            return;
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AiClassificationException("Interrupted while waiting for a classification slot", ex);
        }
    }
}
