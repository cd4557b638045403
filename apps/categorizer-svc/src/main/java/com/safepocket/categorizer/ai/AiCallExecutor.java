package com.safepocket.categorizer.ai;

import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a classification call inside the rate limiter and retries it with exponential backoff while
 * the service answers 429. Every attempt, retries included, takes a slot from the limiter.
 */
public class AiCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(AiCallExecutor.class);

    private final AiRateLimiter rateLimiter;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public AiCallExecutor(AiRateLimiter rateLimiter, int maxRetries, Duration baseDelay) {
        this(rateLimiter, maxRetries, baseDelay, Sleeper.threadSleep());
    }

    public AiCallExecutor(AiRateLimiter rateLimiter, int maxRetries, Duration baseDelay, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.rateLimiter = rateLimiter;
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    public <T> T execute(Supplier<T> call) {
        for (int attempt = 0; ; attempt++) {
            rateLimiter.awaitSlot();
            try {
                return call.get();
            } catch (AiThrottledException ex) {
                if (attempt >= maxRetries) {
                    throw new AiRateLimitedException(attempt + 1, ex);
                }
                Duration delay = backoff(attempt);
                log.warn("Classification service throttled (attempt {}/{}); retrying in {} ms",
                        attempt + 1, maxRetries + 1, delay.toMillis());
                pause(delay);
            }
        }
    }

    Duration backoff(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 30));
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AiClassificationException("Interrupted during classification retry backoff", ex);
        }
    }
}
