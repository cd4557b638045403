package com.safepocket.categorizer.ai;

public class AiRateLimitedException extends AiClassificationException {

    private final int attempts;

    public AiRateLimitedException(int attempts, AiThrottledException lastFailure) {
        super("Classification service still throttling after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
