package com.safepocket.categorizer.ai;

import java.time.Instant;

public class DailyQuotaExceededException extends AiClassificationException {

    private final Instant resetsAt;

    public DailyQuotaExceededException(int requestsPerDay, Instant resetsAt) {
        super("Daily classification quota of " + requestsPerDay + " requests exhausted until " + resetsAt);
        this.resetsAt = resetsAt;
    }

    public Instant resetsAt() {
        return resetsAt;
    }
}
