package com.safepocket.categorizer.ai;

/**
 * HTTP 429 from the classification service; the only failure the retry loop repeats.
 */
public class AiThrottledException extends AiClassificationException {

    public AiThrottledException(String message) {
        super(message);
    }
}
