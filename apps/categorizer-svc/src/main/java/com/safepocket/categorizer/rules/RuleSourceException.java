package com.safepocket.categorizer.rules;

public class RuleSourceException extends RuntimeException {

    public RuleSourceException(String message) {
        super(message);
    }

    public RuleSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
