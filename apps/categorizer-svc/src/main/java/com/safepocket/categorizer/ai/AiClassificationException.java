package com.safepocket.categorizer.ai;

/**
 * Failure of a call to the external classification service. The categorization engine never lets
 * one of these escape; it degrades the transaction to "uncategorized".
 */
public class AiClassificationException extends RuntimeException {

    public AiClassificationException(String message) {
        super(message);
    }

    public AiClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
