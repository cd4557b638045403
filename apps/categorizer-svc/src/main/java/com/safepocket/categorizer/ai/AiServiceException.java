package com.safepocket.categorizer.ai;

public class AiServiceException extends AiClassificationException {

    private final int status;

    public AiServiceException(int status, String message) {
        super(message);
        this.status = status;
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * HTTP status of the failed call, or -1 when no response was received.
     */
    public int status() {
        return status;
    }
}
