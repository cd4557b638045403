package com.safepocket.categorizer.ai;

/**
 * Result of one fallback classification attempt. Only {@link Accepted} produces a category.
 */
public sealed interface AiOutcome {

    record Accepted(AiClassification classification) implements AiOutcome {}

    record Rejected(Reason reason, String detail) implements AiOutcome {
        public enum Reason {
            UNPARSEABLE,
            LOW_CONFIDENCE
        }
    }

    record Failed(AiClassificationException cause) implements AiOutcome {}

    record Disabled(String reason) implements AiOutcome {}
}
