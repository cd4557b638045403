package com.safepocket.categorizer.ai;

import com.safepocket.categorizer.model.Category;
import java.util.Optional;

/**
 * Reads the four labelled lines ({@code Tier1:}, {@code Tier2:}, {@code Tier3:}, {@code Confidence:})
 * out of a model answer. Other lines are ignored.
 */
public class AiResponseParser {

    public Optional<AiClassification> parse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String tier1 = null;
        String tier2 = null;
        String tier3 = null;
        int confidence = 0;
        for (String rawLine : response.split("\\R")) {
            String line = rawLine.strip();
            if (line.startsWith("Tier1:")) {
                tier1 = valueOf(line);
            } else if (line.startsWith("Tier2:")) {
                tier2 = valueOf(line);
            } else if (line.startsWith("Tier3:")) {
                tier3 = valueOf(line);
            } else if (line.startsWith("Confidence:")) {
                confidence = parseConfidence(valueOf(line));
            }
        }
        if (isBlank(tier1) || isBlank(tier2) || isBlank(tier3)) {
            return Optional.empty();
        }
        return Optional.of(new AiClassification(new Category(tier1, tier2, tier3), confidence));
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1).strip();
    }

    static int parseConfidence(String value) {
        try {
            return Integer.parseInt(value.replace("%", "").strip());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
