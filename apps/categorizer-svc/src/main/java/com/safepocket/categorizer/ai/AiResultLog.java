package com.safepocket.categorizer.ai;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safepocket.categorizer.model.Category;
import com.safepocket.categorizer.model.Transaction;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only audit trail of accepted AI classifications, one JSON object per line.
 * Nothing reads it back during categorization.
 */
public class AiResultLog {

    private static final Logger log = LoggerFactory.getLogger(AiResultLog.class);

    record Entry(
            String description,
            @JsonProperty("counterparty_name") String counterpartyName,
            BigDecimal amount,
            Category category,
            int confidence,
            Instant timestamp
    ) {}

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AiResultLog(Path path, ObjectMapper objectMapper) {
        this(path, objectMapper, Clock.systemUTC());
    }

    AiResultLog(Path path, ObjectMapper objectMapper, Clock clock) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    public synchronized void append(Transaction transaction, AiClassification classification) {
        Entry entry = new Entry(
                transaction.description(),
                transaction.counterpartyName(),
                transaction.amount(),
                classification.category(),
                classification.confidence(),
                clock.instant());
        try {
            String line = objectMapper.writeValueAsString(entry) + System.lineSeparator();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (JsonProcessingException ex) {
            log.warn("Could not serialize AI result entry: {}", ex.getMessage());
        } catch (IOException ex) {
            log.warn("Could not append AI result to {}: {}", path, ex.getMessage());
        }
    }
}
