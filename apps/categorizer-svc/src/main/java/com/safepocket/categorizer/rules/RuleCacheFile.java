package com.safepocket.categorizer.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safepocket.categorizer.model.CategoryTaxonomy;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local JSON snapshot of the last bundle fetched from the rule source. Each write replaces the whole
 * file through a temp file and a move, so readers see either the old or the new snapshot.
 */
public class RuleCacheFile {

    private static final Logger log = LoggerFactory.getLogger(RuleCacheFile.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public RuleCacheFile(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public static RuleCacheFile disabled(ObjectMapper objectMapper) {
        return new RuleCacheFile(null, objectMapper);
    }

    public boolean enabled() {
        return path != null;
    }

    public Path path() {
        return path;
    }

    public void write(RuleBundle bundle) throws IOException {
        if (path == null) {
            return;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), CachedBundle.of(bundle));
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Reads the snapshot back. An unreadable file is reported and treated as absent.
     */
    public Optional<RuleBundle> read() {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            CachedBundle cached = objectMapper.readValue(path.toFile(), CachedBundle.class);
            return Optional.of(cached.toBundle());
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Rule cache file {} is unreadable: {}", path, ex.getMessage());
            return Optional.empty();
        }
    }

    record CachedBundle(
            Instant loadedAt,
            List<CategorizationRule> rules,
            Map<String, String> ownerMap,
            CategoryTaxonomy taxonomy
    ) {
        static CachedBundle of(RuleBundle bundle) {
            return new CachedBundle(bundle.loadedAt(), bundle.rules(), bundle.ownerMap(), bundle.taxonomy());
        }

        RuleBundle toBundle() {
            return new RuleBundle(rules, ownerMap, taxonomy, loadedAt, RuleBundle.Origin.CACHE_FILE);
        }
    }
}
