package com.safepocket.categorizer.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Optional local YAML file of rules learned from reviewed categorizations. Entries use the manual
 * rule format; the document is either a plain list or a mapping with a {@code learned_rules} list.
 * A missing or unreadable file yields no rules.
 */
public class LearnedRuleFile {

    private static final Logger log = LoggerFactory.getLogger(LearnedRuleFile.class);

    private final Path path;
    private final YAMLMapper yamlMapper;

    public LearnedRuleFile(Path path) {
        this(path, new YAMLMapper());
    }

    LearnedRuleFile(Path path, YAMLMapper yamlMapper) {
        this.path = path;
        this.yamlMapper = yamlMapper;
    }

    public static LearnedRuleFile disabled() {
        return new LearnedRuleFile(null);
    }

    public boolean enabled() {
        return path != null;
    }

    public Path path() {
        return path;
    }

    public List<CategorizationRule> load() {
        if (path == null) {
            return List.of();
        }
        if (!Files.isRegularFile(path)) {
            log.debug("No learned rules file at {}", path);
            return List.of();
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(path.toFile());
        } catch (IOException ex) {
            log.warn("Could not read learned rules file {}: {}", path, ex.getMessage());
            return List.of();
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        JsonNode rulesNode = root.isObject() ? root.path("learned_rules") : root;
        if (!rulesNode.isArray()) {
            log.warn("Learned rules file {} holds no rule list", path);
            return List.of();
        }
        List<CategorizationRule> rules = RuleDefinitionParser.parseRules(rulesNode, "learned:" + path);
        log.info("Loaded {} learned rules from {}", rules.size(), path);
        return rules;
    }
}
