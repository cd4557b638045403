package com.safepocket.categorizer.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.safepocket.categorizer.model.CategoryTaxonomy;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Reads the categorization document: {@code manual_rules}, {@code category_tree} and
 * {@code owner_accounts}. The resource is re-read on every fetch so edits apply on the next reload.
 */
public class YamlRuleSource implements RuleSource {

    private static final Logger log = LoggerFactory.getLogger(YamlRuleSource.class);

    private final Resource resource;
    private final YAMLMapper yamlMapper;

    public YamlRuleSource(Resource resource) {
        this(resource, new YAMLMapper());
    }

    YamlRuleSource(Resource resource, YAMLMapper yamlMapper) {
        this.resource = resource;
        this.yamlMapper = yamlMapper;
    }

    @Override
    public Snapshot fetch() {
        if (!resource.exists()) {
            throw new RuleSourceException("Categorization document not found: " + resource.getDescription());
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = yamlMapper.readTree(in);
        } catch (IOException ex) {
            throw new RuleSourceException("Failed to read categorization document " + resource.getDescription(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new RuleSourceException("Categorization document " + resource.getDescription() + " is empty");
        }
        return new Snapshot(RuleDefinitionParser.parseRules(root.path("manual_rules"), describe()), readOwners(root.path("owner_accounts")),
                readTaxonomy(root.path("category_tree")));
    }

    @Override
    public String describe() {
        return "yaml:" + resource.getDescription();
    }

    private Map<String, String> readOwners(JsonNode ownersNode) {
        Map<String, String> owners = new LinkedHashMap<>();
        if (ownersNode.isObject()) {
            ownersNode.fields().forEachRemaining(entry -> putOwner(owners, entry.getKey(), entry.getValue().asText(null)));
        } else if (ownersNode.isArray()) {
            for (JsonNode entry : ownersNode) {
                putOwner(owners, entry.path("account").asText(null), entry.path("owner").asText(null));
            }
        }
        return owners;
    }

    private void putOwner(Map<String, String> owners, String account, String owner) {
        if (account == null || account.isBlank() || owner == null || owner.isBlank()) {
            log.warn("Ignoring incomplete owner mapping account='{}' owner='{}'", account, owner);
            return;
        }
        owners.put(account.trim(), owner.trim());
    }

    private CategoryTaxonomy readTaxonomy(JsonNode treeNode) {
        if (!treeNode.isArray()) {
            return CategoryTaxonomy.EMPTY;
        }
        List<CategoryTaxonomy.Tier1> groups = new ArrayList<>();
        for (JsonNode tier1Node : treeNode) {
            Optional<String> tier1 = Optional.ofNullable(tier1Node.path("tier1").asText(null)).filter(s -> !s.isBlank());
            if (tier1.isEmpty()) {
                log.warn("Ignoring category tree entry without tier1: {}", tier1Node);
                continue;
            }
            List<CategoryTaxonomy.Tier2> subcategories = new ArrayList<>();
            for (JsonNode tier2Node : tier1Node.path("tier2_categories")) {
                String tier2 = tier2Node.path("tier2").asText("");
                if (tier2.isBlank()) {
                    continue;
                }
                List<String> leaves = new ArrayList<>();
                for (JsonNode leaf : tier2Node.path("tier3")) {
                    if (!leaf.asText("").isBlank()) {
                        leaves.add(leaf.asText().trim());
                    }
                }
                subcategories.add(new CategoryTaxonomy.Tier2(tier2.trim(), leaves));
            }
            groups.add(new CategoryTaxonomy.Tier1(tier1.get().trim(), subcategories));
        }
        return new CategoryTaxonomy(groups);
    }
}
