package com.safepocket.categorizer.rules;

import com.safepocket.categorizer.model.CategoryTaxonomy;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of rules, owner map and taxonomy that categorizations read from. A reload builds a
 * new bundle; an existing one is never modified.
 *
 * <p>{@code learnedRules} come from the local learned-rules file and are consulted only after every
 * manual rule has missed.
 */
public record RuleBundle(
        List<CategorizationRule> rules,
        Map<String, String> ownerMap,
        CategoryTaxonomy taxonomy,
        Instant loadedAt,
        Origin origin,
        List<CategorizationRule> learnedRules
) {

    public enum Origin {
        SOURCE,
        CACHE_FILE,
        /** The previous in-memory bundle, kept because the source failed and no newer cache file exists. */
        STALE,
        EMPTY
    }

    public RuleBundle {
        rules = rules == null ? List.of() : List.copyOf(rules);
        ownerMap = ownerMap == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ownerMap));
        taxonomy = taxonomy == null ? CategoryTaxonomy.EMPTY : taxonomy;
        origin = origin == null ? Origin.SOURCE : origin;
        learnedRules = learnedRules == null ? List.of() : List.copyOf(learnedRules);
    }

    public RuleBundle(
            List<CategorizationRule> rules,
            Map<String, String> ownerMap,
            CategoryTaxonomy taxonomy,
            Instant loadedAt,
            Origin origin) {
        this(rules, ownerMap, taxonomy, loadedAt, origin, List.of());
    }

    public static RuleBundle empty(Instant now) {
        return new RuleBundle(List.of(), Map.of(), CategoryTaxonomy.EMPTY, now, Origin.EMPTY);
    }

    public RuleBundle withOrigin(Origin newOrigin) {
        return new RuleBundle(rules, ownerMap, taxonomy, loadedAt, newOrigin, learnedRules);
    }

    public RuleBundle withLearnedRules(List<CategorizationRule> newLearnedRules) {
        return new RuleBundle(rules, ownerMap, taxonomy, loadedAt, origin, newLearnedRules);
    }
}
