package com.safepocket.categorizer.rules;

import com.safepocket.categorizer.model.CategoryTaxonomy;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend the rule store fetches rules, owner map and taxonomy from.
 */
public interface RuleSource {

    /**
     * @throws RuleSourceException when the backend cannot be read at all; individual malformed
     *                             rules are skipped by the implementation instead
     */
    Snapshot fetch();

    String describe();

    record Snapshot(List<CategorizationRule> rules, Map<String, String> ownerMap, CategoryTaxonomy taxonomy) {
        public Snapshot {
            rules = rules == null ? List.of() : List.copyOf(rules);
            ownerMap = ownerMap == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ownerMap));
            taxonomy = taxonomy == null ? CategoryTaxonomy.EMPTY : taxonomy;
        }
    }
}
