package com.safepocket.categorizer.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Three-level category tree in authoring order. Only used to give the AI classifier context.
 */
public record CategoryTaxonomy(List<Tier1> groups) {

    public static final CategoryTaxonomy EMPTY = new CategoryTaxonomy(List.of());

    public CategoryTaxonomy {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public record Tier1(String name, List<Tier2> subcategories) {
        public Tier1 {
            subcategories = subcategories == null ? List.of() : List.copyOf(subcategories);
        }
    }

    public record Tier2(String name, List<String> leaves) {
        public Tier2 {
            leaves = leaves == null ? List.of() : List.copyOf(leaves);
        }
    }

    /**
     * Groups flat (tier1, tier2, tier3) rows; rows sharing tier1 and tier2 end up under the same node.
     */
    public static CategoryTaxonomy fromRows(List<Category> rows) {
        Map<String, Map<String, List<String>>> grouped = new LinkedHashMap<>();
        for (Category row : rows) {
            List<String> leaves = grouped
                    .computeIfAbsent(row.tier1(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(row.tier2(), k -> new ArrayList<>());
            if (!leaves.contains(row.tier3())) {
                leaves.add(row.tier3());
            }
        }
        List<Tier1> groups = new ArrayList<>();
        grouped.forEach((tier1, tier2s) -> {
            List<Tier2> subcategories = new ArrayList<>();
            tier2s.forEach((tier2, leaves) -> subcategories.add(new Tier2(tier2, leaves)));
            groups.add(new Tier1(tier1, subcategories));
        });
        return new CategoryTaxonomy(groups);
    }

    public int tier1Count() {
        return groups.size();
    }
}
