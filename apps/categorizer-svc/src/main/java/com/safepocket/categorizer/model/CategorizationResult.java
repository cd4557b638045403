package com.safepocket.categorizer.model;

import java.util.Optional;

public record CategorizationResult(
        String tier1,
        String tier2,
        String tier3,
        String owner,
        boolean internalTransfer,
        CategorizationSource source,
        Optional<Integer> confidence
) {

    public static CategorizationResult internalTransfer(Category category, String owner) {
        return new CategorizationResult(category.tier1(), category.tier2(), category.tier3(), owner, true,
                CategorizationSource.INTERNAL_TRANSFER, Optional.empty());
    }

    public static CategorizationResult manualRule(Category category, String owner) {
        return new CategorizationResult(category.tier1(), category.tier2(), category.tier3(), owner, false,
                CategorizationSource.MANUAL_RULE, Optional.empty());
    }

    public static CategorizationResult ai(Category category, String owner, int confidence) {
        return new CategorizationResult(category.tier1(), category.tier2(), category.tier3(), owner, false,
                CategorizationSource.AI, Optional.of(confidence));
    }

    public static CategorizationResult uncategorized(String owner) {
        Category category = Category.UNCATEGORIZED;
        return new CategorizationResult(category.tier1(), category.tier2(), category.tier3(), owner, false,
                CategorizationSource.UNCATEGORIZED, Optional.empty());
    }

    public Category category() {
        return new Category(tier1, tier2, tier3);
    }
}
