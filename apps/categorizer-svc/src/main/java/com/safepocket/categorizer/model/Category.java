package com.safepocket.categorizer.model;

public record Category(String tier1, String tier2, String tier3) {

    public static final Category UNCATEGORIZED = new Category("Uncategorized", "Needs Review", "Unknown Transaction");

    public Category {
        if (tier1 == null || tier1.isBlank()) {
            throw new IllegalArgumentException("tier1 must be provided");
        }
        if (tier2 == null || tier2.isBlank()) {
            throw new IllegalArgumentException("tier2 must be provided");
        }
        if (tier3 == null || tier3.isBlank()) {
            throw new IllegalArgumentException("tier3 must be provided");
        }
        tier1 = tier1.trim();
        tier2 = tier2.trim();
        tier3 = tier3.trim();
    }

    @Override
    public String toString() {
        return tier1 + " > " + tier2 + " > " + tier3;
    }
}
