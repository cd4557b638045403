package com.safepocket.categorizer.rules;

import com.safepocket.categorizer.model.Category;
import java.util.List;

/**
 * User-authored rule. All conditions must hold for the rule to match; a rule without conditions
 * is rejected because it would silently capture every transaction.
 */
public record CategorizationRule(
        String name,
        int priority,
        List<MatchCondition> conditions,
        Category category,
        String owner
) {

    public CategorizationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name must be provided");
        }
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("rule '" + name + "' has no match conditions");
        }
        if (category == null) {
            throw new IllegalArgumentException("rule '" + name + "' has no target category");
        }
        conditions = List.copyOf(conditions);
        owner = owner == null || owner.isBlank() ? null : owner.trim();
    }

    public boolean hasOwner() {
        return owner != null;
    }
}
