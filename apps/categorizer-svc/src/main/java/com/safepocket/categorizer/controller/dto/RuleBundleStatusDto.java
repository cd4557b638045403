package com.safepocket.categorizer.controller.dto;

import com.safepocket.categorizer.rules.RuleBundle;
import java.time.Instant;

public record RuleBundleStatusDto(
        String source,
        RuleBundle.Origin origin,
        int rules,
        int learnedRules,
        int ownerAccounts,
        int topLevelCategories,
        Instant loadedAt
) {

    public static RuleBundleStatusDto from(String source, RuleBundle bundle) {
        return new RuleBundleStatusDto(
                source,
                bundle.origin(),
                bundle.rules().size(),
                bundle.learnedRules().size(),
                bundle.ownerMap().size(),
                bundle.taxonomy().tier1Count(),
                bundle.loadedAt());
    }
}
