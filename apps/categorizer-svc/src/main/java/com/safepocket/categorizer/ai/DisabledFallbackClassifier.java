package com.safepocket.categorizer.ai;

import com.safepocket.categorizer.model.CategoryTaxonomy;
import com.safepocket.categorizer.model.Transaction;

public class DisabledFallbackClassifier implements FallbackClassifier {

    private final String reason;

    public DisabledFallbackClassifier(String reason) {
        this.reason = reason;
    }

    @Override
    public AiOutcome classify(Transaction transaction, CategoryTaxonomy taxonomy) {
        return new AiOutcome.Disabled(reason);
    }

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public String describe() {
        return "disabled (" + reason + ")";
    }
}
