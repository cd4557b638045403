package com.safepocket.categorizer.ai;

import com.safepocket.categorizer.model.CategoryTaxonomy;
import com.safepocket.categorizer.model.Transaction;

/**
 * Last categorization step before a transaction is left uncategorized.
 */
public interface FallbackClassifier {

    /**
     * Never throws for service failures; they come back as {@link AiOutcome.Failed}.
     */
    AiOutcome classify(Transaction transaction, CategoryTaxonomy taxonomy);

    boolean enabled();

    String describe();
}
