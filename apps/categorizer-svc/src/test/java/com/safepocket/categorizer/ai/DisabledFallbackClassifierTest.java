package com.safepocket.categorizer.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.categorizer.model.CategoryTaxonomy;
import com.safepocket.categorizer.model.Transaction;
import org.junit.jupiter.api.Test;

class DisabledFallbackClassifierTest {

    @Test
    void alwaysReportsDisabledWithReason() {
        var classifier = new DisabledFallbackClassifier("no API key in GEMINI_API_KEY");

        assertThat(classifier.enabled()).isFalse();
        assertThat(classifier.classify(Transaction.builder().build(), CategoryTaxonomy.EMPTY))
                .isEqualTo(new AiOutcome.Disabled("no API key in GEMINI_API_KEY"));
        assertThat(classifier.describe()).contains("GEMINI_API_KEY");
    }
}
