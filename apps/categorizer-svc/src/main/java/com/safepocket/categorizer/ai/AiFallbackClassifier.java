package com.safepocket.categorizer.ai;

import com.safepocket.categorizer.model.CategoryTaxonomy;
import com.safepocket.categorizer.model.Transaction;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the language model for a category and accepts the answer only at or above the confidence
 * threshold. Accepted answers are also written to the result log when one is configured.
 */
public class AiFallbackClassifier implements FallbackClassifier {

    private static final Logger log = LoggerFactory.getLogger(AiFallbackClassifier.class);

    private final ClassificationServiceClient client;
    private final AiCallExecutor executor;
    private final PromptBuilder promptBuilder;
    private final AiResponseParser parser;
    private final int confidenceThreshold;
    private final AiResultLog resultLog;

    public AiFallbackClassifier(
            ClassificationServiceClient client,
            AiCallExecutor executor,
            PromptBuilder promptBuilder,
            AiResponseParser parser,
            int confidenceThreshold,
            AiResultLog resultLog) {
        this.client = client;
        this.executor = executor;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.confidenceThreshold = confidenceThreshold;
        this.resultLog = resultLog;
    }

    @Override
    public AiOutcome classify(Transaction transaction, CategoryTaxonomy taxonomy) {
        String prompt = promptBuilder.build(transaction, taxonomy);
        String answer;
        try {
            answer = executor.execute(() -> client.complete(prompt));
        } catch (AiClassificationException ex) {
            return new AiOutcome.Failed(ex);
        }

        Optional<AiClassification> parsed = parser.parse(answer);
        if (parsed.isEmpty()) {
            log.warn("Unparseable classification answer for '{}'", transaction.description());
            return new AiOutcome.Rejected(AiOutcome.Rejected.Reason.UNPARSEABLE, answer);
        }
        AiClassification classification = parsed.get();
        if (classification.confidence() < confidenceThreshold) {
            log.info("AI classification below threshold: category='{}' confidence={} threshold={}",
                    classification.category(), classification.confidence(), confidenceThreshold);
            return new AiOutcome.Rejected(AiOutcome.Rejected.Reason.LOW_CONFIDENCE,
                    classification.category() + " at " + classification.confidence());
        }
        if (resultLog != null) {
            resultLog.append(transaction, classification);
        }
        return new AiOutcome.Accepted(classification);
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String describe() {
        return "enabled (threshold " + confidenceThreshold + ")";
    }
}
