package com.safepocket.categorizer.service;

import com.safepocket.categorizer.ai.AiOutcome;
import com.safepocket.categorizer.ai.FallbackClassifier;
import com.safepocket.categorizer.config.CategorizerProperties;
import com.safepocket.categorizer.model.CategorizationResult;
import com.safepocket.categorizer.model.Category;
import com.safepocket.categorizer.model.Transaction;
import com.safepocket.categorizer.owner.OwnerResolver;
import com.safepocket.categorizer.rules.CategorizationRule;
import com.safepocket.categorizer.rules.RuleBundle;
import com.safepocket.categorizer.rules.RuleMatcher;
import com.safepocket.categorizer.rules.RuleStore;
import com.safepocket.categorizer.transfer.TransferDetector;
import com.safepocket.categorizer.transfer.TransferSignal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Decides the category of a transaction. Steps run in a fixed order and the first one with an
 * answer wins: internal transfer, manual rule, learned rule, AI fallback, uncategorized. Learned rules
 * report as {@code manual_rule}.
 */
@Service
public class CategorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(CategorizationEngine.class);

    private final RuleStore ruleStore;
    private final TransferDetector transferDetector;
    private final RuleMatcher ruleMatcher;
    private final OwnerResolver ownerResolver;
    private final FallbackClassifier fallbackClassifier;
    private final Category transferCategory;

    @Autowired
    public CategorizationEngine(
            RuleStore ruleStore,
            TransferDetector transferDetector,
            RuleMatcher ruleMatcher,
            OwnerResolver ownerResolver,
            FallbackClassifier fallbackClassifier,
            CategorizerProperties properties) {
        this(ruleStore, transferDetector, ruleMatcher, ownerResolver, fallbackClassifier,
                properties.transfers().category().toCategory());
    }

    public CategorizationEngine(
            RuleStore ruleStore,
            TransferDetector transferDetector,
            RuleMatcher ruleMatcher,
            OwnerResolver ownerResolver,
            FallbackClassifier fallbackClassifier,
            Category transferCategory) {
        this.ruleStore = ruleStore;
        this.transferDetector = transferDetector;
        this.ruleMatcher = ruleMatcher;
        this.ownerResolver = ownerResolver;
        this.fallbackClassifier = fallbackClassifier;
        this.transferCategory = transferCategory;
    }

    /**
     * @param disableAi skip the AI step entirely; the result then depends only on the transaction and
     *                  the loaded rule bundle
     */
    public CategorizationResult categorize(Transaction transaction, boolean disableAi) {
        return categorize(transaction, disableAi, ruleStore.load(false));
    }

    /**
     * Categorizes every transaction against the same rule bundle, preserving input order.
     */
    public List<CategorizationResult> categorizeAll(List<Transaction> transactions, boolean disableAi) {
        RuleBundle bundle = ruleStore.load(false);
        List<CategorizationResult> results = new ArrayList<>(transactions.size());
        for (Transaction transaction : transactions) {
            results.add(categorize(transaction, disableAi, bundle));
        }
        return results;
    }

    public boolean aiEnabled() {
        return fallbackClassifier.enabled();
    }

    private CategorizationResult categorize(Transaction transaction, boolean disableAi, RuleBundle bundle) {
        TransferSignal signal = transferDetector.detect(transaction);
        if (signal.internal()) {
            log.debug("Transaction '{}' is an internal transfer (signal={})", transaction.description(), signal);
            return CategorizationResult.internalTransfer(transferCategory, resolveOwner(transaction, bundle));
        }

        Optional<CategorizationRule> rule = ruleMatcher.firstMatch(bundle.rules(), transaction);
        if (rule.isPresent()) {
            log.debug("Transaction '{}' matched rule '{}'", transaction.description(), rule.get().name());
            return ruleResult(rule.get(), transaction, bundle);
        }

        Optional<CategorizationRule> learned = ruleMatcher.firstMatch(bundle.learnedRules(), transaction);
        if (learned.isPresent()) {
            log.debug("Transaction '{}' matched learned rule '{}'", transaction.description(), learned.get().name());
            return ruleResult(learned.get(), transaction, bundle);
        }

        if (!disableAi && fallbackClassifier.enabled()) {
            AiOutcome outcome = fallbackClassifier.classify(transaction, bundle.taxonomy());
            if (outcome instanceof AiOutcome.Accepted accepted) {
                return CategorizationResult.ai(accepted.classification().category(), resolveOwner(transaction, bundle),
                        accepted.classification().confidence());
            }
            if (outcome instanceof AiOutcome.Failed failed) {
                log.warn("AI categorization failed for '{}': {}", transaction.description(), failed.cause().getMessage());
            }
        }

        return CategorizationResult.uncategorized(resolveOwner(transaction, bundle));
    }

    private CategorizationResult ruleResult(CategorizationRule rule, Transaction transaction, RuleBundle bundle) {
        String owner = rule.hasOwner() ? rule.owner() : resolveOwner(transaction, bundle);
        return CategorizationResult.manualRule(rule.category(), owner);
    }

    private String resolveOwner(Transaction transaction, RuleBundle bundle) {
        return ownerResolver.resolveOwner(transaction, bundle.ownerMap());
    }
}
