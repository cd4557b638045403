package com.safepocket.categorizer.config;

import com.safepocket.categorizer.ai.FallbackClassifier;
import com.safepocket.categorizer.rules.RuleStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final CategorizerProperties props;
    private final RuleStore ruleStore;
    private final FallbackClassifier fallbackClassifier;

    public StartupDiagnostics(CategorizerProperties props, RuleStore ruleStore, FallbackClassifier fallbackClassifier) {
        this.props = props;
        this.ruleStore = ruleStore;
        this.fallbackClassifier = fallbackClassifier;
    }

    @PostConstruct
    void logConfig() {
        // Structural info only; the API key itself is never logged.
        var rules = props.rules();
        log.info("Rules config: source={}, cacheFile='{}', cacheTtl={}",
                ruleStore.describeSource(), rules.hasCacheFile() ? rules.cacheFile() : "", rules.cacheTtl());

        var learning = props.learning();
        log.info("Learning config: enabled={}, learnedRulesFile='{}'",
                learning.enabledFlag(), learning.enabledFlag() ? learning.learnedRulesFile() : "");

        var transfers = props.transfers();
        log.info("Transfer config: category='{}', ownAccounts={}, excludedCounterparties={}, excludedTypes={}, methods={}",
                transfers.category().toCategory(), transfers.ownAccounts().size(),
                transfers.exclusions().counterpartyNames().size(), transfers.exclusions().transactionTypes().size(),
                transfers.detectionMethods().size());

        var ai = props.ai();
        log.info("AI config: provider='{}', model='{}', endpoint='{}', apiKeyPresent={}, rpm={}, rpd={}, threshold={}, classifier={}",
                ai.provider(), ai.model(), ai.endpoint(), ai.resolveApiKey().isPresent(),
                ai.requestsPerMinute(), ai.requestsPerDay(), ai.confidenceThreshold(), fallbackClassifier.describe());
    }
}
