package com.safepocket.categorizer.config;

import com.safepocket.categorizer.model.Category;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "categorizer")
public record CategorizerProperties(
        Rules rules,
        Transfers transfers,
        Learning learning,
        Ai ai
) {

    @ConstructorBinding
    public CategorizerProperties {
        rules = rules != null ? rules : new Rules(null, null, null, null);
        transfers = transfers != null ? transfers : new Transfers(null, null, null, null);
        learning = learning != null ? learning : new Learning(null, null);
        ai = ai != null ? ai : Ai.disabled();
    }

    public record Rules(String source, String path, String cacheFile, Duration cacheTtl) {
        public Rules {
            source = source == null || source.isBlank() ? "yaml" : source.trim().toLowerCase(Locale.ROOT);
            if (!source.equals("yaml") && !source.equals("jdbc")) {
                throw new IllegalArgumentException("rules.source must be 'yaml' or 'jdbc' but was '" + source + "'");
            }
            if (source.equals("yaml") && (path == null || path.isBlank())) {
                path = "classpath:categorization.yaml";
            }
            cacheTtl = cacheTtl != null ? cacheTtl : Duration.ofMinutes(5);
            if (cacheTtl.isNegative()) {
                throw new IllegalArgumentException("rules.cache-ttl must not be negative");
            }
            // cacheFile optional: without it a source outage degrades straight to an empty rule set
        }

        public boolean hasCacheFile() {
            return cacheFile != null && !cacheFile.isBlank();
        }
    }

    public record Transfers(
            TransferCategory category,
            List<String> ownAccounts,
            Exclusions exclusions,
            List<DetectionMethod> detectionMethods
    ) {
        public Transfers {
            category = category != null ? category : new TransferCategory(null, null, null);
            ownAccounts = ownAccounts == null ? List.of() : List.copyOf(ownAccounts);
            exclusions = exclusions != null ? exclusions : new Exclusions(null, null);
            detectionMethods = detectionMethods == null ? List.of() : List.copyOf(detectionMethods);
        }

        public boolean methodEnabled(DetectionMethod.Type type) {
            return detectionMethods.stream().anyMatch(method -> method.type() == type && method.enabledFlag());
        }

        public List<String> keywords() {
            return detectionMethods.stream()
                    .filter(method -> method.type() == DetectionMethod.Type.DESCRIPTION_KEYWORDS && method.enabledFlag())
                    .flatMap(method -> method.keywords().stream())
                    .toList();
        }
    }

    public record TransferCategory(String tier1, String tier2, String tier3) {
        public TransferCategory {
            tier1 = tier1 == null || tier1.isBlank() ? "Transfers" : tier1;
            tier2 = tier2 == null || tier2.isBlank() ? "Internal Transfer" : tier2;
            tier3 = tier3 == null || tier3.isBlank() ? "Between Own Accounts" : tier3;
        }

        public Category toCategory() {
            return new Category(tier1, tier2, tier3);
        }
    }

    public record Exclusions(List<String> counterpartyNames, List<String> transactionTypes) {
        public Exclusions {
            counterpartyNames = counterpartyNames == null ? List.of() : List.copyOf(counterpartyNames);
            transactionTypes = transactionTypes == null ? List.of() : List.copyOf(transactionTypes);
        }
    }

    public record DetectionMethod(Type type, Boolean enabled, List<String> keywords) {

        public enum Type {
            COUNTERPARTY_IN_OWN_ACCOUNTS,
            SELF_TRANSFER,
            DESCRIPTION_KEYWORDS
        }

        public DetectionMethod {
            if (type == null) {
                throw new IllegalArgumentException("detection method type must be provided");
            }
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }
    }

    public record Learning(Boolean enabled, String learnedRulesFile) {
        public Learning {
            learnedRulesFile = learnedRulesFile == null || learnedRulesFile.isBlank()
                    ? "data/cache/learned_rules.yaml"
                    : learnedRulesFile.trim();
        }

        public boolean enabledFlag() {
            return enabled != null && enabled;
        }
    }

    public record Ai(
            Boolean enabled,
            String provider,
            String model,
            String endpoint,
            String apiKeyEnv,
            String apiKey,
            Integer confidenceThreshold,
            String promptTemplate,
            Duration timeout,
            Integer requestsPerMinute,
            Integer requestsPerDay,
            Integer maxRetries,
            Duration baseDelay,
            Boolean cacheResults,
            String resultLogFile
    ) {
        public static final String DEFAULT_PROMPT_TEMPLATE = """
                You categorize personal bank transactions into a fixed three-level category tree.

                Transaction:
                - Date: {date}
                - Amount: {amount} {currency}
                - Description: {description}
                - Counterparty: {counterparty_name}
                - Counterparty account: {counterparty_account}
                - Institution: {institution}
                - Type: {type}

                Available categories:
                {category_tree_summary}

                Answer with exactly these four lines and nothing else:
                Tier1: <tier1>
                Tier2: <tier2>
                Tier3: <tier3>
                Confidence: <0-100>
                """;

        public Ai {
            provider = provider == null || provider.isBlank() ? "gemini" : provider.trim().toLowerCase(Locale.ROOT);
            if (!provider.equals("gemini") && !provider.equals("openai")) {
                throw new IllegalArgumentException("ai.provider must be 'gemini' or 'openai' but was '" + provider + "'");
            }
            if (model == null || model.isBlank()) {
                model = provider.equals("gemini") ? "gemini-2.0-flash" : "gpt-4o-mini";
            }
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = provider.equals("gemini")
                        ? "https://generativelanguage.googleapis.com/v1beta"
                        : "https://api.openai.com/v1/responses";
            }
            apiKeyEnv = apiKeyEnv == null || apiKeyEnv.isBlank() ? "GEMINI_API_KEY" : apiKeyEnv.trim();
            confidenceThreshold = confidenceThreshold != null ? confidenceThreshold : 75;
            if (confidenceThreshold < 0 || confidenceThreshold > 100) {
                throw new IllegalArgumentException("ai.confidence-threshold must be between 0 and 100");
            }
            promptTemplate = promptTemplate == null || promptTemplate.isBlank() ? DEFAULT_PROMPT_TEMPLATE : promptTemplate;
            timeout = timeout != null ? timeout : Duration.ofSeconds(30);
            requestsPerMinute = requestsPerMinute != null ? requestsPerMinute : 15;
            if (requestsPerMinute <= 0) {
                throw new IllegalArgumentException("ai.requests-per-minute must be positive");
            }
            requestsPerDay = requestsPerDay != null ? requestsPerDay : 1500;
            if (requestsPerDay <= 0) {
                throw new IllegalArgumentException("ai.requests-per-day must be positive");
            }
            maxRetries = maxRetries != null ? maxRetries : 3;
            if (maxRetries < 0) {
                throw new IllegalArgumentException("ai.max-retries must not be negative");
            }
            baseDelay = baseDelay != null ? baseDelay : Duration.ofSeconds(2);
            // apiKey may be null/blank; the key is then taken from the environment variable named by apiKeyEnv
        }

        static Ai disabled() {
            return new Ai(false, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
        }

        public boolean enabledFlag() {
            return enabled != null && enabled;
        }

        public boolean cacheResultsFlag() {
            return cacheResults != null && cacheResults && resultLogFile != null && !resultLogFile.isBlank();
        }

        public Optional<String> resolveApiKey() {
            return resolveApiKey(System::getenv);
        }

        Optional<String> resolveApiKey(Function<String, String> environment) {
            String envKey = environment.apply(apiKeyEnv);
            if (envKey != null && !envKey.isBlank()) {
                return Optional.of(envKey.trim());
            }
            if (apiKey != null && !apiKey.isBlank()) {
                return Optional.of(apiKey.trim());
            }
            return Optional.empty();
        }
    }
}
