package com.safepocket.categorizer.rules;

import com.safepocket.categorizer.model.Transaction;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(RuleMatcher.class);

    private final ConcurrentMap<String, Optional<Pattern>> compiledPatterns = new ConcurrentHashMap<>();

    /**
     * Returns the first rule, in list order, whose conditions all hold. Callers pass rules already
     * sorted by priority.
     */
    public Optional<CategorizationRule> firstMatch(List<CategorizationRule> rules, Transaction transaction) {
        for (CategorizationRule rule : rules) {
            if (matches(rule, transaction)) {
                log.debug("Rule '{}' (priority {}) matched: {}", rule.name(), rule.priority(), rule.category());
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Drops compiled patterns that no rule of {@code bundle} uses any more.
     */
    public void retainPatterns(RuleBundle bundle) {
        Set<String> inUse = new HashSet<>();
        collectPatterns(bundle.rules(), inUse);
        collectPatterns(bundle.learnedRules(), inUse);
        int before = compiledPatterns.size();
        compiledPatterns.keySet().retainAll(inUse);
        int evicted = before - compiledPatterns.size();
        if (evicted > 0) {
            log.debug("Evicted {} compiled patterns no longer referenced by the rule bundle", evicted);
        }
    }

    int cachedPatternCount() {
        return compiledPatterns.size();
    }

    public boolean matches(CategorizationRule rule, Transaction transaction) {
        for (MatchCondition condition : rule.conditions()) {
            if (!evaluate(condition, transaction)) {
                return false;
            }
        }
        return true;
    }

    boolean evaluate(MatchCondition condition, Transaction transaction) {
        if (condition instanceof MatchCondition.Contains contains) {
            return upper(contains.field().text(transaction)).contains(upper(contains.value()));
        }
        if (condition instanceof MatchCondition.Exact exact) {
            return exact.field().text(transaction).trim().equalsIgnoreCase(exact.value());
        }
        if (condition instanceof MatchCondition.GreaterThan greaterThan) {
            return greaterThan.field().number(transaction)
                    .map(value -> value.compareTo(greaterThan.value()) > 0)
                    .orElse(false);
        }
        if (condition instanceof MatchCondition.LessThan lessThan) {
            return lessThan.field().number(transaction)
                    .map(value -> value.compareTo(lessThan.value()) < 0)
                    .orElse(false);
        }
        if (condition instanceof MatchCondition.Regex regex) {
            return compile(regex.pattern())
                    .map(pattern -> pattern.matcher(regex.field().text(transaction)).find())
                    .orElse(false);
        }
        if (condition instanceof MatchCondition.AmountRange range) {
            return inRange(range, transaction);
        }
        if (condition instanceof MatchCondition.All all) {
            for (MatchCondition.FieldCondition nested : all.conditions()) {
                if (!evaluate(nested, transaction)) {
                    return false;
                }
            }
            return true;
        }
        throw new IllegalStateException("Unsupported condition type: " + condition.getClass().getName());
    }

    private boolean inRange(MatchCondition.AmountRange range, Transaction transaction) {
        if (range.min() != null || range.max() != null) {
            Optional<BigDecimal> amount = range.field().number(transaction);
            if (amount.isEmpty()) {
                return false;
            }
            if (range.min() != null && amount.get().compareTo(range.min()) < 0) {
                return false;
            }
            if (range.max() != null && amount.get().compareTo(range.max()) > 0) {
                return false;
            }
        }
        if (range.descriptionContains() != null) {
            return upper(TransactionField.DESCRIPTION.text(transaction)).contains(upper(range.descriptionContains()));
        }
        return true;
    }

    private Optional<Pattern> compile(String regex) {
        return compiledPatterns.computeIfAbsent(regex, source -> {
            try {
                return Optional.of(Pattern.compile(source, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            } catch (PatternSyntaxException ex) {
                log.warn("Invalid regex pattern '{}' in categorization rule; condition will never match: {}",
                        source, ex.getDescription());
                return Optional.empty();
            }
        });
    }

    private static void collectPatterns(List<CategorizationRule> rules, Set<String> patterns) {
        for (CategorizationRule rule : rules) {
            for (MatchCondition condition : rule.conditions()) {
                if (condition instanceof MatchCondition.Regex regex) {
                    patterns.add(regex.pattern());
                }
            }
        }
    }

    private static String upper(String value) {
        return value == null ? "" : value.toUpperCase(Locale.ROOT);
    }
}
