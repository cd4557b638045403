package com.safepocket.categorizer.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.categorizer.model.Category;
import com.safepocket.categorizer.model.Transaction;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RuleMatcherTest {

    private final RuleMatcher matcher = new RuleMatcher();

    private static final Category GROCERIES = new Category("Living Expenses", "Groceries", "Supermarket");
    private static final Category CAFE = new Category("Living Expenses", "Eating Out", "Cafe");

    @Test
    void highestPriorityMatchingRuleWins() {
        CategorizationRule low = rule("low", 1, new MatchCondition.Contains(TransactionField.DESCRIPTION, "ALBERT"), GROCERIES);
        CategorizationRule high = rule("high", 9, new MatchCondition.Contains(TransactionField.DESCRIPTION, "albert"), CAFE);

        var sorted = RuleStore.sortByPriority(List.of(low, high));

        assertThat(matcher.firstMatch(sorted, tx("ALBERT SUPERMARKET"))).map(CategorizationRule::name).contains("high");
    }

    @Test
    void equalPrioritiesKeepAuthoringOrder() {
        CategorizationRule first = rule("first", 5, new MatchCondition.Contains(TransactionField.DESCRIPTION, "ALBERT"), GROCERIES);
        CategorizationRule second = rule("second", 5, new MatchCondition.Contains(TransactionField.DESCRIPTION, "SUPER"), CAFE);

        var sorted = RuleStore.sortByPriority(List.of(first, second));

        assertThat(matcher.firstMatch(sorted, tx("ALBERT SUPERMARKET"))).map(CategorizationRule::name).contains("first");
    }

    @Test
    void noMatchReturnsEmpty() {
        CategorizationRule rule = rule("albert", 1, new MatchCondition.Contains(TransactionField.DESCRIPTION, "ALBERT"), GROCERIES);

        assertThat(matcher.firstMatch(List.of(rule), tx("TESCO"))).isEmpty();
    }

    @Test
    void exactIsCaseInsensitiveAndWholeValue() {
        var condition = new MatchCondition.Exact(TransactionField.INSTITUTION, "Fio Banka");

        assertThat(matcher.evaluate(condition, Transaction.builder().institution(" FIO BANKA ").build())).isTrue();
        assertThat(matcher.evaluate(condition, Transaction.builder().institution("Fio Banka Extra").build())).isFalse();
    }

    @Test
    void regexIsCaseInsensitive() {
        var condition = new MatchCondition.Regex(TransactionField.DESCRIPTION, "^lidl\\s+\\d+");

        assertThat(matcher.evaluate(condition, tx("LIDL 1234 PRAHA"))).isTrue();
        assertThat(matcher.evaluate(condition, tx("PAYMENT LIDL 1234"))).isFalse();
    }

    @Test
    void invalidRegexNeverMatchesAndOtherRulesStillApply() {
        CategorizationRule broken = rule("broken", 10, new MatchCondition.Regex(TransactionField.DESCRIPTION, "(unclosed"), CAFE);
        CategorizationRule fine = rule("fine", 1, new MatchCondition.Contains(TransactionField.DESCRIPTION, "unclosed"), GROCERIES);

        assertThat(matcher.firstMatch(List.of(broken, fine), tx("(unclosed bracket"))).map(CategorizationRule::name).contains("fine");
    }

    @Test
    void retainPatternsDropsPatternsOfReplacedBundles() {
        CategorizationRule lidl = rule("lidl", 1, new MatchCondition.Regex(TransactionField.DESCRIPTION, "^lidl"), GROCERIES);
        CategorizationRule cafe = rule("cafe", 1, new MatchCondition.Regex(TransactionField.DESCRIPTION, "coffee|cafe"), CAFE);
        CategorizationRule learnedCafe = rule("learned", 1, new MatchCondition.Regex(TransactionField.DESCRIPTION, "espresso"), CAFE);
        matcher.firstMatch(List.of(lidl, cafe), tx("COSTA COFFEE"));
        matcher.firstMatch(List.of(learnedCafe), tx("ESPRESSO BAR"));
        assertThat(matcher.cachedPatternCount()).isEqualTo(3);

        RuleBundle replacement = new RuleBundle(List.of(cafe), Map.of(), null, Instant.EPOCH,
                RuleBundle.Origin.SOURCE, List.of(learnedCafe));
        matcher.retainPatterns(replacement);

        assertThat(matcher.cachedPatternCount()).isEqualTo(2);
        assertThat(matcher.firstMatch(replacement.rules(), tx("CAFE LOUVRE"))).map(CategorizationRule::name).contains("cafe");
    }

    @Test
    void amountRangeIsInclusiveWithOptionalDescription() {
        var range = new MatchCondition.AmountRange(TransactionField.AMOUNT, new BigDecimal("-150"), BigDecimal.ZERO, "coffee");

        assertThat(matcher.evaluate(range, tx("COFFEE BAR", "-150"))).isTrue();
        assertThat(matcher.evaluate(range, tx("COFFEE BAR", "0"))).isTrue();
        assertThat(matcher.evaluate(range, tx("COFFEE BAR", "-150.01"))).isFalse();
        assertThat(matcher.evaluate(range, tx("TEA ROOM", "-50"))).isFalse();
        assertThat(matcher.evaluate(range, tx("COFFEE BAR", null))).isFalse();
    }

    @Test
    void openEndedRangeOnNormalizedAmountFallsBackToAmount() {
        var range = new MatchCondition.AmountRange(TransactionField.NORMALIZED_AMOUNT, new BigDecimal("1000"), null, null);

        assertThat(matcher.evaluate(range, tx("X", "2500"))).isTrue();
        assertThat(matcher.evaluate(range, Transaction.builder()
                .amount(new BigDecimal("100"))
                .normalizedAmount(new BigDecimal("2400"))
                .build())).isTrue();
        assertThat(matcher.evaluate(range, tx("X", "999.99"))).isFalse();
    }

    @Test
    void allRequiresEverySubCondition() {
        var all = new MatchCondition.All(List.of(
                new MatchCondition.Contains(TransactionField.COUNTERPARTY_NAME, "reality"),
                new MatchCondition.LessThan(TransactionField.AMOUNT, BigDecimal.ZERO),
                new MatchCondition.GreaterThan(TransactionField.AMOUNT, new BigDecimal("-30000"))));

        Transaction rent = Transaction.builder().counterpartyName("Reality Praha s.r.o.").amount(new BigDecimal("-18000")).build();
        Transaction refund = Transaction.builder().counterpartyName("Reality Praha s.r.o.").amount(new BigDecimal("500")).build();

        assertThat(matcher.evaluate(all, rent)).isTrue();
        assertThat(matcher.evaluate(all, refund)).isFalse();
    }

    @Test
    void ruleRequiresAllOfItsConditions() {
        CategorizationRule rule = new CategorizationRule("salary", 1, List.of(
                new MatchCondition.Contains(TransactionField.COUNTERPARTY_NAME, "EMPLOYER"),
                new MatchCondition.Contains(TransactionField.TYPE, "incoming")), GROCERIES, null);

        assertThat(matcher.matches(rule, Transaction.builder().counterpartyName("Employer a.s.").type("Incoming payment").build())).isTrue();
        assertThat(matcher.matches(rule, Transaction.builder().counterpartyName("Employer a.s.").type("Card payment").build())).isFalse();
    }

    private static CategorizationRule rule(String name, int priority, MatchCondition condition, Category category) {
        return new CategorizationRule(name, priority, List.of(condition), category, null);
    }

    private static Transaction tx(String description) {
        return Transaction.builder().description(description).build();
    }

    private static Transaction tx(String description, String amount) {
        return Transaction.builder()
                .description(description)
                .amount(amount == null ? null : new BigDecimal(amount))
                .build();
    }
}
