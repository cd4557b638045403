package com.safepocket.categorizer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.safepocket.categorizer.ai.AiClassification;
import com.safepocket.categorizer.ai.AiOutcome;
import com.safepocket.categorizer.ai.AiServiceException;
import com.safepocket.categorizer.ai.DailyQuotaExceededException;
import com.safepocket.categorizer.ai.FallbackClassifier;
import com.safepocket.categorizer.config.CategorizerProperties.DetectionMethod;
import com.safepocket.categorizer.config.CategorizerProperties.Exclusions;
import com.safepocket.categorizer.config.CategorizerProperties.Transfers;
import com.safepocket.categorizer.model.CategorizationResult;
import com.safepocket.categorizer.model.CategorizationSource;
import com.safepocket.categorizer.model.Category;
import com.safepocket.categorizer.model.CategoryTaxonomy;
import com.safepocket.categorizer.model.Transaction;
import com.safepocket.categorizer.owner.OwnerResolver;
import com.safepocket.categorizer.rules.CategorizationRule;
import com.safepocket.categorizer.rules.MatchCondition;
import com.safepocket.categorizer.rules.RuleBundle;
import com.safepocket.categorizer.rules.RuleMatcher;
import com.safepocket.categorizer.rules.RuleStore;
import com.safepocket.categorizer.rules.TransactionField;
import com.safepocket.categorizer.transfer.TransferDetector;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CategorizationEngineTest {

    private static final Category TRANSFERS = new Category("Transfers", "Internal Transfer", "Between Own Accounts");
    private static final Category GROCERIES = new Category("Living Expenses", "Groceries", "Supermarket");
    private static final Category SALARY = new Category("Income", "Salary", "Monthly Salary");
    private static final CategoryTaxonomy TAXONOMY = CategoryTaxonomy.fromRows(List.of(GROCERIES, SALARY));

    @Mock
    private RuleStore ruleStore;

    @Mock
    private FallbackClassifier fallbackClassifier;

    private CategorizationEngine engine;
    private RuleBundle bundle;

    @BeforeEach
    void setUp() {
        TransferDetector transferDetector = new TransferDetector(new Transfers(null,
                List.of("999/0100"),
                new Exclusions(List.of("Cashback"), List.of()),
                List.of(new DetectionMethod(DetectionMethod.Type.COUNTERPARTY_IN_OWN_ACCOUNTS, true, null),
                        new DetectionMethod(DetectionMethod.Type.SELF_TRANSFER, true, null))));
        engine = new CategorizationEngine(ruleStore, transferDetector, new RuleMatcher(), new OwnerResolver(),
                fallbackClassifier, TRANSFERS);

        bundle = new RuleBundle(
                List.of(
                        new CategorizationRule("salary", 10,
                                List.of(new MatchCondition.Contains(TransactionField.COUNTERPARTY_NAME, "EMPLOYER")),
                                SALARY, "Payroll"),
                        new CategorizationRule("albert", 1,
                                List.of(new MatchCondition.Contains(TransactionField.DESCRIPTION, "ALBERT")),
                                GROCERIES, null)),
                Map.of("123456789/0800", "Primary"),
                TAXONOMY,
                Instant.parse("2024-06-01T12:00:00Z"),
                RuleBundle.Origin.SOURCE);
        when(ruleStore.load(false)).thenReturn(bundle);
    }

    @Test
    void ownAccountCounterpartyIsInternalTransfer() {
        var tx = Transaction.builder()
                .description("ALBERT SUPERMARKET")
                .account("123456789/0800")
                .counterpartyAccount("999/0100")
                .build();

        CategorizationResult result = engine.categorize(tx, false);

        assertThat(result.source()).isEqualTo(CategorizationSource.INTERNAL_TRANSFER);
        assertThat(result.internalTransfer()).isTrue();
        assertThat(result.category()).isEqualTo(TRANSFERS);
        assertThat(result.owner()).isEqualTo("Primary");
        assertThat(result.confidence()).isEmpty();
        verify(fallbackClassifier, never()).classify(any(), any());
    }

    @Test
    void excludedCounterpartyFallsThroughToRules() {
        var tx = Transaction.builder()
                .description("ALBERT cashback")
                .counterpartyName("Cashback")
                .counterpartyAccount("999/0100")
                .build();

        assertThat(engine.categorize(tx, true).source()).isEqualTo(CategorizationSource.MANUAL_RULE);
    }

    @Test
    void matchingRuleUsesOwnerMapWhenRuleHasNoOwner() {
        var tx = Transaction.builder().description("ALBERT SUPERMARKET").account("123456789").build();

        CategorizationResult result = engine.categorize(tx, false);

        assertThat(result).isEqualTo(new CategorizationResult("Living Expenses", "Groceries", "Supermarket",
                "Primary", false, CategorizationSource.MANUAL_RULE, Optional.empty()));
        verify(fallbackClassifier, never()).classify(any(), any());
    }

    @Test
    void ruleOwnerWinsOverOwnerMap() {
        var tx = Transaction.builder().counterpartyName("EMPLOYER a.s.").account("123456789/0800").build();

        CategorizationResult result = engine.categorize(tx, false);

        assertThat(result.category()).isEqualTo(SALARY);
        assertThat(result.owner()).isEqualTo("Payroll");
    }

    @Test
    void learnedRuleAppliesWhenManualRulesMissAndReportsAsManualRule() {
        Category music = new Category("Entertainment", "Subscriptions", "Music");
        when(ruleStore.load(false)).thenReturn(bundle.withLearnedRules(List.of(
                new CategorizationRule("learned-spotify", 0,
                        List.of(new MatchCondition.Contains(TransactionField.DESCRIPTION, "SPOTIFY")), music, null))));
        var tx = Transaction.builder().description("SPOTIFY P1234").account("123456789/0800").build();

        CategorizationResult result = engine.categorize(tx, false);

        assertThat(result).isEqualTo(new CategorizationResult("Entertainment", "Subscriptions", "Music",
                "Primary", false, CategorizationSource.MANUAL_RULE, Optional.empty()));
        verify(fallbackClassifier, never()).classify(any(), any());
    }

    @Test
    void manualRuleBeatsLearnedRuleWhateverItsPriority() {
        Category cafe = new Category("Living Expenses", "Eating Out", "Cafe");
        when(ruleStore.load(false)).thenReturn(bundle.withLearnedRules(List.of(
                new CategorizationRule("learned-albert", 100,
                        List.of(new MatchCondition.Contains(TransactionField.DESCRIPTION, "ALBERT")), cafe, "Partner"))));

        CategorizationResult result = engine.categorize(Transaction.builder().description("ALBERT 1234").build(), true);

        assertThat(result.category()).isEqualTo(GROCERIES);
    }

    @Test
    void learnedRuleOwnerWinsOverOwnerMap() {
        when(ruleStore.load(false)).thenReturn(bundle.withLearnedRules(List.of(
                new CategorizationRule("learned-gym", 0,
                        List.of(new MatchCondition.Contains(TransactionField.DESCRIPTION, "GYM")),
                        new Category("Health", "Sport", "Gym"), "Partner"))));

        CategorizationResult result = engine.categorize(
                Transaction.builder().description("CITY GYM").account("123456789/0800").build(), true);

        assertThat(result.owner()).isEqualTo("Partner");
        assertThat(result.source()).isEqualTo(CategorizationSource.MANUAL_RULE);
    }

    @Test
    void noRuleAndAiDisabledIsUncategorized() {
        var tx = Transaction.builder().description("UNKNOWN SHOP").owner("Imported").build();

        CategorizationResult result = engine.categorize(tx, true);

        assertThat(result).isEqualTo(CategorizationResult.uncategorized("Imported"));
        assertThat(result.category()).isEqualTo(Category.UNCATEGORIZED);
        verify(fallbackClassifier, never()).classify(any(), any());
    }

    @Test
    void acceptedAiResultCarriesConfidence() {
        var tx = Transaction.builder().description("SPOTIFY").amount(new BigDecimal("-169")).build();
        Category music = new Category("Entertainment", "Subscriptions", "Music");
        when(fallbackClassifier.enabled()).thenReturn(true);
        when(fallbackClassifier.classify(tx, TAXONOMY)).thenReturn(new AiOutcome.Accepted(new AiClassification(music, 88)));

        CategorizationResult result = engine.categorize(tx, false);

        assertThat(result.source()).isEqualTo(CategorizationSource.AI);
        assertThat(result.category()).isEqualTo(music);
        assertThat(result.confidence()).contains(88);
        assertThat(result.owner()).isEqualTo(OwnerResolver.UNKNOWN_OWNER);
    }

    @Test
    void lowConfidenceAiResultIsUncategorized() {
        var tx = Transaction.builder().description("SPOTIFY").build();
        when(fallbackClassifier.enabled()).thenReturn(true);
        when(fallbackClassifier.classify(tx, TAXONOMY))
                .thenReturn(new AiOutcome.Rejected(AiOutcome.Rejected.Reason.LOW_CONFIDENCE, "40 < 75"));

        assertThat(engine.categorize(tx, false).source()).isEqualTo(CategorizationSource.UNCATEGORIZED);
    }

    @Test
    void aiFailuresDegradeToUncategorized() {
        var tx = Transaction.builder().description("SPOTIFY").build();
        when(fallbackClassifier.enabled()).thenReturn(true);
        when(fallbackClassifier.classify(tx, TAXONOMY)).thenReturn(
                new AiOutcome.Failed(new AiServiceException(500, "boom")),
                new AiOutcome.Failed(new DailyQuotaExceededException(1500, Instant.EPOCH)));

        assertThat(engine.categorize(tx, false).source()).isEqualTo(CategorizationSource.UNCATEGORIZED);
        assertThat(engine.categorize(tx, false).source()).isEqualTo(CategorizationSource.UNCATEGORIZED);
    }

    @Test
    void disabledClassifierIsNotConsulted() {
        when(fallbackClassifier.enabled()).thenReturn(false);

        engine.categorize(Transaction.builder().description("SPOTIFY").build(), false);

        verify(fallbackClassifier, never()).classify(any(), any());
    }

    @Test
    void categorizationWithoutAiIsIdempotent() {
        var tx = Transaction.builder().description("ALBERT 1234").account("555/0100").build();

        assertThat(engine.categorize(tx, true)).isEqualTo(engine.categorize(tx, true));
    }

    @Test
    void categorizeAllKeepsOrderAndLoadsBundleOnce() {
        var results = engine.categorizeAll(List.of(
                Transaction.builder().description("ALBERT").build(),
                Transaction.builder().counterpartyAccount("999").build(),
                Transaction.builder().description("???").build()), true);

        assertThat(results).extracting(CategorizationResult::source).containsExactly(
                CategorizationSource.MANUAL_RULE, CategorizationSource.INTERNAL_TRANSFER, CategorizationSource.UNCATEGORIZED);
        verify(ruleStore, times(1)).load(false);
    }
}
