package com.safepocket.categorizer.transfer;

import static org.assertj.core.api.Assertions.assertThat;

import com.safepocket.categorizer.config.CategorizerProperties.DetectionMethod;
import com.safepocket.categorizer.config.CategorizerProperties.Exclusions;
import com.safepocket.categorizer.config.CategorizerProperties.Transfers;
import com.safepocket.categorizer.model.Transaction;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransferDetectorTest {

    private static final List<DetectionMethod> ALL_METHODS = List.of(
            new DetectionMethod(DetectionMethod.Type.COUNTERPARTY_IN_OWN_ACCOUNTS, true, null),
            new DetectionMethod(DetectionMethod.Type.SELF_TRANSFER, null, null),
            new DetectionMethod(DetectionMethod.Type.DESCRIPTION_KEYWORDS, true, List.of("prevod mezi ucty")));

    private final TransferDetector detector = new TransferDetector(new Transfers(null,
            List.of("999/0100", "123456789/0300"),
            new Exclusions(List.of("Cashback"), List.of("Card refund")),
            ALL_METHODS));

    @Test
    void counterpartyOwnAccountIsInternal() {
        var tx = Transaction.builder().counterpartyAccount("999/0100").counterpartyName("Me").build();

        assertThat(detector.detect(tx)).isEqualTo(TransferSignal.OWN_ACCOUNT);
        assertThat(detector.isInternalTransfer(tx)).isTrue();
    }

    @Test
    void ownAccountMatchToleratesRoutingSuffix() {
        assertThat(detector.isInternalTransfer(Transaction.builder().counterpartyAccount("123456789").build())).isTrue();
        assertThat(detector.isInternalTransfer(Transaction.builder().counterpartyAccount("123456789/0800").build())).isTrue();
        assertThat(detector.isInternalTransfer(Transaction.builder().counterpartyAccount("12345678/0300").build())).isFalse();
    }

    @Test
    void exclusionAlwaysWins() {
        var byName = Transaction.builder().counterpartyAccount("999/0100").counterpartyName(" cashback ").build();
        var byType = Transaction.builder().counterpartyAccount("999/0100").type("CARD REFUND").build();

        assertThat(detector.detect(byName)).isEqualTo(TransferSignal.EXCLUDED_COUNTERPARTY);
        assertThat(detector.detect(byType)).isEqualTo(TransferSignal.EXCLUDED_TYPE);
        assertThat(detector.isInternalTransfer(byName)).isFalse();
        assertThat(detector.isInternalTransfer(byType)).isFalse();
    }

    @Test
    void selfTransferBetweenSameAccountNumbers() {
        var tx = Transaction.builder().account("555666777/2010").counterpartyAccount("555666777").build();

        assertThat(detector.detect(tx)).isEqualTo(TransferSignal.SELF_TRANSFER);
    }

    @Test
    void keywordInDescriptionOrCounterpartyName() {
        assertThat(detector.detect(Transaction.builder().description("Prevod mezi ucty - sporeni").build()))
                .isEqualTo(TransferSignal.KEYWORD);
        assertThat(detector.detect(Transaction.builder().counterpartyName("PREVOD MEZI UCTY").build()))
                .isEqualTo(TransferSignal.KEYWORD);
    }

    @Test
    void unrelatedTransactionIsNotInternal() {
        var tx = Transaction.builder().description("ALBERT SUPERMARKET").counterpartyAccount("777/0600").account("111/0100").build();

        assertThat(detector.detect(tx)).isEqualTo(TransferSignal.NONE);
    }

    @Test
    void disabledOrMissingMethodsAreSkipped() {
        TransferDetector onlyKeywords = new TransferDetector(new Transfers(null, List.of("999/0100"), null, List.of(
                new DetectionMethod(DetectionMethod.Type.COUNTERPARTY_IN_OWN_ACCOUNTS, false, null),
                new DetectionMethod(DetectionMethod.Type.DESCRIPTION_KEYWORDS, true, List.of("SAVINGS")))));

        assertThat(onlyKeywords.isInternalTransfer(Transaction.builder().counterpartyAccount("999/0100").build())).isFalse();
        assertThat(onlyKeywords.isInternalTransfer(Transaction.builder().account("1/0100").counterpartyAccount("1/0100").build())).isFalse();
        assertThat(onlyKeywords.isInternalTransfer(Transaction.builder().description("to savings").build())).isTrue();
    }
}
