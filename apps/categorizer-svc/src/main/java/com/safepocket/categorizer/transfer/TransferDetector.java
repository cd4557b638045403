package com.safepocket.categorizer.transfer;

import com.safepocket.categorizer.config.CategorizerProperties;
import com.safepocket.categorizer.config.CategorizerProperties.DetectionMethod;
import com.safepocket.categorizer.model.Transaction;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides whether a transaction moves money between the user's own accounts. Exclusions are checked
 * first and veto every detection method; the methods then run in a fixed order and each can be
 * switched off in configuration.
 */
@Component
public class TransferDetector {

    private static final Logger log = LoggerFactory.getLogger(TransferDetector.class);

    private final List<String> ownAccounts;
    private final Set<String> excludedCounterparties;
    private final Set<String> excludedTypes;
    private final boolean ownAccountMethod;
    private final boolean selfTransferMethod;
    private final List<String> keywords;

    @Autowired
    public TransferDetector(CategorizerProperties properties) {
        this(properties.transfers());
    }

    public TransferDetector(CategorizerProperties.Transfers transfers) {
        this.ownAccounts = transfers.ownAccounts().stream()
                .filter(account -> account != null && !account.isBlank())
                .map(String::trim)
                .toList();
        this.excludedCounterparties = normalizedSet(transfers.exclusions().counterpartyNames());
        this.excludedTypes = normalizedSet(transfers.exclusions().transactionTypes());
        this.ownAccountMethod = transfers.methodEnabled(DetectionMethod.Type.COUNTERPARTY_IN_OWN_ACCOUNTS);
        this.selfTransferMethod = transfers.methodEnabled(DetectionMethod.Type.SELF_TRANSFER);
        this.keywords = transfers.keywords().stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> keyword.trim().toUpperCase(Locale.ROOT))
                .toList();
    }

    public boolean isInternalTransfer(Transaction transaction) {
        return detect(transaction).internal();
    }

    public TransferSignal detect(Transaction transaction) {
        if (excludedCounterparties.contains(normalize(transaction.counterpartyName()))) {
            log.debug("Transfer detection vetoed: counterparty '{}' is excluded", transaction.counterpartyName());
            return TransferSignal.EXCLUDED_COUNTERPARTY;
        }
        if (excludedTypes.contains(normalize(transaction.type()))) {
            log.debug("Transfer detection vetoed: transaction type '{}' is excluded", transaction.type());
            return TransferSignal.EXCLUDED_TYPE;
        }

        String counterparty = transaction.counterpartyAccount();
        if (ownAccountMethod && counterparty != null && !counterparty.isBlank()) {
            for (String own : ownAccounts) {
                if (AccountNumbers.sameAccount(counterparty, own)) {
                    log.debug("Internal transfer: counterparty account '{}' matches own account '{}'", counterparty, own);
                    return TransferSignal.OWN_ACCOUNT;
                }
            }
        }
        if (selfTransferMethod && AccountNumbers.sameAccount(transaction.account(), counterparty)) {
            log.debug("Internal transfer: self-transfer on account '{}'", transaction.account());
            return TransferSignal.SELF_TRANSFER;
        }
        if (!keywords.isEmpty()) {
            String description = upper(transaction.description());
            String counterpartyName = upper(transaction.counterpartyName());
            for (String keyword : keywords) {
                if (description.contains(keyword) || counterpartyName.contains(keyword)) {
                    log.debug("Internal transfer: keyword '{}' found", keyword);
                    return TransferSignal.KEYWORD;
                }
            }
        }
        return TransferSignal.NONE;
    }

    private static Set<String> normalizedSet(List<String> values) {
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(TransferDetector::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String upper(String value) {
        return value == null ? "" : value.toUpperCase(Locale.ROOT);
    }
}
