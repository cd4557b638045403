package com.safepocket.categorizer.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.safepocket.categorizer.model.Transaction;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Transaction attributes a rule condition may refer to, keyed by the names used in rule definitions.
 */
public enum TransactionField {
    DESCRIPTION("description", Transaction::description),
    COUNTERPARTY_NAME("counterparty_name", Transaction::counterpartyName),
    COUNTERPARTY_ACCOUNT("counterparty_account", Transaction::counterpartyAccount),
    ACCOUNT("account", Transaction::account),
    INSTITUTION("institution", Transaction::institution),
    TYPE("type", Transaction::type, "transaction_type"),
    AMOUNT("amount", Transaction::amount),
    NORMALIZED_AMOUNT("normalized_amount",
            tx -> tx.normalizedAmount() != null ? tx.normalizedAmount() : tx.amount(),
            "amount_czk"),
    CURRENCY("currency", Transaction::currency),
    VARIABLE_SYMBOL("variable_symbol", Transaction::variableSymbol),
    OWNER("owner", Transaction::owner);

    private final String key;
    private final Function<Transaction, Object> accessor;
    private final List<String> aliases;

    TransactionField(String key, Function<Transaction, Object> accessor, String... aliases) {
        this.key = key;
        this.accessor = accessor;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static TransactionField fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("field must be provided");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransactionField field : values()) {
            if (field.key.equals(normalized) || field.aliases.contains(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown transaction field '" + value + "'");
    }

    /**
     * Field value as text; missing values read as the empty string.
     */
    public String text(Transaction transaction) {
        Object value = accessor.apply(transaction);
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    public Optional<BigDecimal> number(Transaction transaction) {
        Object value = accessor.apply(transaction);
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value.toString().trim().replace(',', '.')));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
