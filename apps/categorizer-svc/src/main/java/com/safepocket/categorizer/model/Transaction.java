package com.safepocket.categorizer.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Normalized transaction as handed over by the statement import pipeline.
 * {@code normalizedAmount} is the amount converted to the reporting currency; {@code owner}
 * is whatever owner the importer already attached, if any.
 */
public record Transaction(
        String description,
        String counterpartyName,
        String counterpartyAccount,
        String account,
        String institution,
        String type,
        BigDecimal amount,
        BigDecimal normalizedAmount,
        String currency,
        String variableSymbol,
        LocalDate date,
        String owner
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String description;
        private String counterpartyName;
        private String counterpartyAccount;
        private String account;
        private String institution;
        private String type;
        private BigDecimal amount;
        private BigDecimal normalizedAmount;
        private String currency;
        private String variableSymbol;
        private LocalDate date;
        private String owner;

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder counterpartyName(String counterpartyName) {
            this.counterpartyName = counterpartyName;
            return this;
        }

        public Builder counterpartyAccount(String counterpartyAccount) {
            this.counterpartyAccount = counterpartyAccount;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder institution(String institution) {
            this.institution = institution;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder normalizedAmount(BigDecimal normalizedAmount) {
            this.normalizedAmount = normalizedAmount;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder variableSymbol(String variableSymbol) {
            this.variableSymbol = variableSymbol;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Transaction build() {
            return new Transaction(description, counterpartyName, counterpartyAccount, account, institution, type,
                    amount, normalizedAmount, currency, variableSymbol, date, owner);
        }
    }
}
