package com.safepocket.categorizer.controller.dto;

import com.safepocket.categorizer.model.Transaction;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

public record TransactionRequestDto(
        @Size(max = 1024) String description,
        @Size(max = 255) String counterpartyName,
        @Size(max = 64) String counterpartyAccount,
        @Size(max = 64) String account,
        @Size(max = 128) String institution,
        @Size(max = 128) String type,
        BigDecimal amount,
        BigDecimal normalizedAmount,
        @Size(max = 3) String currency,
        @Size(max = 32) String variableSymbol,
        LocalDate date,
        @Size(max = 128) String owner
) {

    public Transaction toTransaction() {
        return Transaction.builder()
                .description(description)
                .counterpartyName(counterpartyName)
                .counterpartyAccount(counterpartyAccount)
                .account(account)
                .institution(institution)
                .type(type)
                .amount(amount)
                .normalizedAmount(normalizedAmount)
                .currency(currency)
                .variableSymbol(variableSymbol)
                .date(date)
                .owner(owner)
                .build();
    }
}
