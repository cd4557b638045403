package com.safepocket.categorizer.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CategorizationBatchRequestDto(
        @NotNull @Size(max = 1000) List<@Valid @NotNull TransactionRequestDto> transactions
) {
}
