package com.safepocket.categorizer.controller;

import com.safepocket.categorizer.controller.dto.CategorizationBatchRequestDto;
import com.safepocket.categorizer.controller.dto.CategorizationBatchResponseDto;
import com.safepocket.categorizer.controller.dto.CategorizationResponseDto;
import com.safepocket.categorizer.controller.dto.TransactionRequestDto;
import com.safepocket.categorizer.model.Transaction;
import com.safepocket.categorizer.service.CategorizationEngine;
import com.safepocket.categorizer.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/categorizations")
public class CategorizationController {

    private final CategorizationEngine categorizationEngine;

    public CategorizationController(CategorizationEngine categorizationEngine) {
        this.categorizationEngine = categorizationEngine;
    }

    @PostMapping
    public ResponseEntity<CategorizationResponseDto> categorize(
            @Valid @RequestBody TransactionRequestDto request,
            @RequestParam(value = "disableAi", required = false, defaultValue = "false") boolean disableAi
    ) {
        var result = categorizationEngine.categorize(request.toTransaction(), disableAi);
        return ResponseEntity.ok(CategorizationResponseDto.from(result));
    }

    /**
     * Bulk re-categorization. AI is off unless asked for so that re-runs after a rule edit stay
     * deterministic and do not spend the daily quota.
     */
    @PostMapping("/batch")
    public ResponseEntity<CategorizationBatchResponseDto> categorizeBatch(
            @Valid @RequestBody CategorizationBatchRequestDto request,
            @RequestParam(value = "disableAi", required = false, defaultValue = "true") boolean disableAi
    ) {
        List<Transaction> transactions = request.transactions().stream()
                .map(TransactionRequestDto::toTransaction)
                .toList();
        List<CategorizationResponseDto> results = categorizationEngine.categorizeAll(transactions, disableAi).stream()
                .map(CategorizationResponseDto::from)
                .toList();
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(new CategorizationBatchResponseDto(results, traceId));
    }
}
