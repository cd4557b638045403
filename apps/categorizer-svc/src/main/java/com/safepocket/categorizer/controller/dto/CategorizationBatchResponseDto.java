package com.safepocket.categorizer.controller.dto;

import java.util.List;

public record CategorizationBatchResponseDto(List<CategorizationResponseDto> results, String traceId) {
}
