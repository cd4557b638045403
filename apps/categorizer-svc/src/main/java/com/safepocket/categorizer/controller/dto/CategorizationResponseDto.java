package com.safepocket.categorizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.safepocket.categorizer.model.CategorizationResult;
import com.safepocket.categorizer.model.CategorizationSource;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategorizationResponseDto(
        String tier1,
        String tier2,
        String tier3,
        String owner,
        boolean internalTransfer,
        CategorizationSource source,
        Integer confidence
) {

    public static CategorizationResponseDto from(CategorizationResult result) {
        return new CategorizationResponseDto(
                result.tier1(),
                result.tier2(),
                result.tier3(),
                result.owner(),
                result.internalTransfer(),
                result.source(),
                result.confidence().orElse(null));
    }
}
