package com.phillippitts.querybridge.presentation.controller;

import com.phillippitts.querybridge.domain.ContextTurn;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Body of {@code POST /api/query}. Length and context limits are enforced by the service layer.
 *
 * @param timeoutMs optional wait bound; absent or {@code <= 0} uses the configured default
 */
record QueryRequest(
        @NotBlank String query,
        String callerId,
        String sessionId,
        List<ContextTurn> context,
        Long timeoutMs
) {
}
