package com.skillswap.billing.api.response;

import com.skillswap.billing.api.model.ReconciliationIssueKind;

import java.time.LocalDateTime;

public record ReconciliationIssueResponse(
        Long id,
        ReconciliationIssueKind kind,
        String txRef,
        Long userId,
        String details,
        boolean resolved,
        String resolutionNote,
        LocalDateTime createdAt,
        LocalDateTime resolvedAt
) {}
