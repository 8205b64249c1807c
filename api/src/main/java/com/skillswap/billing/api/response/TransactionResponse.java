package com.skillswap.billing.api.response;

import com.skillswap.billing.api.model.PlanDuration;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;

import java.time.LocalDateTime;

public record TransactionResponse(
        Long id,
        Long userId,
        TransactionType type,
        Long amount,
        String currency,
        String txRef,
        TransactionStatus status,
        String description,
        String providerTransactionId,
        String failureReason,
        Long courseId,
        Long counterpartyUserId,
        Long planId,
        String planName,
        PlanDuration planDuration,
        boolean renewal,
        boolean requiresReconciliation,
        LocalDateTime initiatedAt,
        LocalDateTime completedAt,
        LocalDateTime failedAt
) {}
