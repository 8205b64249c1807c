package com.skillswap.billing.service;

import com.skillswap.billing.api.model.TransactionStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Guards the lifecycle of a ledger transaction.
 *
 * <pre>
 *            PENDING
 *               |
 *     +---------+---------+
 *     |         |         |
 * SUCCESSFUL  FAILED  CANCELLED
 * </pre>
 *
 * <p>A transaction is resolved exactly once. Callers treat a repeated provider event for a
 * resolved transaction as a no-op before asking for a transition.
 */
@Component
public class TransactionStatusStateMachine {

    private static final Set<TransactionStatus> RESOLVED = EnumSet.of(
            TransactionStatus.SUCCESSFUL,
            TransactionStatus.FAILED,
            TransactionStatus.CANCELLED
    );

    private static final Map<TransactionStatus, Set<TransactionStatus>> NEXT_STATES =
            Map.of(TransactionStatus.PENDING, RESOLVED);

    public boolean isTransitionAllowed(TransactionStatus current, TransactionStatus target) {
        if (current == null || target == null) {
            return false;
        }
        return NEXT_STATES.getOrDefault(current, Set.of()).contains(target);
    }

    /**
     * @throws IllegalStateException if {@code target} cannot follow {@code current}
     */
    public void validateTransition(TransactionStatus current, TransactionStatus target) {
        if (!isTransitionAllowed(current, target)) {
            throw new IllegalStateException("Transaction cannot move from " + current + " to " + target
                    + "; allowed: " + NEXT_STATES.getOrDefault(current, Set.of()));
        }
    }

    public boolean isFinalState(TransactionStatus status) {
        return RESOLVED.contains(status);
    }
}
