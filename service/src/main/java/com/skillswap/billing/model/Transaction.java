package com.skillswap.billing.model;

import com.skillswap.billing.api.model.PlanDuration;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Ledger entry of a user.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>Created PENDING when a provider payment starts, or directly SUCCESSFUL for internal
 *       wallet movements (deductions, earnings)</li>
 *   <li>PENDING moves exactly once to SUCCESSFUL, FAILED or CANCELLED</li>
 *   <li>Resolved rows never change status again</li>
 * </ul>
 *
 * <p>{@code txRef} is unique and is the idempotency key for provider confirmations.
 */
@Entity
@Table(name = "ledger_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Transaction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TransactionType type;

    /**
     * Amount in minor currency units, never negative. The direction follows from the type.
     */
    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "tx_ref", nullable = false, unique = true, length = 100)
    private String txRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(length = 255)
    private String description;

    @Column(name = "provider_transaction_id", length = 100)
    private String providerTransactionId;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "course_id")
    private Long courseId;

    /**
     * Other side of a transfer: the instructor for an enrollment deduction, the buyer for
     * instructor earnings.
     */
    @Column(name = "counterparty_user_id")
    private Long counterpartyUserId;

    // Plan snapshot for SUBSCRIPTION transactions
    @Column(name = "plan_id")
    private Long planId;

    @Column(name = "plan_name", length = 100)
    private String planName;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_duration", length = 20)
    private PlanDuration planDuration;

    /**
     * Marks a renewal charge: on success the subscription extends from the previous end date
     * instead of starting now.
     */
    @Column(name = "is_renewal", nullable = false)
    private boolean renewal;

    /**
     * Set when automatic processing gave up; see the reconciliation_issue table.
     */
    @Column(name = "requires_reconciliation", nullable = false)
    private boolean requiresReconciliation;

    @Column(name = "initiated_at", nullable = false)
    private LocalDateTime initiatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;
}
