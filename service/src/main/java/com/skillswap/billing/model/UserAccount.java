package com.skillswap.billing.model;

import com.skillswap.billing.api.model.SubscriptionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * Billing view of a marketplace user.
 * <p>
 * Identity is owned by the user service; this row mirrors the user by ID and holds the wallet
 * and subscription state. Rows are mutated only under a pessimistic lock obtained through
 * {@code UserAccountRepository.getOneForUpdate}.
 * </p>
 * <p>
 * Invariant: {@code pro == true} implies {@code subscriptionEndDate != null} and
 * {@code subscriptionStatus} is ACTIVE or PAST_DUE.
 * </p>
 */
@Entity
@Table(name = "user_account")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class UserAccount {
    @Id
    private Long id;

    private String email;

    @Column(name = "full_name")
    private String fullName;

    @Embedded
    private Wallet wallet = new Wallet();

    @Column(name = "is_pro", nullable = false)
    private boolean pro;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_status", nullable = false, length = 20)
    private SubscriptionStatus subscriptionStatus = SubscriptionStatus.INACTIVE;

    @Column(name = "subscription_plan_id")
    private Long subscriptionPlanId;

    @Column(name = "subscription_start_date")
    private LocalDateTime subscriptionStartDate;

    @Column(name = "subscription_end_date")
    private LocalDateTime subscriptionEndDate;

    @Column(name = "auto_renewal", nullable = false)
    private boolean autoRenewal = true;

    /**
     * Set when the user cancelled. Access continues until {@code subscriptionEndDate}, then the
     * expiry sweep moves the subscription to CANCELLED instead of EXPIRED.
     */
    @Column(name = "cancel_at_period_end", nullable = false)
    private boolean cancelAtPeriodEnd;

    /**
     * txRef of the subscription charge currently in flight, if any.
     */
    @Column(name = "pending_subscription_tx_ref", length = 100)
    private String pendingSubscriptionTxRef;

    @Column(name = "pending_subscription_plan_id")
    private Long pendingSubscriptionPlanId;

    @Column(name = "last_payment_reference", length = 100)
    private String lastPaymentReference;

    @Column(name = "last_payment_amount")
    private Long lastPaymentAmount;

    @Column(name = "last_payment_date")
    private LocalDateTime lastPaymentDate;

    @Column(name = "last_payment_failure_reason", length = 500)
    private String lastPaymentFailureReason;

    /**
     * End date for which the "expiring soon" reminder was sent. Reset implicitly when the end
     * date moves.
     */
    @Column(name = "reminder_sent_for_end_date")
    private LocalDateTime reminderSentForEndDate;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "user_enrolled_course", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "course_id")
    private Set<Long> enrolledCourseIds = new HashSet<>();

    public void clearPendingSubscription() {
        this.pendingSubscriptionTxRef = null;
        this.pendingSubscriptionPlanId = null;
    }
}
