package com.skillswap.billing.repository;

import com.skillswap.billing.api.model.SubscriptionStatus;
import com.skillswap.billing.model.UserAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {
    /**
     * Retrieves the {@link UserAccount} with the specified ID and locks it for update.
     * <p>
     * Every wallet or subscription mutation goes through this method so that concurrent
     * deductions, webhook confirmations and renewals of the same user are serialized by the
     * database row lock. When a transaction row is also locked, it must be locked first.
     * </p>
     * <p>
     * <b>Note:</b> Keep the surrounding transaction short; other writers of the same user block
     * until it commits.
     * </p>
     *
     * @param id The user ID.
     * @return The locked account, or empty if the user is unknown.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM UserAccount u WHERE u.id = :id")
    Optional<UserAccount> getOneForUpdate(@Param("id") Long id);

    /**
     * Finds Pro users whose paid period is over.
     *
     * @param statuses statuses eligible for expiry (ACTIVE, PAST_DUE)
     * @param now      current time
     * @return user IDs
     */
    @Query("""
            SELECT u.id FROM UserAccount u
            WHERE u.pro = true
              AND u.subscriptionStatus IN :statuses
              AND u.subscriptionEndDate < :now
            ORDER BY u.id
            """)
    List<Long> findExpiredSubscriptionIds(@Param("statuses") Collection<SubscriptionStatus> statuses,
                                          @Param("now") LocalDateTime now);

    /**
     * Finds auto-renewing active subscriptions ending before the horizon.
     *
     * @param horizon end of the lookahead window
     * @return user IDs
     */
    @Query("""
            SELECT u.id FROM UserAccount u
            WHERE u.pro = true
              AND u.autoRenewal = true
              AND u.cancelAtPeriodEnd = false
              AND u.subscriptionStatus = com.skillswap.billing.api.model.SubscriptionStatus.ACTIVE
              AND u.subscriptionEndDate <= :horizon
            ORDER BY u.id
            """)
    List<Long> findRenewalCandidateIds(@Param("horizon") LocalDateTime horizon);

    /**
     * Finds active subscriptions ending within the window that have not been reminded for their
     * current end date.
     */
    @Query("""
            SELECT u.id FROM UserAccount u
            WHERE u.pro = true
              AND u.subscriptionStatus = com.skillswap.billing.api.model.SubscriptionStatus.ACTIVE
              AND u.subscriptionEndDate > :now
              AND u.subscriptionEndDate <= :horizon
              AND (u.reminderSentForEndDate IS NULL OR u.reminderSentForEndDate <> u.subscriptionEndDate)
            ORDER BY u.id
            """)
    List<Long> findReminderCandidateIds(@Param("now") LocalDateTime now,
                                        @Param("horizon") LocalDateTime horizon);

    long countByProTrue();

    long countByWalletBalanceGreaterThan(Long balance);

    @Query("""
            SELECT COUNT(u), COALESCE(SUM(u.wallet.balance), 0), COALESCE(SUM(u.wallet.totalEarnings), 0),
                   COALESCE(SUM(u.wallet.totalSpent), 0)
            FROM UserAccount u
            """)
    List<Object[]> summarizeWallets();

    @Query("SELECT u.subscriptionStatus, COUNT(u) FROM UserAccount u GROUP BY u.subscriptionStatus")
    List<Object[]> countBySubscriptionStatus();
}
