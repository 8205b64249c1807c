package com.skillswap.billing.repository;

import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.model.Transaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long>, JpaSpecificationExecutor<Transaction> {

    Optional<Transaction> findByTxRef(String txRef);

    /**
     * Retrieves the transaction with the given txRef and locks it for update.
     * <p>
     * Confirmations of the same payment (webhook, client verification, renewal) serialize on
     * this lock, which together with the status check makes them apply at most once.
     * </p>
     *
     * @param txRef payment reference
     * @return the locked transaction, or empty if unknown
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Transaction t WHERE t.txRef = :txRef")
    Optional<Transaction> getOneForUpdate(@Param("txRef") String txRef);

    @Query("""
            SELECT t.type, COUNT(t), COALESCE(SUM(t.amount), 0) FROM Transaction t
            WHERE t.userId = :userId
            GROUP BY t.type
            """)
    List<Object[]> summarizeByType(@Param("userId") Long userId);

    @Query("""
            SELECT t.status, COUNT(t), COALESCE(SUM(t.amount), 0) FROM Transaction t
            WHERE t.userId = :userId
            GROUP BY t.status
            """)
    List<Object[]> summarizeByStatus(@Param("userId") Long userId);

    @Query("""
            SELECT t.status, t.currency, COUNT(t), COALESCE(SUM(t.amount), 0) FROM Transaction t
            GROUP BY t.status, t.currency
            ORDER BY t.status, t.currency
            """)
    List<Object[]> summarizeAllByStatusAndCurrency();

    @Query("""
            SELECT t.type, t.currency, COUNT(t), COALESCE(SUM(t.amount), 0) FROM Transaction t
            GROUP BY t.type, t.currency
            ORDER BY t.type, t.currency
            """)
    List<Object[]> summarizeAllByTypeAndCurrency();

    @Query("""
            SELECT t.currency, COALESCE(SUM(t.amount), 0) FROM Transaction t
            WHERE t.type = :type AND t.status = :status
            GROUP BY t.currency
            """)
    List<Object[]> sumAmountByCurrency(@Param("type") TransactionType type,
                                       @Param("status") TransactionStatus status);
}
