package com.skillswap.billing.repository;

import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.model.Transaction;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;

/**
 * Filters for transaction history queries. A {@code null} argument means "no filter".
 */
public final class TransactionSpecifications {

    private TransactionSpecifications() {
    }

    public static Specification<Transaction> ownedBy(Long userId) {
        return (root, query, cb) -> cb.equal(root.get("userId"), userId);
    }

    public static Specification<Transaction> hasType(TransactionType type) {
        return (root, query, cb) -> type == null ? null : cb.equal(root.get("type"), type);
    }

    public static Specification<Transaction> hasStatus(TransactionStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<Transaction> initiatedBetween(LocalDateTime from, LocalDateTime to) {
        return (root, query, cb) -> {
            if (from == null && to == null) {
                return null;
            }
            if (from == null) {
                return cb.lessThanOrEqualTo(root.get("initiatedAt"), to);
            }
            if (to == null) {
                return cb.greaterThanOrEqualTo(root.get("initiatedAt"), from);
            }
            return cb.between(root.get("initiatedAt"), from, to);
        };
    }
}
