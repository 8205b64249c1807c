package com.skillswap.billing.repository;

import com.skillswap.billing.model.PaymentMethod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentMethodRepository extends JpaRepository<PaymentMethod, Long> {

    List<PaymentMethod> findByUserIdOrderByPrimaryMethodDescCreatedAtAsc(Long userId);

    /**
     * The method renewals charge: the primary one, else the oldest one.
     *
     * @param userId owner
     * @return designated payment method, or empty if the user has none
     */
    Optional<PaymentMethod> findFirstByUserIdOrderByPrimaryMethodDescCreatedAtAsc(Long userId);

    Optional<PaymentMethod> findByIdAndUserId(Long id, Long userId);

    @Modifying
    @Query("UPDATE PaymentMethod p SET p.primaryMethod = false WHERE p.userId = :userId")
    int clearPrimary(@Param("userId") Long userId);
}
