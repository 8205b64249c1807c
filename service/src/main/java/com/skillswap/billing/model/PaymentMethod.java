package com.skillswap.billing.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Reusable card authorization of a user, charged by the renewal sweep.
 */
@Entity
@Table(name = "payment_method")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PaymentMethod {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(name = "authorization_token", nullable = false, length = 255)
    private String authorizationToken;

    @Column(length = 30)
    private String brand;

    @Column(length = 4)
    private String last4;

    @Column(name = "is_primary", nullable = false)
    private boolean primaryMethod;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
