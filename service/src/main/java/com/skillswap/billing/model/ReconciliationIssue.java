package com.skillswap.billing.model;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A payment condition that automatic processing could not settle and an operator must review.
 */
@Entity
@Table(name = "reconciliation_issue")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ReconciliationIssue {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private ReconciliationIssueKind kind;

    @Column(name = "tx_ref", length = 100)
    private String txRef;

    @Column(name = "user_id")
    private Long userId;

    @Column(nullable = false, length = 2000)
    private String details;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "resolution_note", length = 1000)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
