package com.skillswap.billing.repository;

import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.model.ReconciliationIssue;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReconciliationIssueRepository extends JpaRepository<ReconciliationIssue, Long> {

    Page<ReconciliationIssue> findByResolved(boolean resolved, Pageable pageable);

    List<ReconciliationIssue> findByTxRef(String txRef);

    boolean existsByTxRefAndKindAndResolvedFalse(String txRef, ReconciliationIssueKind kind);
}
