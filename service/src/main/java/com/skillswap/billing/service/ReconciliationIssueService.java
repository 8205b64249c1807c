package com.skillswap.billing.service;

import com.skillswap.billing.api.dto.PagedResponse;
import com.skillswap.billing.api.model.ReconciliationIssueKind;
import com.skillswap.billing.api.response.ReconciliationIssueResponse;
import com.skillswap.billing.error.ReconciliationIssueNotFoundException;
import com.skillswap.billing.mapper.ReconciliationIssueMapper;
import com.skillswap.billing.model.ReconciliationIssue;
import com.skillswap.billing.repository.ReconciliationIssueRepository;
import com.skillswap.billing.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Manual reconciliation queue.
 *
 * <p>Recording runs in its own transaction so the flag persists even when the caller's
 * transaction rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationIssueService {

    private static final int MAX_DETAILS_LENGTH = 2000;

    private final ReconciliationIssueRepository issueRepository;
    private final TransactionRepository transactionRepository;
    private final Clock clock;

    /**
     * Records an issue and marks the referenced transaction, if it exists, as requiring
     * reconciliation. The transaction status is not touched.
     *
     * @param kind    issue category
     * @param txRef   payment reference, may be {@code null}
     * @param userId  affected user, may be {@code null}
     * @param details what happened
     * @return the stored issue
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReconciliationIssue record(ReconciliationIssueKind kind, String txRef, Long userId, String details) {
        Long affectedUser = userId;
        if (txRef != null) {
            var transaction = transactionRepository.findByTxRef(txRef);
            if (transaction.isPresent()) {
                transaction.get().setRequiresReconciliation(true);
                if (affectedUser == null) {
                    affectedUser = transaction.get().getUserId();
                }
            }
        }

        ReconciliationIssue issue = new ReconciliationIssue();
        issue.setKind(kind);
        issue.setTxRef(txRef);
        issue.setUserId(affectedUser);
        issue.setDetails(truncate(details));
        issue.setResolved(false);
        issue.setCreatedAt(LocalDateTime.now(clock));
        ReconciliationIssue saved = issueRepository.save(issue);

        log.error("Reconciliation issue recorded: id={}, kind={}, txRef={}, userId={}, details={}",
                saved.getId(), kind, txRef, affectedUser, details);
        return saved;
    }

    @Transactional(readOnly = true)
    public PagedResponse<ReconciliationIssueResponse> list(boolean resolved, int page, int size) {
        Pagination.validate(page, size);
        Page<ReconciliationIssue> issues = issueRepository.findByResolved(resolved,
                PageRequest.of(page - 1, size, Sort.by(Sort.Direction.ASC, "createdAt", "id")));
        return new PagedResponse<>(
                ReconciliationIssueMapper.INSTANCE.toResponseList(issues.getContent()),
                page, size, issues.getTotalElements());
    }

    @Transactional
    public ReconciliationIssueResponse resolve(Long issueId, String note) {
        ReconciliationIssue issue = issueRepository.findById(issueId)
                .orElseThrow(() -> new ReconciliationIssueNotFoundException("Reconciliation issue with ID " + issueId + " not found"));
        if (issue.isResolved()) {
            throw new IllegalStateException("Reconciliation issue " + issueId + " is already resolved");
        }
        issue.setResolved(true);
        issue.setResolutionNote(note);
        issue.setResolvedAt(LocalDateTime.now(clock));
        log.info("Reconciliation issue resolved: id={}, kind={}, txRef={}", issueId, issue.getKind(), issue.getTxRef());
        return ReconciliationIssueMapper.INSTANCE.toResponse(issue);
    }

    private static String truncate(String details) {
        if (details == null) {
            return "";
        }
        return details.length() <= MAX_DETAILS_LENGTH ? details : details.substring(0, MAX_DETAILS_LENGTH);
    }
}
