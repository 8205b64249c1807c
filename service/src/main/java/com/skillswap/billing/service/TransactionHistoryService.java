package com.skillswap.billing.service;

import com.skillswap.billing.api.dto.PagedResponse;
import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.api.response.TransactionResponse;
import com.skillswap.billing.api.response.TransactionSummaryResponse;
import com.skillswap.billing.api.response.WalletStatisticsResponse;
import com.skillswap.billing.error.TransactionNotFoundException;
import com.skillswap.billing.mapper.TransactionMapper;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.repository.TransactionRepository;
import com.skillswap.billing.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

import static com.skillswap.billing.repository.TransactionSpecifications.hasStatus;
import static com.skillswap.billing.repository.TransactionSpecifications.hasType;
import static com.skillswap.billing.repository.TransactionSpecifications.initiatedBetween;
import static com.skillswap.billing.repository.TransactionSpecifications.ownedBy;

/**
 * Read side of the ledger.
 */
@Service
@RequiredArgsConstructor
public class TransactionHistoryService {

    private final TransactionRepository transactionRepository;
    private final UserAccountRepository userAccountRepository;

    /**
     * @throws TransactionNotFoundException if the txRef is unknown or belongs to another user
     */
    @Transactional(readOnly = true)
    public TransactionResponse getTransaction(Long userId, String txRef) {
        return transactionRepository.findByTxRef(txRef)
                .filter(transaction -> transaction.getUserId().equals(userId))
                .map(TransactionMapper.INSTANCE::toResponse)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction with txRef " + txRef + " not found"));
    }

    /**
     * Returns one page of a user's transactions, newest first.
     *
     * @param page 1-based page number
     * @param size page size, at most {@value Pagination#MAX_PAGE_SIZE}
     * @throws IllegalArgumentException on invalid paging or {@code from} after {@code to}
     */
    @Transactional(readOnly = true)
    public PagedResponse<TransactionResponse> getHistory(Long userId, TransactionType type, TransactionStatus status,
                                                         LocalDateTime from, LocalDateTime to, int page, int size) {
        Pagination.validate(page, size);
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }

        Specification<Transaction> filter = Specification.where(ownedBy(userId))
                .and(hasType(type))
                .and(hasStatus(status))
                .and(initiatedBetween(from, to));
        PageRequest pageRequest = PageRequest.of(page - 1, size,
                Sort.by(Sort.Order.desc("initiatedAt"), Sort.Order.desc("id")));

        Page<Transaction> transactions = transactionRepository.findAll(filter, pageRequest);
        return new PagedResponse<>(
                TransactionMapper.INSTANCE.toResponseList(transactions.getContent()),
                page, size, transactions.getTotalElements());
    }

    @Transactional(readOnly = true)
    public TransactionSummaryResponse getSummary(Long userId) {
        List<TransactionSummaryResponse.Bucket> byType = toBuckets(transactionRepository.summarizeByType(userId));
        List<TransactionSummaryResponse.Bucket> byStatus = toBuckets(transactionRepository.summarizeByStatus(userId));
        long total = byType.stream().mapToLong(TransactionSummaryResponse.Bucket::count).sum();
        return new TransactionSummaryResponse(userId, total, byType, byStatus);
    }

    @Transactional(readOnly = true)
    public WalletStatisticsResponse getWalletStatistics() {
        Object[] wallets = userAccountRepository.summarizeWallets().get(0);
        return new WalletStatisticsResponse(
                ((Number) wallets[0]).longValue(),
                userAccountRepository.countByWalletBalanceGreaterThan(0L),
                ((Number) wallets[1]).longValue(),
                ((Number) wallets[2]).longValue(),
                ((Number) wallets[3]).longValue(),
                toCurrencyBuckets(transactionRepository.summarizeAllByStatusAndCurrency()),
                toCurrencyBuckets(transactionRepository.summarizeAllByTypeAndCurrency()));
    }

    private static List<WalletStatisticsResponse.Bucket> toCurrencyBuckets(List<Object[]> rows) {
        return rows.stream()
                .map(row -> new WalletStatisticsResponse.Bucket(
                        String.valueOf(row[0]),
                        (String) row[1],
                        ((Number) row[2]).longValue(),
                        ((Number) row[3]).longValue()))
                .toList();
    }

    private static List<TransactionSummaryResponse.Bucket> toBuckets(List<Object[]> rows) {
        return rows.stream()
                .map(row -> new TransactionSummaryResponse.Bucket(
                        String.valueOf(row[0]),
                        ((Number) row[1]).longValue(),
                        ((Number) row[2]).longValue()))
                .toList();
    }
}
