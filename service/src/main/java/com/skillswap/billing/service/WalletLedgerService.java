package com.skillswap.billing.service;

import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.config.BillingProperties;
import com.skillswap.billing.error.InsufficientFundsException;
import com.skillswap.billing.error.UserNotFoundException;
import com.skillswap.billing.event.BillingEventPublisher;
import com.skillswap.billing.event.BillingEventType;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.model.Wallet;
import com.skillswap.billing.repository.TransactionRepository;
import com.skillswap.billing.repository.UserAccountRepository;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Locked balance mutations for internal token movements.
 *
 * <p>Each method is one database transaction holding the user row lock, so the balance check
 * and the decrement cannot interleave with another deduction of the same user. The balance
 * never goes negative.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletLedgerService {

    private final UserAccountRepository userAccountRepository;
    private final TransactionRepository transactionRepository;
    private final TxRefGenerator txRefGenerator;
    private final BillingEventPublisher eventPublisher;
    private final BillingProperties properties;
    private final Clock clock;

    /**
     * Deducts from a user's wallet and records a SUCCESSFUL DEDUCTION transaction. With a course
     * the course is added to the user's enrollments in the same transaction.
     *
     * @param userId       buyer
     * @param amount       amount in minor units
     * @param description  reason shown in the history
     * @param courseId     course being purchased, may be {@code null}
     * @param instructorId instructor recorded as counterparty, may be {@code null}
     * @return the committed deduction
     * @throws UserNotFoundException      if the user does not exist
     * @throws InsufficientFundsException if the balance is lower than the amount
     * @throws IllegalStateException      if the user is already enrolled in the course
     */
    @Transactional
    public WalletDebit debit(@NotNull Long userId, @NotNull @Positive Long amount, String description,
                             Long courseId, Long instructorId) {
        UserAccount user = userAccountRepository.getOneForUpdate(userId)
                .orElseThrow(() -> new UserNotFoundException("User with ID " + userId + " not found"));
        Wallet wallet = user.getWallet();

        if (wallet.getBalance() < amount) {
            log.warn("Insufficient balance: userId={}, required={}, available={}", userId, amount, wallet.getBalance());
            throw new InsufficientFundsException(amount, wallet.getBalance());
        }
        if (courseId != null && user.getEnrolledCourseIds().contains(courseId)) {
            throw new IllegalStateException("User " + userId + " is already enrolled in course " + courseId);
        }

        wallet.setBalance(wallet.getBalance() - amount);
        wallet.setTotalSpent(wallet.getTotalSpent() + amount);
        if (courseId != null) {
            user.getEnrolledCourseIds().add(courseId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Transaction deduction = new Transaction();
        deduction.setUserId(userId);
        deduction.setType(TransactionType.DEDUCTION);
        deduction.setAmount(amount);
        deduction.setCurrency(properties.wallet().currency());
        deduction.setTxRef(txRefGenerator.generate(TxRefGenerator.DEDUCTION, userId));
        deduction.setStatus(TransactionStatus.SUCCESSFUL);
        deduction.setDescription(description == null || description.isBlank() ? "Wallet deduction" : description);
        deduction.setCourseId(courseId);
        deduction.setCounterpartyUserId(instructorId);
        deduction.setInitiatedAt(now);
        deduction.setCompletedAt(now);
        transactionRepository.save(deduction);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("txRef", deduction.getTxRef());
        payload.put("amount", amount);
        payload.put("newBalance", wallet.getBalance());
        payload.put("description", deduction.getDescription());
        if (courseId != null) {
            payload.put("courseId", courseId);
        }
        eventPublisher.publish(BillingEventType.WALLET_DEDUCTED, userId, payload);
        if (courseId != null) {
            eventPublisher.publish(BillingEventType.COURSE_ENROLLED, userId, Map.of(
                    "courseId", courseId,
                    "txRef", deduction.getTxRef()));
        }

        log.info("Wallet debited: userId={}, amount={}, newBalance={}, txRef={}, courseId={}",
                userId, amount, wallet.getBalance(), deduction.getTxRef(), courseId);
        return new WalletDebit(deduction.getTxRef(), amount, wallet.getBalance());
    }

    /**
     * Credits an instructor for a course sale and records a SUCCESSFUL EARNINGS transaction.
     *
     * @param instructorId    instructor to credit
     * @param buyerId         buyer, recorded as counterparty
     * @param amount          amount in minor units
     * @param courseId        course sold
     * @param deductionTxRef  reference of the buyer's deduction
     * @return reference of the earnings transaction
     * @throws UserNotFoundException if the instructor has no billing account
     */
    @Transactional
    public String creditInstructorEarnings(@NotNull Long instructorId, @NotNull Long buyerId,
                                           @NotNull @Positive Long amount, Long courseId, String deductionTxRef) {
        UserAccount instructor = userAccountRepository.getOneForUpdate(instructorId)
                .orElseThrow(() -> new UserNotFoundException("Instructor with ID " + instructorId + " not found"));
        Wallet wallet = instructor.getWallet();
        wallet.setBalance(wallet.getBalance() + amount);
        wallet.setTotalEarnings(wallet.getTotalEarnings() + amount);

        LocalDateTime now = LocalDateTime.now(clock);
        Transaction earnings = new Transaction();
        earnings.setUserId(instructorId);
        earnings.setType(TransactionType.EARNINGS);
        earnings.setAmount(amount);
        earnings.setCurrency(properties.wallet().currency());
        earnings.setTxRef(txRefGenerator.generate(TxRefGenerator.EARNINGS, instructorId));
        earnings.setStatus(TransactionStatus.SUCCESSFUL);
        earnings.setDescription("Course sale " + deductionTxRef);
        earnings.setCourseId(courseId);
        earnings.setCounterpartyUserId(buyerId);
        earnings.setInitiatedAt(now);
        earnings.setCompletedAt(now);
        transactionRepository.save(earnings);

        eventPublisher.publish(BillingEventType.WALLET_CREDITED, instructorId, Map.of(
                "txRef", earnings.getTxRef(),
                "amount", amount,
                "newBalance", wallet.getBalance()));

        log.info("Instructor credited: instructorId={}, buyerId={}, amount={}, newBalance={}, txRef={}",
                instructorId, buyerId, amount, wallet.getBalance(), earnings.getTxRef());
        return earnings.getTxRef();
    }
}
