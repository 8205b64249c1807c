package com.skillswap.billing.service;

import com.skillswap.billing.api.model.TransactionStatus;
import com.skillswap.billing.api.model.TransactionType;
import com.skillswap.billing.api.response.PaymentLinkResponse;
import com.skillswap.billing.model.Transaction;
import com.skillswap.billing.model.UserAccount;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Paid course enrollment through the payment provider. The course is added when the payment is
 * confirmed.
 */
@Service
@RequiredArgsConstructor
public class CourseCheckoutService {

    private final UserAccountService userAccountService;
    private final PaymentInitiationService paymentInitiationService;
    private final TxRefGenerator txRefGenerator;
    private final Clock clock;

    /**
     * @param amount course price in minor units, as quoted by the course catalog
     * @throws IllegalStateException if the user is already enrolled
     */
    public PaymentLinkResponse checkout(Long userId, Long courseId, Long amount, String currency, String redirectUrl) {
        if (amount == null || amount <= 0) {
            throw new IllegalArgumentException("Course price must be positive");
        }
        UserAccount user = userAccountService.getAccount(userId);
        if (userAccountService.isEnrolled(userId, courseId)) {
            throw new IllegalStateException("User " + userId + " is already enrolled in course " + courseId);
        }

        Transaction pending = new Transaction();
        pending.setUserId(userId);
        pending.setType(TransactionType.COURSE_ENROLLMENT);
        pending.setAmount(amount);
        pending.setCurrency(currency.trim().toUpperCase(Locale.ROOT));
        pending.setTxRef(txRefGenerator.generate(TxRefGenerator.COURSE, userId, courseId));
        pending.setStatus(TransactionStatus.PENDING);
        pending.setDescription("Course enrollment " + courseId);
        pending.setCourseId(courseId);
        pending.setInitiatedAt(LocalDateTime.now(clock));

        return paymentInitiationService.initiate(pending, user, redirectUrl);
    }
}
