package com.skillswap.billing.service;

import com.skillswap.billing.error.UserNotFoundException;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Billing accounts mirrored from the user service.
 *
 * <p>Accounts are created on first sight of a user ID, either from an authenticated request or
 * from an instructor credit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserAccountService {

    private final UserAccountRepository userAccountRepository;

    /**
     * Returns the account, creating an empty one if the user has none yet.
     *
     * @param userId   user ID from the identity provider
     * @param email    email claim, may be {@code null}
     * @param fullName name claim, may be {@code null}
     * @return the account
     * @throws org.springframework.dao.DataIntegrityViolationException if another request created
     *                                                                 the account concurrently
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UserAccount provision(Long userId, String email, String fullName) {
        return userAccountRepository.findById(userId).orElseGet(() -> create(userId, email, fullName));
    }

    @Transactional(readOnly = true)
    public UserAccount getAccount(Long userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException("User with ID " + userId + " not found"));
    }

    @Transactional(readOnly = true)
    public boolean isEnrolled(Long userId, Long courseId) {
        return getAccount(userId).getEnrolledCourseIds().contains(courseId);
    }

    private UserAccount create(Long userId, String email, String fullName) {
        UserAccount account = new UserAccount();
        account.setId(userId);
        account.setEmail(email);
        account.setFullName(fullName);
        UserAccount saved = userAccountRepository.saveAndFlush(account);
        log.info("Provisioned billing account: userId={}", userId);
        return saved;
    }
}
