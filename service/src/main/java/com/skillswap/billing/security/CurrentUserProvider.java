package com.skillswap.billing.security;

import com.skillswap.billing.service.UserAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the authenticated user of the current request.
 *
 * <p>The JWT subject is the numeric user ID issued by the marketplace auth service. The billing
 * account is provisioned on first use.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CurrentUserProvider {

    private final UserAccountService userAccountService;

    /**
     * @return ID of the authenticated user
     * @throws AccessDeniedException if the request is not authenticated with a numeric subject
     */
    public Long currentUserId() {
        Jwt jwt = currentJwt();
        Long userId = parseSubject(jwt);
        try {
            userAccountService.provision(userId, jwt.getClaimAsString("email"), jwt.getClaimAsString("name"));
        } catch (DataIntegrityViolationException e) {
            // concurrent first request of the same user created the account
            log.debug("Billing account provisioned concurrently: userId={}", userId);
        }
        return userId;
    }

    /**
     * @return whether the current token carries one of the roles, given without the ROLE_ prefix
     */
    public boolean hasAnyRole(String... roles) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null) {
            return false;
        }
        Set<String> granted = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .collect(Collectors.toSet());
        return Arrays.stream(roles).anyMatch(role -> granted.contains("ROLE_" + role));
    }

    private Jwt currentJwt() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof JwtAuthenticationToken token) {
            return token.getToken();
        }
        throw new AccessDeniedException("Authentication required");
    }

    private static Long parseSubject(Jwt jwt) {
        try {
            return Long.valueOf(jwt.getSubject());
        } catch (NumberFormatException e) {
            throw new AccessDeniedException("Token subject is not a user ID: " + jwt.getSubject());
        }
    }
}
