package org.merchantportal.security.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.merchantportal.security.configs.PropertiesConfig;
import org.merchantportal.security.models.LoginAttemptModel;
import org.merchantportal.security.stores.LoginAttemptStore;
import org.merchantportal.security.utils.EmailSanitizerUtility;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Counts failed password attempts per (email, origin) pair and locks the pair once the threshold is hit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LockoutService {
    private final LoginAttemptStore loginAttemptStore;
    private final PropertiesConfig propertiesConfig;
    private final Clock clock;

    public LoginAttemptModel recordFailure(String email,
                                           String origin,
                                           UUID identityId) {
        var key = EmailSanitizerUtility.normalizeEmail(email);
        try {
            return applyFailure(key, origin, identityId);
        } catch (DataIntegrityViolationException ex) {
            // A concurrent first failure inserted the row for this pair; count against that row.
            log.debug("Retrying failed-login bookkeeping for origin {} after concurrent insert", origin);
            return applyFailure(key, origin, identityId);
        }
    }

    public void recordSuccess(String email,
                              String origin) {
        loginAttemptStore.delete(EmailSanitizerUtility.normalizeEmail(email), origin);
    }

    public boolean isLocked(String email,
                            String origin) {
        var now = clock.instant();
        return loginAttemptStore.find(EmailSanitizerUtility.normalizeEmail(email), origin)
                .map(attempt -> attempt.isLockedAt(now))
                .orElse(false);
    }

    public int remainingAttempts(String email,
                                 String origin) {
        var now = clock.instant();
        var max = propertiesConfig.getLockoutMaxAttempts();
        return loginAttemptStore.find(EmailSanitizerUtility.normalizeEmail(email), origin)
                .filter(attempt -> !attempt.isLockoutElapsedAt(now))
                .map(attempt -> Math.max(0, max - attempt.getAttemptCount()))
                .orElse(max);
    }

    public long remainingLockoutSeconds(String email,
                                        String origin) {
        var now = clock.instant();
        return loginAttemptStore.find(EmailSanitizerUtility.normalizeEmail(email), origin)
                .filter(attempt -> attempt.isLockedAt(now))
                .map(LoginAttemptModel::getLockoutUntil)
                .filter(Objects::nonNull)
                .map(until -> {
                    var remaining = Duration.between(now, until);
                    // Round up so a caller never sees 0 while still locked.
                    return remaining.getSeconds() + (remaining.getNano() > 0 ? 1 : 0);
                })
                .orElse(0L);
    }

    private LoginAttemptModel applyFailure(String key,
                                           String origin,
                                           UUID identityId) {
        var now = clock.instant();
        var attempt = loginAttemptStore.find(key, origin)
                .orElseGet(() -> LoginAttemptModel.builder()
                        .email(key)
                        .origin(origin)
                        .build());
        if (attempt.isLockoutElapsedAt(now)) attempt.startNewCycle();
        attempt.recordFailure(now, identityId, propertiesConfig.getLockoutMaxAttempts(), propertiesConfig.getLockoutDuration());
        if (attempt.isLockedAt(now)) {
            log.warn("Login locked for origin {} after {} failed attempts, until {}", origin, attempt.getAttemptCount(), attempt.getLockoutUntil());
        }
        return loginAttemptStore.save(attempt);
    }
}
