package org.merchantportal.security.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.merchantportal.security.configs.PropertiesConfig;
import org.merchantportal.security.models.MfaAttemptModel;
import org.merchantportal.security.stores.MfaAttemptStore;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Limits failed MFA verifications per (identity, origin) pair inside a fixed window.
 * Successful verifications are not counted and reset the pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MfaAttemptService {
    private final MfaAttemptStore mfaAttemptStore;
    private final PropertiesConfig propertiesConfig;
    private final Clock clock;

    /**
     * Returns the instant the pair may try again, or empty when verification is allowed now.
     */
    public Optional<Instant> blockedUntil(UUID identityId,
                                          String origin) {
        var now = clock.instant();
        var window = propertiesConfig.getMfaVerifyWindow();
        return mfaAttemptStore.find(identityId, origin)
                .filter(attempt -> attempt.isBlockedAt(now, propertiesConfig.getMfaVerifyMaxFailures(), window))
                .map(attempt -> attempt.windowEndsAt(window));
    }

    public MfaAttemptModel recordFailure(UUID identityId,
                                         String origin) {
        try {
            return applyFailure(identityId, origin);
        } catch (DataIntegrityViolationException ex) {
            log.debug("Retrying MFA failure bookkeeping for identity {} after concurrent insert", identityId);
            return applyFailure(identityId, origin);
        }
    }

    public void recordSuccess(UUID identityId,
                              String origin) {
        mfaAttemptStore.delete(identityId, origin);
    }

    private MfaAttemptModel applyFailure(UUID identityId,
                                         String origin) {
        var now = clock.instant();
        var window = propertiesConfig.getMfaVerifyWindow();
        var attempt = mfaAttemptStore.find(identityId, origin)
                .orElseGet(() -> MfaAttemptModel.builder()
                        .identityId(identityId)
                        .origin(origin)
                        .build());
        attempt.recordFailure(now, window);
        if (attempt.isBlockedAt(now, propertiesConfig.getMfaVerifyMaxFailures(), window)) {
            log.warn("MFA verification blocked for identity {} from origin {} until {}", identityId, origin, attempt.windowEndsAt(window));
        }
        return mfaAttemptStore.save(attempt);
    }
}
