package org.merchantportal.security.stores;

import org.merchantportal.security.models.MfaAttemptModel;

import java.util.Optional;
import java.util.UUID;

/**
 * Failed MFA verification bookkeeping keyed by identity and request origin.
 */
public interface MfaAttemptStore {
    Optional<MfaAttemptModel> find(UUID identityId,
                                   String origin);

    MfaAttemptModel save(MfaAttemptModel attempt);

    void delete(UUID identityId,
                String origin);
}
