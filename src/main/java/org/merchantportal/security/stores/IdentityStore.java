package org.merchantportal.security.stores;

import org.merchantportal.security.models.IdentityModel;

import java.util.Optional;
import java.util.UUID;

public interface IdentityStore {
    Optional<IdentityModel> findById(UUID id);

    Optional<IdentityModel> findByEmail(String normalizedEmail);

    boolean existsByEmail(String normalizedEmail);

    IdentityModel save(IdentityModel identity);

    /**
     * Atomically takes one verification attempt against the pending email code.
     * Returns {@code false} when there is no pending code or the attempt limit is already reached.
     */
    boolean claimEmailOtpAttempt(UUID identityId,
                                 int maxAttempts);
}
