package org.merchantportal.security.stores;

import org.merchantportal.security.models.LoginAttemptModel;

import java.util.Optional;

/**
 * Failed-login bookkeeping keyed by normalized email and request origin.
 */
public interface LoginAttemptStore {
    Optional<LoginAttemptModel> find(String normalizedEmail,
                                     String origin);

    LoginAttemptModel save(LoginAttemptModel attempt);

    void delete(String normalizedEmail,
                String origin);
}
