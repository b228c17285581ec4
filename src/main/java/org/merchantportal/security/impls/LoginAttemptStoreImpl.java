package org.merchantportal.security.impls;

import lombok.RequiredArgsConstructor;
import org.merchantportal.security.models.LoginAttemptModel;
import org.merchantportal.security.repos.LoginAttemptRepo;
import org.merchantportal.security.stores.LoginAttemptStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class LoginAttemptStoreImpl implements LoginAttemptStore {
    private final LoginAttemptRepo loginAttemptRepo;

    @Override
    public Optional<LoginAttemptModel> find(String normalizedEmail,
                                            String origin) {
        return loginAttemptRepo.findByEmailAndOrigin(normalizedEmail, origin);
    }

    @Override
    public LoginAttemptModel save(LoginAttemptModel attempt) {
        return loginAttemptRepo.saveAndFlush(attempt);
    }

    @Override
    @Transactional
    public void delete(String normalizedEmail,
                       String origin) {
        loginAttemptRepo.deleteByEmailAndOrigin(normalizedEmail, origin);
    }
}
