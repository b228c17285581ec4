package org.merchantportal.security.impls;

import lombok.RequiredArgsConstructor;
import org.merchantportal.security.models.IdentityModel;
import org.merchantportal.security.repos.IdentityRepo;
import org.merchantportal.security.stores.IdentityStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class IdentityStoreImpl implements IdentityStore {
    private final IdentityRepo identityRepo;

    @Override
    public Optional<IdentityModel> findById(UUID id) {
        return identityRepo.findById(id);
    }

    @Override
    public Optional<IdentityModel> findByEmail(String normalizedEmail) {
        return identityRepo.findByEmail(normalizedEmail);
    }

    @Override
    public boolean existsByEmail(String normalizedEmail) {
        return identityRepo.existsByEmail(normalizedEmail);
    }

    @Override
    public IdentityModel save(IdentityModel identity) {
        return identityRepo.save(identity);
    }

    @Override
    @Transactional
    public boolean claimEmailOtpAttempt(UUID identityId,
                                        int maxAttempts) {
        return identityRepo.incrementEmailOtpAttempts(identityId, maxAttempts) == 1;
    }
}
