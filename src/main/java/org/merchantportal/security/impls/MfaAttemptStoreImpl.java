package org.merchantportal.security.impls;

import lombok.RequiredArgsConstructor;
import org.merchantportal.security.models.MfaAttemptModel;
import org.merchantportal.security.repos.MfaAttemptRepo;
import org.merchantportal.security.stores.MfaAttemptStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class MfaAttemptStoreImpl implements MfaAttemptStore {
    private final MfaAttemptRepo mfaAttemptRepo;

    @Override
    public Optional<MfaAttemptModel> find(UUID identityId,
                                          String origin) {
        return mfaAttemptRepo.findByIdentityIdAndOrigin(identityId, origin);
    }

    @Override
    public MfaAttemptModel save(MfaAttemptModel attempt) {
        return mfaAttemptRepo.saveAndFlush(attempt);
    }

    @Override
    @Transactional
    public void delete(UUID identityId,
                       String origin) {
        mfaAttemptRepo.deleteByIdentityIdAndOrigin(identityId, origin);
    }
}
