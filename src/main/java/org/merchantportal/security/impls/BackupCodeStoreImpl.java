package org.merchantportal.security.impls;

import lombok.RequiredArgsConstructor;
import org.merchantportal.security.models.BackupCodeModel;
import org.merchantportal.security.repos.BackupCodeRepo;
import org.merchantportal.security.stores.BackupCodeStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class BackupCodeStoreImpl implements BackupCodeStore {
    private final BackupCodeRepo backupCodeRepo;

    @Override
    public List<BackupCodeModel> findUnused(UUID identityId) {
        return backupCodeRepo.findByIdentityId(identityId);
    }

    @Override
    public int countUnused(UUID identityId) {
        return (int) backupCodeRepo.countByIdentityId(identityId);
    }

    @Override
    @Transactional
    public void replaceAll(UUID identityId,
                           List<BackupCodeModel> codes) {
        backupCodeRepo.deleteAllByIdentityId(identityId);
        backupCodeRepo.saveAll(codes);
    }

    @Override
    @Transactional
    public boolean consume(UUID codeId) {
        return backupCodeRepo.deleteOneById(codeId) == 1;
    }

    @Override
    @Transactional
    public void deleteAll(UUID identityId) {
        backupCodeRepo.deleteAllByIdentityId(identityId);
    }
}
