package org.merchantportal.security.support;

import org.merchantportal.security.models.BackupCodeModel;
import org.merchantportal.security.stores.BackupCodeStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBackupCodeStore implements BackupCodeStore {
    private final Map<UUID, BackupCodeModel> codes = new ConcurrentHashMap<>();

    @Override
    public List<BackupCodeModel> findUnused(UUID identityId) {
        return codes.values().stream().filter(code -> code.getIdentityId().equals(identityId)).toList();
    }

    @Override
    public int countUnused(UUID identityId) {
        return findUnused(identityId).size();
    }

    @Override
    public synchronized void replaceAll(UUID identityId,
                                        List<BackupCodeModel> replacement) {
        deleteAll(identityId);
        for (var code : replacement) {
            if (Objects.isNull(code.getId())) code.setId(UUID.randomUUID());
            codes.put(code.getId(), code);
        }
    }

    @Override
    public boolean consume(UUID codeId) {
        return Objects.nonNull(codes.remove(codeId));
    }

    @Override
    public void deleteAll(UUID identityId) {
        codes.values().removeIf(code -> code.getIdentityId().equals(identityId));
    }
}
