package org.merchantportal.security.stores;

import org.merchantportal.security.models.BackupCodeModel;

import java.util.List;
import java.util.UUID;

public interface BackupCodeStore {
    List<BackupCodeModel> findUnused(UUID identityId);

    int countUnused(UUID identityId);

    /**
     * Drops every existing code for the identity and stores the given ones in their place.
     */
    void replaceAll(UUID identityId,
                    List<BackupCodeModel> codes);

    /**
     * Removes a single code. Returns {@code true} only for the caller whose delete actually took the row,
     * so two concurrent requests presenting the same code cannot both succeed.
     */
    boolean consume(UUID codeId);

    void deleteAll(UUID identityId);
}
