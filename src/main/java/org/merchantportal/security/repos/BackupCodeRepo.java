package org.merchantportal.security.repos;

import org.merchantportal.security.models.BackupCodeModel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BackupCodeRepo extends JpaRepository<BackupCodeModel, UUID> {
    List<BackupCodeModel> findByIdentityId(UUID identityId);

    long countByIdentityId(UUID identityId);

    // Row count tells the caller whether this request is the one that consumed the code.
    @Modifying
    @Query("delete from BackupCodeModel b where b.id = :id")
    int deleteOneById(@Param("id") UUID id);

    @Modifying
    @Query("delete from BackupCodeModel b where b.identityId = :identityId")
    int deleteAllByIdentityId(@Param("identityId") UUID identityId);
}
