package org.merchantportal.security.repos;

import org.merchantportal.security.models.MfaAttemptModel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MfaAttemptRepo extends JpaRepository<MfaAttemptModel, UUID> {
    Optional<MfaAttemptModel> findByIdentityIdAndOrigin(UUID identityId,
                                                        String origin);

    @Modifying
    @Query("delete from MfaAttemptModel a where a.identityId = :identityId and a.origin = :origin")
    int deleteByIdentityIdAndOrigin(@Param("identityId") UUID identityId,
                                    @Param("origin") String origin);
}
