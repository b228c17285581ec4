package org.merchantportal.security.repos;

import org.merchantportal.security.models.IdentityModel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdentityRepo extends JpaRepository<IdentityModel, UUID> {
    Optional<IdentityModel> findByEmail(String email);

    boolean existsByEmail(String email);

    // Zero rows means no pending code or no attempts left.
    @Modifying
    @Query("""
            update IdentityModel i
            set i.emailOtp.attempts = i.emailOtp.attempts + 1
            where i.id = :id
              and i.emailOtp.codeHash is not null
              and i.emailOtp.attempts < :maxAttempts
            """)
    int incrementEmailOtpAttempts(@Param("id") UUID id,
                                  @Param("maxAttempts") int maxAttempts);
}
