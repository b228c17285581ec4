package org.merchantportal.security.repos;

import org.merchantportal.security.models.LoginAttemptModel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoginAttemptRepo extends JpaRepository<LoginAttemptModel, UUID> {
    Optional<LoginAttemptModel> findByEmailAndOrigin(String email,
                                                     String origin);

    @Modifying
    @Query("delete from LoginAttemptModel a where a.email = :email and a.origin = :origin")
    int deleteByEmailAndOrigin(@Param("email") String email,
                               @Param("origin") String origin);
}
