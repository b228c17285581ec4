package org.merchantportal.security.models;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "login_attempts",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_login_attempts_email_origin", columnNames = {"email", "origin"})
        })
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class LoginAttemptModel {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(columnDefinition = "UUID", updatable = false, nullable = false, unique = true)
    private UUID id;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "origin", nullable = false, length = 64)
    private String origin;

    @Column(name = "identity_id", columnDefinition = "UUID")
    private UUID identityId;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "lockout_until")
    private Instant lockoutUntil;

    public boolean isLockedAt(Instant now) {
        return Objects.nonNull(lockoutUntil) && now.isBefore(lockoutUntil);
    }

    public boolean isLockoutElapsedAt(Instant now) {
        return Objects.nonNull(lockoutUntil) && !now.isBefore(lockoutUntil);
    }

    public void startNewCycle() {
        this.attemptCount = 0;
        this.lockoutUntil = null;
    }

    public void recordFailure(Instant now,
                              UUID identityId,
                              int maxAttempts,
                              Duration lockoutDuration) {
        this.attemptCount++;
        this.lastAttemptAt = now;
        if (Objects.nonNull(identityId)) {
            this.identityId = identityId;
        }
        if (attemptCount >= maxAttempts) {
            this.lockoutUntil = now.plus(lockoutDuration);
        }
    }
}
