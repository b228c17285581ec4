package org.merchantportal.security.models;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "mfa_verification_attempts",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_mfa_verification_attempts_identity_origin", columnNames = {"identity_id", "origin"})
        })
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class MfaAttemptModel {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(columnDefinition = "UUID", updatable = false, nullable = false, unique = true)
    private UUID id;

    @Column(name = "identity_id", columnDefinition = "UUID", nullable = false)
    private UUID identityId;

    @Column(name = "origin", nullable = false, length = 64)
    private String origin;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Column(name = "window_started_at")
    private Instant windowStartedAt;

    @Column(name = "last_failure_at")
    private Instant lastFailureAt;

    public Instant windowEndsAt(Duration window) {
        return Objects.isNull(windowStartedAt) ? null : windowStartedAt.plus(window);
    }

    public boolean isWindowActiveAt(Instant now,
                                    Duration window) {
        var endsAt = windowEndsAt(window);
        return Objects.nonNull(endsAt) && now.isBefore(endsAt);
    }

    public boolean isBlockedAt(Instant now,
                               int maxFailures,
                               Duration window) {
        return isWindowActiveAt(now, window) && failureCount >= maxFailures;
    }

    public void recordFailure(Instant now,
                              Duration window) {
        if (!isWindowActiveAt(now, window)) {
            this.failureCount = 0;
            this.windowStartedAt = now;
        }
        this.failureCount++;
        this.lastFailureAt = now;
    }
}
