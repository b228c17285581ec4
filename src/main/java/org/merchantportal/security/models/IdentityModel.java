package org.merchantportal.security.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.merchantportal.security.enums.MfaMethod;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "identities",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_identities_email", columnNames = "email")
        })
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class IdentityModel {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(columnDefinition = "UUID", updatable = false, nullable = false, unique = true)
    private UUID id;

    @Column(name = "email", nullable = false)
    private String email;

    @JsonIgnore
    @Column(name = "password_hash", nullable = false, length = 128)
    private String passwordHash;

    @JsonIgnore
    @Column(name = "password_salt", nullable = false, length = 64)
    private String passwordSalt;

    @Column(name = "mfa_required", nullable = false)
    private boolean mfaRequired;

    @Embedded
    private TotpConfiguration totp;

    @Embedded
    private EmailOtpState emailOtp;

    @Column(name = "password_changed_at", nullable = false)
    private Instant passwordChangedAt;

    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (Objects.isNull(this.passwordChangedAt)) {
            this.passwordChangedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // Hibernate leaves an embedded component null when all of its columns are null.
    public TotpConfiguration getTotp() {
        if (Objects.isNull(totp)) totp = new TotpConfiguration();
        return totp;
    }

    public EmailOtpState getEmailOtp() {
        if (Objects.isNull(emailOtp)) emailOtp = new EmailOtpState();
        return emailOtp;
    }

    public boolean isTotpEnabled() {
        return getTotp().isEnabled() && Objects.nonNull(getTotp().getSecret());
    }

    public boolean isEmailOtpEnabled() {
        return getEmailOtp().isEnabled();
    }

    public boolean hasMfaEnabled(MfaMethod method) {
        return switch (method) {
            case TOTP -> isTotpEnabled();
            case EMAIL -> isEmailOtpEnabled();
        };
    }

    public Set<MfaMethod> getEnabledMfaMethods() {
        var methods = EnumSet.noneOf(MfaMethod.class);
        for (var method : MfaMethod.values()) if (hasMfaEnabled(method)) methods.add(method);
        return methods;
    }

    public boolean hasAnyMfaEnabled() {
        return isTotpEnabled() || isEmailOtpEnabled();
    }

    public boolean isMfaSetupPending() {
        return mfaRequired && !hasAnyMfaEnabled();
    }

    public boolean isOnlyEnabledMfaMethod(MfaMethod method) {
        var methods = getEnabledMfaMethods();
        return methods.size() == 1 && methods.contains(method);
    }
}
