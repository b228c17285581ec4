package org.merchantportal.security.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Embeddable
@NoArgsConstructor
@Getter
@Setter
public class TotpConfiguration {
    @JsonIgnore
    @Column(name = "totp_secret", length = 512)
    private String secret;

    @Column(name = "totp_enabled", nullable = false)
    private boolean enabled;

    @Column(name = "totp_setup_at")
    private Instant setupAt;

    @Column(name = "totp_last_used_at")
    private Instant lastUsedAt;

    public void enable(String encryptedSecret,
                       Instant now) {
        this.secret = encryptedSecret;
        this.enabled = true;
        this.setupAt = now;
        this.lastUsedAt = null;
    }

    public void recordUse(Instant now) {
        this.lastUsedAt = now;
    }

    public void clear() {
        this.secret = null;
        this.enabled = false;
        this.setupAt = null;
        this.lastUsedAt = null;
    }
}
