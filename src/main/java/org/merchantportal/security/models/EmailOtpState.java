package org.merchantportal.security.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

@Embeddable
@NoArgsConstructor
@Getter
@Setter
public class EmailOtpState {
    @Column(name = "email_otp_enabled", nullable = false)
    private boolean enabled;

    @Column(name = "email_otp_setup_at")
    private Instant setupAt;

    @JsonIgnore
    @Column(name = "email_otp_code_hash", length = 128)
    private String codeHash;

    @JsonIgnore
    @Column(name = "email_otp_code_salt", length = 64)
    private String codeSalt;

    @Column(name = "email_otp_expires_at")
    private Instant codeExpiresAt;

    @Column(name = "email_otp_attempts", nullable = false)
    private int attempts;

    @Column(name = "email_otp_send_count", nullable = false)
    private int sendCount;

    @Column(name = "email_otp_last_sent_at")
    private Instant lastSentAt;

    @Column(name = "email_otp_send_window_reset_at")
    private Instant sendWindowResetAt;

    public boolean hasPendingCode() {
        return Objects.nonNull(codeHash) && Objects.nonNull(codeSalt) && Objects.nonNull(codeExpiresAt);
    }

    public boolean isSendWindowActive(Instant now) {
        return Objects.nonNull(sendWindowResetAt) && now.isBefore(sendWindowResetAt);
    }

    public int currentSendCount(Instant now) {
        return isSendWindowActive(now) ? sendCount : 0;
    }

    public void issueCode(String hash,
                          String salt,
                          Instant expiresAt) {
        this.codeHash = hash;
        this.codeSalt = salt;
        this.codeExpiresAt = expiresAt;
        this.attempts = 0;
    }

    public void recordSend(Instant now,
                           Duration window) {
        if (!isSendWindowActive(now)) {
            this.sendCount = 0;
            this.sendWindowResetAt = now.plus(window);
        }
        this.sendCount++;
        this.lastSentAt = now;
    }

    public void clearPendingCode() {
        this.codeHash = null;
        this.codeSalt = null;
        this.codeExpiresAt = null;
        this.attempts = 0;
    }

    public void enable(Instant now) {
        this.enabled = true;
        this.setupAt = now;
    }

    public void clear() {
        clearPendingCode();
        this.enabled = false;
        this.setupAt = null;
        this.sendCount = 0;
        this.lastSentAt = null;
        this.sendWindowResetAt = null;
    }
}
