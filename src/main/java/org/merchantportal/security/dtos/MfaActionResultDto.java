package org.merchantportal.security.dtos;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.merchantportal.security.enums.AuthErrorKind;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of an enrollment, confirmation, disable, send or backup-code operation.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MfaActionResultDto {
    private boolean success;
    private AuthErrorKind error;
    private String message;
    private List<String> backupCodes;
    private Instant expiresAt;
    private Instant retryAfter;
    private Integer remainingAttempts;
    private TotpEnrollmentDto enrollment;

    public static MfaActionResultDto ok(String message) {
        return MfaActionResultDto.builder()
                .success(true)
                .message(message)
                .build();
    }

    public static MfaActionResultDto withBackupCodes(String message,
                                                     List<String> backupCodes) {
        return MfaActionResultDto.builder()
                .success(true)
                .message(message)
                .backupCodes(backupCodes)
                .build();
    }

    public static MfaActionResultDto enrollment(TotpEnrollmentDto enrollment) {
        return MfaActionResultDto.builder()
                .success(true)
                .message("Scan the QR code or enter the key in your authenticator app")
                .enrollment(enrollment)
                .build();
    }

    public static MfaActionResultDto sent(Instant expiresAt) {
        return MfaActionResultDto.builder()
                .success(true)
                .message("Verification code sent")
                .expiresAt(expiresAt)
                .build();
    }

    public static MfaActionResultDto failure(AuthErrorKind error) {
        return MfaActionResultDto.builder()
                .success(false)
                .error(error)
                .message(error.getMessage())
                .build();
    }

    public static MfaActionResultDto invalidCode(int remainingAttempts) {
        return MfaActionResultDto.builder()
                .success(false)
                .error(AuthErrorKind.MFA_CODE_INVALID)
                .message(AuthErrorKind.MFA_CODE_INVALID.getMessage())
                .remainingAttempts(remainingAttempts)
                .build();
    }

    public static MfaActionResultDto rateLimited(Instant retryAfter) {
        return MfaActionResultDto.builder()
                .success(false)
                .error(AuthErrorKind.MFA_SEND_RATE_LIMITED)
                .message(AuthErrorKind.MFA_SEND_RATE_LIMITED.getMessage())
                .retryAfter(retryAfter)
                .build();
    }
}
