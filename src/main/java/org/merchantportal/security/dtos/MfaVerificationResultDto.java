package org.merchantportal.security.dtos;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.merchantportal.security.enums.AuthErrorKind;
import org.merchantportal.security.enums.MfaMethod;

import java.time.Instant;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MfaVerificationResultDto {
    private boolean success;
    private MfaMethod method;
    private boolean usedBackupCode;
    private AuthErrorKind error;
    private String message;
    private Integer remainingAttempts;
    private Instant retryAfter;

    public static MfaVerificationResultDto verified(MfaMethod method,
                                                    boolean usedBackupCode) {
        return MfaVerificationResultDto.builder()
                .success(true)
                .method(method)
                .usedBackupCode(usedBackupCode)
                .build();
    }

    public static MfaVerificationResultDto failure(MfaMethod method,
                                                   AuthErrorKind error) {
        return failure(method, error, null);
    }

    public static MfaVerificationResultDto failure(MfaMethod method,
                                                   AuthErrorKind error,
                                                   Integer remainingAttempts) {
        return MfaVerificationResultDto.builder()
                .success(false)
                .method(method)
                .error(error)
                .message(error.getMessage())
                .remainingAttempts(remainingAttempts)
                .build();
    }

    public static MfaVerificationResultDto throttled(MfaMethod method,
                                                     Instant retryAfter) {
        return MfaVerificationResultDto.builder()
                .success(false)
                .method(method)
                .error(AuthErrorKind.MFA_VERIFICATION_THROTTLED)
                .message(AuthErrorKind.MFA_VERIFICATION_THROTTLED.getMessage())
                .retryAfter(retryAfter)
                .build();
    }
}
