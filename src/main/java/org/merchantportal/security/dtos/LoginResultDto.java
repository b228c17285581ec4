package org.merchantportal.security.dtos;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.merchantportal.security.enums.AuthErrorKind;
import org.merchantportal.security.enums.LoginStatus;

import java.util.UUID;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResultDto {
    private LoginStatus status;
    private UUID identityId;
    private LoginChallengeDto challenge;
    private AuthErrorKind error;
    private String message;
    private Long remainingLockoutSeconds;

    public static LoginResultDto authenticated(UUID identityId) {
        return LoginResultDto.builder()
                .status(LoginStatus.AUTHENTICATED)
                .identityId(identityId)
                .build();
    }

    public static LoginResultDto mfaSetupRequired(UUID identityId) {
        return LoginResultDto.builder()
                .status(LoginStatus.MFA_SETUP_REQUIRED)
                .identityId(identityId)
                .message("Login successful. Multi-factor authentication must be set up for this account")
                .build();
    }

    public static LoginResultDto mfaRequired(LoginChallengeDto challenge) {
        return LoginResultDto.builder()
                .status(LoginStatus.MFA_REQUIRED)
                .identityId(challenge.getIdentityId())
                .challenge(challenge)
                .build();
    }

    public static LoginResultDto invalidCredentials() {
        return LoginResultDto.builder()
                .status(LoginStatus.INVALID_CREDENTIALS)
                .error(AuthErrorKind.INVALID_CREDENTIALS)
                .message(AuthErrorKind.INVALID_CREDENTIALS.getMessage())
                .build();
    }

    public static LoginResultDto locked(long remainingLockoutSeconds) {
        return LoginResultDto.builder()
                .status(LoginStatus.LOCKED)
                .error(AuthErrorKind.ACCOUNT_LOCKED)
                .message(AuthErrorKind.ACCOUNT_LOCKED.getMessage())
                .remainingLockoutSeconds(remainingLockoutSeconds)
                .build();
    }
}
