package org.merchantportal.security.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.merchantportal.security.dtos.LoginChallengeDto;
import org.merchantportal.security.dtos.LoginResultDto;
import org.merchantportal.security.dtos.MfaActionResultDto;
import org.merchantportal.security.dtos.MfaVerificationResultDto;
import org.merchantportal.security.enums.AuthErrorKind;
import org.merchantportal.security.enums.MfaMethod;
import org.merchantportal.security.models.IdentityModel;
import org.merchantportal.security.stores.IdentityStore;
import org.merchantportal.security.utils.EmailSanitizerUtility;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationService {
    private static final String UNKNOWN_ORIGIN = "unknown";
    private final IdentityStore identityStore;
    private final PasswordService passwordService;
    private final LockoutService lockoutService;
    private final MfaAttemptService mfaAttemptService;
    private final TotpService totpService;
    private final EmailOtpService emailOtpService;
    private final Clock clock;

    public LoginResultDto login(String email,
                                String password,
                                String origin) {
        var normalizedEmail = EmailSanitizerUtility.normalizeEmail(email);
        if (normalizedEmail.isEmpty()) return LoginResultDto.invalidCredentials();
        var resolvedOrigin = resolveOrigin(origin);
        if (lockoutService.isLocked(normalizedEmail, resolvedOrigin))
            return LoginResultDto.locked(lockoutService.remainingLockoutSeconds(normalizedEmail, resolvedOrigin));
        var identity = identityStore.findByEmail(normalizedEmail).orElse(null);
        if (Objects.isNull(identity)) {
            passwordService.verifyAgainstDummy(password);
            lockoutService.recordFailure(normalizedEmail, resolvedOrigin, null);
            return LoginResultDto.invalidCredentials();
        }
        if (!passwordService.verify(password, identity.getPasswordHash(), identity.getPasswordSalt())) {
            lockoutService.recordFailure(normalizedEmail, resolvedOrigin, identity.getId());
            return LoginResultDto.invalidCredentials();
        }
        lockoutService.recordSuccess(normalizedEmail, resolvedOrigin);
        return proceedAfterPassword(identity);
    }

    public MfaVerificationResultDto verifyMfa(UUID identityId,
                                              String code,
                                              MfaMethod method,
                                              String origin) {
        var identity = Objects.isNull(identityId) ? null : identityStore.findById(identityId).orElse(null);
        if (Objects.isNull(identity)) return MfaVerificationResultDto.failure(method, AuthErrorKind.MFA_CODE_INVALID);
        var resolvedOrigin = resolveOrigin(origin);
        var blockedUntil = mfaAttemptService.blockedUntil(identity.getId(), resolvedOrigin);
        if (blockedUntil.isPresent()) {
            log.warn("MFA verification refused for identity {} from origin {}, blocked until {}", identity.getId(), resolvedOrigin, blockedUntil.get());
            return MfaVerificationResultDto.throttled(method, blockedUntil.get());
        }
        if (!identity.hasAnyMfaEnabled()) return MfaVerificationResultDto.failure(method, AuthErrorKind.MFA_NOT_ENABLED);
        var resolved = method;
        if (Objects.isNull(resolved)) {
            var enabled = identity.getEnabledMfaMethods();
            if (enabled.size() > 1)
                return MfaVerificationResultDto.failure(null, AuthErrorKind.MFA_METHOD_SELECTION_REQUIRED);
            resolved = enabled.iterator().next();
        }
        if (!identity.hasMfaEnabled(resolved))
            return MfaVerificationResultDto.failure(resolved, AuthErrorKind.MFA_NOT_ENABLED);
        var result = switch (resolved) {
            case TOTP -> totpService.verifyForLogin(identity, code);
            case EMAIL -> emailOtpService.verifyLoginOtp(identity, code);
        };
        if (result.isSuccess()) {
            mfaAttemptService.recordSuccess(identity.getId(), resolvedOrigin);
            log.info("MFA verified for identity {} using {}", identity.getId(), result.isUsedBackupCode() ? "backup code" : resolved);
        } else {
            mfaAttemptService.recordFailure(identity.getId(), resolvedOrigin);
            log.info("MFA verification failed for identity {} from origin {}: {}", identity.getId(), resolvedOrigin, result.getError());
        }
        return result;
    }

    public MfaActionResultDto sendLoginOtp(UUID identityId) {
        var identity = Objects.isNull(identityId) ? null : identityStore.findById(identityId).orElse(null);
        if (Objects.isNull(identity)) return MfaActionResultDto.failure(AuthErrorKind.MFA_NOT_ENABLED);
        return emailOtpService.sendLoginOtp(identity);
    }

    private static String resolveOrigin(String origin) {
        return Objects.isNull(origin) || origin.isBlank() ? UNKNOWN_ORIGIN : origin;
    }

    private LoginResultDto proceedAfterPassword(IdentityModel identity) {
        if (identity.hasAnyMfaEnabled()) {
            return LoginResultDto.mfaRequired(new LoginChallengeDto(
                    identity.getId(),
                    identity.isTotpEnabled(),
                    identity.isEmailOtpEnabled(),
                    clock.instant()
            ));
        }
        if (identity.isMfaRequired()) {
            log.info("Identity {} signed in with MFA setup still pending", identity.getId());
            return LoginResultDto.mfaSetupRequired(identity.getId());
        }
        return LoginResultDto.authenticated(identity.getId());
    }
}
