package org.merchantportal.security.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.merchantportal.security.configs.PropertiesConfig;
import org.merchantportal.security.dtos.MfaActionResultDto;
import org.merchantportal.security.dtos.MfaVerificationResultDto;
import org.merchantportal.security.enums.AuthErrorKind;
import org.merchantportal.security.enums.MfaMethod;
import org.merchantportal.security.models.IdentityModel;
import org.merchantportal.security.stores.IdentityStore;
import org.merchantportal.security.utils.OTPUtility;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmailOtpService {
    private final IdentityStore identityStore;
    private final PasswordService passwordService;
    private final NotificationSender notificationSender;
    private final PropertiesConfig propertiesConfig;
    private final Clock clock;

    public MfaActionResultDto sendSetupOtp(IdentityModel identity) {
        if (identity.isEmailOtpEnabled()) return MfaActionResultDto.failure(AuthErrorKind.MFA_ALREADY_ENABLED);
        return issueAndSend(identity);
    }

    public MfaActionResultDto sendLoginOtp(IdentityModel identity) {
        if (!identity.isEmailOtpEnabled()) return MfaActionResultDto.failure(AuthErrorKind.MFA_NOT_ENABLED);
        return issueAndSend(identity);
    }

    public MfaActionResultDto verifySetupOtp(IdentityModel identity,
                                             String code,
                                             String password) {
        if (!passwordService.verify(password, identity.getPasswordHash(), identity.getPasswordSalt()))
            return MfaActionResultDto.failure(AuthErrorKind.REAUTHENTICATION_REQUIRED);
        if (identity.isEmailOtpEnabled()) return MfaActionResultDto.failure(AuthErrorKind.MFA_ALREADY_ENABLED);
        var result = verifyPendingCode(identity, code);
        if (!result.isSuccess()) return result;
        identity.getEmailOtp().enable(clock.instant());
        identityStore.save(identity);
        log.info("Email MFA enabled for identity {}", identity.getId());
        return MfaActionResultDto.ok("Email MFA enabled");
    }

    public MfaVerificationResultDto verifyLoginOtp(IdentityModel identity,
                                                   String code) {
        if (!identity.isEmailOtpEnabled())
            return MfaVerificationResultDto.failure(MfaMethod.EMAIL, AuthErrorKind.MFA_NOT_ENABLED);
        var result = verifyPendingCode(identity, code);
        if (result.isSuccess()) return MfaVerificationResultDto.verified(MfaMethod.EMAIL, false);
        return MfaVerificationResultDto.failure(MfaMethod.EMAIL, result.getError(), result.getRemainingAttempts());
    }

    public MfaActionResultDto disable(IdentityModel identity,
                                      String password) {
        if (!passwordService.verify(password, identity.getPasswordHash(), identity.getPasswordSalt()))
            return MfaActionResultDto.failure(AuthErrorKind.REAUTHENTICATION_REQUIRED);
        if (!identity.isEmailOtpEnabled()) return MfaActionResultDto.failure(AuthErrorKind.MFA_NOT_ENABLED);
        if (identity.isMfaRequired() && identity.isOnlyEnabledMfaMethod(MfaMethod.EMAIL))
            return MfaActionResultDto.failure(AuthErrorKind.MFA_METHOD_REQUIRED);
        identity.getEmailOtp().clear();
        identityStore.save(identity);
        log.info("Email MFA disabled for identity {}", identity.getId());
        return MfaActionResultDto.ok("Email MFA disabled");
    }

    private MfaActionResultDto issueAndSend(IdentityModel identity) {
        var now = clock.instant();
        var state = identity.getEmailOtp();
        if (state.currentSendCount(now) >= propertiesConfig.getEmailOtpMaxSends()) {
            log.debug("Email code send limit reached for identity {} until {}", identity.getId(), state.getSendWindowResetAt());
            return MfaActionResultDto.rateLimited(state.getSendWindowResetAt());
        }
        var code = OTPUtility.generateOtp(propertiesConfig.getEmailOtpLength());
        var hashed = passwordService.hash(code);
        var expiresAt = now.plus(propertiesConfig.getEmailOtpExpiry());
        state.issueCode(hashed.getHash(), hashed.getSalt(), expiresAt);
        state.recordSend(now, propertiesConfig.getEmailOtpSendWindow());
        identityStore.save(identity);
        notificationSender.sendCode(identity.getEmail(), code, expiresAt);
        log.debug("Email code issued for identity {}, send {} in current window", identity.getId(), state.getSendCount());
        return MfaActionResultDto.sent(expiresAt);
    }

    private MfaActionResultDto verifyPendingCode(IdentityModel identity,
                                                 String code) {
        var state = identity.getEmailOtp();
        var now = clock.instant();
        var maxAttempts = propertiesConfig.getEmailOtpMaxAttempts();
        if (!state.hasPendingCode()) return MfaActionResultDto.failure(AuthErrorKind.MFA_CODE_INVALID);
        if (state.getAttempts() >= maxAttempts) {
            state.clearPendingCode();
            identityStore.save(identity);
            return MfaActionResultDto.failure(AuthErrorKind.MFA_ATTEMPTS_EXHAUSTED);
        }
        if (!now.isBefore(state.getCodeExpiresAt())) {
            state.clearPendingCode();
            identityStore.save(identity);
            return MfaActionResultDto.failure(AuthErrorKind.MFA_CODE_EXPIRED);
        }
        // Claimed in the store before the hash check.
        var attempt = state.getAttempts() + 1;
        if (!identityStore.claimEmailOtpAttempt(identity.getId(), maxAttempts)) {
            state.clearPendingCode();
            identityStore.save(identity);
            log.warn("Email code attempts exhausted for identity {}", identity.getId());
            return MfaActionResultDto.failure(AuthErrorKind.MFA_ATTEMPTS_EXHAUSTED);
        }
        state.setAttempts(attempt);
        var candidate = Objects.isNull(code) ? "" : code.trim();
        if (!passwordService.verify(candidate, state.getCodeHash(), state.getCodeSalt())) {
            log.debug("Incorrect email code for identity {}, attempt {} of {}", identity.getId(), attempt, maxAttempts);
            return MfaActionResultDto.invalidCode(Math.max(0, maxAttempts - attempt));
        }
        state.clearPendingCode();
        identityStore.save(identity);
        return MfaActionResultDto.ok("Verification code accepted");
    }
}
