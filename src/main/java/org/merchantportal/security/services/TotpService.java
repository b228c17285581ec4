package org.merchantportal.security.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.merchantportal.security.configs.PropertiesConfig;
import org.merchantportal.security.converter.TotpSecretConverter;
import org.merchantportal.security.dtos.MfaActionResultDto;
import org.merchantportal.security.dtos.MfaVerificationResultDto;
import org.merchantportal.security.dtos.TotpEnrollmentDto;
import org.merchantportal.security.enums.AuthErrorKind;
import org.merchantportal.security.enums.MfaMethod;
import org.merchantportal.security.exceptions.BadRequestException;
import org.merchantportal.security.exceptions.ServiceUnavailableException;
import org.merchantportal.security.models.BackupCodeModel;
import org.merchantportal.security.models.IdentityModel;
import org.merchantportal.security.stores.BackupCodeStore;
import org.merchantportal.security.stores.IdentityStore;
import org.merchantportal.security.utils.OTPUtility;
import org.merchantportal.security.utils.TOTPUtility;
import org.merchantportal.security.utils.ValidationUtility;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class TotpService {
    private static final int VERIFICATION_WINDOW = 1;
    private static final Pattern TOTP_CODE_PATTERN = Pattern.compile("^[0-9]{" + TOTPUtility.CODE_DIGITS + "}$");
    private final IdentityStore identityStore;
    private final BackupCodeStore backupCodeStore;
    private final PasswordService passwordService;
    private final TotpSecretConverter totpSecretConverter;
    private final PropertiesConfig propertiesConfig;
    private final Clock clock;

    public TotpEnrollmentDto generateEnrollment(String accountLabel) {
        String secret;
        try {
            secret = TOTPUtility.generateBase32Secret();
        } catch (NoSuchAlgorithmException ex) {
            throw new ServiceUnavailableException("TOTP key generation is unavailable", ex);
        }
        return new TotpEnrollmentDto(
                secret,
                TOTPUtility.generateTOTPUrl(propertiesConfig.getTotpIssuer(), accountLabel, secret),
                formatManualKey(secret)
        );
    }

    @Transactional
    public MfaActionResultDto enableWithVerification(IdentityModel identity,
                                                     String secret,
                                                     String code) {
        if (identity.isTotpEnabled()) return MfaActionResultDto.failure(AuthErrorKind.MFA_ALREADY_ENABLED);
        var normalizedSecret = Objects.isNull(secret) ? null : secret.replace(" ", "").toUpperCase(Locale.ROOT);
        try {
            ValidationUtility.validateBase32Secret(normalizedSecret);
        } catch (BadRequestException ex) {
            return MfaActionResultDto.failure(AuthErrorKind.MFA_CODE_INVALID);
        }
        if (!verifyCode(normalizedSecret, code)) return MfaActionResultDto.failure(AuthErrorKind.MFA_CODE_INVALID);
        var backupCodes = issueBackupCodes(identity.getId());
        identity.getTotp().enable(totpSecretConverter.encrypt(normalizedSecret), clock.instant());
        identityStore.save(identity);
        log.info("Authenticator app MFA enabled for identity {}", identity.getId());
        return MfaActionResultDto.withBackupCodes("Authenticator app MFA enabled", backupCodes);
    }

    @Transactional
    public MfaVerificationResultDto verifyForLogin(IdentityModel identity,
                                                   String code) {
        if (!identity.isTotpEnabled())
            return MfaVerificationResultDto.failure(MfaMethod.TOTP, AuthErrorKind.MFA_NOT_ENABLED);
        if (Objects.isNull(code))
            return MfaVerificationResultDto.failure(MfaMethod.TOTP, AuthErrorKind.MFA_CODE_INVALID);
        var trimmed = code.trim();
        if (TOTP_CODE_PATTERN.matcher(trimmed).matches()) {
            if (verifyCode(totpSecretConverter.decrypt(identity.getTotp().getSecret()), trimmed)) {
                identity.getTotp().recordUse(clock.instant());
                identityStore.save(identity);
                return MfaVerificationResultDto.verified(MfaMethod.TOTP, false);
            }
            return MfaVerificationResultDto.failure(MfaMethod.TOTP, AuthErrorKind.MFA_CODE_INVALID);
        }
        var normalized = OTPUtility.normalizeBackupCode(trimmed);
        if (OTPUtility.looksLikeBackupCode(normalized) && consumeBackupCode(identity.getId(), normalized)) {
            identity.getTotp().recordUse(clock.instant());
            identityStore.save(identity);
            log.info("Backup code used by identity {}, {} remaining", identity.getId(), backupCodeStore.countUnused(identity.getId()));
            return MfaVerificationResultDto.verified(MfaMethod.TOTP, true);
        }
        return MfaVerificationResultDto.failure(MfaMethod.TOTP, AuthErrorKind.MFA_CODE_INVALID);
    }

    @Transactional
    public MfaActionResultDto disable(IdentityModel identity,
                                      String password) {
        if (!passwordService.verify(password, identity.getPasswordHash(), identity.getPasswordSalt()))
            return MfaActionResultDto.failure(AuthErrorKind.REAUTHENTICATION_REQUIRED);
        if (!identity.isTotpEnabled()) return MfaActionResultDto.failure(AuthErrorKind.MFA_NOT_ENABLED);
        if (identity.isMfaRequired() && identity.isOnlyEnabledMfaMethod(MfaMethod.TOTP))
            return MfaActionResultDto.failure(AuthErrorKind.MFA_METHOD_REQUIRED);
        identity.getTotp().clear();
        backupCodeStore.deleteAll(identity.getId());
        identityStore.save(identity);
        log.info("Authenticator app MFA disabled for identity {}", identity.getId());
        return MfaActionResultDto.ok("Authenticator app MFA disabled");
    }

    @Transactional
    public MfaActionResultDto regenerateBackupCodes(IdentityModel identity,
                                                    String password) {
        if (!passwordService.verify(password, identity.getPasswordHash(), identity.getPasswordSalt()))
            return MfaActionResultDto.failure(AuthErrorKind.REAUTHENTICATION_REQUIRED);
        if (!identity.isTotpEnabled()) return MfaActionResultDto.failure(AuthErrorKind.MFA_NOT_ENABLED);
        var backupCodes = issueBackupCodes(identity.getId());
        log.info("Backup codes regenerated for identity {}", identity.getId());
        return MfaActionResultDto.withBackupCodes("Backup codes regenerated", backupCodes);
    }

    public int remainingBackupCodes(UUID identityId) {
        return backupCodeStore.countUnused(identityId);
    }

    private boolean verifyCode(String base32Secret,
                               String code) {
        try {
            return TOTPUtility.verifyTOTP(base32Secret, Objects.isNull(code) ? null : code.trim(), clock.instant(), VERIFICATION_WINDOW);
        } catch (InvalidKeyException | IllegalArgumentException ex) {
            log.debug("Rejecting TOTP code against unusable secret: {}", ex.getMessage());
            return false;
        }
    }

    private List<String> issueBackupCodes(UUID identityId) {
        var now = clock.instant();
        var plainCodes = new ArrayList<String>();
        var models = new ArrayList<BackupCodeModel>();
        for (int i = 0; i < propertiesConfig.getBackupCodeCount(); i++) {
            var plain = OTPUtility.generateBackupCode();
            var hashed = passwordService.hash(OTPUtility.normalizeBackupCode(plain));
            plainCodes.add(plain);
            models.add(BackupCodeModel.builder()
                    .identityId(identityId)
                    .codeHash(hashed.getHash())
                    .codeSalt(hashed.getSalt())
                    .createdAt(now)
                    .build());
        }
        backupCodeStore.replaceAll(identityId, models);
        return plainCodes;
    }

    private boolean consumeBackupCode(UUID identityId,
                                      String normalizedCode) {
        for (var candidate : backupCodeStore.findUnused(identityId)) {
            if (passwordService.verify(normalizedCode, candidate.getCodeHash(), candidate.getCodeSalt()))
                return backupCodeStore.consume(candidate.getId());
        }
        return false;
    }

    private static String formatManualKey(String secret) {
        var grouped = new StringBuilder();
        for (int i = 0; i < secret.length(); i += 4) {
            if (i > 0) grouped.append(' ');
            grouped.append(secret, i, Math.min(i + 4, secret.length()));
        }
        return grouped.toString();
    }
}
