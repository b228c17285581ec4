package org.merchantportal.security.services;

import lombok.RequiredArgsConstructor;
import org.merchantportal.security.dtos.MfaActionResultDto;
import org.merchantportal.security.dtos.MfaStatusDto;
import org.merchantportal.security.enums.AuthErrorKind;
import org.merchantportal.security.enums.MfaMethod;
import org.merchantportal.security.exceptions.BadRequestException;
import org.merchantportal.security.models.IdentityModel;
import org.merchantportal.security.stores.IdentityStore;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.UUID;

/**
 * MFA management for an already authenticated identity.
 */
@Service
@RequiredArgsConstructor
public class MfaService {
    private final IdentityStore identityStore;
    private final PasswordService passwordService;
    private final TotpService totpService;
    private final EmailOtpService emailOtpService;
    private final NotificationSender notificationSender;

    public MfaActionResultDto enrollTotp(UUID identityId) {
        var identity = getIdentity(identityId);
        if (identity.isTotpEnabled()) return MfaActionResultDto.failure(AuthErrorKind.MFA_ALREADY_ENABLED);
        return MfaActionResultDto.enrollment(totpService.generateEnrollment(identity.getEmail()));
    }

    public MfaActionResultDto confirmTotp(UUID identityId,
                                          String secret,
                                          String code) {
        var identity = getIdentity(identityId);
        var result = totpService.enableWithVerification(identity, secret, code);
        if (result.isSuccess()) notificationSender.sendMfaChanged(identity.getEmail(), MfaMethod.TOTP, true);
        return result;
    }

    public MfaActionResultDto disableTotp(UUID identityId,
                                          String password) {
        var identity = getIdentity(identityId);
        var result = totpService.disable(identity, password);
        if (result.isSuccess()) notificationSender.sendMfaChanged(identity.getEmail(), MfaMethod.TOTP, false);
        return result;
    }

    public MfaActionResultDto regenerateBackupCodes(UUID identityId,
                                                    String password) {
        var identity = getIdentity(identityId);
        var result = totpService.regenerateBackupCodes(identity, password);
        if (result.isSuccess()) notificationSender.sendBackupCodesRegenerated(identity.getEmail());
        return result;
    }

    public MfaActionResultDto enrollEmailOtp(UUID identityId,
                                             String password) {
        var identity = getIdentity(identityId);
        if (!passwordService.verify(password, identity.getPasswordHash(), identity.getPasswordSalt()))
            return MfaActionResultDto.failure(AuthErrorKind.REAUTHENTICATION_REQUIRED);
        return emailOtpService.sendSetupOtp(identity);
    }

    public MfaActionResultDto confirmEmailOtp(UUID identityId,
                                              String code,
                                              String password) {
        var identity = getIdentity(identityId);
        var result = emailOtpService.verifySetupOtp(identity, code, password);
        if (result.isSuccess()) notificationSender.sendMfaChanged(identity.getEmail(), MfaMethod.EMAIL, true);
        return result;
    }

    public MfaActionResultDto disableEmailOtp(UUID identityId,
                                              String password) {
        var identity = getIdentity(identityId);
        var result = emailOtpService.disable(identity, password);
        if (result.isSuccess()) notificationSender.sendMfaChanged(identity.getEmail(), MfaMethod.EMAIL, false);
        return result;
    }

    public MfaStatusDto getMfaStatus(UUID identityId) {
        var identity = getIdentity(identityId);
        var status = new MfaStatusDto();
        status.setMfaRequired(identity.isMfaRequired());
        status.setMfaSetupPending(identity.isMfaSetupPending());
        status.setTotpEnabled(identity.isTotpEnabled());
        status.setTotpSetupAt(identity.getTotp().getSetupAt());
        status.setTotpLastUsedAt(identity.getTotp().getLastUsedAt());
        status.setRemainingBackupCodes(identity.isTotpEnabled() ? totpService.remainingBackupCodes(identity.getId()) : 0);
        status.setEmailOtpEnabled(identity.isEmailOtpEnabled());
        status.setEmailOtpSetupAt(identity.getEmailOtp().getSetupAt());
        status.setEmailOtpLastSentAt(identity.getEmailOtp().getLastSentAt());
        status.setEmailOtpSendCount(identity.getEmailOtp().getSendCount());
        return status;
    }

    private IdentityModel getIdentity(UUID identityId) {
        if (Objects.isNull(identityId)) throw new BadRequestException("Identity id cannot be null");
        return identityStore.findById(identityId).orElseThrow(() -> new BadRequestException("Invalid identity"));
    }
}
