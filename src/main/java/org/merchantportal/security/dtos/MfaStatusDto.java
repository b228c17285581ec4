package org.merchantportal.security.dtos;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
public class MfaStatusDto {
    private boolean mfaRequired;
    private boolean mfaSetupPending;
    private boolean totpEnabled;
    private Instant totpSetupAt;
    private Instant totpLastUsedAt;
    private int remainingBackupCodes;
    private boolean emailOtpEnabled;
    private Instant emailOtpSetupAt;
    private Instant emailOtpLastSentAt;
    private int emailOtpSendCount;
}
