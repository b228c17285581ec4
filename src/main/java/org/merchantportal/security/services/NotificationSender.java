package org.merchantportal.security.services;

import org.merchantportal.security.enums.MfaMethod;

import java.time.Instant;

/**
 * Outbound notifications. Implementations deliver asynchronously and never fail the caller.
 */
public interface NotificationSender {
    void sendCode(String destination,
                  String code,
                  Instant expiresAt);

    void sendMfaChanged(String destination,
                        MfaMethod method,
                        boolean enabled);

    void sendBackupCodesRegenerated(String destination);
}
