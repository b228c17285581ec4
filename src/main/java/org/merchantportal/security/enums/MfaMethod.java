package org.merchantportal.security.enums;

import org.merchantportal.security.exceptions.BadRequestException;

import java.util.Locale;

public enum MfaMethod {
    TOTP,
    EMAIL;

    public static MfaMethod fromValue(String value) {
        try {
            return MfaMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new BadRequestException("Unsupported MFA method: " + value);
        }
    }
}
