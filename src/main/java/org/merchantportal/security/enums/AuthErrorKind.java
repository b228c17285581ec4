package org.merchantportal.security.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AuthErrorKind {
    INVALID_CREDENTIALS("Invalid credentials"),
    ACCOUNT_LOCKED("Too many failed attempts. Please try again later"),
    MFA_CODE_INVALID("Invalid verification code"),
    MFA_CODE_EXPIRED("Verification code has expired"),
    MFA_ATTEMPTS_EXHAUSTED("Too many incorrect attempts. Please request a new code"),
    MFA_SEND_RATE_LIMITED("Too many verification codes requested. Please try again later"),
    MFA_VERIFICATION_THROTTLED("Too many failed verification attempts. Please try again later"),
    REAUTHENTICATION_REQUIRED("Password confirmation failed"),
    MFA_NOT_ENABLED("MFA method is not enabled"),
    MFA_ALREADY_ENABLED("MFA method is already enabled"),
    MFA_METHOD_REQUIRED("At least one MFA method must remain enabled"),
    MFA_METHOD_SELECTION_REQUIRED("Please select an MFA method");

    private final String message;
}
