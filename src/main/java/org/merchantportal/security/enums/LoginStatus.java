package org.merchantportal.security.enums;

public enum LoginStatus {
    AUTHENTICATED,
    MFA_REQUIRED,
    MFA_SETUP_REQUIRED,
    INVALID_CREDENTIALS,
    LOCKED
}
