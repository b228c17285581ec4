package org.merchantportal.security.dtos;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Carries the plaintext secret back to the caller only. Nothing is persisted until the code is confirmed.
 */
@Getter
@AllArgsConstructor
public class TotpEnrollmentDto {
    private final String secret;
    private final String provisioningUri;
    private final String manualKey;
}
