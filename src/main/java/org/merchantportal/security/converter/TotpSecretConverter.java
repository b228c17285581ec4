package org.merchantportal.security.converter;

import org.merchantportal.security.configs.PropertiesConfig;
import org.merchantportal.security.exceptions.ServiceUnavailableException;
import org.merchantportal.security.utils.AESRandomUtility;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Encrypts authenticator secrets before they reach the identity table.
 */
@Component
public class TotpSecretConverter {
    private final AESRandomUtility aesRandomUtility;

    public TotpSecretConverter(PropertiesConfig propertiesConfig) throws NoSuchAlgorithmException {
        var key = propertiesConfig.getTotpSecretEncryptionKey();
        if (Objects.isNull(key) || key.isBlank())
            throw new IllegalStateException("properties.totp-secret-encryption-key must be configured");
        this.aesRandomUtility = new AESRandomUtility(key);
    }

    public String encrypt(String base32Secret) {
        try {
            return aesRandomUtility.encryptString(base32Secret);
        } catch (GeneralSecurityException ex) {
            throw new ServiceUnavailableException("Unable to protect authenticator secret", ex);
        }
    }

    public String decrypt(String encryptedSecret) {
        try {
            return aesRandomUtility.decryptString(encryptedSecret);
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            throw new ServiceUnavailableException("Unable to read stored authenticator secret", ex);
        }
    }
}
