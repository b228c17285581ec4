package org.merchantportal.security.utils;

import javax.crypto.*;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.*;
import java.util.Base64;

/**
 * AES-256-GCM with a fresh random IV per call. Output is {@code base64(iv):base64(ciphertext+tag)}.
 */
public class AESRandomUtility {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final SecureRandom secureRandom = new SecureRandom();
    private final SecretKey secretKey;

    public AESRandomUtility(String aesSecret) throws NoSuchAlgorithmException {
        this.secretKey = new SecretKeySpec(MessageDigest.getInstance("SHA-256").digest(aesSecret.getBytes(StandardCharsets.UTF_8)), "AES");
    }

    public String encryptString(String data) throws NoSuchPaddingException, NoSuchAlgorithmException, InvalidAlgorithmParameterException, InvalidKeyException, IllegalBlockSizeException, BadPaddingException {
        var iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);
        var cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        var encryptedBytes = cipher.doFinal(data.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(iv) + ":" + Base64.getEncoder().encodeToString(encryptedBytes);
    }

    public String decryptString(String encryptedData) throws NoSuchPaddingException, NoSuchAlgorithmException, InvalidAlgorithmParameterException, InvalidKeyException, IllegalBlockSizeException, BadPaddingException {
        var parts = encryptedData.split(":");
        if (parts.length != 2) throw new IllegalArgumentException("Malformed encrypted value");
        var iv = Base64.getDecoder().decode(parts[0]);
        var encryptedBytes = Base64.getDecoder().decode(parts[1]);
        var cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return new String(cipher.doFinal(encryptedBytes), StandardCharsets.UTF_8);
    }
}
