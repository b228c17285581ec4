package org.merchantportal.security.utils;

import org.merchantportal.security.exceptions.BadRequestException;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Objects;

public class OTPUtility {
    public static final SecureRandom secureRandom = new SecureRandom();
    public static final String DIGITS = "0123456789";
    public static final String BACKUP_CODE_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    public static final int BACKUP_CODE_LENGTH = 8;

    public static String generateOtp(int length) {
        return randomString(DIGITS, length);
    }

    /**
     * Eight characters from {@code [0-9A-Z]}, shown to the user as {@code XXXX-XXXX}.
     */
    public static String generateBackupCode() {
        var raw = randomString(BACKUP_CODE_ALPHABET, BACKUP_CODE_LENGTH);
        return raw.substring(0, BACKUP_CODE_LENGTH / 2) + "-" + raw.substring(BACKUP_CODE_LENGTH / 2);
    }

    public static String normalizeBackupCode(String code) {
        if (Objects.isNull(code)) return "";
        return code.replace("-", "").replaceAll("\\s", "").toUpperCase(Locale.ROOT);
    }

    public static boolean looksLikeBackupCode(String normalizedCode) {
        if (normalizedCode.length() != BACKUP_CODE_LENGTH) return false;
        for (var c : normalizedCode.toCharArray()) if (BACKUP_CODE_ALPHABET.indexOf(c) < 0) return false;
        return true;
    }

    private static String randomString(String alphabet,
                                       int length) {
        if (length < 1) throw new BadRequestException("OTP length must be at least 1");
        var chars = new char[length];
        for (int i = 0; i < length; i++) chars[i] = alphabet.charAt(secureRandom.nextInt(alphabet.length()));
        return new String(chars);
    }
}
