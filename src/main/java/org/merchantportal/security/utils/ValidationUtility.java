package org.merchantportal.security.utils;

import org.merchantportal.security.exceptions.BadRequestException;

import java.util.Objects;
import java.util.regex.Pattern;

public class ValidationUtility {
    public static final Pattern EMAIL_PATTERN = Pattern.compile("^(?=.{1,64}@)[\\p{L}0-9]+([._+-][\\p{L}0-9]+)*@([\\p{L}0-9]+(-[\\p{L}0-9]+)*\\.)+\\p{L}{2,190}$");
    private static final Pattern PASSWORD_PATTERN = Pattern.compile("^(?=.*[0-9])(?=.*[a-z])(?=.*[A-Z])(?=.*[!@#$%^&*()_+\\-=\\[\\]{};':\"\\\\|,.<>/?]).{8,255}$");
    private static final Pattern BASE32_SECRET_PATTERN = Pattern.compile("^[A-Z2-7]{16,128}$");

    public static void validateStringNonNullAndNotEmpty(String value,
                                                        String fieldName) {
        if (Objects.isNull(value)) throw new BadRequestException(fieldName + " cannot be null");
        if (value.isBlank()) throw new BadRequestException(fieldName + " cannot be blank");
    }

    private static void validateStringLengthRange(String value,
                                                  String fieldName,
                                                  int minLength,
                                                  int maxLength) {
        validateStringNonNullAndNotEmpty(value, fieldName);
        if (value.length() < minLength)
            throw new BadRequestException(fieldName + " must be at least " + minLength + " characters long");
        if (value.length() > maxLength)
            throw new BadRequestException(fieldName + " must be at most " + maxLength + " characters long");
    }

    public static void validatePassword(String password) {
        validateStringLengthRange(password, "Password", 8, 255);
        if (!PASSWORD_PATTERN.matcher(password).matches())
            throw new BadRequestException("Password is invalid as it must contain at least one digit, one lowercase letter, one uppercase letter, and one special character");
    }

    public static void validateEmail(String email) {
        validateStringNonNullAndNotEmpty(email, "Email");
        if (!EMAIL_PATTERN.matcher(email.trim()).matches())
            throw new BadRequestException("Email: '" + email + "' is of invalid format");
    }

    public static void validateBase32Secret(String secret) {
        validateStringNonNullAndNotEmpty(secret, "Secret");
        if (!BASE32_SECRET_PATTERN.matcher(secret).matches())
            throw new BadRequestException("Secret is not a valid base32 value");
    }
}
