package org.merchantportal.security.utils;

import java.util.Locale;
import java.util.Objects;

public class EmailSanitizerUtility {
    public static String normalizeEmail(String email) {
        if (Objects.isNull(email)) return "";
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
