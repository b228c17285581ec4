package org.merchantportal.security.utils;

import com.eatthepath.otp.TimeBasedOneTimePasswordGenerator;
import org.apache.commons.codec.binary.Base32;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Objects;

public class TOTPUtility {
    public static final int CODE_DIGITS = 6;
    private static final TimeBasedOneTimePasswordGenerator totp = new TimeBasedOneTimePasswordGenerator();

    public static String generateBase32Secret() throws NoSuchAlgorithmException {
        var keyGenerator = KeyGenerator.getInstance(totp.getAlgorithm());
        keyGenerator.init(160);
        return new Base32().encodeToString(keyGenerator.generateKey().getEncoded()).replace("=", "");
    }

    public static String generateTOTPUrl(String issuer,
                                         String accountName,
                                         String base32Secret) {
        return String.format("otpauth://totp/%s:%s?secret=%s&issuer=%s&algorithm=SHA1&digits=%d&period=%d",
                urlEncode(issuer),
                urlEncode(accountName),
                base32Secret,
                urlEncode(issuer),
                CODE_DIGITS,
                totp.getTimeStep().getSeconds()
        );
    }

    // Authenticator apps read '+' literally inside the label.
    public static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static String generateTOTP(String base32Secret,
                                      Instant instant) throws InvalidKeyException {
        return String.format("%0" + CODE_DIGITS + "d", totp.generateOneTimePassword(decodeBase32Secret(base32Secret), instant));
    }

    /**
     * Accepts the code for the time step containing {@code now} and for {@code window} steps on either side.
     */
    public static boolean verifyTOTP(String base32Secret,
                                     String userInputCode,
                                     Instant now,
                                     int window) throws InvalidKeyException {
        if (Objects.isNull(userInputCode) || userInputCode.length() != CODE_DIGITS) return false;
        var provided = userInputCode.getBytes(StandardCharsets.US_ASCII);
        var step = totp.getTimeStep();
        var matched = false;
        for (int offset = -window; offset <= window; offset++) {
            var candidate = generateTOTP(base32Secret, now.plus(step.multipliedBy(offset)));
            matched |= MessageDigest.isEqual(candidate.getBytes(StandardCharsets.US_ASCII), provided);
        }
        return matched;
    }

    public static SecretKey decodeBase32Secret(String base32Secret) {
        return new SecretKeySpec(new Base32().decode(base32Secret), totp.getAlgorithm());
    }
}
