package org.merchantportal.security.services;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.merchantportal.security.configs.PropertiesConfig;
import org.merchantportal.security.dtos.HashedSecretDto;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * Argon2id hashing for passwords, backup codes and email codes. Hash and salt are stored base64 encoded.
 */
@Service
public class PasswordService {
    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;
    private static final SecureRandom secureRandom = new SecureRandom();
    private final PropertiesConfig propertiesConfig;
    private final byte[] dummySalt;

    public PasswordService(PropertiesConfig propertiesConfig) {
        this.propertiesConfig = propertiesConfig;
        this.dummySalt = randomSalt();
    }

    public HashedSecretDto hash(String secret) {
        Objects.requireNonNull(secret, "secret");
        var salt = randomSalt();
        return new HashedSecretDto(
                Base64.getEncoder().encodeToString(derive(secret, salt)),
                Base64.getEncoder().encodeToString(salt)
        );
    }

    public boolean verify(String secret,
                          String storedHash,
                          String storedSalt) {
        var candidate = Objects.isNull(secret) ? "" : secret;
        if (Objects.isNull(storedHash) || Objects.isNull(storedSalt)) return verifyAgainstDummy(candidate);
        byte[] expected;
        byte[] salt;
        try {
            expected = Base64.getDecoder().decode(storedHash);
            salt = Base64.getDecoder().decode(storedSalt);
        } catch (IllegalArgumentException ex) {
            return verifyAgainstDummy(candidate);
        }
        if (salt.length == 0 || expected.length != HASH_LENGTH) return verifyAgainstDummy(candidate);
        return MessageDigest.isEqual(derive(candidate, salt), expected) && Objects.nonNull(secret);
    }

    /**
     * Burns the same work as a real check so unknown accounts cannot be told apart by timing. Always {@code false}.
     */
    public boolean verifyAgainstDummy(String secret) {
        derive(Objects.isNull(secret) ? "" : secret, dummySalt);
        return false;
    }

    private byte[] derive(String secret,
                          byte[] salt) {
        var parameters = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withSalt(salt)
                .withParallelism(propertiesConfig.getArgon2Parallelism())
                .withMemoryAsKB(propertiesConfig.getArgon2MemoryKib())
                .withIterations(propertiesConfig.getArgon2Iterations())
                .build();
        var generator = new Argon2BytesGenerator();
        generator.init(parameters);
        var hash = new byte[HASH_LENGTH];
        generator.generateBytes(secret.getBytes(StandardCharsets.UTF_8), hash);
        return hash;
    }

    private static byte[] randomSalt() {
        var salt = new byte[SALT_LENGTH];
        secureRandom.nextBytes(salt);
        return salt;
    }
}
