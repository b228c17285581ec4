package org.merchantportal.security.configs;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "properties")
public class PropertiesConfig {
    private String totpIssuer = "Merchant Portal";
    private String totpSecretEncryptionKey;
    private int backupCodeCount = 10;
    private int lockoutMaxAttempts = 5;
    private Duration lockoutDuration = Duration.ofHours(1);
    private int emailOtpLength = 6;
    private Duration emailOtpExpiry = Duration.ofMinutes(10);
    private int emailOtpMaxAttempts = 5;
    private int emailOtpMaxSends = 5;
    private Duration emailOtpSendWindow = Duration.ofHours(1);
    private int mfaVerifyMaxFailures = 5;
    private Duration mfaVerifyWindow = Duration.ofMinutes(15);
    private int argon2MemoryKib = 65536;
    private int argon2Iterations = 3;
    private int argon2Parallelism = 1;
    private String mailDisplayName;
    private String mailFromAddress;
    private String helpMailAddress;
}
