package org.merchantportal.security.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.merchantportal.security.configs.AsyncConfig;
import org.merchantportal.security.configs.PropertiesConfig;
import org.merchantportal.security.enums.MfaMethod;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class MailService implements NotificationSender {
    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);
    private final JavaMailSender mailSender;
    private final PropertiesConfig propertiesConfig;

    public enum MailType {
        OTP,
        MFA_ENABLE_DISABLE_CONFIRMATION,
        BACKUP_CODES_REGENERATED_CONFIRMATION
    }

    private static final String OTP_TEMPLATE = """
            Your verification code is: %s
            This code will expire at %s.
            """;
    private static final String MFA_ENABLE_DISABLE_CONFIRMATION_TEMPLATE = """
            %s.
            If this was not done by you, please contact %s immediately.
            """;
    private static final String BACKUP_CODES_REGENERATED_CONFIRMATION_TEMPLATE = """
            Your authenticator backup codes have been regenerated. Previously issued codes no longer work.
            If this was not done by you, please contact %s immediately.
            """;

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @Override
    public void sendCode(String destination,
                         String code,
                         Instant expiresAt) {
        sendEmail(destination, "Your verification code", String.format(OTP_TEMPLATE, code, EXPIRY_FORMAT.format(expiresAt)), MailType.OTP);
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @Override
    public void sendMfaChanged(String destination,
                               MfaMethod method,
                               boolean enabled) {
        var label = method == MfaMethod.TOTP ? "Authenticator app verification" : "Email verification";
        var summary = label + " has been " + (enabled ? "enabled" : "disabled") + " for your account";
        sendEmail(destination, "Multi-factor authentication updated", String.format(MFA_ENABLE_DISABLE_CONFIRMATION_TEMPLATE, summary, supportAddress()), MailType.MFA_ENABLE_DISABLE_CONFIRMATION);
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @Override
    public void sendBackupCodesRegenerated(String destination) {
        sendEmail(destination, "Backup codes regenerated", String.format(BACKUP_CODES_REGENERATED_CONFIRMATION_TEMPLATE, supportAddress()), MailType.BACKUP_CODES_REGENERATED_CONFIRMATION);
    }

    private void sendEmail(String to,
                           String subject,
                           String text,
                           MailType mailType) {
        var message = new SimpleMailMessage();
        if (Objects.nonNull(propertiesConfig.getMailFromAddress())) {
            message.setFrom(Objects.nonNull(propertiesConfig.getMailDisplayName())
                    ? propertiesConfig.getMailDisplayName() + " <" + propertiesConfig.getMailFromAddress() + ">"
                    : propertiesConfig.getMailFromAddress());
        }
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        try {
            mailSender.send(message);
            log.debug("Sent {} mail", mailType);
        } catch (MailException ex) {
            log.warn("Failed to deliver {} mail: {}", mailType, ex.getMessage());
        }
    }

    private String supportAddress() {
        return Objects.nonNull(propertiesConfig.getHelpMailAddress()) ? propertiesConfig.getHelpMailAddress() : "support";
    }
}
