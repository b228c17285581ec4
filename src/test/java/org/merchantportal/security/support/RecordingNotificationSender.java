package org.merchantportal.security.support;

import org.merchantportal.security.enums.MfaMethod;
import org.merchantportal.security.services.NotificationSender;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotificationSender implements NotificationSender {
    public record SentCode(String destination, String code, Instant expiresAt) {
    }

    public record MfaChange(String destination, MfaMethod method, boolean enabled) {
    }

    private final List<SentCode> codes = new CopyOnWriteArrayList<>();
    private final List<MfaChange> changes = new CopyOnWriteArrayList<>();
    private final List<String> regenerations = new CopyOnWriteArrayList<>();

    @Override
    public void sendCode(String destination,
                         String code,
                         Instant expiresAt) {
        codes.add(new SentCode(destination, code, expiresAt));
    }

    @Override
    public void sendMfaChanged(String destination,
                               MfaMethod method,
                               boolean enabled) {
        changes.add(new MfaChange(destination, method, enabled));
    }

    @Override
    public void sendBackupCodesRegenerated(String destination) {
        regenerations.add(destination);
    }

    public List<SentCode> getCodes() {
        return codes;
    }

    public String lastCode() {
        return codes.get(codes.size() - 1).code();
    }

    public List<MfaChange> getChanges() {
        return changes;
    }

    public List<String> getRegenerations() {
        return regenerations;
    }
}
