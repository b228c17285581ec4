package org.merchantportal.security.support;

import org.merchantportal.security.models.EmailOtpState;
import org.merchantportal.security.models.IdentityModel;
import org.merchantportal.security.models.TotpConfiguration;
import org.merchantportal.security.stores.IdentityStore;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shares instances with callers by default. In detached mode every read and write goes through a copy,
 * the way a JPA repository behaves outside a transaction.
 */
public class InMemoryIdentityStore implements IdentityStore {
    private final Map<UUID, IdentityModel> identities = new ConcurrentHashMap<>();
    private final boolean detached;
    private int saveCount;

    public InMemoryIdentityStore() {
        this(false);
    }

    public InMemoryIdentityStore(boolean detached) {
        this.detached = detached;
    }

    @Override
    public synchronized Optional<IdentityModel> findById(UUID id) {
        return Optional.ofNullable(identities.get(id)).map(this::handOut);
    }

    @Override
    public synchronized Optional<IdentityModel> findByEmail(String normalizedEmail) {
        return identities.values().stream()
                .filter(identity -> identity.getEmail().equals(normalizedEmail))
                .findFirst()
                .map(this::handOut);
    }

    @Override
    public boolean existsByEmail(String normalizedEmail) {
        return findByEmail(normalizedEmail).isPresent();
    }

    @Override
    public synchronized IdentityModel save(IdentityModel identity) {
        if (Objects.isNull(identity.getId())) identity.setId(UUID.randomUUID());
        identities.put(identity.getId(), handOut(identity));
        saveCount++;
        return identity;
    }

    @Override
    public synchronized boolean claimEmailOtpAttempt(UUID identityId,
                                                     int maxAttempts) {
        var stored = identities.get(identityId);
        if (Objects.isNull(stored)) return false;
        var state = stored.getEmailOtp();
        if (Objects.isNull(state.getCodeHash()) || state.getAttempts() >= maxAttempts) return false;
        state.setAttempts(state.getAttempts() + 1);
        return true;
    }

    public synchronized int getSaveCount() {
        return saveCount;
    }

    public synchronized int storedEmailOtpAttempts(UUID identityId) {
        return identities.get(identityId).getEmailOtp().getAttempts();
    }

    private IdentityModel handOut(IdentityModel identity) {
        return detached ? copyOf(identity) : identity;
    }

    private static IdentityModel copyOf(IdentityModel identity) {
        var totp = new TotpConfiguration();
        totp.setSecret(identity.getTotp().getSecret());
        totp.setEnabled(identity.getTotp().isEnabled());
        totp.setSetupAt(identity.getTotp().getSetupAt());
        totp.setLastUsedAt(identity.getTotp().getLastUsedAt());
        var source = identity.getEmailOtp();
        var emailOtp = new EmailOtpState();
        emailOtp.setEnabled(source.isEnabled());
        emailOtp.setSetupAt(source.getSetupAt());
        emailOtp.setCodeHash(source.getCodeHash());
        emailOtp.setCodeSalt(source.getCodeSalt());
        emailOtp.setCodeExpiresAt(source.getCodeExpiresAt());
        emailOtp.setAttempts(source.getAttempts());
        emailOtp.setSendCount(source.getSendCount());
        emailOtp.setLastSentAt(source.getLastSentAt());
        emailOtp.setSendWindowResetAt(source.getSendWindowResetAt());
        return identity.toBuilder()
                .totp(totp)
                .emailOtp(emailOtp)
                .build();
    }
}
