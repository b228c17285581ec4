package org.merchantportal.security.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.merchantportal.security.dtos.RegistrationDto;
import org.merchantportal.security.exceptions.BadRequestException;
import org.merchantportal.security.models.EmailOtpState;
import org.merchantportal.security.models.IdentityModel;
import org.merchantportal.security.models.TotpConfiguration;
import org.merchantportal.security.stores.IdentityStore;
import org.merchantportal.security.utils.EmailSanitizerUtility;
import org.merchantportal.security.utils.ValidationUtility;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityService {
    private final IdentityStore identityStore;
    private final PasswordService passwordService;
    private final Clock clock;

    public IdentityModel register(RegistrationDto dto) {
        ValidationUtility.validateEmail(dto.getEmail());
        ValidationUtility.validatePassword(dto.getPassword());
        var email = EmailSanitizerUtility.normalizeEmail(dto.getEmail());
        if (identityStore.existsByEmail(email))
            throw new BadRequestException("Email: '" + email + "' is already registered");
        var hashed = passwordService.hash(dto.getPassword());
        var identity = IdentityModel.builder()
                .email(email)
                .passwordHash(hashed.getHash())
                .passwordSalt(hashed.getSalt())
                .mfaRequired(Objects.isNull(dto.getMfaRequired()) || dto.getMfaRequired())
                .totp(new TotpConfiguration())
                .emailOtp(new EmailOtpState())
                .passwordChangedAt(clock.instant())
                .build();
        var saved = identityStore.save(identity);
        log.info("Registered identity {}", saved.getId());
        return saved;
    }

    public IdentityModel register(String email,
                                  String password,
                                  boolean mfaRequired) {
        var dto = new RegistrationDto();
        dto.setEmail(email);
        dto.setPassword(password);
        dto.setMfaRequired(mfaRequired);
        return register(dto);
    }
}
