package org.merchantportal.security.dtos;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.merchantportal.security.enums.MfaMethod;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

@Getter
@AllArgsConstructor
public class LoginChallengeDto {
    private final UUID identityId;
    private final boolean totpAvailable;
    private final boolean emailAvailable;
    private final Instant issuedAt;

    public Set<MfaMethod> getAvailableMethods() {
        var methods = EnumSet.noneOf(MfaMethod.class);
        if (totpAvailable) methods.add(MfaMethod.TOTP);
        if (emailAvailable) methods.add(MfaMethod.EMAIL);
        return methods;
    }
}
