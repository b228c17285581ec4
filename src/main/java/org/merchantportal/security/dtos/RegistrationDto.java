package org.merchantportal.security.dtos;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RegistrationDto {
    private String email;
    private String password;
    private Boolean mfaRequired;
}
