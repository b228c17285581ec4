package org.merchantportal.security.dtos;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HashedSecretDto {
    private final String hash;
    private final String salt;
}
