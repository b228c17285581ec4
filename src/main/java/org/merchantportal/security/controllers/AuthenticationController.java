package org.merchantportal.security.controllers;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.merchantportal.security.dtos.LoginResultDto;
import org.merchantportal.security.dtos.MfaActionResultDto;
import org.merchantportal.security.dtos.MfaVerificationResultDto;
import org.merchantportal.security.enums.AuthErrorKind;
import org.merchantportal.security.enums.MfaMethod;
import org.merchantportal.security.services.AuthenticationService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthenticationController {
    private final AuthenticationService authenticationService;
    private final Clock clock;

    @PostMapping("/login")
    public ResponseEntity<LoginResultDto> login(@RequestParam String email,
                                                @RequestParam String password,
                                                HttpServletRequest request) {
        var result = authenticationService.login(email, password, request.getRemoteAddr());
        return switch (result.getStatus()) {
            case LOCKED -> ResponseEntity.status(HttpStatus.LOCKED).body(result);
            case INVALID_CREDENTIALS -> ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(result);
            case AUTHENTICATED, MFA_REQUIRED, MFA_SETUP_REQUIRED -> ResponseEntity.ok(result);
        };
    }

    @PostMapping("/MFA/verify/toLogin")
    public ResponseEntity<MfaVerificationResultDto> verifyMfaToLogin(@RequestParam UUID identityId,
                                                                     @RequestParam String code,
                                                                     @RequestParam(required = false) String method,
                                                                     HttpServletRequest request) {
        var result = authenticationService.verifyMfa(identityId, code, Objects.isNull(method) || method.isBlank() ? null : MfaMethod.fromValue(method), request.getRemoteAddr());
        if (result.isSuccess()) return ResponseEntity.ok(result);
        if (result.getError() == AuthErrorKind.MFA_VERIFICATION_THROTTLED)
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, retryAfterSeconds(result.getRetryAfter()))
                    .body(result);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(result);
    }

    @PostMapping("/MFA/send/email/OTP/toLogin")
    public ResponseEntity<MfaActionResultDto> sendEmailOtpToLogin(@RequestParam UUID identityId) {
        var result = authenticationService.sendLoginOtp(identityId);
        if (result.isSuccess()) return ResponseEntity.ok(result);
        if (result.getError() == AuthErrorKind.MFA_SEND_RATE_LIMITED)
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, retryAfterSeconds(result.getRetryAfter()))
                    .body(result);
        return ResponseEntity.badRequest().body(result);
    }

    private String retryAfterSeconds(Instant retryAfter) {
        if (Objects.isNull(retryAfter)) return "0";
        return String.valueOf(Math.max(1, Duration.between(clock.instant(), retryAfter).toSeconds()));
    }
}
