package org.merchantportal.security.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.merchantportal.security.enums.AuthErrorKind;
import org.merchantportal.security.enums.LoginStatus;
import org.merchantportal.security.enums.MfaMethod;
import org.merchantportal.security.models.IdentityModel;
import org.merchantportal.security.models.MfaAttemptModel;
import org.merchantportal.security.support.AuthTestFixture;
import org.merchantportal.security.utils.TOTPUtility;

import java.time.Duration;
import java.util.ArrayList;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuthenticationService")
class AuthenticationServiceTest {
    private static final String EMAIL = "a@x.com";
    private static final String PASSWORD = "Correct1!";
    private static final String WRONG_PASSWORD = "Wrong1!";
    private static final String ORIGIN = "1.2.3.4";
    private static final String OTHER_ORIGIN = "5.6.7.8";
    private static final String SECRET = "JBSWY3DPEHPK3PXPJBSWY3DPEHPK3PXP";

    private AuthTestFixture fixture;
    private AuthenticationService authenticationService;

    @BeforeEach
    void setUp() {
        fixture = new AuthTestFixture();
        authenticationService = fixture.authenticationService;
    }

    private IdentityModel enableTotp(IdentityModel identity) throws Exception {
        var result = fixture.totpService.enableWithVerification(identity, SECRET, TOTPUtility.generateTOTP(SECRET, fixture.clock.instant()));
        assertThat(result.isSuccess()).isTrue();
        return identity;
    }

    private IdentityModel enableEmail(IdentityModel identity) {
        fixture.emailOtpService.sendSetupOtp(identity);
        assertThat(fixture.emailOtpService.verifySetupOtp(identity, fixture.notifications.lastCode(), PASSWORD).isSuccess()).isTrue();
        return identity;
    }

    @Test
    @DisplayName("identity without MFA requirement is authenticated directly")
    void authenticatedWithoutMfa() {
        var identity = fixture.register(EMAIL, PASSWORD, false);

        var result = authenticationService.login("A@X.COM", PASSWORD, ORIGIN);

        assertThat(result.getStatus()).isEqualTo(LoginStatus.AUTHENTICATED);
        assertThat(result.getIdentityId()).isEqualTo(identity.getId());
    }

    @Test
    @DisplayName("identity that requires MFA but has none enabled is told to set it up")
    void setupRequired() {
        fixture.register(EMAIL, PASSWORD, true);

        var result = authenticationService.login(EMAIL, PASSWORD, ORIGIN);

        assertThat(result.getStatus()).isEqualTo(LoginStatus.MFA_SETUP_REQUIRED);
    }

    @Test
    @DisplayName("unknown email and wrong password are indistinguishable and both count")
    void invalidCredentialsAreUniform() {
        fixture.register(EMAIL, PASSWORD, false);

        var unknown = authenticationService.login("nobody@x.com", PASSWORD, ORIGIN);
        var wrong = authenticationService.login(EMAIL, WRONG_PASSWORD, ORIGIN);

        assertThat(unknown.getStatus()).isEqualTo(LoginStatus.INVALID_CREDENTIALS);
        assertThat(wrong.getStatus()).isEqualTo(LoginStatus.INVALID_CREDENTIALS);
        assertThat(unknown.getMessage()).isEqualTo(wrong.getMessage());
        assertThat(unknown.getIdentityId()).isNull();
        assertThat(wrong.getIdentityId()).isNull();
        assertThat(fixture.lockoutService.remainingAttempts("nobody@x.com", ORIGIN)).isEqualTo(4);
        assertThat(fixture.lockoutService.remainingAttempts(EMAIL, ORIGIN)).isEqualTo(4);
    }

    @Test
    @DisplayName("five failures lock the origin even for the right password while another origin still works")
    void lockoutScenario() {
        fixture.register(EMAIL, PASSWORD, false);
        for (int i = 0; i < 5; i++) {
            assertThat(authenticationService.login(EMAIL, WRONG_PASSWORD, ORIGIN).getStatus()).isEqualTo(LoginStatus.INVALID_CREDENTIALS);
        }

        var locked = authenticationService.login(EMAIL, PASSWORD, ORIGIN);
        var elsewhere = authenticationService.login(EMAIL, PASSWORD, OTHER_ORIGIN);

        assertThat(locked.getStatus()).isEqualTo(LoginStatus.LOCKED);
        assertThat(locked.getError()).isEqualTo(AuthErrorKind.ACCOUNT_LOCKED);
        assertThat(locked.getRemainingLockoutSeconds()).isEqualTo(3600);
        assertThat(elsewhere.getStatus()).isEqualTo(LoginStatus.AUTHENTICATED);
    }

    @Test
    @DisplayName("the lock lifts after an hour and success clears the counter")
    void lockLifts() {
        fixture.register(EMAIL, PASSWORD, false);
        for (int i = 0; i < 5; i++) authenticationService.login(EMAIL, WRONG_PASSWORD, ORIGIN);
        fixture.clock.advance(Duration.ofHours(1));

        var result = authenticationService.login(EMAIL, PASSWORD, ORIGIN);

        assertThat(result.getStatus()).isEqualTo(LoginStatus.AUTHENTICATED);
        assertThat(fixture.loginAttemptStore.find(EMAIL, ORIGIN)).isEmpty();
    }

    @Test
    @DisplayName("TOTP identity gets a challenge and completes it with a current code")
    void totpChallenge() throws Exception {
        var identity = enableTotp(fixture.register(EMAIL, PASSWORD, true));

        var login = authenticationService.login(EMAIL, PASSWORD, ORIGIN);

        assertThat(login.getStatus()).isEqualTo(LoginStatus.MFA_REQUIRED);
        assertThat(login.getChallenge().getIdentityId()).isEqualTo(identity.getId());
        assertThat(login.getChallenge().getAvailableMethods()).containsExactly(MfaMethod.TOTP);

        var verified = authenticationService.verifyMfa(identity.getId(), TOTPUtility.generateTOTP(SECRET, fixture.clock.instant()), null, ORIGIN);

        assertThat(verified.isSuccess()).isTrue();
        assertThat(verified.getMethod()).isEqualTo(MfaMethod.TOTP);
    }

    @Test
    @DisplayName("MFA failures never touch the lockout counter")
    void mfaFailuresDoNotLock() throws Exception {
        var identity = enableTotp(fixture.register(EMAIL, PASSWORD, true));
        authenticationService.login(EMAIL, PASSWORD, ORIGIN);

        for (int i = 0; i < 10; i++) {
            assertThat(authenticationService.verifyMfa(identity.getId(), "000000", MfaMethod.TOTP, ORIGIN).isSuccess()).isFalse();
        }

        assertThat(fixture.loginAttemptStore.size()).isZero();
        assertThat(authenticationService.login(EMAIL, PASSWORD, ORIGIN).getStatus()).isEqualTo(LoginStatus.MFA_REQUIRED);
    }

    @Test
    @DisplayName("with both methods enabled the caller has to choose")
    void methodSelection() throws Exception {
        var identity = enableEmail(enableTotp(fixture.register(EMAIL, PASSWORD, true)));

        var challenge = authenticationService.login(EMAIL, PASSWORD, ORIGIN).getChallenge();
        assertThat(challenge.isTotpAvailable()).isTrue();
        assertThat(challenge.isEmailAvailable()).isTrue();

        var unselected = authenticationService.verifyMfa(identity.getId(), "123456", null, ORIGIN);
        assertThat(unselected.getError()).isEqualTo(AuthErrorKind.MFA_METHOD_SELECTION_REQUIRED);

        assertThat(authenticationService.sendLoginOtp(identity.getId()).isSuccess()).isTrue();
        var verified = authenticationService.verifyMfa(identity.getId(), fixture.notifications.lastCode(), MfaMethod.EMAIL, ORIGIN);
        assertThat(verified.isSuccess()).isTrue();
        assertThat(verified.getMethod()).isEqualTo(MfaMethod.EMAIL);
    }

    @Test
    @DisplayName("choosing a method that is not enabled is refused")
    void methodNotEnabled() {
        var identity = enableEmail(fixture.register(EMAIL, PASSWORD, true));

        var result = authenticationService.verifyMfa(identity.getId(), "123456", MfaMethod.TOTP, ORIGIN);

        assertThat(result.getError()).isEqualTo(AuthErrorKind.MFA_NOT_ENABLED);
    }

    @Test
    @DisplayName("the only enabled method is inferred")
    void methodInferred() {
        var identity = enableEmail(fixture.register(EMAIL, PASSWORD, true));
        authenticationService.sendLoginOtp(identity.getId());

        var result = authenticationService.verifyMfa(identity.getId(), fixture.notifications.lastCode(), null, ORIGIN);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMethod()).isEqualTo(MfaMethod.EMAIL);
    }

    @Test
    @DisplayName("verification for an unknown identity is a generic failure")
    void unknownIdentity() {
        assertThat(authenticationService.verifyMfa(UUID.randomUUID(), "123456", null, ORIGIN).getError()).isEqualTo(AuthErrorKind.MFA_CODE_INVALID);
        assertThat(authenticationService.sendLoginOtp(UUID.randomUUID()).getError()).isEqualTo(AuthErrorKind.MFA_NOT_ENABLED);
    }

    @Test
    @DisplayName("a failed TOTP disable keeps MFA demanded at the next login")
    void failedDisableKeepsMfa() throws Exception {
        var identity = enableTotp(fixture.register(EMAIL, PASSWORD, false));

        var disable = fixture.totpService.disable(identity, WRONG_PASSWORD);

        assertThat(disable.getError()).isEqualTo(AuthErrorKind.REAUTHENTICATION_REQUIRED);
        assertThat(authenticationService.login(EMAIL, PASSWORD, ORIGIN).getStatus()).isEqualTo(LoginStatus.MFA_REQUIRED);
    }

    @Test
    @DisplayName("a backup code completes login and cannot be replayed")
    void backupCodeLogin() throws Exception {
        var identity = fixture.register(EMAIL, PASSWORD, true);
        var enable = fixture.totpService.enableWithVerification(identity, SECRET, TOTPUtility.generateTOTP(SECRET, fixture.clock.instant()));
        var backupCode = enable.getBackupCodes().get(0);

        var first = authenticationService.verifyMfa(identity.getId(), backupCode, MfaMethod.TOTP, ORIGIN);
        var replay = authenticationService.verifyMfa(identity.getId(), backupCode, MfaMethod.TOTP, ORIGIN);

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.isUsedBackupCode()).isTrue();
        assertThat(replay.isSuccess()).isFalse();
    }

    @Test
    @DisplayName("five failed TOTP verifications from one origin block that origin for fifteen minutes")
    void mfaVerificationThrottle() throws Exception {
        var identity = enableTotp(fixture.register(EMAIL, PASSWORD, true));
        for (int i = 0; i < 5; i++) {
            assertThat(authenticationService.verifyMfa(identity.getId(), "000000", MfaMethod.TOTP, ORIGIN).getError()).isEqualTo(AuthErrorKind.MFA_CODE_INVALID);
        }
        var current = TOTPUtility.generateTOTP(SECRET, fixture.clock.instant());

        var blocked = authenticationService.verifyMfa(identity.getId(), current, MfaMethod.TOTP, ORIGIN);
        var elsewhere = authenticationService.verifyMfa(identity.getId(), current, MfaMethod.TOTP, OTHER_ORIGIN);

        assertThat(blocked.isSuccess()).isFalse();
        assertThat(blocked.getError()).isEqualTo(AuthErrorKind.MFA_VERIFICATION_THROTTLED);
        assertThat(blocked.getRetryAfter()).isEqualTo(AuthTestFixture.START.plus(Duration.ofMinutes(15)));
        assertThat(elsewhere.isSuccess()).isTrue();

        fixture.clock.advance(Duration.ofMinutes(15));

        var later = authenticationService.verifyMfa(identity.getId(), TOTPUtility.generateTOTP(SECRET, fixture.clock.instant()), MfaMethod.TOTP, ORIGIN);
        assertThat(later.isSuccess()).isTrue();
        assertThat(fixture.mfaAttemptStore.size()).isZero();
    }

    @Test
    @DisplayName("a successful verification resets the failed verification count")
    void mfaSuccessResetsThrottle() throws Exception {
        var identity = enableTotp(fixture.register(EMAIL, PASSWORD, true));
        for (int i = 0; i < 4; i++) authenticationService.verifyMfa(identity.getId(), "000000", MfaMethod.TOTP, ORIGIN);

        assertThat(authenticationService.verifyMfa(identity.getId(), TOTPUtility.generateTOTP(SECRET, fixture.clock.instant()), MfaMethod.TOTP, ORIGIN).isSuccess()).isTrue();
        assertThat(authenticationService.verifyMfa(identity.getId(), "000000", MfaMethod.TOTP, ORIGIN).getError()).isEqualTo(AuthErrorKind.MFA_CODE_INVALID);
        assertThat(fixture.mfaAttemptStore.find(identity.getId(), ORIGIN)).get()
                .extracting(MfaAttemptModel::getFailureCount)
                .isEqualTo(1);
    }

    @Test
    @DisplayName("parallel email code guesses from stale copies of the identity cannot exceed the attempt cap")
    void emailAttemptCapWithDetachedCopies() {
        fixture = new AuthTestFixture(true);
        authenticationService = fixture.authenticationService;
        var identity = enableEmail(fixture.register(EMAIL, PASSWORD, true));
        assertThat(authenticationService.sendLoginOtp(identity.getId()).isSuccess()).isTrue();
        var code = fixture.notifications.lastCode();
        var wrong = code.equals("000000") ? "111111" : "000000";
        var snapshots = new ArrayList<IdentityModel>();
        for (int i = 0; i < 20; i++) snapshots.add(fixture.identityStore.findById(identity.getId()).orElseThrow());

        var errors = snapshots.stream()
                .map(snapshot -> fixture.emailOtpService.verifyLoginOtp(snapshot, wrong).getError())
                .toList();

        assertThat(errors).filteredOn(error -> error == AuthErrorKind.MFA_CODE_INVALID).hasSize(5);
        assertThat(errors).filteredOn(error -> error == AuthErrorKind.MFA_ATTEMPTS_EXHAUSTED).hasSize(15);
        assertThat(authenticationService.verifyMfa(identity.getId(), code, MfaMethod.EMAIL, ORIGIN).isSuccess()).isFalse();
    }

    @Test
    @DisplayName("wrong email codes on stale copies all reach the stored attempt counter")
    void emailAttemptsNotLostOnDetachedCopies() {
        fixture = new AuthTestFixture(true);
        var identity = enableEmail(fixture.register(EMAIL, PASSWORD, true));
        fixture.emailOtpService.sendLoginOtp(identity);
        var code = fixture.notifications.lastCode();
        var wrong = code.equals("000000") ? "111111" : "000000";
        var first = fixture.identityStore.findById(identity.getId()).orElseThrow();
        var second = fixture.identityStore.findById(identity.getId()).orElseThrow();
        var third = fixture.identityStore.findById(identity.getId()).orElseThrow();

        fixture.emailOtpService.verifyLoginOtp(first, wrong);
        fixture.emailOtpService.verifyLoginOtp(second, wrong);
        var result = fixture.emailOtpService.verifyLoginOtp(third, wrong);

        assertThat(fixture.identityStore.storedEmailOtpAttempts(identity.getId())).isEqualTo(3);
        assertThat(result.getError()).isEqualTo(AuthErrorKind.MFA_CODE_INVALID);
    }

    @Test
    @DisplayName("blank email is rejected without touching lockout state")
    void blankEmail() {
        var result = authenticationService.login("  ", PASSWORD, ORIGIN);

        assertThat(result.getStatus()).isEqualTo(LoginStatus.INVALID_CREDENTIALS);
        assertThat(fixture.loginAttemptStore.size()).isZero();
    }
}
