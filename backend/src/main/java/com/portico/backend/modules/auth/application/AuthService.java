package com.portico.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import com.portico.backend.global.error.AuthException;
import com.portico.backend.global.error.ProblemCode;
import com.portico.backend.modules.auth.domain.UserAccount;
import com.portico.backend.modules.auth.domain.UserRole;
import com.portico.backend.modules.auth.domain.UserSession;
import com.portico.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.portico.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.portico.backend.modules.auth.presentation.dto.LoginRequest;
import com.portico.backend.modules.auth.presentation.dto.RegisterRequest;
import com.portico.backend.modules.auth.presentation.dto.ResetPasswordRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Registration, sign-in and credential recovery flows.
 *
 * <p>Flows do not share one transaction. Changes to a stored account are column-targeted
 * updates, never a write-back of the loaded entity, so a concurrent status change or
 * verification is not undone. The rotated verification token must persist when login then
 * fails with {@code EMAIL_NOT_VERIFIED}.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final int EMAIL_MAX_LENGTH = 320;
    private static final int NAME_MAX_LENGTH = 100;

    private final UserAccountRepository userAccountRepository;
    private final PasswordHasher passwordHasher;
    private final SessionService sessionService;
    private final AccountTokenService accountTokenService;
    private final EmailLinkService emailLinkService;
    private final EmailDispatcher emailDispatcher;
    private final int minPasswordLength;
    private final boolean emailVerificationEnabled;
    private final Clock clock;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordHasher passwordHasher,
            SessionService sessionService,
            AccountTokenService accountTokenService,
            EmailLinkService emailLinkService,
            EmailDispatcher emailDispatcher,
            @Value("${app.auth.min-password-length:8}") int minPasswordLength,
            @Value("${app.auth.email-verification-enabled:true}") boolean emailVerificationEnabled,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordHasher = passwordHasher;
        this.sessionService = sessionService;
        this.accountTokenService = accountTokenService;
        this.emailLinkService = emailLinkService;
        this.emailDispatcher = emailDispatcher;
        this.minPasswordLength = minPasswordLength;
        this.emailVerificationEnabled = emailVerificationEnabled;
        this.clock = clock;
    }

    public RegistrationResult register(RegisterRequest request, String ipAddress, String userAgent) {
        String email = UserAccount.normalizeEmail(request.email());
        String name = request.name() == null ? null : request.name().trim();
        validateEmail(email);
        if (!StringUtils.hasText(name)) {
            throw AuthException.validation("name", "name is required");
        }
        if (name.length() > NAME_MAX_LENGTH) {
            throw AuthException.validation("name", "name must be at most " + NAME_MAX_LENGTH + " characters");
        }
        validateNewPassword("password", request.password(), request.passwordConfirmation());

        if (userAccountRepository.existsByEmail(email)) {
            throw new AuthException(ProblemCode.EMAIL_ALREADY_REGISTERED);
        }

        UserAccount user = new UserAccount(email, name, passwordHasher.hash(request.password()), initialRole());
        String verificationToken = null;
        if (emailVerificationEnabled) {
            verificationToken = accountTokenService.issueVerificationToken(user);
        } else {
            user.markEmailVerified();
        }

        UserAccount saved;
        try {
            saved = userAccountRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new AuthException(ProblemCode.EMAIL_ALREADY_REGISTERED);
        }
        log.info("User registered userId={} role={} ip={} userAgent={}",
                saved.getId(), saved.getRole().code(), ipAddress, userAgent);

        if (verificationToken != null) {
            emailDispatcher.dispatchVerification(saved.getEmail(), saved.getName(), verificationToken);
        }
        return new RegistrationResult(saved, verificationToken != null);
    }

    public LoginResult login(LoginRequest request, String ipAddress, String userAgent) {
        String email = UserAccount.normalizeEmail(request.email());
        validateEmail(email);
        if (!StringUtils.hasText(request.password())) {
            throw AuthException.validation("password", "password is required");
        }

        UserAccount user = userAccountRepository.findByEmail(email).orElse(null);
        if (user == null || !passwordHasher.matches(request.password(), user.getPasswordHash())) {
            log.info("Login failed: bad credentials ip={}", ipAddress);
            throw new AuthException(ProblemCode.INVALID_CREDENTIALS);
        }
        if (!user.isActive()) {
            log.info("Login refused: account {} userId={}", user.getStatus().code(), user.getId());
            throw new AuthException(ProblemCode.ACCOUNT_INACTIVE);
        }
        if (emailVerificationEnabled && !user.isEmailVerified()) {
            Optional<String> token = accountTokenService.reissueVerificationToken(user);
            if (token.isPresent()) {
                emailDispatcher.dispatchVerification(user.getEmail(), user.getName(), token.get());
                log.info("Login refused: email not verified userId={}", user.getId());
                throw new AuthException(ProblemCode.EMAIL_NOT_VERIFIED);
            }
            log.debug("Email verified during login userId={}", user.getId());
        }

        UserSession session = sessionService.create(user.getId(), ipAddress, userAgent);
        return new LoginResult(user, session);
    }

    public void logout(String sessionId) {
        sessionService.revoke(sessionId);
    }

    public UserAccount currentUser(String sessionId) {
        return sessionService.validate(sessionId);
    }

    public void verifyEmail(String token) {
        accountTokenService.verifyEmail(token);
    }

    /**
     * Always completes normally for a well-formed address so callers cannot probe which emails exist.
     */
    public void requestPasswordReset(String rawEmail) {
        String email = UserAccount.normalizeEmail(rawEmail);
        validateEmail(email);
        UserAccount user = userAccountRepository.findByEmail(email).orElse(null);
        if (user == null) {
            log.debug("Password reset requested for unknown email");
            return;
        }
        IssuedResetToken issued = accountTokenService.issuePasswordReset(user);
        emailDispatcher.dispatchPasswordReset(user.getEmail(), user.getName(), issued.token());
    }

    public void resetPassword(ResetPasswordRequest request) {
        validateNewPassword("password", request.password(), request.passwordConfirmation());
        UUID userId = accountTokenService.redeemPasswordReset(request.token());
        if (userAccountRepository.updatePasswordHash(userId, passwordHasher.hash(request.password()), now()) == 0) {
            throw new AuthException(ProblemCode.INVALID_OR_EXPIRED_TOKEN);
        }
        sessionService.revokeAllForUser(userId);
        log.info("Password reset completed userId={}", userId);
    }

    public void changePassword(UUID userId, ChangePasswordRequest request) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new AuthException(ProblemCode.USER_NOT_FOUND));
        if (!passwordHasher.matches(request.currentPassword(), user.getPasswordHash())) {
            throw new AuthException(ProblemCode.INVALID_CREDENTIALS, "Current password is incorrect");
        }
        validateNewPassword("newPassword", request.newPassword(), request.newPasswordConfirmation());
        if (userAccountRepository.updatePasswordHash(userId, passwordHasher.hash(request.newPassword()), now()) == 0) {
            throw new AuthException(ProblemCode.USER_NOT_FOUND);
        }
        sessionService.revokeAllForUser(userId);
        log.info("Password changed userId={}", userId);
    }

    public int signOutAllDevices(UUID userId) {
        return sessionService.revokeAllForUser(userId);
    }

    public void requestEmailLink(String rawEmail) {
        String email = UserAccount.normalizeEmail(rawEmail);
        validateEmail(email);
        emailDispatcher.dispatchEmailLoginLink(email, emailLinkService.issue(email));
    }

    /**
     * Signs in through an emailed link, creating the account on first use. Holding the link
     * proves control of the address, so the email is marked verified.
     */
    public LoginResult loginWithEmailLink(String token, String ipAddress, String userAgent) {
        UserAccount user = resolveVerifiedAccount(emailLinkService.verify(token), null);
        if (!user.isActive()) {
            throw new AuthException(ProblemCode.ACCOUNT_INACTIVE);
        }
        UserSession session = sessionService.create(user.getId(), ipAddress, userAgent);
        return new LoginResult(user, session);
    }

    /**
     * Account for an address whose ownership was proven without a password. A missing account is
     * created without a password; an existing one is marked verified.
     */
    public UserAccount resolveVerifiedAccount(String rawEmail, String displayName) {
        String email = UserAccount.normalizeEmail(rawEmail);
        validateEmail(email);
        UserAccount user = userAccountRepository.findByEmail(email)
                .orElseGet(() -> createPasswordlessAccount(email, displayName));
        if (!user.isEmailVerified()) {
            userAccountRepository.markEmailVerifiedById(user.getId(), now());
            user.markEmailVerified();
        }
        return user;
    }

    private UserAccount createPasswordlessAccount(String email, String displayName) {
        String name = StringUtils.hasText(displayName) ? displayName.trim() : localPart(email);
        if (name.length() > NAME_MAX_LENGTH) {
            name = name.substring(0, NAME_MAX_LENGTH);
        }
        UserAccount user = new UserAccount(email, name, "", initialRole());
        user.markEmailVerified();
        try {
            UserAccount saved = userAccountRepository.saveAndFlush(user);
            log.info("User created without password userId={} role={}", saved.getId(), saved.getRole().code());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            return userAccountRepository.findByEmail(email)
                    .orElseThrow(() -> new AuthException(ProblemCode.EMAIL_ALREADY_REGISTERED));
        }
    }

    /**
     * The first account in an empty system administers it. Two concurrent first sign-ups may
     * both observe an empty table; that window is accepted.
     */
    private UserRole initialRole() {
        return userAccountRepository.count() == 0 ? UserRole.SUPER_ADMIN : UserRole.USER;
    }

    private void validateEmail(String email) {
        if (!StringUtils.hasText(email)) {
            throw AuthException.validation("email", "email is required");
        }
        if (email.length() > EMAIL_MAX_LENGTH || !EMAIL_PATTERN.matcher(email).matches()) {
            throw AuthException.validation("email", "email is not a valid address");
        }
    }

    private void validateNewPassword(String field, String password, String confirmation) {
        if (!StringUtils.hasText(password)) {
            throw AuthException.validation(field, field + " is required");
        }
        if (password.length() < minPasswordLength) {
            throw AuthException.validation(field, field + " must be at least " + minPasswordLength + " characters");
        }
        if (PasswordHasher.exceedsMaxLength(password)) {
            throw AuthException.validation(field,
                    field + " must be at most " + PasswordHasher.MAX_PASSWORD_BYTES + " bytes");
        }
        if (!password.equals(confirmation)) {
            throw AuthException.validation(field + "Confirmation", "passwords do not match");
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static String localPart(String email) {
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }
}
