package com.dentistflow.dentistflowserver.services;

import com.dentistflow.dentistflowserver.dto.LoginRequest;
import com.dentistflow.dentistflowserver.dto.LoginResponse;
import com.dentistflow.dentistflowserver.dto.RegisterRequest;
import com.dentistflow.dentistflowserver.entity.Role;
import com.dentistflow.dentistflowserver.entity.User;
import com.dentistflow.dentistflowserver.exception.ConflictException;
import com.dentistflow.dentistflowserver.exception.UnauthorizedException;
import com.dentistflow.dentistflowserver.exception.ValidationException;
import com.dentistflow.dentistflowserver.repository.UserRepository;
import com.dentistflow.dentistflowserver.security.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private static final String DUPLICATE_EMAIL = "An account with this email already exists";
    private static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final LoginAttemptService loginAttemptService;

    // checked against when the email is unknown
    private volatile String dummyHash;

    @Transactional
    public User register(RegisterRequest request) {
        Role role = resolveRole(request.getRole());
        String email = normalizeEmail(request.getEmail());

        if (userRepository.existsByEmail(email)) {
            throw new ConflictException(DUPLICATE_EMAIL);
        }

        User user = User.builder()
                .fullName(request.getFullName())
                .email(email)
                .password(passwordEncoder.encode(request.getPassword()))
                .role(role)
                .phone(request.getPhone())
                .build();

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration of the same email
            throw new ConflictException(DUPLICATE_EMAIL);
        }

        log.info("Registered user {} with role {}", user.getId(), role.getValue());
        return user;
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        String email = normalizeEmail(request.getEmail());

        if (loginAttemptService.isBlocked(email)) {
            log.warn("Login refused, too many failed attempts for {}", email);
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }

        Optional<User> found = email == null ? Optional.empty() : userRepository.findByEmail(email);
        String rawPassword = request.getPassword() != null ? request.getPassword() : "";

        boolean matches;
        if (found.isPresent()) {
            matches = passwordEncoder.matches(rawPassword, found.get().getPassword());
        } else {
            passwordEncoder.matches(rawPassword, dummyHash());
            matches = false;
        }

        if (!matches) {
            loginAttemptService.loginFailed(email);
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }

        User user = found.get();
        loginAttemptService.loginSucceeded(email);
        String token = tokenService.issue(user.getId(), user.getRole());
        log.info("User {} logged in", user.getId());
        return new LoginResponse(token, user);
    }

    private Role resolveRole(String requested) {
        if (requested == null || requested.isBlank()) {
            return Role.CLIENT;
        }
        Role role = Role.fromValue(requested);
        if (role == null) {
            throw new ValidationException("role: must be one of client, dentist, staff");
        }
        return role;
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = passwordEncoder.encode("dentistflow-timing-guard");
            dummyHash = hash;
        }
        return hash;
    }
}
