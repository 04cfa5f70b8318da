package com.dentistflow.dentistflowserver.security;

import com.dentistflow.dentistflowserver.entity.Role;
import com.dentistflow.dentistflowserver.exception.InternalException;
import com.dentistflow.dentistflowserver.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and validates HS256 session tokens carrying the user id and role.
 * <p>
 * The signing secret comes from {@code dentistflow.security.jwt-secret}. When it is
 * blank or shorter than 256 bits the service stays up but refuses every issue and
 * validate call.
 */
@Service
@Slf4j
public class TokenService {

    public static final Duration TOKEN_TTL = Duration.ofHours(24);

    private static final String USER_ID_CLAIM = "userId";
    private static final String ROLE_CLAIM = "role";

    private final SecretKey signingKey;
    private final Clock clock;

    @Autowired
    public TokenService(@Value("${dentistflow.security.jwt-secret:}") String secret) {
        this(secret, Clock.systemUTC());
    }

    public TokenService(String secret, Clock clock) {
        this.clock = clock;
        this.signingKey = buildKey(secret);
    }

    private static SecretKey buildKey(String secret) {
        if (secret == null || secret.isBlank()) {
            log.error("CRITICAL: JWT secret is not configured. Tokens can be neither issued nor validated.");
            return null;
        }
        try {
            SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
            log.info("JWT secret is SET.");
            return key;
        } catch (WeakKeyException e) {
            log.error("CRITICAL: JWT secret is shorter than 256 bits. Tokens can be neither issued nor validated.");
            return null;
        }
    }

    boolean isConfigured() {
        return signingKey != null;
    }

    public String issue(Long userId, Role role) {
        if (signingKey == null) {
            throw new InternalException("Could not generate token");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(USER_ID_CLAIM, String.valueOf(userId))
                .claim(ROLE_CLAIM, role.getValue())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(TOKEN_TTL)))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * @throws UnauthorizedException on a bad signature, expiry, malformed token,
     *                               unknown role or an unconfigured secret
     */
    public SessionPrincipal validate(String token) {
        if (signingKey == null) {
            throw new UnauthorizedException("Invalid token");
        }
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("Invalid token");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Long userId = Long.valueOf(claims.get(USER_ID_CLAIM, String.class));
            Role role = Role.fromValue(claims.get(ROLE_CLAIM, String.class));
            if (role == null) {
                throw new UnauthorizedException("Invalid token");
            }
            return new SessionPrincipal(userId, role);
        } catch (JwtException | IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            log.debug("Rejected session token: {}", e.getMessage());
            throw new UnauthorizedException("Invalid token");
        }
    }
}
