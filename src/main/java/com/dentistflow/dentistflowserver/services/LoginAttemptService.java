package com.dentistflow.dentistflowserver.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts failed logins per email and blocks the email for a while once the limit is
 * reached. Unknown emails are counted too, so a block says nothing about whether an
 * account exists.
 * <p>
 * Failures are counted inside a window opened by the first one. An entry expires when
 * its window or its block is over, whichever applies, and is dropped on the next
 * access or by the periodic sweep.
 */
@Service
@Slf4j
public class LoginAttemptService {
    static final int MAX_ATTEMPT = 5;
    static final int BLOCK_DURATION_MIN = 5;
    static final int ATTEMPT_WINDOW_MIN = 15;

    private static final long BLOCK_DURATION_MS = BLOCK_DURATION_MIN * 60 * 1000L;
    private static final long ATTEMPT_WINDOW_MS = ATTEMPT_WINDOW_MIN * 60 * 1000L;

    private final Map<String, Attempts> attemptsCache = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public LoginAttemptService() {
        this(Clock.systemUTC());
    }

    LoginAttemptService(Clock clock) {
        this.clock = clock;
    }

    public void loginSucceeded(String email) {
        attemptsCache.remove(key(email));
    }

    public void loginFailed(String email) {
        long now = clock.millis();
        attemptsCache.compute(key(email), (k, current) -> {
            Attempts base = current == null || current.isExpired(now) ? new Attempts(0, now, 0L) : current;
            int count = base.count + 1;
            long blockedUntil = count >= MAX_ATTEMPT ? now + BLOCK_DURATION_MS : base.blockedUntil;
            return new Attempts(count, base.windowStart, blockedUntil);
        });
    }

    public boolean isBlocked(String email) {
        String key = key(email);
        Attempts attempts = attemptsCache.get(key);
        if (attempts == null) return false;
        long now = clock.millis();
        if (attempts.isExpired(now)) {
            attemptsCache.remove(key, attempts);
            return false;
        }
        return attempts.blockedUntil != 0L;
    }

    @Scheduled(fixedDelayString = "${dentistflow.security.login-attempts.sweep-interval-ms:60000}")
    public void evictExpired() {
        long now = clock.millis();
        int before = attemptsCache.size();
        attemptsCache.values().removeIf(a -> a.isExpired(now));
        int evicted = before - attemptsCache.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired login attempt entries", evicted);
        }
    }

    int getAttempts(String email) {
        Attempts attempts = attemptsCache.get(key(email));
        return attempts == null || attempts.isExpired(clock.millis()) ? 0 : attempts.count;
    }

    int trackedEmails() {
        return attemptsCache.size();
    }

    private static String key(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Attempts {
        private final int count;
        private final long windowStart;
        private final long blockedUntil;

        private Attempts(int count, long windowStart, long blockedUntil) {
            this.count = count;
            this.windowStart = windowStart;
            this.blockedUntil = blockedUntil;
        }

        private boolean isExpired(long now) {
            if (blockedUntil != 0L) {
                return now > blockedUntil;
            }
            return now - windowStart > ATTEMPT_WINDOW_MS;
        }
    }
}
