package com.dentistflow.dentistflowserver.services;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class LoginAttemptServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-07-01T08:00:00Z"));
    private final LoginAttemptService service = new LoginAttemptService(clock);

    @Test
    void blocksAfterMaxFailuresAndReleasesAfterBlockDuration() {
        for (int i = 0; i < LoginAttemptService.MAX_ATTEMPT - 1; i++) {
            service.loginFailed("a@b.com");
        }
        assertThat(service.isBlocked("a@b.com")).isFalse();

        service.loginFailed("A@B.com");
        assertThat(service.isBlocked("a@b.com")).isTrue();

        clock.advance(Duration.ofMinutes(LoginAttemptService.BLOCK_DURATION_MIN).plusSeconds(1));
        assertThat(service.isBlocked("a@b.com")).isFalse();
        assertThat(service.getAttempts("a@b.com")).isZero();
    }

    @Test
    void successResetsCounter() {
        service.loginFailed("a@b.com");
        service.loginFailed("a@b.com");

        service.loginSucceeded("a@b.com");

        assertThat(service.getAttempts("a@b.com")).isZero();
    }

    @Test
    void failuresBelowLimitExpireAfterWindow() {
        service.loginFailed("a@b.com");
        service.loginFailed("a@b.com");
        assertThat(service.getAttempts("a@b.com")).isEqualTo(2);

        clock.advance(Duration.ofMinutes(LoginAttemptService.ATTEMPT_WINDOW_MIN).plusSeconds(1));

        assertThat(service.getAttempts("a@b.com")).isZero();
        assertThat(service.isBlocked("a@b.com")).isFalse();
        assertThat(service.trackedEmails()).isZero();
    }

    @Test
    void failureAfterExpiredWindowStartsNewCount() {
        for (int i = 0; i < LoginAttemptService.MAX_ATTEMPT - 1; i++) {
            service.loginFailed("a@b.com");
        }
        clock.advance(Duration.ofMinutes(LoginAttemptService.ATTEMPT_WINDOW_MIN).plusSeconds(1));

        service.loginFailed("a@b.com");

        assertThat(service.getAttempts("a@b.com")).isEqualTo(1);
        assertThat(service.isBlocked("a@b.com")).isFalse();
    }

    @Test
    void sweepDropsOnlyExpiredEntries() {
        for (int i = 0; i < 100; i++) {
            service.loginFailed("random" + i + "@b.com");
        }
        clock.advance(Duration.ofMinutes(LoginAttemptService.ATTEMPT_WINDOW_MIN).plusSeconds(1));
        service.loginFailed("fresh@b.com");

        service.evictExpired();

        assertThat(service.trackedEmails()).isEqualTo(1);
        assertThat(service.getAttempts("fresh@b.com")).isEqualTo(1);
    }

    @Test
    void blockOutlivesAttemptWindow() {
        for (int i = 0; i < LoginAttemptService.MAX_ATTEMPT - 1; i++) {
            service.loginFailed("a@b.com");
        }
        clock.advance(Duration.ofMinutes(LoginAttemptService.ATTEMPT_WINDOW_MIN - 1));
        service.loginFailed("a@b.com");

        clock.advance(Duration.ofMinutes(2));
        service.evictExpired();

        assertThat(service.isBlocked("a@b.com")).isTrue();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
