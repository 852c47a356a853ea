package com.blogicum.auth.service;

import com.blogicum.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static com.blogicum.support.Fixtures.CLOCK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    static final String SECRET = "test-secret-test-secret-test-secret-0123456789";

    private final JwtService jwtService = new JwtService(new AuthProperties("blogicum", SECRET, 3600), CLOCK);

    @Test
    void accessToken_ShouldCarryAccountAndStaffFlag() {
        String token = jwtService.issueAccessToken(42L, true);

        Claims claims = jwtService.parseAccessToken(token).getPayload();

        assertThat(jwtService.getAccountId(claims)).isEqualTo(42L);
        assertThat(jwtService.isStaff(claims)).isTrue();
        assertThat(claims.getIssuedAt().toInstant()).isEqualTo(CLOCK.instant());
        assertThat(claims.getExpiration().toInstant()).isEqualTo(CLOCK.instant().plusSeconds(3600));
    }

    @Test
    void parseAccessToken_ShouldRejectExpiredTokenByInjectedClock() {
        String token = jwtService.issueAccessToken(42L, false);
        JwtService later = new JwtService(new AuthProperties("blogicum", SECRET, 3600),
                Clock.offset(CLOCK, Duration.ofHours(2)));

        assertThatThrownBy(() -> later.parseAccessToken(token)).isInstanceOf(ExpiredJwtException.class);
    }

    @Test
    void parseAccessToken_ShouldRejectOtherIssuer() {
        JwtService other = new JwtService(new AuthProperties("someone-else", SECRET, 3600), CLOCK);
        String token = other.issueAccessToken(42L, false);

        assertThatThrownBy(() -> jwtService.parseAccessToken(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void parseAccessToken_ShouldRejectForeignSignature() {
        JwtService forger = new JwtService(
                new AuthProperties("blogicum", "another-secret-another-secret-another-0123", 3600), CLOCK);
        String token = forger.issueAccessToken(42L, true);

        assertThatThrownBy(() -> jwtService.parseAccessToken(token)).isInstanceOf(JwtException.class);
    }
}
