package haven.adapter.in.auth;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;

import haven.core.config.TokenConfig;
import haven.core.model.auth.IssuedToken;

/**
 * Creates the HttpOnly cookie that carries the refresh token.
 */
@ApplicationScoped
public class RefreshCookieManager {

    private final TokenConfig config;
    private final Clock clock;

    @Inject
    public RefreshCookieManager(TokenConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public String cookieName() {
        return config.refreshCookie().name();
    }

    /**
     * Creates a cookie for the given refresh token, living as long as the token.
     */
    public NewCookie createCookie(IssuedToken refreshToken) {
        final var maxAge = Duration.between(clock.instant(), refreshToken.claims().expiresAt()).toSeconds();
        return builder(refreshToken.token())
                .maxAge((int) Math.max(0, Math.min(Integer.MAX_VALUE, maxAge)))
                .build();
    }

    /**
     * Creates a cookie that clears the refresh token.
     */
    public NewCookie createLogoutCookie() {
        return builder("").maxAge(0).build();
    }

    private NewCookie.Builder builder(String value) {
        return new NewCookie.Builder(config.refreshCookie().name())
                .value(value)
                .path(config.refreshCookie().path())
                .secure(config.refreshCookie().secure())
                .httpOnly(true)
                .sameSite(NewCookie.SameSite.STRICT);
    }
}
