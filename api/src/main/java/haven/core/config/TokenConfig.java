package haven.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for token issuance and verification.
 *
 * <p>Configuration prefix: {@code haven.auth.tokens}
 */
@ConfigMapping(prefix = "haven.auth.tokens")
public interface TokenConfig {

    /**
     * Issuer written into the {@code iss} claim.
     *
     * @return issuer (default: haven)
     */
    @WithDefault("haven")
    String issuer();

    /**
     * Lifetime of access tokens.
     *
     * @return access token TTL (default: 45 minutes)
     */
    @WithDefault("PT45M")
    Duration accessTtl();

    /**
     * Lifetime of refresh tokens.
     *
     * @return refresh token TTL (default: 7 days)
     */
    @WithDefault("P7D")
    Duration refreshTtl();

    /**
     * Lifetime of invitation tokens.
     *
     * @return invitation TTL (default: 7 days)
     */
    @WithDefault("P7D")
    Duration invitationTtl();

    /**
     * Lifetime of password-reset tokens.
     *
     * @return reset TTL (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration resetTtl();

    /**
     * Signing key configuration.
     */
    SigningConfig signing();

    /**
     * Cookie carrying the refresh token.
     */
    RefreshCookieConfig refreshCookie();

    interface SigningConfig {

        /**
         * Shared HMAC secret. Must be at least as long as the digest of the
         * configured algorithm (32, 48 or 64 bytes).
         */
        Optional<String> secret();

        /**
         * JWS algorithm identifier: HS256, HS384 or HS512.
         *
         * @return algorithm (default: HS256)
         */
        @WithDefault("HS256")
        String algorithm();
    }

    interface RefreshCookieConfig {

        @WithDefault("refresh_token")
        String name();

        @WithDefault("/auth")
        String path();

        /**
         * Send the cookie over HTTPS only.
         *
         * @return true if the Secure attribute is set (default: true)
         */
        @WithDefault("true")
        boolean secure();
    }
}
