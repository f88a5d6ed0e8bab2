package haven.core.service.auth;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generate token nonces.
 *
 * <p>Nonces are 32 bytes (256 bits) of random data encoded as URL-safe
 * Base64, so they are safe to embed in cache keys.
 */
@ApplicationScoped
public class NonceGenerator {

    private static final int NONCE_BYTES = 32; // 256 bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * Generate a new nonce.
     *
     * @return A URL-safe Base64 encoded nonce (43 characters)
     */
    public String generate() {
        byte[] bytes = new byte[NONCE_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
