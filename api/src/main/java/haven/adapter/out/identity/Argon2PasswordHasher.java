package haven.adapter.out.identity;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import org.jboss.logging.Logger;

import haven.core.config.IdentityConfig;

/**
 * Argon2id password hashing for the configuration-backed identity store.
 *
 * <p>Hashes are PHC strings ({@code $argon2id$v=19$m=..,t=..,p=..$salt$hash})
 * with a random 16 byte salt per hash. Verification reads the cost parameters
 * from the stored hash, so hashes made with older settings keep working.
 *
 * <p>Both operations are CPU and memory heavy; callers keep them off the event
 * loop.
 */
@ApplicationScoped
public class Argon2PasswordHasher {

    private static final Logger LOG = Logger.getLogger(Argon2PasswordHasher.class);
    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;

    private final Argon2 argon2;
    private final int memoryKib;
    private final int iterations;
    private final int parallelism;

    @Inject
    public Argon2PasswordHasher(IdentityConfig config) {
        this(config.passwordHashing().memoryKib(),
                config.passwordHashing().iterations(),
                config.passwordHashing().parallelism());
    }

    public Argon2PasswordHasher(int memoryKib, int iterations, int parallelism) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
        this.memoryKib = memoryKib;
        this.iterations = iterations;
        this.parallelism = parallelism;
    }

    /**
     * Hash a password with the configured cost.
     *
     * @param password plaintext password
     * @return PHC-formatted Argon2id hash
     */
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        final var chars = password.toCharArray();
        try {
            return argon2.hash(iterations, memoryKib, parallelism, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Check a password against a stored hash. A malformed or non-Argon2 hash
     * never matches.
     */
    public boolean verify(String password, String storedHash) {
        if (password == null || storedHash == null || !storedHash.startsWith("$argon2")) {
            return false;
        }
        final var chars = password.toCharArray();
        try {
            return argon2.verify(storedHash, chars);
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOG.warnf("Stored password hash could not be verified: %s", e.getMessage());
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }
}
