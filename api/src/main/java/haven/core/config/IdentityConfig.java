package haven.core.config;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the configuration-backed identity store.
 *
 * <p>Configuration prefix: {@code haven.identity}
 *
 * <pre>
 * haven.identity.domains=north-shelter,south-shelter
 * haven.identity.users.u-1.username=alice
 * haven.identity.users.u-1.password-hash=$argon2id$v=19$m=65536,t=3,p=4$...
 * haven.identity.users.u-1.domains=north-shelter
 * haven.identity.users.u-1.permissions=crm:write,users:invite
 * </pre>
 */
@ConfigMapping(prefix = "haven.identity")
public interface IdentityConfig {

    /**
     * Known tenant domains.
     */
    Optional<Set<String>> domains();

    /**
     * Principals keyed by id.
     */
    Map<String, UserConfig> users();

    /**
     * Argon2id cost for hashes written by password resets.
     */
    PasswordHashingConfig passwordHashing();

    interface PasswordHashingConfig {

        @WithDefault("65536")
        int memoryKib();

        @WithDefault("3")
        int iterations();

        @WithDefault("4")
        int parallelism();
    }

    interface UserConfig {

        String username();

        /**
         * Argon2id hash of the password in PHC format.
         */
        String passwordHash();

        Optional<Set<String>> domains();

        Optional<Set<String>> permissions();
    }
}
