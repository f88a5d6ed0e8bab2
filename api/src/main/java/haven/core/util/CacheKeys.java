package haven.core.util;

/**
 * Builds the cache store keys used by the security-state services.
 *
 * <pre>
 * {prefix}revoked:{nonce}
 * {prefix}epoch:{principalId}
 * {prefix}password:{principalId}
 * {prefix}lease:{recordId}
 * </pre>
 */
public final class CacheKeys {

    private final String prefix;

    public CacheKeys(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public String revoked(String nonce) {
        return prefix + "revoked:" + nonce;
    }

    public String epoch(String principalId) {
        return prefix + "epoch:" + principalId;
    }

    public String password(String principalId) {
        return prefix + "password:" + principalId;
    }

    /**
     * Key holding every lease on the record and its sections.
     */
    public String lease(String recordId) {
        return prefix + "lease:" + recordId;
    }
}
