package haven.core.port.out;

import haven.core.exception.FailureKind;
import haven.core.model.auth.TokenKind;

/**
 * Port interface for recording security-state metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface SecurityMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a successfully issued token.
     *
     * @param kind the token kind
     */
    void recordTokenIssued(TokenKind kind);

    /**
     * Record a token that failed validation.
     *
     * @param reason why it was rejected
     */
    void recordTokenRejected(FailureKind reason);

    /**
     * Record a revocation.
     *
     * @param scope "token" for a single nonce, "principal" for an epoch bump
     */
    void recordRevocation(String scope);

    /**
     * Record a login attempt.
     *
     * @param success whether tokens were issued
     */
    void recordAuthentication(boolean success);

    /**
     * Record the outcome of a lease operation.
     *
     * @param operation acquire, renew, release or verify
     * @param outcome   ok or the failure kind
     */
    void recordLeaseOperation(String operation, String outcome);

    /**
     * Record a cache store timeout.
     *
     * @param store     provider name
     * @param operation operation that timed out
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a cache store failure other than a timeout.
     *
     * @param store     provider name
     * @param operation operation that failed
     */
    void recordStoreFailure(String store, String operation);
}
