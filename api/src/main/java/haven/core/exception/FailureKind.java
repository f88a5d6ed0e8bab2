package haven.core.exception;

/**
 * Machine-checkable failure kinds reported by the token and lease subsystems.
 *
 * <p>Every failure surfaced to callers carries exactly one kind. Only
 * {@link #STORE_UNAVAILABLE} is transient; all other kinds are terminal for
 * the operation that produced them.
 */
public enum FailureKind {
    MALFORMED,
    INVALID_SIGNATURE,
    UNSUPPORTED_ALGORITHM,
    EXPIRED,
    REVOKED,
    WRONG_KIND,
    BAD_CREDENTIALS,
    UNKNOWN_DOMAIN,
    DOMAIN_NOT_AUTHORIZED,
    SUBJECT_MISMATCH,
    ALREADY_LOCKED,
    NOT_HOLDER,
    LEASE_EXPIRED,
    STORE_UNAVAILABLE;

    /**
     * Whether a caller may retry the failed operation.
     */
    public boolean retryable() {
        return this == STORE_UNAVAILABLE;
    }
}
