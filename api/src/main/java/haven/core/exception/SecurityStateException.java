package haven.core.exception;

/**
 * Base type for every failure raised by the security-state core.
 *
 * <p>Subclasses group failures by subsystem; {@link #kind()} identifies the
 * precise failure so the HTTP layer can map it to a status and message.
 */
public abstract class SecurityStateException extends RuntimeException {

    private final FailureKind kind;

    protected SecurityStateException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SecurityStateException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
