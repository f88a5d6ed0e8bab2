package haven.core.exception;

/**
 * Raised when the shared cache store cannot be reached or does not answer in
 * time. The only retryable failure.
 */
public class StoreUnavailableException extends SecurityStateException {

    private final String operation;

    public StoreUnavailableException(String operation, String message) {
        super(FailureKind.STORE_UNAVAILABLE, message);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(FailureKind.STORE_UNAVAILABLE, message, cause);
        this.operation = operation;
    }

    /** Returns the name of the store operation that failed. */
    public String getOperation() {
        return operation;
    }
}
