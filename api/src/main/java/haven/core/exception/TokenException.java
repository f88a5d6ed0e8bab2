package haven.core.exception;

import haven.core.model.auth.TokenKind;

/**
 * Raised when a bearer token cannot be decoded or is not acceptable for the
 * requested operation.
 */
public class TokenException extends SecurityStateException {

    public TokenException(FailureKind kind, String message) {
        super(kind, message);
    }

    public TokenException(FailureKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static TokenException malformed(String detail) {
        return new TokenException(FailureKind.MALFORMED, "Malformed token: " + detail);
    }

    public static TokenException malformed(String detail, Throwable cause) {
        return new TokenException(FailureKind.MALFORMED, "Malformed token: " + detail, cause);
    }

    public static TokenException invalidSignature() {
        return new TokenException(FailureKind.INVALID_SIGNATURE, "Token signature verification failed");
    }

    public static TokenException unsupportedAlgorithm(String algorithm) {
        return new TokenException(
                FailureKind.UNSUPPORTED_ALGORITHM, "Unsupported token algorithm: %s".formatted(algorithm));
    }

    public static TokenException expired() {
        return new TokenException(FailureKind.EXPIRED, "Token has expired");
    }

    public static TokenException revoked() {
        return new TokenException(FailureKind.REVOKED, "Token has been revoked");
    }

    public static TokenException revoked(String detail) {
        return new TokenException(FailureKind.REVOKED, "Token has been revoked: " + detail);
    }

    public static TokenException wrongKind(TokenKind expected, TokenKind actual) {
        return new TokenException(
                FailureKind.WRONG_KIND,
                "Expected %s token but got %s".formatted(expected.claimValue(), actual.claimValue()));
    }

    public static TokenException subjectMismatch() {
        return new TokenException(FailureKind.SUBJECT_MISMATCH, "Subject does not match the token");
    }
}
