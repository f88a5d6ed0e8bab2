package haven.core.exception;

/**
 * Raised by the password grant when credentials or the requested domain are
 * not acceptable.
 */
public class AuthenticationException extends SecurityStateException {

    public AuthenticationException(FailureKind kind, String message) {
        super(kind, message);
    }

    public static AuthenticationException badCredentials() {
        return new AuthenticationException(FailureKind.BAD_CREDENTIALS, "Invalid username or password");
    }

    public static AuthenticationException unknownDomain(String domain) {
        return new AuthenticationException(FailureKind.UNKNOWN_DOMAIN, "Domain '%s' does not exist".formatted(domain));
    }

    public static AuthenticationException domainNotAuthorized(String domain) {
        return new AuthenticationException(
                FailureKind.DOMAIN_NOT_AUTHORIZED,
                domain == null
                        ? "A domain must be selected"
                        : "Not authorized for domain '%s'".formatted(domain));
    }
}
