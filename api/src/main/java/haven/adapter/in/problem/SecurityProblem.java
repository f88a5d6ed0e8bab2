package haven.adapter.in.problem;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import haven.core.exception.FailureKind;
import haven.core.exception.LeaseException;
import haven.core.exception.SecurityStateException;

/**
 * RFC 7807 Problem Details factory for security-state errors.
 *
 * <p>Every problem built from a {@link SecurityStateException} carries its
 * failure kind in a {@code kind} extension field.
 */
public final class SecurityProblem {

    /** Seconds a client should wait before retrying after STORE_UNAVAILABLE. */
    public static final long RETRY_AFTER_SECONDS = 1;

    private static final Response.StatusType UNPROCESSABLE_ENTITY = new Response.StatusType() {
        @Override
        public int getStatusCode() {
            return 422;
        }

        @Override
        public Status.Family getFamily() {
            return Status.Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Unprocessable Entity";
        }
    };

    private SecurityProblem() {
        // Utility class - prevent instantiation
    }

    /**
     * Map a failure raised by the core to its problem response.
     */
    public static HttpProblem from(SecurityStateException e) {
        final var kind = e.kind();
        final var builder = HttpProblem.builder()
                .withTitle(title(kind))
                .withStatus(status(kind))
                .withDetail(e.getMessage())
                .with("kind", kind.name());

        if (e instanceof LeaseException lease) {
            builder.with("recordId", lease.target().recordId());
            if (lease.target().section() != null) {
                builder.with("section", lease.target().section());
            }
            lease.blockingLease().ifPresent(blocking -> builder.with("holder", blocking.holder())
                    .with("expiresAt", blocking.expiresAt().toString()));
        }
        if (kind.retryable()) {
            builder.with("retryAfter", RETRY_AFTER_SECONDS);
        }
        return builder.build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem forbidden(String detail) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .build();
    }

    static Response.StatusType status(FailureKind kind) {
        return switch (kind) {
            case MALFORMED, INVALID_SIGNATURE, UNSUPPORTED_ALGORITHM -> UNPROCESSABLE_ENTITY;
            case EXPIRED, REVOKED, WRONG_KIND, BAD_CREDENTIALS -> Status.UNAUTHORIZED;
            case DOMAIN_NOT_AUTHORIZED, NOT_HOLDER -> Status.FORBIDDEN;
            case UNKNOWN_DOMAIN -> Status.NOT_FOUND;
            case SUBJECT_MISMATCH -> Status.BAD_REQUEST;
            case ALREADY_LOCKED -> Status.CONFLICT;
            case LEASE_EXPIRED -> Status.GONE;
            case STORE_UNAVAILABLE -> Status.SERVICE_UNAVAILABLE;
        };
    }

    private static String title(FailureKind kind) {
        return switch (kind) {
            case MALFORMED -> "Malformed Token";
            case INVALID_SIGNATURE -> "Invalid Token Signature";
            case UNSUPPORTED_ALGORITHM -> "Unsupported Token Algorithm";
            case EXPIRED -> "Token Expired";
            case REVOKED -> "Token Revoked";
            case WRONG_KIND -> "Wrong Token Kind";
            case BAD_CREDENTIALS -> "Invalid Credentials";
            case UNKNOWN_DOMAIN -> "Domain Not Found";
            case DOMAIN_NOT_AUTHORIZED -> "Domain Not Authorized";
            case SUBJECT_MISMATCH -> "Subject Mismatch";
            case ALREADY_LOCKED -> "Record Locked";
            case NOT_HOLDER -> "Lease Not Held";
            case LEASE_EXPIRED -> "Lease Expired";
            case STORE_UNAVAILABLE -> "Service Unavailable";
        };
    }
}
