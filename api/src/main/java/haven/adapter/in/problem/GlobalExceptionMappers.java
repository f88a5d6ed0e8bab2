package haven.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import haven.core.exception.SecurityStateException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapSecurityStateException(SecurityStateException e) {
        final var problem = SecurityProblem.from(e);
        if (e.kind().retryable()) {
            LOG.warnv("Security state unavailable: {0}", e.getMessage());
            return Response.fromResponse(toResponse(problem))
                    .header(HttpHeaders.RETRY_AFTER, SecurityProblem.RETRY_AFTER_SECONDS)
                    .build();
        }
        LOG.debugv("Security check failed ({0}): {1}", e.kind(), e.getMessage());
        return toResponse(problem);
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(SecurityProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
