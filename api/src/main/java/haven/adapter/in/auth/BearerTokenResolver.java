package haven.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import haven.adapter.in.problem.SecurityProblem;
import haven.core.model.auth.TokenClaims;
import haven.core.model.auth.TokenKind;
import haven.core.port.in.TokenManagement;

/**
 * Extracts and validates the access token of a request.
 */
@ApplicationScoped
public class BearerTokenResolver {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenManagement tokenManagement;

    @Inject
    public BearerTokenResolver(TokenManagement tokenManagement) {
        this.tokenManagement = tokenManagement;
    }

    /**
     * Pull the raw token out of an Authorization header.
     *
     * @param authorization header value
     * @return the token
     * @throws io.quarkiverse.resteasy.problem.HttpProblem 401 if the header is missing or not Bearer
     */
    public String extract(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw SecurityProblem.unauthorized("Bearer token required");
        }
        final var token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw SecurityProblem.unauthorized("Bearer token required");
        }
        return token;
    }

    /**
     * Validate the access token of an Authorization header.
     *
     * @param authorization header value
     * @return Uni with the caller's claims
     */
    public Uni<TokenClaims> resolve(String authorization) {
        return Uni.createFrom()
                .item(() -> extract(authorization))
                .flatMap(token -> tokenManagement.validate(token, TokenKind.ACCESS));
    }
}
