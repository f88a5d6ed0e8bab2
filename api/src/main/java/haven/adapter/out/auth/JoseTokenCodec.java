package haven.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import haven.core.config.TokenConfig;
import haven.core.exception.TokenException;
import haven.core.model.auth.TokenClaims;
import haven.core.model.auth.TokenKind;
import haven.core.port.out.TokenCodec;

/**
 * HMAC JWS token codec.
 *
 * <p>Signs the whole claim set with a shared secret using HS256, HS384 or
 * HS512. The algorithm is fixed by configuration: a token whose header names
 * any other algorithm (including {@code none}) is rejected before its
 * signature is looked at.
 *
 * <p>The secret is checked at startup and must be at least as long as the
 * digest of the configured algorithm.
 */
@Startup
@ApplicationScoped
public class JoseTokenCodec implements TokenCodec {

    private static final Logger LOG = Logger.getLogger(JoseTokenCodec.class);

    static final String CLAIM_DOMAIN = "domain";
    static final String CLAIM_KIND = "kind";
    static final String CLAIM_EPOCH = "epoch";

    private static final Set<String> RESERVED_CLAIMS =
            Set.of("iss", "sub", "aud", "iat", "exp", "nbf", "jti", CLAIM_DOMAIN, CLAIM_KIND, CLAIM_EPOCH);

    private static final Map<String, Integer> MIN_SECRET_BYTES = Map.of(
            AlgorithmIdentifiers.HMAC_SHA256, 32,
            AlgorithmIdentifiers.HMAC_SHA384, 48,
            AlgorithmIdentifiers.HMAC_SHA512, 64);

    private final String issuer;
    private final String algorithm;
    private final HmacKey key;

    @Inject
    public JoseTokenCodec(TokenConfig config) {
        this(
                config.issuer(),
                config.signing().algorithm(),
                config.signing()
                        .secret()
                        .orElseThrow(() -> new IllegalStateException(
                                "haven.auth.tokens.signing.secret must be configured")));
    }

    public JoseTokenCodec(String issuer, String algorithm, String secret) {
        Integer minBytes = MIN_SECRET_BYTES.get(algorithm);
        if (minBytes == null) {
            throw new IllegalStateException(
                    "Unsupported signing algorithm '%s'; expected HS256, HS384 or HS512".formatted(algorithm));
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < minBytes) {
            throw new IllegalStateException("Signing secret for %s must be at least %d bytes, got %d"
                    .formatted(algorithm, minBytes, secretBytes.length));
        }
        this.issuer = issuer;
        this.algorithm = algorithm;
        this.key = new HmacKey(secretBytes);
        LOG.infof("Token codec initialized with %s", algorithm);
    }

    @Override
    public String encode(TokenClaims tokenClaims) {
        final var claims = new JwtClaims();
        claims.setIssuer(issuer);
        claims.setSubject(tokenClaims.subject());
        if (tokenClaims.domain() != null) {
            claims.setClaim(CLAIM_DOMAIN, tokenClaims.domain());
        }
        claims.setClaim(CLAIM_KIND, tokenClaims.kind().claimValue());
        claims.setIssuedAt(NumericDate.fromSeconds(tokenClaims.issuedAt().getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(tokenClaims.expiresAt().getEpochSecond()));
        claims.setJwtId(tokenClaims.nonce());
        claims.setClaim(CLAIM_EPOCH, tokenClaims.epoch());

        tokenClaims.attributes().forEach((name, value) -> {
            if (RESERVED_CLAIMS.contains(name)) {
                throw new IllegalArgumentException("Attribute '%s' clashes with a reserved claim".formatted(name));
            }
            claims.setClaim(name, value instanceof Collection<?> values ? new ArrayList<>(values) : value);
        });

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(algorithm);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to sign token: " + e.getMessage(), e);
        }
    }

    @Override
    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw TokenException.malformed("empty token");
        }

        final var jws = new JsonWebSignature();
        try {
            jws.setCompactSerialization(token.trim());
        } catch (JoseException e) {
            throw TokenException.malformed("not a compact JWS", e);
        }

        final var headerAlgorithm = jws.getAlgorithmHeaderValue();
        if (!algorithm.equals(headerAlgorithm)) {
            LOG.debugf("Rejected token with header algorithm %s", headerAlgorithm);
            throw TokenException.unsupportedAlgorithm(headerAlgorithm);
        }

        jws.setAlgorithmConstraints(new AlgorithmConstraints(ConstraintType.PERMIT, algorithm));
        jws.setKey(key);

        final String payload;
        try {
            if (!jws.verifySignature()) {
                throw TokenException.invalidSignature();
            }
            payload = jws.getUnverifiedPayload();
        } catch (JoseException e) {
            throw TokenException.malformed("signature could not be checked", e);
        }

        try {
            return toTokenClaims(JwtClaims.parse(payload));
        } catch (InvalidJwtException e) {
            throw TokenException.malformed("payload is not a claim set", e);
        }
    }

    private TokenClaims toTokenClaims(JwtClaims claims) {
        try {
            if (!issuer.equals(claims.getIssuer())) {
                throw TokenException.malformed("unexpected issuer");
            }
            final var kind = TokenKind.fromClaim(claims.getStringClaimValue(CLAIM_KIND))
                    .orElseThrow(() -> TokenException.malformed("unknown kind"));
            final var issuedAt = claims.getIssuedAt();
            final var expiresAt = claims.getExpirationTime();
            final var epoch = claims.getClaimValue(CLAIM_EPOCH, Long.class);
            if (issuedAt == null || expiresAt == null || epoch == null) {
                throw TokenException.malformed("missing required claims");
            }

            final var attributes = new LinkedHashMap<String, Object>(claims.getClaimsMap(RESERVED_CLAIMS));

            return new TokenClaims(
                    claims.getSubject(),
                    claims.getStringClaimValue(CLAIM_DOMAIN),
                    kind,
                    Instant.ofEpochSecond(issuedAt.getValue()),
                    Instant.ofEpochSecond(expiresAt.getValue()),
                    claims.getJwtId(),
                    epoch,
                    attributes);
        } catch (MalformedClaimException e) {
            throw TokenException.malformed("ill-typed claim", e);
        } catch (IllegalArgumentException e) {
            throw TokenException.malformed(e.getMessage(), e);
        }
    }
}
