package haven.core.model.auth;

import java.util.Arrays;
import java.util.Optional;

/**
 * The kinds of bearer token the subsystem issues.
 *
 * <p>A token is only ever accepted for its own kind. Invitation and reset
 * tokens are single-use: a successful validation consumes them.
 */
public enum TokenKind {
    ACCESS("access", false),
    REFRESH("refresh", false),
    INVITATION("invitation", true),
    RESET("reset", true);

    private final String claimValue;
    private final boolean singleUse;

    TokenKind(String claimValue, boolean singleUse) {
        this.claimValue = claimValue;
        this.singleUse = singleUse;
    }

    /**
     * Value written into the {@code kind} claim.
     */
    public String claimValue() {
        return claimValue;
    }

    public boolean singleUse() {
        return singleUse;
    }

    /**
     * Resolve a kind from its claim value.
     *
     * @param value the claim value
     * @return the matching kind, or empty if unknown
     */
    public static Optional<TokenKind> fromClaim(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(k -> k.claimValue.equals(value)).findFirst();
    }
}
