package haven.core.model.auth;

/**
 * Permission names checked by the HTTP surface.
 */
public final class Permission {

    /** Invite new users into the caller's domain. */
    public static final String USERS_INVITE = "users:invite";

    /** Edit CRM records, which requires holding their lease. */
    public static final String CRM_WRITE = "crm:write";

    private Permission() {}

    /**
     * Check whether token claims grant a permission.
     */
    public static boolean isGranted(TokenClaims claims, String permission) {
        final var granted = claims.attributes().get(TokenClaims.PERMISSIONS);
        return granted instanceof Iterable<?> values && contains(values, permission);
    }

    private static boolean contains(Iterable<?> values, String permission) {
        for (Object value : values) {
            if (permission.equals(value)) {
                return true;
            }
        }
        return false;
    }
}
