package ublauth.core.model.token;

import java.util.Locale;

/**
 * Terminal outcomes of a failed token verification.
 *
 * <p>Each value is distinct so callers can treat routine failures (an expired
 * token) differently from ones that may indicate an attack (a bad signature).
 */
public enum VerificationFailure {
    MALFORMED_TOKEN(true),
    UNSUPPORTED_ALGORITHM(true),
    UNKNOWN_KEY_ID(false),
    INVALID_SIGNATURE(true),
    EXPIRED(false),
    NOT_YET_VALID(false),
    ISSUED_IN_FUTURE(false),
    ISSUER_MISMATCH(true),
    AUDIENCE_MISMATCH(true),
    INVALID_SUBJECT(true),
    JWKS_FETCH_ERROR(false),
    JWKS_PARSE_ERROR(false);

    private final boolean securityRelevant;

    VerificationFailure(boolean securityRelevant) {
        this.securityRelevant = securityRelevant;
    }

    /**
     * Whether this failure should be surfaced as a potential attack rather than
     * logged as routine.
     *
     * @return true for forged, confused or misdirected tokens
     */
    public boolean securityRelevant() {
        return securityRelevant;
    }

    /**
     * Lower-case tag value for metrics.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
