package ublauth.core.model.token;

/**
 * Value-style outcome of verifying a bearer token.
 */
public sealed interface VerificationResult {

    /**
     * Token passed every check.
     *
     * @param claims the verified claims
     */
    record Verified(VerifiedClaims claims) implements VerificationResult {
        public Verified {
            if (claims == null) {
                throw new IllegalArgumentException("Claims cannot be null");
            }
        }
    }

    /**
     * Token was rejected.
     *
     * @param failure the check that rejected it
     * @param detail  human readable description
     */
    record Rejected(VerificationFailure failure, String detail) implements VerificationResult {
        public Rejected {
            if (failure == null) {
                throw new IllegalArgumentException("Failure cannot be null");
            }
        }
    }

    /**
     * No token was provided.
     */
    record NoToken() implements VerificationResult {}
}
