package ublauth.core.model.token;

import java.util.Optional;

/**
 * Claims whose signature, time window, issuer, audience and subject have all
 * been checked.
 *
 * @param claims the verified claims
 * @param keyId  id of the JWKS key that verified the signature
 */
public record VerifiedClaims(Claims claims, Optional<String> keyId) {

    public VerifiedClaims {
        if (claims == null) {
            throw new IllegalArgumentException("Claims cannot be null");
        }
        if (keyId == null) {
            keyId = Optional.empty();
        }
    }

    public String subject() {
        return claims.subject();
    }

    public Optional<String> issuer() {
        return claims.issuer();
    }
}
