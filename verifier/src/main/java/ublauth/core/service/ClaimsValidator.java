package ublauth.core.service;

import java.util.Optional;

import ublauth.core.model.token.Claims;
import ublauth.core.model.token.TokenHeader;
import ublauth.core.model.token.TokenVerificationException;
import ublauth.core.model.token.VerificationFailure;
import ublauth.core.model.token.VerifiedClaims;
import ublauth.core.model.token.VerifyOptions;

/**
 * Enforces the claims policy on a token whose signature has already been
 * verified.
 *
 * <p>Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>{@code alg} is EdDSA</li>
 *   <li>{@code exp} has not passed (with leeway)</li>
 *   <li>{@code nbf} has been reached (with leeway)</li>
 *   <li>{@code iat} is not in the future (with leeway)</li>
 *   <li>{@code iss} matches, if an issuer is expected</li>
 *   <li>{@code aud} contains the audience, if one is required</li>
 *   <li>{@code sub} is a DID</li>
 * </ol>
 *
 * <p>All time checks use one instant read from the options' clock.
 */
public class ClaimsValidator {

    /**
     * Reject any algorithm other than EdDSA.
     *
     * @param header the token header
     * @throws TokenVerificationException with {@code UNSUPPORTED_ALGORITHM}
     */
    public void checkAlgorithm(TokenHeader header) {
        if (!header.isEdDsa()) {
            throw new TokenVerificationException(
                    VerificationFailure.UNSUPPORTED_ALGORITHM,
                    "Algorithm '" + header.algorithm() + "' is not allowed, expected " + TokenHeader.EDDSA);
        }
    }

    /**
     * Validate the header and claims of a signature-verified token.
     *
     * @param header  the token header
     * @param claims  the token claims
     * @param options the verification policy
     * @param keyId   id of the key that verified the signature
     * @return the verified claims
     * @throws TokenVerificationException on the first failed check
     */
    public VerifiedClaims validate(TokenHeader header, Claims claims, VerifyOptions options, Optional<String> keyId) {
        checkAlgorithm(header);

        final long now = options.clock().instant().getEpochSecond();
        final long leeway = options.leeway().getSeconds();

        final long earliest = saturatedAdd(now, -leeway);
        final long latest = saturatedAdd(now, leeway);

        if (claims.expiresAt().isPresent() && earliest > claims.expiresAt().getAsLong()) {
            throw new TokenVerificationException(VerificationFailure.EXPIRED, "Token has expired");
        }
        if (claims.notBefore().isPresent() && latest < claims.notBefore().getAsLong()) {
            throw new TokenVerificationException(VerificationFailure.NOT_YET_VALID, "Token is not yet valid");
        }
        if (claims.issuedAt().isPresent() && claims.issuedAt().getAsLong() > latest) {
            throw new TokenVerificationException(
                    VerificationFailure.ISSUED_IN_FUTURE, "Token was issued in the future");
        }

        if (options.issuer().isPresent()
                && !options.issuer().get().equals(claims.issuer().orElse(null))) {
            throw new TokenVerificationException(VerificationFailure.ISSUER_MISMATCH, "Invalid token issuer");
        }
        if (options.audience().isPresent() && !claims.audience().contains(options.audience().get())) {
            throw new TokenVerificationException(VerificationFailure.AUDIENCE_MISMATCH, "Invalid token audience");
        }

        if (!claims.hasDidSubject()) {
            throw new TokenVerificationException(
                    VerificationFailure.INVALID_SUBJECT, "Token subject is not a DID");
        }

        return new VerifiedClaims(claims, keyId);
    }

    /** Adds two instants or offsets, clamping to the {@code long} range instead of wrapping. */
    static long saturatedAdd(long value, long delta) {
        try {
            return Math.addExact(value, delta);
        } catch (ArithmeticException e) {
            return delta > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }
}
