package ublauth.core.port.in;

import java.net.URI;

import io.smallrye.mutiny.Uni;

import ublauth.core.model.token.TokenVerificationException;
import ublauth.core.model.token.VerificationResult;
import ublauth.core.model.token.VerifiedClaims;
import ublauth.core.model.token.VerifyOptions;

/**
 * Port for verifying EdDSA-signed bearer tokens issued for DID subjects.
 *
 * <p>A token is accepted only if all of the following hold:
 * <ul>
 *   <li>It is a well-formed compact JWS with {@code alg=EdDSA}</li>
 *   <li>Its signature verifies under an Ed25519 key from the JWKS</li>
 *   <li>It is inside its {@code exp}/{@code nbf}/{@code iat} window, allowing for leeway</li>
 *   <li>Its issuer and audience match, when the options ask for it</li>
 *   <li>Its subject is a DID</li>
 * </ul>
 */
public interface TokenVerification {

    /**
     * Verify a token, blocking while the JWKS is fetched if needed.
     *
     * @param token   compact serialized token
     * @param jwksUri where the issuer publishes its keys
     * @param options verification policy
     * @return the verified claims
     * @throws TokenVerificationException on the first failed check
     */
    VerifiedClaims verify(String token, URI jwksUri, VerifyOptions options);

    /**
     * Verify a token without blocking.
     *
     * @param token   compact serialized token
     * @param jwksUri where the issuer publishes its keys
     * @param options verification policy
     * @return Uni with the verified claims, failed with {@link TokenVerificationException}
     */
    Uni<VerifiedClaims> verifyAsync(String token, URI jwksUri, VerifyOptions options);

    /**
     * Verify a token and report the outcome as a value.
     *
     * @param token   compact serialized token, may be null
     * @param jwksUri where the issuer publishes its keys
     * @param options verification policy
     * @return Uni with Verified, Rejected or NoToken
     */
    Uni<VerificationResult> validate(String token, URI jwksUri, VerifyOptions options);
}
