package ublauth.core.service;

import java.net.URI;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import ublauth.core.model.token.DecodedToken;
import ublauth.core.model.token.TokenVerificationException;
import ublauth.core.model.token.VerificationResult;
import ublauth.core.model.token.VerifiedClaims;
import ublauth.core.model.token.VerifyOptions;
import ublauth.core.port.in.TokenVerification;
import ublauth.core.port.out.JwksCache;
import ublauth.core.port.out.VerificationMetrics;

/**
 * Verifies EdDSA bearer tokens against a JWKS endpoint.
 *
 * <p>The order of steps is a security property:
 * <ol>
 *   <li>Decode the token structurally</li>
 *   <li>Reject any {@code alg} other than EdDSA, before any key is fetched</li>
 *   <li>Resolve the signing key through the JWKS cache</li>
 *   <li>Verify the signature over the received signing input</li>
 *   <li>Only then evaluate time, issuer, audience and subject claims</li>
 * </ol>
 */
public class Ed25519JwtVerifier implements TokenVerification {

    private static final Logger LOG = Logger.getLogger(Ed25519JwtVerifier.class);

    private final TokenDecoder decoder;
    private final JwksCache jwksCache;
    private final Ed25519SignatureVerifier signatureVerifier;
    private final ClaimsValidator claimsValidator;
    private final VerificationMetrics metrics;

    public Ed25519JwtVerifier(JwksCache jwksCache, VerificationMetrics metrics) {
        this(new TokenDecoder(), jwksCache, new Ed25519SignatureVerifier(), new ClaimsValidator(), metrics);
    }

    public Ed25519JwtVerifier(
            TokenDecoder decoder,
            JwksCache jwksCache,
            Ed25519SignatureVerifier signatureVerifier,
            ClaimsValidator claimsValidator,
            VerificationMetrics metrics) {
        this.decoder = decoder;
        this.jwksCache = jwksCache;
        this.signatureVerifier = signatureVerifier;
        this.claimsValidator = claimsValidator;
        this.metrics = metrics;
    }

    @Override
    public VerifiedClaims verify(String token, URI jwksUri, VerifyOptions options) {
        // The wait is bounded by the JWKS fetch timeout
        return verifyAsync(token, jwksUri, options).await().indefinitely();
    }

    @Override
    public Uni<VerifiedClaims> verifyAsync(String token, URI jwksUri, VerifyOptions options) {
        return Uni.createFrom()
                .item(() -> decodeAndPinAlgorithm(token))
                .flatMap(decoded -> jwksCache
                        .resolve(jwksUri, decoded.header().keyId().orElse(null))
                        .map(key -> {
                            signatureVerifier.verify(decoded.signingInput(), decoded.signature(), key.publicKey());
                            return claimsValidator.validate(
                                    decoded.header(), decoded.claims(), options, key.keyId());
                        }))
                .invoke(verified -> {
                    metrics.recordVerified();
                    LOG.debugv("Token verified with key {0} from {1}", verified.keyId().orElse("<none>"), jwksUri);
                })
                .onFailure()
                .invoke(error -> recordFailure(error, jwksUri));
    }

    @Override
    public Uni<VerificationResult> validate(String token, URI jwksUri, VerifyOptions options) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(new VerificationResult.NoToken());
        }
        return verifyAsync(token, jwksUri, options)
                .map(claims -> (VerificationResult) new VerificationResult.Verified(claims))
                .onFailure(TokenVerificationException.class)
                .recoverWithItem(error -> {
                    final var failure = (TokenVerificationException) error;
                    return new VerificationResult.Rejected(failure.failure(), failure.getMessage());
                });
    }

    private DecodedToken decodeAndPinAlgorithm(String token) {
        final var decoded = decoder.decode(token);
        claimsValidator.checkAlgorithm(decoded.header());
        return decoded;
    }

    private void recordFailure(Throwable error, URI jwksUri) {
        if (!(error instanceof TokenVerificationException verificationException)) {
            LOG.errorv(error, "Unexpected error verifying token against {0}", jwksUri);
            return;
        }

        final var failure = verificationException.failure();
        metrics.recordRejected(failure);
        if (failure.securityRelevant()) {
            LOG.warnv("Token rejected ({0}): {1}", failure, error.getMessage());
        } else {
            LOG.debugv("Token rejected ({0}): {1}", failure, error.getMessage());
        }
    }
}
