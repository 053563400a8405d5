package ublauth.core.service;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;

import ublauth.core.model.token.TokenVerificationException;
import ublauth.core.model.token.VerificationFailure;

/**
 * Verifies Ed25519 signatures using the JDK provider.
 */
public class Ed25519SignatureVerifier {

    private static final String SIGNING_ALGORITHM = "Ed25519";

    static final int SIGNATURE_LENGTH = 64;

    /**
     * Verify a signature over the given input.
     *
     * @param signingInput the signed bytes
     * @param signature    the raw 64-byte signature
     * @param publicKey    the Ed25519 public key
     * @throws TokenVerificationException with {@code INVALID_SIGNATURE} on any mismatch, wrong length or bad key
     */
    public void verify(byte[] signingInput, byte[] signature, PublicKey publicKey) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw new TokenVerificationException(
                    VerificationFailure.INVALID_SIGNATURE,
                    "Ed25519 signature must be 64 bytes, got " + (signature == null ? 0 : signature.length));
        }

        final boolean valid;
        try {
            final var verifier = Signature.getInstance(SIGNING_ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(signingInput);
            valid = verifier.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new TokenVerificationException(
                    VerificationFailure.INVALID_SIGNATURE, "Ed25519 verification failed: " + e.getMessage(), e);
        }

        if (!valid) {
            throw new TokenVerificationException(VerificationFailure.INVALID_SIGNATURE, "Invalid token signature");
        }
    }
}
