package ublauth.core.model.jwks;

import java.security.PublicKey;
import java.util.Optional;

/**
 * An Ed25519 public key selected from a JWKS document.
 *
 * @param keyId     the {@code kid} of the selected key
 * @param publicKey the decoded public key
 */
public record ResolvedKey(Optional<String> keyId, PublicKey publicKey) {

    public ResolvedKey {
        if (keyId == null) {
            keyId = Optional.empty();
        }
        if (publicKey == null) {
            throw new IllegalArgumentException("Public key cannot be null");
        }
    }
}
