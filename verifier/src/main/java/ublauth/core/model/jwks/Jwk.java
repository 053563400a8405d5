package ublauth.core.model.jwks;

import java.util.Optional;

/**
 * A single entry of a JSON Web Key Set.
 *
 * <p>The public key material is kept in its base64url transport form and only
 * decoded when the key is selected for verification, so a malformed key that
 * is never used does not poison the whole document.
 *
 * @param keyId   the {@code kid} member
 * @param keyType the {@code kty} member
 * @param curve   the {@code crv} member
 * @param x       the {@code x} member (base64url public key)
 */
public record Jwk(Optional<String> keyId, Optional<String> keyType, Optional<String> curve, Optional<String> x) {

    public static final String KEY_TYPE_OKP = "OKP";
    public static final String CURVE_ED25519 = "Ed25519";

    public Jwk {
        keyId = keyId == null ? Optional.empty() : keyId;
        keyType = keyType == null ? Optional.empty() : keyType;
        curve = curve == null ? Optional.empty() : curve;
        x = x == null ? Optional.empty() : x;
    }

    /**
     * Creates an Ed25519 public key entry.
     *
     * @param keyId the key id
     * @param x     base64url encoded 32-byte public key
     */
    public static Jwk ed25519(String keyId, String x) {
        return new Jwk(Optional.ofNullable(keyId), Optional.of(KEY_TYPE_OKP), Optional.of(CURVE_ED25519), Optional.of(x));
    }

    /**
     * Whether this key can verify EdDSA signatures: {@code kty=OKP} and {@code crv=Ed25519}.
     */
    public boolean isEd25519() {
        return keyType.filter(KEY_TYPE_OKP::equals).isPresent()
                && curve.filter(CURVE_ED25519::equals).isPresent();
    }

    public boolean hasKeyId(String candidate) {
        return keyId.filter(id -> id.equals(candidate)).isPresent();
    }
}
