package ublauth.core.model.token;

import java.util.Optional;

/**
 * Decoded JOSE header of a compact token.
 *
 * @param algorithm the {@code alg} header value
 * @param keyId     the {@code kid} header value, if present
 */
public record TokenHeader(String algorithm, Optional<String> keyId) {

    /**
     * The only signature algorithm accepted.
     */
    public static final String EDDSA = "EdDSA";

    public TokenHeader {
        if (algorithm == null) {
            throw new IllegalArgumentException("Algorithm cannot be null");
        }
        if (keyId == null) {
            keyId = Optional.empty();
        }
    }

    public boolean isEdDsa() {
        return EDDSA.equals(algorithm);
    }
}
