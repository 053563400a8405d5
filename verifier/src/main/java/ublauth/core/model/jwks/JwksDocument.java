package ublauth.core.model.jwks;

import java.util.List;

/**
 * Parsed JSON Web Key Set, in document order.
 *
 * @param keys the keys
 */
public record JwksDocument(List<Jwk> keys) {

    public JwksDocument {
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public static JwksDocument of(Jwk... keys) {
        return new JwksDocument(List.of(keys));
    }

    /**
     * Keys usable for EdDSA verification, in document order.
     */
    public List<Jwk> ed25519Keys() {
        return keys.stream().filter(Jwk::isEd25519).toList();
    }
}
