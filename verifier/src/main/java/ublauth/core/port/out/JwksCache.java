package ublauth.core.port.out;

import java.net.URI;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import ublauth.core.model.jwks.CachedJwks;
import ublauth.core.model.jwks.JwksDocument;
import ublauth.core.model.jwks.ResolvedKey;

/**
 * Port for caching JSON Web Key Sets and resolving signing keys from them.
 *
 * <p>Implementations are responsible for:
 * <ul>
 *   <li>Fetching JWKS from remote endpoints</li>
 *   <li>Caching documents with a TTL</li>
 *   <li>Issuing at most one concurrent fetch per JWKS URI</li>
 *   <li>Serving stale documents when a refresh fails</li>
 * </ul>
 */
public interface JwksCache {

    /**
     * Get the key set for a JWKS URI.
     *
     * <p>Returns the cached document while it is fresh, otherwise refreshes it.
     *
     * @param jwksUri the JWKS endpoint URI
     * @return the key set
     */
    Uni<JwksDocument> getKeySet(URI jwksUri);

    /**
     * Resolve the Ed25519 key that should verify a token.
     *
     * <p>When {@code keyId} is null the document must contain exactly one
     * Ed25519 key.
     *
     * @param jwksUri the JWKS endpoint URI
     * @param keyId   the {@code kid} from the token header, or null
     * @return the resolved key
     */
    Uni<ResolvedKey> resolve(URI jwksUri, String keyId);

    /**
     * Seed the cache with a document, as if it had just been fetched.
     *
     * @param jwksUri  the JWKS endpoint URI
     * @param document the key set
     */
    void put(URI jwksUri, JwksDocument document);

    /**
     * Look at the cached entry without fetching.
     *
     * @param jwksUri the JWKS endpoint URI
     * @return the cached entry, fresh or stale
     */
    Optional<CachedJwks> peek(URI jwksUri);

    /**
     * Invalidate the cached document for a JWKS URI.
     *
     * @param jwksUri the JWKS endpoint URI
     */
    void invalidate(URI jwksUri);

    /**
     * Invalidate every cached document.
     */
    void invalidateAll();
}
