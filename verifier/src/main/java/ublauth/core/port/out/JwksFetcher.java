package ublauth.core.port.out;

import java.net.URI;

import io.smallrye.mutiny.Uni;

/**
 * Port for retrieving the raw bytes of a JWKS document.
 *
 * <p>Implementations own the transport. They are expected to bound the fetch
 * with a timeout and to fail the returned {@link Uni} on any transport error,
 * non-success response or timeout. They must not retry.
 */
public interface JwksFetcher {

    /**
     * Fetch the JWKS document.
     *
     * @param jwksUri the JWKS endpoint URI
     * @return the response body
     */
    Uni<byte[]> fetch(URI jwksUri);
}
