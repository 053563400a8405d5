package ublauth.adapter.out.http;

import java.net.URI;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import ublauth.core.config.VerifierConfig;
import ublauth.core.port.out.JwksFetcher;

/**
 * Fetches JWKS documents over HTTP(S) with the Vert.x web client.
 *
 * <p>A single {@code GET} is issued per call with the configured fetch timeout.
 * Anything other than a {@code 200} with a body within the size limit fails
 * the returned {@link Uni}.
 *
 * <p>The web client buffers the whole response before it is checked, so
 * {@code max-document-bytes} bounds what is handed to the parser and cached,
 * not the memory used while reading. The fetch timeout is what limits an
 * endpoint that streams an unbounded body.
 */
public class VertxJwksFetcher implements JwksFetcher {

    private static final Logger LOG = Logger.getLogger(VertxJwksFetcher.class);

    private final WebClient webClient;
    private final VerifierConfig.JwksConfig jwksConfig;

    public VertxJwksFetcher(Vertx vertx, VerifierConfig.JwksConfig jwksConfig) {
        this.webClient = WebClient.create(vertx);
        this.jwksConfig = jwksConfig;
    }

    @Override
    public Uni<byte[]> fetch(URI jwksUri) {
        final var startTime = System.currentTimeMillis();

        return webClient
                .getAbs(jwksUri.toString())
                .timeout(jwksConfig.fetchTimeout().toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .map(response -> {
                    final var duration = System.currentTimeMillis() - startTime;
                    if (response.statusCode() != 200) {
                        LOG.warnf(
                                "JWKS fetch failed: url=%s, status=%d, duration=%dms",
                                jwksUri, response.statusCode(), duration);
                        throw new JwksFetchException("JWKS endpoint returned status " + response.statusCode());
                    }

                    final var body = response.body();
                    if (body == null || body.length() == 0) {
                        throw new JwksFetchException("JWKS endpoint returned an empty body");
                    }
                    if (body.length() > jwksConfig.maxDocumentBytes()) {
                        throw new JwksFetchException("JWKS document exceeds " + jwksConfig.maxDocumentBytes() + " bytes");
                    }

                    LOG.debugf("JWKS fetched: url=%s, bytes=%d, duration=%dms", jwksUri, body.length(), duration);
                    return body.getBytes();
                });
    }

    /**
     * Exception thrown when the JWKS endpoint cannot be read.
     *
     * <p>This can occur due to network timeout, HTTP error or an oversized response.
     */
    public static class JwksFetchException extends RuntimeException {
        public JwksFetchException(String message) {
            super(message);
        }
    }
}
