package ublauth.config;

import java.time.Clock;

import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.vertx.mutiny.core.Vertx;

import ublauth.adapter.out.http.VertxJwksFetcher;
import ublauth.adapter.out.telemetry.MicrometerVerificationMetrics;
import ublauth.core.config.VerifierConfig;
import ublauth.core.port.out.JwksFetcher;
import ublauth.core.service.Ed25519JwtVerifier;
import ublauth.core.service.JwksCacheService;

/**
 * Wires a verifier and its JWKS cache from configuration.
 *
 * <p>Each factory owns one cache. Build one factory per process (or per trust
 * domain) and share the verifier it returns.
 */
public final class VerifierFactory {

    private final VerifierConfig config;
    private final MicrometerVerificationMetrics metrics;

    public VerifierFactory(VerifierConfig config, MeterRegistry registry) {
        this.config = config;
        this.metrics = new MicrometerVerificationMetrics(registry, config.metrics());
    }

    /**
     * Load {@link VerifierConfig} from system properties, environment variables
     * and {@code META-INF/microprofile-config.properties}.
     *
     * @return the mapped configuration
     */
    public static VerifierConfig loadConfig() {
        final SmallRyeConfig smallRyeConfig = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withMapping(VerifierConfig.class)
                .build();
        return smallRyeConfig.getConfigMapping(VerifierConfig.class);
    }

    public VerifierConfig config() {
        return config;
    }

    /**
     * Create a JWKS cache that fetches over HTTP.
     *
     * @param vertx the Vert.x instance backing the web client
     * @return the cache
     */
    public JwksCacheService jwksCache(Vertx vertx) {
        return jwksCache(new VertxJwksFetcher(vertx, config.jwks()), Clock.systemUTC());
    }

    /**
     * Create a JWKS cache with a custom transport and clock.
     *
     * @param fetcher the JWKS transport
     * @param clock   the clock used for cache freshness
     * @return the cache
     */
    public JwksCacheService jwksCache(JwksFetcher fetcher, Clock clock) {
        return new JwksCacheService(fetcher, config.jwks(), metrics, clock);
    }

    /**
     * Create a verifier backed by the given cache.
     *
     * @param jwksCache the cache resolving signing keys
     * @return the verifier
     */
    public Ed25519JwtVerifier verifier(JwksCacheService jwksCache) {
        return new Ed25519JwtVerifier(jwksCache, metrics);
    }
}
