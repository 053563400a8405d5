package ublauth.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import ublauth.core.model.token.VerifyOptions;

/**
 * Configuration mapping for token verification and the JWKS cache.
 *
 * <p>Configuration prefix: {@code ubl-auth}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code ubl-auth.leeway} - clock skew tolerance for time claims</li>
 *   <li>{@code ubl-auth.issuer} - expected issuer (optional)</li>
 *   <li>{@code ubl-auth.audience} - required audience (optional)</li>
 *   <li>{@code ubl-auth.jwks.*} - JWKS fetch and cache settings</li>
 *   <li>{@code ubl-auth.metrics.enabled} - Micrometer metrics toggle</li>
 * </ul>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code UBL_AUTH_LEEWAY} - e.g., "PT5M"</li>
 *   <li>{@code UBL_AUTH_JWKS_CACHE_TTL} - e.g., "PT10M"</li>
 *   <li>{@code UBL_AUTH_JWKS_MAX_STALE} - e.g., "PT0S" to disable stale fallback</li>
 * </ul>
 */
@ConfigMapping(prefix = "ubl-auth")
public interface VerifierConfig {

    /**
     * Clock skew tolerance applied to {@code exp}, {@code nbf} and {@code iat}.
     *
     * @return leeway (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration leeway();

    /**
     * Expected {@code iss} claim. The issuer check is skipped when unset.
     */
    Optional<String> issuer();

    /**
     * Audience that must appear in the {@code aud} claim. The audience check is
     * skipped when unset.
     */
    Optional<String> audience();

    /**
     * JWKS fetch and cache configuration.
     */
    JwksConfig jwks();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * Build the default per-call options from this configuration.
     *
     * @return options using the system clock
     */
    default VerifyOptions defaultOptions() {
        return VerifyOptions.builder()
                .issuer(issuer().orElse(null))
                .audience(audience().orElse(null))
                .leeway(leeway())
                .build();
    }

    /**
     * JWKS (JSON Web Key Set) configuration.
     */
    interface JwksConfig {

        /**
         * How long a fetched document is used before it is refreshed.
         *
         * @return cache TTL (default: 5 minutes)
         */
        @WithDefault("PT5M")
        Duration cacheTtl();

        /**
         * How long past its TTL a document may still be served when a refresh
         * fails.
         *
         * <p>A rotated-out key stays trusted for at most this long while the
         * JWKS endpoint is unreachable. Set to {@code PT0S} to fail instead.
         *
         * @return maximum staleness (default: 24 hours)
         */
        @WithDefault("PT24H")
        Duration maxStale();

        /**
         * Maximum time to wait when fetching a JWKS document.
         *
         * @return fetch timeout (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration fetchTimeout();

        /**
         * Maximum number of JWKS URIs cached at once. Least-used entries are
         * evicted when exceeded.
         *
         * @return maximum cache entries (default: 100)
         */
        @WithDefault("100")
        int maxCacheEntries();

        /**
         * Largest JWKS response body accepted. The body is checked once it has
         * been read, so this limits what is parsed and cached rather than
         * what is buffered during the fetch.
         *
         * @return maximum document size in bytes (default: 64 KiB)
         */
        @WithDefault("65536")
        int maxDocumentBytes();
    }

    /**
     * Metrics settings.
     */
    interface MetricsConfig {

        /**
         * @return whether Micrometer metrics are recorded (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
