package ublauth.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import ublauth.core.config.VerifierConfig;
import ublauth.core.model.token.VerificationFailure;
import ublauth.core.port.out.VerificationMetrics;

/**
 * Micrometer-backed verification metrics.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code ubl.auth.verification.total} - Verifications by outcome and rejection reason</li>
 *   <li>{@code ubl.auth.jwks.cache.hits} - JWKS lookups served from a fresh entry</li>
 *   <li>{@code ubl.auth.jwks.cache.misses} - JWKS lookups that needed a refresh</li>
 *   <li>{@code ubl.auth.jwks.fetch.total} - JWKS fetches by result</li>
 *   <li>{@code ubl.auth.jwks.stale.served} - Stale documents served after a failed refresh</li>
 * </ul>
 */
public class MicrometerVerificationMetrics implements VerificationMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    public MicrometerVerificationMetrics(MeterRegistry registry, VerifierConfig.MetricsConfig config) {
        this.registry = registry;
        this.enabled = registry != null && config != null && config.enabled();
    }

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordVerified() {
        if (!enabled) {
            return;
        }

        Counter.builder("ubl.auth.verification.total")
                .description("Token verifications")
                .tag("outcome", "verified")
                .tag("reason", "none")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRejected(VerificationFailure failure) {
        if (!enabled) {
            return;
        }

        Counter.builder("ubl.auth.verification.total")
                .description("Token verifications")
                .tag("outcome", "rejected")
                .tag("reason", failure.tag())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheHit() {
        if (!enabled) {
            return;
        }

        Counter.builder("ubl.auth.jwks.cache.hits")
                .description("JWKS cache hits")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheMiss() {
        if (!enabled) {
            return;
        }

        Counter.builder("ubl.auth.jwks.cache.misses")
                .description("JWKS cache misses")
                .register(registry)
                .increment();
    }

    @Override
    public void recordFetch(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("ubl.auth.jwks.fetch.total")
                .description("JWKS fetches")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordStaleServed() {
        if (!enabled) {
            return;
        }

        Counter.builder("ubl.auth.jwks.stale.served")
                .description("Stale JWKS documents served after a failed refresh")
                .register(registry)
                .increment();
    }
}
