package ublauth.core.port.out;

import ublauth.core.model.token.VerificationFailure;

/**
 * Port interface for recording verification and JWKS cache metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface VerificationMetrics {

    /**
     * Record a token that passed verification.
     */
    void recordVerified();

    /**
     * Record a rejected token.
     *
     * @param failure the reason it was rejected
     */
    void recordRejected(VerificationFailure failure);

    /**
     * Record a JWKS document served from a fresh cache entry.
     */
    void recordCacheHit();

    /**
     * Record a lookup that required a refresh.
     */
    void recordCacheMiss();

    /**
     * Record the outcome of a JWKS fetch.
     *
     * @param success whether the document was fetched and parsed
     */
    void recordFetch(boolean success);

    /**
     * Record a stale document served after a failed refresh.
     */
    void recordStaleServed();
}
