package ublauth.core.model.jwks;

import java.time.Duration;
import java.time.Instant;

/**
 * A JWKS document together with when it was fetched.
 *
 * <p>Replaced as a whole on refresh, never modified.
 *
 * @param document  the key set
 * @param fetchedAt when the document was fetched (or seeded)
 * @param ttl       how long the document is considered fresh
 */
public record CachedJwks(JwksDocument document, Instant fetchedAt, Duration ttl) {

    public CachedJwks {
        if (document == null) {
            throw new IllegalArgumentException("Document cannot be null");
        }
        if (fetchedAt == null) {
            throw new IllegalArgumentException("Fetched-at cannot be null");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be non-negative");
        }
    }

    /**
     * An entry is expired once {@code now - fetchedAt >= ttl}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(fetchedAt.plus(ttl));
    }

    /**
     * Whether this entry may still stand in for a failed refresh.
     *
     * @param now      current time
     * @param maxStale how long past its TTL the entry may be served
     * @return true while {@code now - fetchedAt < ttl + maxStale}
     */
    public boolean isServableWhenStale(Instant now, Duration maxStale) {
        return now.isBefore(fetchedAt.plus(ttl).plus(maxStale));
    }
}
