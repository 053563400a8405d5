package ublauth.core.service;

import java.net.URI;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.lang.JoseException;

import ublauth.core.config.VerifierConfig;
import ublauth.core.model.jwks.CachedJwks;
import ublauth.core.model.jwks.Jwk;
import ublauth.core.model.jwks.JwksDocument;
import ublauth.core.model.jwks.ResolvedKey;
import ublauth.core.model.token.TokenVerificationException;
import ublauth.core.model.token.VerificationFailure;
import ublauth.core.port.out.JwksCache;
import ublauth.core.port.out.JwksFetcher;
import ublauth.core.port.out.VerificationMetrics;

/**
 * Service for caching JSON Web Key Sets and resolving Ed25519 keys from them.
 *
 * <p>Features:
 * <ul>
 *   <li>In-memory caching with configurable TTL, measured on the injected clock</li>
 *   <li>Thundering herd protection via request coalescing</li>
 *   <li>Stale-while-revalidate: a failed refresh falls back to the previous
 *       document for up to {@code max-stale} past its TTL</li>
 * </ul>
 *
 * <p>Thread-safety: concurrent lookups that find a missing or expired entry for
 * the same URI share a single in-flight fetch. Entries are replaced whole.
 */
public class JwksCacheService implements JwksCache {

    private static final Logger LOG = Logger.getLogger(JwksCacheService.class);

    static final int ED25519_PUBLIC_KEY_LENGTH = 32;

    private final JwksFetcher fetcher;
    private final JwksDocumentParser parser;
    private final VerifierConfig.JwksConfig jwksConfig;
    private final VerificationMetrics metrics;
    private final Clock clock;
    private final Cache<URI, CachedJwks> cache;
    private final Map<URI, Uni<JwksDocument>> inFlightFetches = new ConcurrentHashMap<>();
    private final Map<URI, Long> generations = new ConcurrentHashMap<>();
    private final AtomicLong globalGeneration = new AtomicLong();

    public JwksCacheService(
            JwksFetcher fetcher, VerifierConfig.JwksConfig jwksConfig, VerificationMetrics metrics, Clock clock) {
        if (jwksConfig.cacheTtl().isNegative() || jwksConfig.cacheTtl().isZero()) {
            throw new IllegalArgumentException("JWKS cache TTL must be positive: " + jwksConfig.cacheTtl());
        }
        if (jwksConfig.maxStale().isNegative()) {
            throw new IllegalArgumentException("JWKS max-stale cannot be negative: " + jwksConfig.maxStale());
        }
        this.fetcher = fetcher;
        this.parser = new JwksDocumentParser();
        this.jwksConfig = jwksConfig;
        this.metrics = metrics;
        this.clock = clock;

        // Stale entries must outlive their TTL so a failed refresh can fall back to them
        this.cache = Caffeine.newBuilder()
                .maximumSize(jwksConfig.maxCacheEntries())
                .expireAfterWrite(jwksConfig.cacheTtl().plus(jwksConfig.maxStale()))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    @Override
    public Uni<JwksDocument> getKeySet(URI jwksUri) {
        return Uni.createFrom().deferred(() -> {
            final var cached = cache.getIfPresent(jwksUri);
            if (cached != null && !cached.isExpired(clock.instant())) {
                LOG.debugv("Using cached JWKS for {0}", jwksUri);
                metrics.recordCacheHit();
                return Uni.createFrom().item(cached.document());
            }
            metrics.recordCacheMiss();
            return getOrCreateFetch(jwksUri);
        });
    }

    @Override
    public Uni<ResolvedKey> resolve(URI jwksUri, String keyId) {
        return getKeySet(jwksUri).map(document -> selectKey(jwksUri, document, keyId));
    }

    @Override
    public void put(URI jwksUri, JwksDocument document) {
        cache.put(jwksUri, new CachedJwks(document, clock.instant(), jwksConfig.cacheTtl()));
        LOG.debugv("Seeded JWKS cache for {0} with {1} keys", jwksUri, document.keys().size());
    }

    @Override
    public Optional<CachedJwks> peek(URI jwksUri) {
        return Optional.ofNullable(cache.getIfPresent(jwksUri));
    }

    @Override
    public void invalidate(URI jwksUri) {
        LOG.infov("Invalidating cached JWKS for {0}", jwksUri);
        generations.merge(jwksUri, 1L, Long::sum);
        cache.invalidate(jwksUri);
        inFlightFetches.remove(jwksUri);
    }

    @Override
    public void invalidateAll() {
        LOG.info("Invalidating all cached JWKS");
        globalGeneration.incrementAndGet();
        cache.invalidateAll();
        inFlightFetches.clear();
    }

    /**
     * Get an existing in-flight fetch or create a new one.
     * This prevents thundering herd by coalescing concurrent requests.
     */
    private Uni<JwksDocument> getOrCreateFetch(URI jwksUri) {
        return inFlightFetches.computeIfAbsent(jwksUri, this::createFetch);
    }

    private Uni<JwksDocument> createFetch(URI jwksUri) {
        final var self = new AtomicReference<Uni<JwksDocument>>();
        final Uni<JwksDocument> fetch = Uni.createFrom()
                .deferred(() -> {
                    // A fetch that finished between the caller's cache check and now already refreshed the entry
                    final var cached = cache.getIfPresent(jwksUri);
                    if (cached != null && !cached.isExpired(clock.instant())) {
                        return Uni.createFrom().item(cached.document());
                    }
                    return fetchAndCache(jwksUri);
                })
                .onTermination()
                .invoke(() -> inFlightFetches.remove(jwksUri, self.get()))
                .memoize()
                .indefinitely();
        self.set(fetch);
        return fetch;
    }

    private Uni<JwksDocument> fetchAndCache(URI jwksUri) {
        LOG.infov("Fetching JWKS from {0}", jwksUri);
        final var generation = generationOf(jwksUri);

        return Uni.createFrom()
                .deferred(() -> fetcher.fetch(jwksUri))
                .ifNoItem()
                .after(jwksConfig.fetchTimeout())
                .failWith(() -> new TokenVerificationException(
                        VerificationFailure.JWKS_FETCH_ERROR,
                        "Timeout fetching JWKS from " + jwksUri + " after " + jwksConfig.fetchTimeout()))
                .map(parser::parse)
                .invoke(document -> {
                    metrics.recordFetch(true);
                    cache.put(jwksUri, new CachedJwks(document, clock.instant(), jwksConfig.cacheTtl()));
                    // An invalidation while the fetch was running wins over its result
                    if (!generation.equals(generationOf(jwksUri))) {
                        cache.invalidate(jwksUri);
                        LOG.debugv("Discarded JWKS fetched from {0} after invalidation", jwksUri);
                        return;
                    }
                    LOG.infov("Cached {0} keys from {1}", document.keys().size(), jwksUri);
                })
                .onFailure()
                .recoverWithUni(error -> {
                    metrics.recordFetch(false);
                    final var stale = cache.getIfPresent(jwksUri);
                    if (stale != null && stale.isServableWhenStale(clock.instant(), jwksConfig.maxStale())) {
                        LOG.warnv("Using stale cached JWKS for {0} due to: {1}", jwksUri, error.getMessage());
                        metrics.recordStaleServed();
                        return Uni.createFrom().item(stale.document());
                    }
                    LOG.errorv(error, "Failed to fetch JWKS from {0}", jwksUri);
                    return Uni.createFrom().failure(toVerificationException(jwksUri, error));
                });
    }

    private Generation generationOf(URI jwksUri) {
        return new Generation(globalGeneration.get(), generations.getOrDefault(jwksUri, 0L));
    }

    private ResolvedKey selectKey(URI jwksUri, JwksDocument document, String keyId) {
        final var candidates = document.ed25519Keys();
        final Jwk match;
        if (keyId != null) {
            match = candidates.stream()
                    .filter(key -> key.hasKeyId(keyId))
                    .findFirst()
                    .orElseThrow(() -> new TokenVerificationException(
                            VerificationFailure.UNKNOWN_KEY_ID,
                            "No Ed25519 key with kid '" + keyId + "' in JWKS " + jwksUri));
        } else if (candidates.size() == 1) {
            match = candidates.get(0);
        } else {
            throw new TokenVerificationException(
                    VerificationFailure.UNKNOWN_KEY_ID,
                    "Token has no kid and JWKS " + jwksUri + " has " + candidates.size() + " Ed25519 keys");
        }
        return new ResolvedKey(match.keyId(), toPublicKey(match));
    }

    private PublicKey toPublicKey(Jwk jwk) {
        final var label = jwk.keyId().orElse("<none>");
        final var x = jwk.x()
                .orElseThrow(() -> parseError("Ed25519 key '" + label + "' has no 'x' member", null));

        final byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(x);
        } catch (IllegalArgumentException e) {
            throw parseError("Ed25519 key '" + label + "' has invalid base64url 'x'", e);
        }
        final var canonical = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
        if (!canonical.equals(x)) {
            throw parseError("Ed25519 key '" + label + "' has non-canonical base64url 'x'", null);
        }
        if (raw.length != ED25519_PUBLIC_KEY_LENGTH) {
            throw parseError("Ed25519 key '" + label + "' is " + raw.length + " bytes, expected 32", null);
        }

        final Map<String, Object> params = new LinkedHashMap<>();
        params.put("kty", Jwk.KEY_TYPE_OKP);
        params.put("crv", Jwk.CURVE_ED25519);
        params.put("x", canonical);
        try {
            return ((PublicJsonWebKey) JsonWebKey.Factory.newJwk(params)).getPublicKey();
        } catch (JoseException | ClassCastException e) {
            throw parseError("Ed25519 key '" + label + "' could not be decoded", e);
        }
    }

    private static TokenVerificationException toVerificationException(URI jwksUri, Throwable error) {
        if (error instanceof TokenVerificationException verificationException) {
            return verificationException;
        }
        return new TokenVerificationException(
                VerificationFailure.JWKS_FETCH_ERROR,
                "Failed to fetch JWKS from " + jwksUri + ": " + error.getMessage(),
                error);
    }

    private static TokenVerificationException parseError(String message, Throwable cause) {
        return new TokenVerificationException(VerificationFailure.JWKS_PARSE_ERROR, message, cause);
    }

    private record Generation(long global, long perUri) {}
}
