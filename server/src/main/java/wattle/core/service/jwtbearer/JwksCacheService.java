package wattle.core.service.jwtbearer;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import wattle.core.config.JwtBearerConfig;
import wattle.core.port.out.JwksCache;

/**
 * Fetches and caches the key sets of trusted JWT bearer issuers.
 *
 * <p>Concurrent lookups of an uncached key set share a single fetch. When a refresh
 * fails, the last fetched key set keeps being served. Refreshes forced by an unknown
 * {@code kid} are limited to one per {@code jwks-min-refresh-interval} and issuer.
 */
@ApplicationScoped
public class JwksCacheService implements JwksCache {

    private static final Logger LOG = Logger.getLogger(JwksCacheService.class);

    private final WebClient webClient;
    private final Cache<URI, JsonWebKeySet> cache;
    private final Map<URI, JsonWebKeySet> lastKnown = new ConcurrentHashMap<>();
    private final Map<URI, Uni<JsonWebKeySet>> inFlightFetches = new ConcurrentHashMap<>();
    private final Map<URI, Instant> lastFetched = new ConcurrentHashMap<>();
    private final JwtBearerConfig config;
    private final Clock clock;

    @Inject
    public JwksCacheService(Vertx vertx, JwtBearerConfig config, MeterRegistry meterRegistry, Clock clock) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.jwksMaxCacheEntries())
                .expireAfterWrite(config.jwksCacheDuration())
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, "wattle.jwks.cache");
    }

    @Override
    public Uni<JsonWebKeySet> getKeySet(URI jwksUri) {
        final var cached = cache.getIfPresent(jwksUri);
        if (cached != null) {
            LOG.debugv("Using cached JWKS for {0}", jwksUri);
            return Uni.createFrom().item(cached);
        }
        return Uni.createFrom().deferred(() -> inFlightFetches.computeIfAbsent(jwksUri, this::createFetch));
    }

    @Override
    public Uni<JsonWebKeySet> refreshKeySet(URI jwksUri) {
        final var fetchedAt = lastFetched.get(jwksUri);
        if (fetchedAt != null && fetchedAt.plus(config.jwksMinRefreshInterval()).isAfter(clock.instant())) {
            LOG.debugv("JWKS for {0} was last fetched at {1}, not refreshing yet", jwksUri, fetchedAt);
            return getKeySet(jwksUri);
        }
        LOG.infov("Refreshing JWKS for {0} after an unknown key id", jwksUri);
        cache.invalidate(jwksUri);
        return Uni.createFrom().deferred(() -> inFlightFetches.computeIfAbsent(jwksUri, this::createFetch));
    }

    private Uni<JsonWebKeySet> createFetch(URI jwksUri) {
        return fetchAndCache(jwksUri)
                .onTermination()
                .invoke(() -> inFlightFetches.remove(jwksUri))
                .memoize()
                .indefinitely();
    }

    private Uni<JsonWebKeySet> fetchAndCache(URI jwksUri) {
        LOG.infov("Fetching JWKS from {0}", jwksUri);
        lastFetched.put(jwksUri, clock.instant());

        return webClient
                .getAbs(jwksUri.toString())
                .ssl("https".equals(jwksUri.getScheme()))
                .send()
                .ifNoItem()
                .after(config.jwksFetchTimeout())
                .failWith(() -> new JwksFetchException("Timeout fetching JWKS from " + jwksUri))
                .map(this::parseResponse)
                .invoke(keySet -> {
                    cache.put(jwksUri, keySet);
                    lastKnown.put(jwksUri, keySet);
                    LOG.infov("Cached {0} keys from {1}", keySet.getJsonWebKeys().size(), jwksUri);
                })
                .onFailure()
                .recoverWithUni(error -> {
                    LOG.errorv(error, "Failed to fetch JWKS from {0}", jwksUri);
                    final var stale = lastKnown.get(jwksUri);
                    if (stale != null) {
                        LOG.warnv("Using stale JWKS for {0} due to: {1}", jwksUri, error.getMessage());
                        return Uni.createFrom().item(stale);
                    }
                    return Uni.createFrom().failure(error);
                });
    }

    private JsonWebKeySet parseResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new JwksFetchException("JWKS endpoint returned status " + response.statusCode());
        }
        try {
            return new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new JwksFetchException("Failed to parse JWKS response: " + e.getMessage(), e);
        }
    }

    /**
     * Fetching a key set failed and no earlier copy is available.
     */
    public static class JwksFetchException extends RuntimeException {
        public JwksFetchException(String message) {
            super(message);
        }

        public JwksFetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
