package fr.lapetina.mesh.gateway;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gateway response cache with a TTL per entry, taken from the route.
 */
public final class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    static final String KEY_PREFIX = "gateway:cache:";
    static final String ANONYMOUS = "anonymous";

    private final Cache<String, Entry> cache;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResponseCache(long maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    /**
     * {@code gateway:cache:<METHOD:path>:<callerId>:<query>}, with {@code anonymous} for a missing caller.
     */
    public static String key(String requestKey, String callerId, String query) {
        return KEY_PREFIX + requestKey + ":" + (callerId != null ? callerId : ANONYMOUS) + ":" + (query != null ? query : "");
    }

    public Optional<GatewayResponse> get(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.response());
    }

    /**
     * @param routeKey key of the route that produced the response, see {@link #invalidateRoute}
     */
    public void put(String key, String routeKey, GatewayResponse response, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        cache.put(key, new Entry(response, ttl, routeKey));
        log.debug("Response cached: key={}, ttlSeconds={}", key, ttl.toSeconds());
    }

    /**
     * Drops every entry of one route.
     */
    public void invalidateRoute(String routeKey) {
        cache.asMap().values().removeIf(entry -> entry.routeKey().equals(routeKey));
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total == 0 ? 0.0 : (double) hits.get() / total;
    }

    public void resetStats() {
        hits.set(0);
        misses.set(0);
    }

    private record Entry(GatewayResponse response, Duration ttl, String routeKey) {
    }
}
