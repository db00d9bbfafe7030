package fr.lapetina.mesh.gateway;

import fr.lapetina.mesh.domain.model.GatewayResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        cache = new ResponseCache(100);
    }

    private static GatewayResponse response(String body) {
        return GatewayResponse.of("req-1", 200, Map.of(), body);
    }

    @Test
    @DisplayName("should build keys from route, caller and query")
    void shouldBuildKeys() {
        assertThat(ResponseCache.key("GET:/api/users/42", "frontend", "page=2"))
                .isEqualTo("gateway:cache:GET:/api/users/42:frontend:page=2");
        assertThat(ResponseCache.key("GET:/api/users/42", null, null))
                .isEqualTo("gateway:cache:GET:/api/users/42:anonymous:");
    }

    @Test
    @DisplayName("should expire entries after their TTL")
    void shouldExpireEntries() throws InterruptedException {
        cache.put("k", "GET:/k", response("v"), Duration.ofMillis(200));
        assertThat(cache.get("k")).isPresent();

        Thread.sleep(300);

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.getHits()).isEqualTo(1);
        assertThat(cache.getMisses()).isEqualTo(1);
    }

    @Test
    @DisplayName("should not store entries without a TTL")
    void shouldIgnoreZeroTtl() {
        cache.put("k", "GET:/k", response("v"), Duration.ZERO);

        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    @DisplayName("should invalidate only the entries of one route")
    void shouldInvalidateRoute() {
        cache.put(ResponseCache.key("GET:/a/1", null, ""), "GET:/a/**", response("a1"), Duration.ofMinutes(1));
        cache.put(ResponseCache.key("GET:/a/2", "caller", "x=1"), "GET:/a/**", response("a2"), Duration.ofMinutes(1));
        cache.put(ResponseCache.key("GET:/b", null, ""), "GET:/b", response("b"), Duration.ofMinutes(1));

        cache.invalidateRoute("GET:/a/**");

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get(ResponseCache.key("GET:/b", null, ""))).isPresent();
    }
}
