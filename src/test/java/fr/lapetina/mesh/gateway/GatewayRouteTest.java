package fr.lapetina.mesh.gateway;

import fr.lapetina.mesh.domain.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GatewayRouteTest {

    @Nested
    @DisplayName("Path matching")
    class MatchingTests {

        private final GatewayRoute wildcard = GatewayRoute.builder()
                .path("/api/users/**")
                .serviceName("user-service")
                .targetPath("/users")
                .build();

        @Test
        @DisplayName("should match the prefix and everything below it")
        void shouldMatchWildcard() {
            assertThat(wildcard.matches("/api/users")).isTrue();
            assertThat(wildcard.matches("/api/users/42")).isTrue();
            assertThat(wildcard.matches("/api/users/42/bookings")).isTrue();
            assertThat(wildcard.matches("/api/usersx")).isFalse();
            assertThat(wildcard.matches("/api/bookings")).isFalse();
        }

        @Test
        @DisplayName("should append the remainder to the target path")
        void shouldResolveTargetPath() {
            assertThat(wildcard.resolveTargetPath("/api/users/42")).isEqualTo("/users/42");
            assertThat(wildcard.resolveTargetPath("/api/users")).isEqualTo("/users");
        }

        @Test
        @DisplayName("should default the target path to the route path")
        void shouldDefaultTargetPath() {
            GatewayRoute exact = GatewayRoute.builder().path("/api/bookings").method("post")
                    .serviceName("booking-service").build();
            GatewayRoute prefix = GatewayRoute.builder().path("/api/payments/**")
                    .serviceName("payment-service").build();

            assertThat(exact.targetPath()).isEqualTo("/api/bookings");
            assertThat(exact.getRouteKey()).isEqualTo("POST:/api/bookings");
            assertThat(prefix.resolveTargetPath("/api/payments/7")).isEqualTo("/api/payments/7");
        }

        @Test
        @DisplayName("should cache GET routes with a TTL only")
        void shouldOnlyCacheGet() {
            assertThat(GatewayRoute.builder().path("/a").serviceName("s").cacheTtlSeconds(10).build().isCacheable())
                    .isTrue();
            assertThat(GatewayRoute.builder().path("/a").method("POST").serviceName("s").cacheTtlSeconds(10).build()
                    .isCacheable()).isFalse();
            assertThat(GatewayRoute.builder().path("/a").serviceName("s").build().isCacheable()).isFalse();
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should require a leading slash")
        void shouldRequireLeadingSlash() {
            assertThatThrownBy(() -> GatewayRoute.builder().path("api/users").serviceName("user-service").build())
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should require a service unless the route aggregates")
        void shouldRequireService() {
            assertThatThrownBy(() -> GatewayRoute.builder().path("/api/users").build())
                    .isInstanceOf(ValidationException.class);

            GatewayRoute aggregated = GatewayRoute.builder()
                    .path("/api/dashboard")
                    .aggregation(new AggregationConfig(null, List.of(
                            new AggregationConfig.Target("user-service", "/users/me", null))))
                    .build();
            assertThat(aggregated.aggregation().mode()).isEqualTo(AggregationConfig.Mode.PARALLEL);
            assertThat(aggregated.aggregation().targets().get(0).mapTo()).isEqualTo("user-service");
        }

        @Test
        @DisplayName("should reject unknown methods and duplicate aggregation keys")
        void shouldRejectInvalidValues() {
            assertThatThrownBy(() -> GatewayRoute.builder().path("/a").method("FETCH").serviceName("s").build())
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> new AggregationConfig(AggregationConfig.Mode.SEQUENTIAL, List.of(
                    new AggregationConfig.Target("user-service", "/users/me", "data"),
                    new AggregationConfig.Target("booking-service", "/bookings", "data"))))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    @DisplayName("should derive the permission from the HTTP method")
    void shouldDerivePermission() {
        assertThat(ApiGateway.permissionFor("GET")).isEqualTo("read");
        assertThat(ApiGateway.permissionFor("HEAD")).isEqualTo("read");
        assertThat(ApiGateway.permissionFor("POST")).isEqualTo("write");
        assertThat(ApiGateway.permissionFor("PATCH")).isEqualTo("write");
        assertThat(ApiGateway.permissionFor("DELETE")).isEqualTo("delete");
    }
}
