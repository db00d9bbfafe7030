package fr.lapetina.mesh.domain.routing;

import fr.lapetina.mesh.domain.exception.NotFoundException;
import fr.lapetina.mesh.domain.exception.ValidationException;
import fr.lapetina.mesh.infrastructure.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Picks the version of a service a request should reach.
 *
 * <p>The latest canary of the service decides first: while RUNNING it
 * splits by stable hash, once terminal it pins its final version. Without
 * a canary, enabled routes of the service are tried in creation order and
 * the first matching rule wins. No match leaves the version open.
 */
public final class TrafficRouter {

    private static final Logger log = LoggerFactory.getLogger(TrafficRouter.class);

    private final ServiceRegistry registry;
    private final Map<String, TrafficRoute> routes = new ConcurrentHashMap<>();
    private final Map<String, CanaryDeployment> canaries = new ConcurrentHashMap<>();
    private final Map<String, CanaryDeployment> latestCanaryByService = new ConcurrentHashMap<>();

    private final AtomicLong totalRequests = new AtomicLong();
    private final Map<String, AtomicLong> routedByVersion = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> routedByRule = new ConcurrentHashMap<>();

    public TrafficRouter(ServiceRegistry registry) {
        this.registry = registry;
    }

    public TrafficRoute createRoute(String name, String serviceName, List<TrafficRule> rules, boolean enabled) {
        ValidationException.requireText(name, "name");
        ValidationException.requireText(serviceName, "serviceName");
        validateRules(rules);

        Instant now = Instant.now();
        TrafficRoute route = new TrafficRoute("route-" + UUID.randomUUID(), name, serviceName, enabled, rules, now, now);
        routes.put(route.id(), route);
        log.info("Traffic route created: routeId={}, name={}, service={}, rules={}",
                route.id(), name, serviceName, rules);
        return route;
    }

    /**
     * Replaces the given fields of a route; null arguments keep the current value.
     */
    public TrafficRoute updateRoute(String routeId, String name, List<TrafficRule> rules, Boolean enabled) {
        if (rules != null) {
            validateRules(rules);
        }
        TrafficRoute updated = routes.computeIfPresent(routeId, (id, current) -> current.update(name, rules, enabled));
        if (updated == null) {
            throw new NotFoundException("Route", routeId);
        }
        log.info("Traffic route updated: routeId={}, enabled={}, rules={}", routeId, updated.enabled(), updated.rules());
        return updated;
    }

    public boolean deleteRoute(String routeId) {
        TrafficRoute removed = routes.remove(routeId);
        if (removed != null) {
            log.info("Traffic route deleted: routeId={}, service={}", routeId, removed.serviceName());
        }
        return removed != null;
    }

    public Optional<TrafficRoute> getRoute(String routeId) {
        return Optional.ofNullable(routes.get(routeId));
    }

    public List<TrafficRoute> getRoutes() {
        return routes.values().stream()
                .sorted(Comparator.comparing(TrafficRoute::createdAt).thenComparing(TrafficRoute::id))
                .toList();
    }

    private void validateRules(List<TrafficRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new ValidationException("rules must not be empty");
        }
        for (int i = 0; i < rules.size(); i++) {
            TrafficRule rule = rules.get(i);
            if (rule == null) {
                throw new ValidationException("rules must not contain null entries");
            }
            if (rule.isCatchAll() && i < rules.size() - 1) {
                throw new ValidationException("default rule must be the last rule");
            }
        }
    }

    /**
     * Starts a canary. A service can have only one RUNNING canary at a time.
     */
    public CanaryDeployment createCanary(String serviceName, String canaryVersion, String stableVersion, int trafficPercent) {
        CanaryDeployment canary = new CanaryDeployment(serviceName, canaryVersion, stableVersion, trafficPercent);
        latestCanaryByService.compute(serviceName, (name, current) -> {
            if (current != null && current.getStatus() == CanaryStatus.RUNNING) {
                throw new ValidationException("service " + name + " already has a running canary: " + current.getId());
            }
            return canary;
        });
        canaries.put(canary.getId(), canary);

        if (registry.discover(serviceName, canaryVersion, null, false).isEmpty()) {
            log.warn("Canary version has no registered instance yet: service={}, canaryVersion={}",
                    serviceName, canaryVersion);
        }
        log.info("Canary created: canaryId={}, service={}, canaryVersion={}, stableVersion={}, trafficPercent={}",
                canary.getId(), serviceName, canaryVersion, stableVersion, trafficPercent);
        return canary;
    }

    /**
     * Sends all traffic to the canary version. No-op on a terminal canary.
     */
    public CanaryDeployment promoteCanary(String canaryId) {
        CanaryDeployment canary = requireCanary(canaryId);
        if (canary.promote()) {
            log.info("Canary promoted: canaryId={}, service={}, version={}",
                    canaryId, canary.getServiceName(), canary.getCanaryVersion());
        } else {
            log.info("Canary promotion ignored, already {}: canaryId={}", canary.getStatus(), canaryId);
        }
        return canary;
    }

    /**
     * Sends all traffic back to the stable version. No-op on a terminal canary.
     */
    public CanaryDeployment rollbackCanary(String canaryId) {
        CanaryDeployment canary = requireCanary(canaryId);
        if (canary.rollback()) {
            log.warn("Canary rolled back: canaryId={}, service={}, stableVersion={}, metrics={}",
                    canaryId, canary.getServiceName(), canary.getStableVersion(), canary.getMetrics());
        } else {
            log.info("Canary rollback ignored, already {}: canaryId={}", canary.getStatus(), canaryId);
        }
        return canary;
    }

    private CanaryDeployment requireCanary(String canaryId) {
        CanaryDeployment canary = canaries.get(canaryId);
        if (canary == null) {
            throw new NotFoundException("Canary", canaryId);
        }
        return canary;
    }

    public Optional<CanaryDeployment> getCanary(String canaryId) {
        return Optional.ofNullable(canaries.get(canaryId));
    }

    public List<CanaryDeployment> getCanaries() {
        return canaries.values().stream()
                .sorted(Comparator.comparing(CanaryDeployment::getCreatedAt))
                .toList();
    }

    /**
     * Decides the target version for one request to {@code serviceName}.
     */
    public RoutingDecision route(String serviceName, RoutingContext context) {
        totalRequests.incrementAndGet();

        CanaryDeployment canary = latestCanaryByService.get(serviceName);
        if (canary != null) {
            String version = canary.route(context.routingKey());
            count(routedByVersion, serviceName + "@" + version);
            log.debug("Routed by canary: service={}, canaryId={}, status={}, version={}",
                    serviceName, canary.getId(), canary.getStatus(), version);
            return new RoutingDecision(version, RoutingDecision.CANARY, canary.getId());
        }

        for (TrafficRoute route : getRoutes()) {
            if (!route.enabled() || !route.serviceName().equals(serviceName)) {
                continue;
            }
            Optional<String> version = route.evaluate(context);
            if (version.isPresent()) {
                count(routedByVersion, serviceName + "@" + version.get());
                count(routedByRule, route.id());
                log.debug("Routed by rule: service={}, routeId={}, version={}", serviceName, route.id(), version.get());
                return new RoutingDecision(version.get(), RoutingDecision.RULE, route.id());
            }
        }
        return RoutingDecision.unrouted();
    }

    /**
     * Feeds a call outcome back into the deciding canary's metrics.
     */
    public void recordOutcome(RoutingDecision decision, boolean success) {
        if (decision == null || !decision.isCanary()) {
            return;
        }
        CanaryDeployment canary = canaries.get(decision.sourceId());
        if (canary != null) {
            canary.recordOutcome(decision.version(), success);
        }
    }

    private static void count(Map<String, AtomicLong> counters, String key) {
        counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    public RouterStats getStats() {
        long active = canaries.values().stream().filter(c -> c.getStatus() == CanaryStatus.RUNNING).count();
        return new RouterStats(
                totalRequests.get(),
                routes.size(),
                canaries.size(),
                active,
                snapshot(routedByVersion),
                snapshot(routedByRule)
        );
    }

    private static Map<String, Long> snapshot(Map<String, AtomicLong> counters) {
        Map<String, Long> copy = new TreeMap<>();
        counters.forEach((key, value) -> copy.put(key, value.get()));
        return copy;
    }

    /**
     * Zeroes counters and canary metrics; routes and canaries are kept.
     */
    public void resetStats() {
        totalRequests.set(0);
        routedByVersion.clear();
        routedByRule.clear();
        canaries.values().forEach(CanaryDeployment::resetMetrics);
    }

    public record RouterStats(
            long totalRequests,
            int totalRoutes,
            int canaryDeployments,
            long activeCanaries,
            Map<String, Long> routedByVersion,
            Map<String, Long> routedByRule
    ) {
    }
}
