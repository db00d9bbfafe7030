/**
 * Mesh Gateway - embedded service-mesh control plane with an API gateway in front of it.
 *
 * <p>Backend services register their instances with the mesh; the gateway binds
 * inbound (method, path) pairs to those services and carries every call through
 * traffic routing, instance selection, circuit breaking and retries. Inbound
 * requests flow through an LMAX Disruptor pipeline.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mesh.MeshFactory} - Wires every component from configuration</li>
 *   <li>{@link fr.lapetina.mesh.MeshGatewayApplication} - Standalone entry point with the HTTP server</li>
 *   <li>{@link fr.lapetina.mesh.controlplane.MeshControlPlane} - Feature switches, stats and health</li>
 *   <li>{@link fr.lapetina.mesh.gateway.ApiGateway} - Route table, cache, auth and dispatch</li>
 *   <li>{@link fr.lapetina.mesh.disruptor.GatewayPipeline} - Ingress ring buffer</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (MeshFactory factory = MeshFactory.create("config.yaml").start()) {
 *     GatewayResponse response = factory.getGateway()
 *             .handle(GatewayRequest.builder().method("GET").path("/api/users/42").build())
 *             .join();
 * }
 * }</pre>
 */
package fr.lapetina.mesh;
