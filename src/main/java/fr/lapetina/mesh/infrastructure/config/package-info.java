/**
 * Configuration loading and hot-reload support.
 *
 * <p>The YAML document is parsed with SnakeYAML into {@link fr.lapetina.mesh.infrastructure.config.MeshGatewayConfig},
 * validated, then published to {@link fr.lapetina.mesh.infrastructure.config.ConfigChangeListener}s.
 * A reload that fails to parse or validate keeps the configuration in effect.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server and admin token</li>
 *   <li>{@code mesh} - Feature switches</li>
 *   <li>{@code registry} - Default strategy and health probing</li>
 *   <li>{@code circuitBreaker} - Breaker thresholds</li>
 *   <li>{@code retry} - Default and per-service retry policies, retry budget</li>
 *   <li>{@code auth} - Certificate signing and rotation</li>
 *   <li>{@code gateway} - Ring buffer, cache and routes</li>
 *   <li>{@code services}, {@code acls} - Seed instances and ACL rows</li>
 *   <li>{@code metrics} - Prometheus metric prefix</li>
 * </ul>
 */
package fr.lapetina.mesh.infrastructure.config;
