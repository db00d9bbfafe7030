/**
 * Instance selection strategies used by the service registry.
 *
 * <p>The registry only ever hands healthy candidates to a strategy, so
 * strategies never need to check health themselves.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through instances, one cursor per service</td></tr>
 *   <tr><td>{@code weighted}</td><td>Random draw proportional to instance weight</td></tr>
 *   <tr><td>{@code least-connections}</td><td>Fewest in-flight calls</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform random choice</td></tr>
 * </table>
 *
 * @see fr.lapetina.mesh.domain.strategy.StrategyFactory
 */
package fr.lapetina.mesh.domain.strategy;
