/**
 * Ingress pipeline of the gateway, built on the LMAX Disruptor.
 *
 * <p>Each request is an event that passes, in order, route resolution,
 * authorization (followed by the cache lookup), dispatch and completion. A handler that
 * fails an event makes the later handlers skip it; completion always answers.
 *
 * @see fr.lapetina.mesh.disruptor.GatewayPipeline
 */
package fr.lapetina.mesh.disruptor;
