/**
 * API gateway: route table, response cache, aggregation, transformation and
 * the dispatcher that carries calls through the mesh.
 */
package fr.lapetina.mesh.gateway;
