/**
 * Immutable request, response and instance types shared by every layer.
 */
package fr.lapetina.mesh.domain.model;
