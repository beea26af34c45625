package ballisticmc.physics.impl;

import ballisticmc.domain.geometry.BoundarySegment;

/**
 * Cruce de un paso con un segmento del contorno.
 *
 * @param segment  Segmento cruzado.
 * @param x        Punto de cruce, ya retraído hacia el origen del paso.
 * @param y        Punto de cruce, ya retraído hacia el origen del paso.
 * @param distance Distancia desde el origen del paso, usada para ordenar.
 */
public record BoundaryIntersection(BoundarySegment segment, double x, double y, double distance) {
}
