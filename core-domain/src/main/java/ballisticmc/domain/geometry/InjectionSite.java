package ballisticmc.domain.geometry;

/**
 * Punto de entrada de un portador y el segmento al que pertenece.
 */
public record InjectionSite(double x, double y, BoundarySegment segment) {
}
