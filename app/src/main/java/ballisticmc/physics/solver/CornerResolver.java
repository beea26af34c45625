package ballisticmc.physics.solver;

import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.physics.solver.LineIntersectionSolver.LineParameters;
import lombok.extern.slf4j.Slf4j;

/**
 * Construye el segmento sintético con el que se refleja un impacto en esquina.
 * <p>
 * El segmento pasa por el vértice real (corte de las rectas de ambos segmentos) y es
 * perpendicular a la bisectriz aproximada: la recta del vértice al punto medio de dos
 * puntos de referencia, uno sobre cada segmento a {@link #REFERENCE_RADIUS} del
 * vértice, elegidos del lado del portador.
 */
@Slf4j
public final class CornerResolver {

    public static final double REFERENCE_RADIUS = 1000.0;

    /**
     * Prohibido construir esta clase utilidad
     */
    private CornerResolver() {
    }

    /**
     * @param first     Segmento más cercano.
     * @param second    Segundo segmento de la esquina.
     * @param particleX Origen del paso que produjo el impacto.
     * @param particleY Origen del paso que produjo el impacto.
     * @param layer     Capa que se asigna al segmento sintético.
     * @return El segmento sintético, o {@code first} si la esquina es degenerada.
     */
    public static BoundarySegment syntheticSegment(BoundarySegment first, BoundarySegment second,
                                                   double particleX, double particleY, int layer) {
        LineParameters params = LineIntersectionSolver.solveLines(
                first.getX0(), first.getY0(), first.getX1(), first.getY1(),
                second.getX0(), second.getY0(), second.getX1(), second.getY1());
        if (params.isParallel()) {
            log.debug("Esquina entre segmentos paralelos; se usa {} para la reflexión.", first);
            return first;
        }
        double vertexX = first.pointX(params.t());
        double vertexY = first.pointY(params.t());

        double[] a = nearerReference(first, vertexX, vertexY, particleX, particleY);
        double[] b = nearerReference(second, vertexX, vertexY, particleX, particleY);
        double bisectorX = 0.5 * (a[0] + b[0]) - vertexX;
        double bisectorY = 0.5 * (a[1] + b[1]) - vertexY;
        double bisectorLength = Math.hypot(bisectorX, bisectorY);
        if (bisectorLength == 0.0 || Double.isNaN(bisectorLength)) {
            log.debug("Bisectriz degenerada en ({}, {}); se usa {} para la reflexión.", vertexX, vertexY, first);
            return first;
        }
        // Normal izquierda de (dx, dy) = bisectriz: el interior queda del lado del portador
        double dx = bisectorY / bisectorLength;
        double dy = -bisectorX / bisectorLength;
        return new BoundarySegment(vertexX - dx, vertexY - dy, vertexX + dx, vertexY + dy, layer);
    }

    private static double[] nearerReference(BoundarySegment segment, double vertexX, double vertexY,
                                            double particleX, double particleY) {
        double plusX = vertexX + REFERENCE_RADIUS * segment.getDirectionX();
        double plusY = vertexY + REFERENCE_RADIUS * segment.getDirectionY();
        double minusX = vertexX - REFERENCE_RADIUS * segment.getDirectionX();
        double minusY = vertexY - REFERENCE_RADIUS * segment.getDirectionY();
        double plusDistance = Math.hypot(plusX - particleX, plusY - particleY);
        double minusDistance = Math.hypot(minusX - particleX, minusY - particleY);
        return plusDistance <= minusDistance ? new double[]{plusX, plusY} : new double[]{minusX, minusY};
    }
}
