package ballisticmc.physics.impl;

import ballisticmc.domain.geometry.AuxiliaryLines;
import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.geometry.DeviceFrame;
import ballisticmc.domain.geometry.IntersectionCoefficients;
import ballisticmc.physics.solver.LineIntersectionSolver;
import ballisticmc.physics.solver.LineIntersectionSolver.LineParameters;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Detecta los segmentos del contorno que corta un paso recto.
 * <p>
 * Solo se aceptan segmentos hacia los que el paso avanza (producto escalar negativo
 * con la normal interior), lo que evita volver a detectar el segmento del que el
 * portador acaba de salir. Cada punto de cruce se retrae {@code bias} unidades hacia
 * el origen del paso para que el portador quede dentro del dispositivo; es un sesgo
 * numérico que no cambia los resultados más allá de la precisión de coma flotante.
 */
public class BoundaryIntersectionEngine {

    private static final Comparator<BoundaryIntersection> BY_DISTANCE =
            Comparator.comparingDouble(BoundaryIntersection::distance);

    private final DeviceFrame frame;
    private final AuxiliaryLines auxiliaryLines;
    @Getter
    private final double bias;

    public BoundaryIntersectionEngine(DeviceFrame frame, AuxiliaryLines auxiliaryLines, double bias) {
        if (bias < 0.0) {
            throw new IllegalArgumentException("El sesgo de intersección no puede ser negativo.");
        }
        this.frame = frame;
        this.auxiliaryLines = auxiliaryLines;
        this.bias = bias;
    }

    /**
     * Todos los cruces válidos del paso (x, y)->(xNew, yNew), ordenados por distancia
     * ascendente desde (x, y).
     */
    public List<BoundaryIntersection> findSortedIntersections(double x, double y, double xNew, double yNew) {
        double xDel = xNew - x;
        double yDel = yNew - y;
        double stepLength = Math.hypot(xDel, yDel);
        List<BoundaryIntersection> intersections = new ArrayList<>(2);
        if (stepLength == 0.0) {
            return intersections;
        }

        IntersectionCoefficients coefficients = frame.getCoefficients();
        List<BoundarySegment> segments = frame.getSegments();
        for (int i = 0; i < coefficients.size(); i++) {
            LineParameters params = LineIntersectionSolver.solve(x, y, xNew, yNew, coefficients, i);
            if (!params.isWithinBothSegments()) {
                continue;
            }
            BoundarySegment segment = segments.get(i);
            if (xDel * segment.getNormalX() + yDel * segment.getNormalY() >= 0.0) {
                // Se aleja de la pared o la roza: no hay impacto
                continue;
            }
            double xInt = coefficients.px0(i) - params.u() * coefficients.x23(i);
            double yInt = coefficients.py0(i) - params.u() * coefficients.y23(i);
            if (xInt == x && yInt == y) {
                continue;
            }
            xInt -= bias * xDel / stepLength;
            yInt -= bias * yDel / stepLength;
            intersections.add(new BoundaryIntersection(segment, xInt, yInt, Math.hypot(xInt - x, yInt - y)));
        }

        if (intersections.size() > 1) {
            intersections.sort(BY_DISTANCE);
        }
        return intersections;
    }

    /**
     * Líneas auxiliares cortadas por el tramo (x, y)->(xEnd, yEnd). Sin filtro de
     * dirección: cualquier cruce cuenta.
     */
    public List<BoundarySegment> findAuxiliaryCrossings(double x, double y, double xEnd, double yEnd) {
        if (auxiliaryLines.isEmpty()) {
            return List.of();
        }
        IntersectionCoefficients coefficients = auxiliaryLines.getCoefficients();
        List<BoundarySegment> crossed = new ArrayList<>();
        for (int i = 0; i < coefficients.size(); i++) {
            if (LineIntersectionSolver.solve(x, y, xEnd, yEnd, coefficients, i).isWithinBothSegments()) {
                crossed.add(auxiliaryLines.getLines().get(i));
            }
        }
        return crossed;
    }
}
