package ballisticmc.physics.simulator;

import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.Waypoint;

import java.util.List;

/**
 * Salida de un paso del portador.
 *
 * @param waypoints          Puntos emitidos, en orden. Nunca vacío; el último fija el estado siguiente.
 * @param auxiliaryCrossings Líneas auxiliares cruzadas por el tramo recorrido.
 * @param terminal           La trayectoria termina con este paso.
 */
public record StepResult(List<Waypoint> waypoints, List<BoundarySegment> auxiliaryCrossings, boolean terminal) {

    public StepResult {
        if (waypoints.isEmpty()) {
            throw new IllegalArgumentException("Un paso debe emitir al menos un punto.");
        }
        waypoints = List.copyOf(waypoints);
        auxiliaryCrossings = List.copyOf(auxiliaryCrossings);
    }

    public Waypoint last() {
        return waypoints.get(waypoints.size() - 1);
    }
}
