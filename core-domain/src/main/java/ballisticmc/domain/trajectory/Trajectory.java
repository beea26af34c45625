package ballisticmc.domain.trajectory;

import java.util.List;
import java.util.Optional;

/**
 * Secuencia inmutable de puntos de un portador, desde la inyección hasta la absorción.
 * Solo contiene los estados que la configuración pidió guardar.
 */
public record Trajectory(List<Waypoint> waypoints) {

    public Trajectory {
        waypoints = List.copyOf(waypoints);
    }

    public int size() {
        return waypoints.size();
    }

    public Optional<Waypoint> last() {
        if (waypoints.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(waypoints.get(waypoints.size() - 1));
    }

    public long count(TrajectoryState state) {
        return waypoints.stream().filter(w -> w.state() == state).count();
    }
}
