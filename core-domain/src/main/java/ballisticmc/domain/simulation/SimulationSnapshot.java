package ballisticmc.domain.simulation;

import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.Trajectory;
import ballisticmc.domain.trajectory.TrajectoryState;
import ballisticmc.domain.trajectory.Waypoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Representación serializable (JSON) de un {@link SimulationResult}.
 * <p>
 * Los segmentos se identifican por su posición en el contador, ya que la identidad
 * de los objetos no sobrevive a la serialización.
 */
public record SimulationSnapshot(List<SegmentCount> counts, List<List<WaypointRecord>> trajectories) {

    public SimulationSnapshot {
        counts = List.copyOf(counts);
        trajectories = trajectories.stream().map(List::copyOf).toList();
    }

    public static SimulationSnapshot from(SimulationResult result) {
        SegmentCounter counter = result.getCounts();
        List<SegmentCount> counts = new ArrayList<>();
        List<BoundarySegment> segments = counter.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            BoundarySegment s = segments.get(i);
            counts.add(new SegmentCount(i, s.getLayer(), s.getX0(), s.getY0(), s.getX1(), s.getY1(), counter.get(s)));
        }

        List<List<WaypointRecord>> trajectories = new ArrayList<>(result.getTrajectoryCount());
        for (Trajectory trajectory : result.getTrajectories()) {
            List<WaypointRecord> waypoints = new ArrayList<>(trajectory.size());
            for (Waypoint w : trajectory.waypoints()) {
                Integer segmentIndex = w.associatedSegment()
                        .map(counter::indexOf)
                        .filter(index -> index >= 0)
                        .orElse(null);
                waypoints.add(new WaypointRecord(w.fermiState().bin(), w.fermiState().fraction(), w.x(), w.y(), w.state(), segmentIndex));
            }
            trajectories.add(waypoints);
        }
        return new SimulationSnapshot(counts, trajectories);
    }

    /**
     * Total de cruces registrados en las capas indicadas.
     */
    public long totalForLayer(int layer) {
        return counts.stream().filter(c -> c.layer() == layer).mapToLong(SegmentCount::count).sum();
    }

    public record SegmentCount(int index, int layer, double x0, double y0, double x1, double y1, long count) {
    }

    public record WaypointRecord(int bin, double fraction, double x, double y, TrajectoryState state, Integer segmentIndex) {
    }
}
