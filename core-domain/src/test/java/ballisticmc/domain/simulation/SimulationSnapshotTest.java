package ballisticmc.domain.simulation;

import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.FermiState;
import ballisticmc.domain.trajectory.Trajectory;
import ballisticmc.domain.trajectory.TrajectoryState;
import ballisticmc.domain.trajectory.Waypoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationSnapshotTest {

    @Test
    @DisplayName("from identifica los segmentos por su posición en el contador")
    void from_indexesSegments() {
        // --- ARRANGE ---
        BoundarySegment source = new BoundarySegment(0, 0, 1, 0, 1);
        BoundarySegment drain = new BoundarySegment(1, 1, 0, 1, 2);
        BoundarySegment unknown = new BoundarySegment(0, 1, 0, 0, 0);

        SegmentCounter counter = new SegmentCounter();
        counter.registerAll(List.of(source, drain));
        counter.increment(drain);

        Trajectory trajectory = new Trajectory(List.of(
                new Waypoint(FermiState.atBin(3), 0.5, 0.0, TrajectoryState.INJECTING, source),
                Waypoint.of(FermiState.atBin(4), 0.5, 0.4, TrajectoryState.PROPAGATE),
                new Waypoint(new FermiState(4, 0.3), 0.5, 1.0, TrajectoryState.ABSORBED, drain),
                new Waypoint(FermiState.atBin(0), 0.0, 0.5, TrajectoryState.COLLISION, unknown)));

        // --- ACT ---
        SimulationSnapshot snapshot = SimulationSnapshot.from(new SimulationResult(counter, List.of(trajectory), 5L));

        // --- ASSERT ---
        assertEquals(2, snapshot.counts().size());
        assertEquals(1, snapshot.counts().get(1).count());
        assertEquals(2, snapshot.counts().get(1).layer());
        assertEquals(1, snapshot.totalForLayer(2));
        assertEquals(0, snapshot.totalForLayer(1));

        List<SimulationSnapshot.WaypointRecord> waypoints = snapshot.trajectories().get(0);
        assertEquals(4, waypoints.size());
        assertEquals(0, waypoints.get(0).segmentIndex());
        assertNull(waypoints.get(1).segmentIndex());
        assertEquals(1, waypoints.get(2).segmentIndex());
        assertEquals(0.3, waypoints.get(2).fraction());
        assertNull(waypoints.get(3).segmentIndex(), "Un segmento no registrado no tiene índice");
    }
}
