package ballisticmc.domain.simulation;

import ballisticmc.domain.trajectory.Trajectory;
import lombok.Getter;

import java.util.List;

/**
 * Resultado de una ejecución: contadores por segmento y trayectorias registradas.
 */
@Getter
public final class SimulationResult {

    private final SegmentCounter counts;
    private final List<Trajectory> trajectories;
    /**
     * Tiempo de cómputo en milisegundos.
     */
    private final long simulationTime;

    public SimulationResult(SegmentCounter counts, List<Trajectory> trajectories, long simulationTime) {
        this.counts = counts;
        this.trajectories = List.copyOf(trajectories);
        this.simulationTime = simulationTime;
    }

    public int getTrajectoryCount() {
        return trajectories.size();
    }
}
