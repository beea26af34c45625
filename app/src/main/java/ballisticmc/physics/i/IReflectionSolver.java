package ballisticmc.physics.i;

import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.FermiState;

public interface IReflectionSolver extends ISolverComponent {
    /**
     * Calcula el estado de Fermi reflejado especularmente en el segmento.
     */
    FermiState reflect(FermiState incoming, BoundarySegment segment);
}
