package ballisticmc.physics.i;

import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.FermiState;

import java.util.random.RandomGenerator;

/**
 * Muestreo de la dirección saliente tras una dispersión difusa en el contorno.
 */
public interface IScatterSampler extends ISolverComponent {

    /**
     * Dispersión en un único segmento.
     */
    FermiState scatter(BoundarySegment segment, RandomGenerator rng);

    /**
     * Dispersión en una esquina formada por dos segmentos.
     *
     * @param counted El segmento que registra el impacto (mayor capa); se usa si los
     *                conos de aceptación no se solapan.
     */
    FermiState cornerScatter(BoundarySegment first, BoundarySegment second, BoundarySegment counted, RandomGenerator rng);
}
