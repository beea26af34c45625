package ballisticmc.physics.impl;

import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.FermiState;
import lombok.Getter;

/**
 * No existe estado reflejado para el impacto. Suele indicar una superficie de Fermi
 * no convexa o mal discretizada; la ejecución no puede continuar.
 */
@Getter
public class SpecularReflectionException extends IllegalStateException {

    private final transient FermiState incoming;
    private final transient BoundarySegment segment;

    public SpecularReflectionException(FermiState incoming, BoundarySegment segment) {
        super("No se encontró estado reflejado para " + incoming + " en " + segment);
        this.incoming = incoming;
        this.segment = segment;
    }
}
