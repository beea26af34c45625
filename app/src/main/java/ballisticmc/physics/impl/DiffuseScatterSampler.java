package ballisticmc.physics.impl;

import ballisticmc.domain.band.InjectionDistribution;
import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.FermiState;
import ballisticmc.physics.i.IScatterSampler;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/**
 * Dispersión difusa: el portador sale con un bin muestreado de la distribución de
 * inyección del segmento, sin memoria del estado incidente.
 */
@Slf4j
public class DiffuseScatterSampler implements IScatterSampler {

    @Override
    public String getName() {
        return "Diffuse";
    }

    @Override
    public FermiState scatter(BoundarySegment segment, RandomGenerator rng) {
        return FermiState.atBin(segment.requireInjection().sampleBin(rng));
    }

    @Override
    public FermiState cornerScatter(BoundarySegment first, BoundarySegment second,
                                    BoundarySegment counted, RandomGenerator rng) {
        InjectionDistribution combined = first.requireInjection()
                .combine(second.requireInjection())
                .orElseGet(() -> {
                    log.debug("Conos de aceptación disjuntos en la esquina; se usa la distribución de {}", counted);
                    return counted.requireInjection();
                });
        return FermiState.atBin(combined.sampleBin(rng));
    }
}
