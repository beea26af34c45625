package ballisticmc.physics.impl;

import ballisticmc.domain.band.InjectionDistribution;
import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.FermiState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiffuseScatterSamplerTest {

    @Mock
    private RandomGenerator rng;

    private final DiffuseScatterSampler sampler = new DiffuseScatterSampler();

    private static BoundarySegment segmentWith(double... weights) {
        return new BoundarySegment(0, 0, 1, 0, 0).withInjection(InjectionDistribution.fromWeights(weights));
    }

    @Test
    @DisplayName("Dispersión simple: muestrea la distribución del segmento con fracción completa")
    void scatter_samplesSegmentDistribution() {
        when(rng.nextDouble()).thenReturn(0.6);

        FermiState state = sampler.scatter(segmentWith(1, 1, 0, 0), rng);

        assertEquals(FermiState.atBin(1), state);
    }

    @Test
    @DisplayName("Dispersión en esquina: solo bins aceptados por ambos segmentos")
    void cornerScatter_usesProduct() {
        BoundarySegment first = segmentWith(1, 1, 0, 0);
        BoundarySegment second = segmentWith(0, 1, 1, 0);
        when(rng.nextDouble()).thenReturn(0.0, 0.999);

        assertEquals(1, sampler.cornerScatter(first, second, second, rng).bin());
        assertEquals(1, sampler.cornerScatter(first, second, second, rng).bin());
    }

    @Test
    @DisplayName("Dispersión en esquina con conos disjuntos: se usa el segmento que cuenta")
    void cornerScatter_disjointFallsBackToCounted() {
        BoundarySegment first = segmentWith(1, 0, 0, 0);
        BoundarySegment second = segmentWith(0, 0, 1, 1);
        when(rng.nextDouble()).thenReturn(0.1);

        assertEquals(2, sampler.cornerScatter(first, second, second, rng).bin());
    }

    @Test
    @DisplayName("Segmento sin distribución: IllegalStateException")
    void scatter_withoutDistribution_throws() {
        BoundarySegment bare = new BoundarySegment(0, 0, 1, 0, 0);
        assertThrows(IllegalStateException.class, () -> sampler.scatter(bare, rng));
    }
}
