package ballisticmc.config;

import ballisticmc.domain.trajectory.TrajectoryState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest {

    @Test
    @DisplayName("Valores por defecto del builder")
    void builder_defaults() {
        SimulationConfig config = SimulationConfig.builder().injectionCount(10).magneticField(1.0).build();

        assertEquals(1.0, config.getPScatter());
        assertEquals(1.0, config.getPOhmicAbsorb());
        assertEquals(1, config.getInjectionLayer());
        assertEquals(EnumSet.allOf(TrajectoryState.class), config.getStoredStates());
        assertEquals(1e-10, config.getIntersectionBias());
        assertEquals(1e-12, config.getCornerTolerance());
        assertFalse(config.isDebug());
        assertFalse(config.isStepBounded());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("Parámetros fuera de rango: validate lanza IllegalArgumentException")
    void validate_rejectsOutOfRange() {
        SimulationConfig base = SimulationConfig.getTestingSimulation();

        assertThrows(IllegalArgumentException.class, () -> base.withInjectionCount(0).validate());
        assertThrows(IllegalArgumentException.class, () -> base.withPScatter(1.5).validate());
        assertThrows(IllegalArgumentException.class, () -> base.withPOhmicAbsorb(-0.1).validate());
        assertThrows(IllegalArgumentException.class, () -> base.withMagneticField(0.0).validate());
        assertThrows(IllegalArgumentException.class, () -> base.withMaxStepsPerTrajectory(-1).validate());
        assertThrows(IllegalArgumentException.class, () -> base.withIntersectionBias(-1e-9).validate());
    }
}
