package ballisticmc.physics.simulator;

import ballisticmc.config.SimulationConfig;
import ballisticmc.domain.band.Bandstructure;
import ballisticmc.domain.geometry.AuxiliaryLines;
import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.geometry.DeviceFrame;
import ballisticmc.domain.trajectory.FermiState;
import ballisticmc.domain.trajectory.TrajectoryState;
import ballisticmc.domain.trajectory.Waypoint;
import ballisticmc.factory.DeviceFrameFactory;
import ballisticmc.factory.FermiSurfaceFactory;
import ballisticmc.physics.i.IReflectionSolver;
import ballisticmc.physics.i.IScatterSampler;
import ballisticmc.physics.impl.BoundaryIntersectionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Test unitario para TrajectoryStepper.
 * Rectángulo 2 x 1: inferior capa 1 (contacto flotante), laterales capa 0 (borde),
 * superior capa 2 (contacto a tierra). Los muestreadores son mocks y el generador
 * aleatorio devuelve valores fijados en cada test.
 */
@ExtendWith(MockitoExtension.class)
class TrajectoryStepperTest {

    private static final double TOLERANCE = 1e-9;

    @Mock
    private IScatterSampler scatterSampler;
    @Mock
    private IReflectionSolver reflectionSolver;
    @Mock
    private RandomGenerator rng;

    private Bandstructure band;
    private DeviceFrame frame;
    private BoundarySegment bottom;
    private BoundarySegment right;
    private BoundarySegment top;
    private SimulationConfig config;
    private TrajectoryStepper stepper;

    @BeforeEach
    void setUp() {
        band = new Bandstructure(FermiSurfaceFactory.circle(1.0, 36), 0.0, 1.0);
        frame = DeviceFrameFactory.rectangle(2.0, 1.0, 1, 0, 2, 0).withInjection(band);
        bottom = frame.getSegments().get(0);
        right = frame.getSegments().get(1);
        top = frame.getSegments().get(2);
        config = SimulationConfig.getTestingSimulation().withPScatter(0.5).withPOhmicAbsorb(0.5);
        stepper = createStepper(frame, AuxiliaryLines.none(), config);
    }

    private TrajectoryStepper createStepper(DeviceFrame device, AuxiliaryLines lines, SimulationConfig simulationConfig) {
        BoundaryIntersectionEngine engine = new BoundaryIntersectionEngine(device, lines, simulationConfig.getIntersectionBias());
        return new TrajectoryStepper(band, device, engine, scatterSampler, reflectionSolver, simulationConfig);
    }

    @Test
    @DisplayName("Sin impacto: PROPAGATE al final del paso y bin siguiente")
    void noHit_propagates() {
        // --- ACT ---
        StepResult result = stepper.resolveStep(new FermiState(35, 1.0), 1.0, 0.5, 1.2, 0.6, rng);

        // --- ASSERT ---
        assertFalse(result.terminal());
        assertEquals(1, result.waypoints().size());
        Waypoint waypoint = result.last();
        assertEquals(TrajectoryState.PROPAGATE, waypoint.state());
        assertEquals(FermiState.atBin(0), waypoint.fermiState(), "El bin avanza de forma cíclica");
        assertEquals(1.2, waypoint.x());
        assertEquals(0.6, waypoint.y());
        assertTrue(waypoint.associatedSegment().isEmpty());
        verifyNoInteractions(rng, scatterSampler, reflectionSolver);
    }

    @Test
    @DisplayName("Borde del dispositivo con dispersión: COLLISION con segmento y SCATTER sin él")
    void deviceBoundary_scatter() {
        // --- ARRANGE ---
        when(rng.nextDouble()).thenReturn(0.2);
        when(scatterSampler.scatter(same(right), any())).thenReturn(FermiState.atBin(7));

        // --- ACT ---
        StepResult result = stepper.resolveStep(FermiState.atBin(3), 1.5, 0.5, 2.5, 0.5, rng);

        // --- ASSERT ---
        List<Waypoint> waypoints = result.waypoints();
        assertFalse(result.terminal());
        assertEquals(2, waypoints.size());
        assertEquals(TrajectoryState.COLLISION, waypoints.get(0).state());
        assertSame(right, waypoints.get(0).segment());
        assertEquals(3, waypoints.get(0).fermiState().bin());
        assertEquals(0.5, waypoints.get(0).fermiState().fraction(), TOLERANCE, "Queda la mitad de la cuerda");
        assertEquals(2.0, waypoints.get(0).x(), TOLERANCE);

        assertEquals(TrajectoryState.SCATTER, waypoints.get(1).state());
        assertEquals(FermiState.atBin(7), waypoints.get(1).fermiState());
        assertNull(waypoints.get(1).segment());
        assertEquals(waypoints.get(0).x(), waypoints.get(1).x());
    }

    @Test
    @DisplayName("Borde del dispositivo con reflexión: REFLECT con el estado truncado")
    void deviceBoundary_reflect() {
        when(rng.nextDouble()).thenReturn(0.7);
        when(reflectionSolver.reflect(any(), same(right))).thenReturn(new FermiState(5, 0.4));

        StepResult result = stepper.resolveStep(FermiState.atBin(3), 1.5, 0.5, 2.5, 0.5, rng);

        assertEquals(TrajectoryState.REFLECT, result.last().state());
        assertEquals(new FermiState(5, 0.4), result.last().fermiState());
        verify(reflectionSolver).reflect(argThat(state -> state.bin() == 3 && Math.abs(state.fraction() - 0.5) < TOLERANCE), same(right));
    }

    @Test
    @DisplayName("Contacto a tierra absorbente: ABSORBED con segmento y fin de la trayectoria")
    void groundedContact_absorbs() {
        when(rng.nextDouble()).thenReturn(0.1);

        StepResult result = stepper.resolveStep(FermiState.atBin(9), 1.0, 0.5, 1.0, 1.5, rng);

        assertTrue(result.terminal());
        assertEquals(1, result.waypoints().size());
        assertEquals(TrajectoryState.ABSORBED, result.last().state());
        assertSame(top, result.last().segment());
    }

    @Test
    @DisplayName("Contacto a tierra no absorbente: COLLISION sin segmento y desvío")
    void groundedContact_notAbsorbed() {
        when(rng.nextDouble()).thenReturn(0.9, 0.1);
        when(scatterSampler.scatter(same(top), any())).thenReturn(FermiState.atBin(27));

        StepResult result = stepper.resolveStep(FermiState.atBin(9), 1.0, 0.5, 1.0, 1.5, rng);

        assertFalse(result.terminal());
        assertEquals(TrajectoryState.COLLISION, result.waypoints().get(0).state());
        assertNull(result.waypoints().get(0).segment(), "La colisión en un contacto no cuenta");
        assertEquals(TrajectoryState.SCATTER, result.last().state());
    }

    @Test
    @DisplayName("Contacto flotante absorbente: ABSORBED y reinyección en la misma capa")
    void floatingContact_absorbsAndReinjects() {
        // Absorción, elección de segmento y posición sobre él
        when(rng.nextDouble()).thenReturn(0.1, 0.3, 0.25);
        when(scatterSampler.scatter(same(bottom), any())).thenReturn(FermiState.atBin(2));

        StepResult result = stepper.resolveStep(FermiState.atBin(20), 1.0, 0.5, 1.0, -0.5, rng);

        assertFalse(result.terminal());
        assertEquals(2, result.waypoints().size());
        assertEquals(TrajectoryState.ABSORBED, result.waypoints().get(0).state());
        assertSame(bottom, result.waypoints().get(0).segment());

        Waypoint injected = result.last();
        assertEquals(TrajectoryState.INJECTING, injected.state());
        assertEquals(FermiState.atBin(2), injected.fermiState());
        assertEquals(0.5, injected.x(), TOLERANCE);
        assertEquals(0.0, injected.y(), TOLERANCE);
        assertNull(injected.segment(), "La reinyección no cuenta");
    }

    @Test
    @DisplayName("Esquina borde-tierra: cuenta el segmento de mayor capa y termina con CABSORBED")
    void corner_groundedAbsorbs() {
        when(rng.nextDouble()).thenReturn(0.1);

        StepResult result = stepper.resolveStep(FermiState.atBin(4), 1.5, 0.5, 2.5, 1.5, rng);

        assertTrue(result.terminal());
        assertEquals(TrajectoryState.CABSORBED, result.last().state());
        assertSame(top, result.last().segment());
    }

    @Test
    @DisplayName("Esquina entre bordes: CCOLLISION y dispersión combinada")
    void corner_deviceBoundaryScatter() {
        // --- ARRANGE --- esquina superior derecha con ambos segmentos de capa 0
        DeviceFrame closed = DeviceFrameFactory.rectangle(2.0, 1.0, 1, 0, 0, 2).withInjection(band);
        BoundarySegment cornerRight = closed.getSegments().get(1);
        BoundarySegment cornerTop = closed.getSegments().get(2);
        TrajectoryStepper cornerStepper = createStepper(closed, AuxiliaryLines.none(), config);
        when(rng.nextDouble()).thenReturn(0.2);
        when(scatterSampler.cornerScatter(same(cornerRight), same(cornerTop), same(cornerRight), any()))
                .thenReturn(FermiState.atBin(22));

        // --- ACT ---
        StepResult result = cornerStepper.resolveStep(FermiState.atBin(4), 1.5, 0.5, 2.5, 1.5, rng);

        // --- ASSERT ---
        assertEquals(2, result.waypoints().size());
        assertEquals(TrajectoryState.CCOLLISION, result.waypoints().get(0).state());
        assertSame(cornerRight, result.waypoints().get(0).segment(), "Con capas iguales cuenta el primero");
        assertEquals(TrajectoryState.CSCATTER, result.last().state());
        assertEquals(FermiState.atBin(22), result.last().fermiState());
    }

    @Test
    @DisplayName("Esquina con reflexión: se refleja en el segmento sintético de la bisectriz")
    void corner_reflectsOnSyntheticSegment() {
        DeviceFrame closed = DeviceFrameFactory.rectangle(2.0, 1.0, 1, 0, 0, 2).withInjection(band);
        TrajectoryStepper cornerStepper = createStepper(closed, AuxiliaryLines.none(), config);
        when(rng.nextDouble()).thenReturn(0.9);
        when(reflectionSolver.reflect(any(), any())).thenReturn(FermiState.atBin(13));

        StepResult result = cornerStepper.resolveStep(FermiState.atBin(4), 1.5, 0.5, 2.5, 1.5, rng);

        assertEquals(TrajectoryState.CREFLECT, result.last().state());
        verify(reflectionSolver).reflect(any(), argThat(mirror ->
                Math.abs(mirror.getNormalX() + Math.sqrt(0.5)) < TOLERANCE
                        && Math.abs(mirror.getNormalY() + Math.sqrt(0.5)) < TOLERANCE));
    }

    @Test
    @DisplayName("Las líneas auxiliares solo se cuentan en el tramo recorrido hasta el impacto")
    void auxiliaryCrossings_onlyOnTraversedPart() {
        BoundarySegment inside = new BoundarySegment(1.75, 0.0, 1.75, 1.0, 3);
        BoundarySegment beyond = new BoundarySegment(2.25, 0.0, 2.25, 1.0, 4);
        TrajectoryStepper auxStepper = createStepper(frame, new AuxiliaryLines(List.of(inside, beyond)), config);
        when(rng.nextDouble()).thenReturn(0.2);
        when(scatterSampler.scatter(same(right), any())).thenReturn(FermiState.atBin(7));

        StepResult result = auxStepper.resolveStep(FermiState.atBin(3), 1.5, 0.5, 2.5, 0.5, rng);

        assertEquals(List.of(inside), result.auxiliaryCrossings());
    }

    @Test
    @DisplayName("Modo debug: una posición fuera del dispositivo produce ERROR terminal")
    void debug_outOfBounds_isError() {
        TrajectoryStepper debugStepper = createStepper(frame, AuxiliaryLines.none(), config.withDebug(true));

        StepResult result = debugStepper.step(FermiState.atBin(0), 5.0, 5.0, rng);

        assertTrue(result.terminal());
        assertEquals(TrajectoryState.ERROR, result.last().state());
        verifyNoInteractions(rng);
    }

    @Test
    @DisplayName("step recorre la fracción restante de la cuerda actual")
    void step_usesBandstructureChord() {
        FermiState partial = new FermiState(0, 0.5);

        StepResult result = stepper.step(partial, 1.0, 0.5, rng);

        assertEquals(TrajectoryState.PROPAGATE, result.last().state());
        assertEquals(1.0 + 0.5 * band.getDrX(0), result.last().x(), TOLERANCE);
        assertEquals(0.5 + 0.5 * band.getDrY(0), result.last().y(), TOLERANCE);
        assertEquals(FermiState.atBin(1), result.last().fermiState());
    }
}
