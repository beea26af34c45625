package ballisticmc.physics.simulator;

import ballisticmc.config.SimulationConfig;
import ballisticmc.domain.band.Bandstructure;
import ballisticmc.domain.band.FermiSurface;
import ballisticmc.domain.geometry.AuxiliaryLines;
import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.geometry.DeviceFrame;
import ballisticmc.domain.geometry.InjectionSite;
import ballisticmc.domain.simulation.SegmentCounter;
import ballisticmc.domain.simulation.SimulationResult;
import ballisticmc.domain.trajectory.FermiState;
import ballisticmc.domain.trajectory.Trajectory;
import ballisticmc.domain.trajectory.TrajectoryState;
import ballisticmc.domain.trajectory.Waypoint;
import ballisticmc.physics.i.IReflectionSolver;
import ballisticmc.physics.i.IScatterSampler;
import ballisticmc.physics.impl.BoundaryIntersectionEngine;
import ballisticmc.physics.impl.DiffuseScatterSampler;
import ballisticmc.physics.impl.SpecularReflectionSolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Orquesta una simulación Monte Carlo completa sobre un dispositivo.
 * <p>
 * En la construcción se fija una copia inmutable de la geometría con las
 * distribuciones de inyección de la banda, y las líneas auxiliares se desplazan a
 * capas por encima de la máxima del dispositivo. {@link #runSimulation()} inyecta
 * los portadores uno tras otro y acumula los cruces por segmento.
 * <p>
 * No es thread-safe: el generador aleatorio es de la instancia. Para barridos en
 * paralelo se usa una instancia por hilo (ver {@link FieldSweepProcessor}).
 */
@Slf4j
public class MonteCarloSimulator {

    @Getter
    private final SimulationConfig config;
    @Getter
    private final Bandstructure bandstructure;
    @Getter
    private final DeviceFrame frame;
    @Getter
    private final AuxiliaryLines auxiliaryLines;

    private final TrajectoryStepper stepper;
    private final IScatterSampler scatterSampler;
    private final RandomGenerator rng;

    public MonteCarloSimulator(FermiSurface surface, DeviceFrame device, AuxiliaryLines lines, SimulationConfig config) {
        this(surface, device, lines, config, new SplittableRandom(config.getSeed()));
    }

    MonteCarloSimulator(FermiSurface surface, DeviceFrame device, AuxiliaryLines lines,
                        SimulationConfig config, RandomGenerator rng) {
        config.validate();
        this.config = config;
        this.bandstructure = new Bandstructure(surface, config.getCrystalAngle(), config.getMagneticField());
        this.frame = device.withInjection(bandstructure);
        if (frame.getSegmentsOfLayer(config.getInjectionLayer()).isEmpty()) {
            throw new IllegalArgumentException("El dispositivo no tiene segmentos en la capa de inyección " + config.getInjectionLayer());
        }
        this.auxiliaryLines = lines.withLayerOffset(frame.getMaxLayer() + 1);

        BoundaryIntersectionEngine engine = new BoundaryIntersectionEngine(frame, auxiliaryLines, config.getIntersectionBias());
        this.scatterSampler = new DiffuseScatterSampler();
        IReflectionSolver reflectionSolver = new SpecularReflectionSolver(bandstructure);
        this.stepper = new TrajectoryStepper(bandstructure, frame, engine, scatterSampler, reflectionSolver, config);
        this.rng = rng;

        log.info("MonteCarloSimulator inicializado. (B={}, phi={}, bins={}, segmentos={}, líneas auxiliares={}, contorno={}/{})",
                config.getMagneticField(), config.getCrystalAngle(), bandstructure.getBinCount(),
                frame.getSegments().size(), auxiliaryLines.getLines().size(),
                scatterSampler.getName(), reflectionSolver.getName());
        log.debug("Reflexión: {}", reflectionSolver.getDescription());
    }

    /**
     * Inyecta {@code injectionCount} portadores y los sigue hasta su absorción.
     *
     * @return Contadores por segmento y las trayectorias filtradas por {@code storedStates}.
     */
    public SimulationResult runSimulation() {
        long startTime = System.currentTimeMillis();

        SegmentCounter counter = new SegmentCounter();
        counter.registerAll(frame.getSegments());
        counter.registerAll(auxiliaryLines.getLines());

        List<Trajectory> trajectories = new ArrayList<>(config.getInjectionCount());
        for (int i = 0; i < config.getInjectionCount(); i++) {
            trajectories.add(runTrajectory(counter));
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Simulación completada: {} trayectorias, {} cruces en {} ms.", trajectories.size(), counter.total(), elapsed);
        log.debug("Cruces por capa: {}", counter.totalsByLayer());
        return new SimulationResult(counter, trajectories, elapsed);
    }

    private Trajectory runTrajectory(SegmentCounter counter) {
        Set<TrajectoryState> storedStates = config.getStoredStates();
        List<Waypoint> stored = new ArrayList<>();

        InjectionSite site = frame.sampleInjection(config.getInjectionLayer(), rng);
        FermiState fermiState = scatterSampler.scatter(site.segment(), rng);
        double x = site.x();
        double y = site.y();
        // La inyección inicial lleva su segmento pero no cuenta
        store(stored, storedStates, new Waypoint(fermiState, x, y, TrajectoryState.INJECTING, site.segment()));

        long steps = 0;
        while (true) {
            if (config.isStepBounded() && steps >= config.getMaxStepsPerTrajectory()) {
                log.warn("Trayectoria truncada tras {} pasos en ({}, {}).", steps, x, y);
                store(stored, storedStates, Waypoint.of(fermiState, x, y, TrajectoryState.ERROR));
                break;
            }

            StepResult result = stepper.step(fermiState, x, y, rng);
            steps++;
            for (Waypoint waypoint : result.waypoints()) {
                store(stored, storedStates, waypoint);
                waypoint.associatedSegment().ifPresent(counter::increment);
            }
            for (BoundarySegment line : result.auxiliaryCrossings()) {
                counter.increment(line);
            }
            if (result.terminal()) {
                break;
            }

            Waypoint last = result.last();
            fermiState = last.fermiState();
            x = last.x();
            y = last.y();
        }
        return new Trajectory(stored);
    }

    private static void store(List<Waypoint> stored, Set<TrajectoryState> storedStates, Waypoint waypoint) {
        if (storedStates.contains(waypoint.state())) {
            stored.add(waypoint);
        }
    }
}
