package ballisticmc.physics.simulator;

import ballisticmc.config.SimulationConfig;
import ballisticmc.domain.band.Bandstructure;
import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.geometry.DeviceFrame;
import ballisticmc.domain.geometry.InjectionSite;
import ballisticmc.domain.trajectory.FermiState;
import ballisticmc.domain.trajectory.TrajectoryState;
import ballisticmc.domain.trajectory.Waypoint;
import ballisticmc.physics.i.IReflectionSolver;
import ballisticmc.physics.i.IScatterSampler;
import ballisticmc.physics.impl.BoundaryIntersection;
import ballisticmc.physics.impl.BoundaryIntersectionEngine;
import ballisticmc.physics.solver.CornerResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Avanza un portador un paso balístico y resuelve el impacto con el contorno.
 * <p>
 * Un paso recorre lo que queda de la cuerda actual de la órbita. Si no toca ningún
 * segmento el portador pasa al bin siguiente (PROPAGATE). Si lo toca, el paso se
 * trunca en el punto de impacto y se decide según el tipo de contacto del segmento
 * que cuenta: colisión con dispersión o reflexión, absorción, o absorción con
 * reinyección en un contacto flotante. Los impactos en esquina siguen las mismas
 * reglas con los estados C*.
 * <p>
 * No guarda estado entre pasos: el generador aleatorio lo aporta el llamador.
 */
@Slf4j
public class TrajectoryStepper {

    /**
     * Estados emitidos según el impacto sea simple o en esquina.
     */
    private enum ImpactKind {
        SINGLE(TrajectoryState.COLLISION, TrajectoryState.SCATTER, TrajectoryState.REFLECT, TrajectoryState.ABSORBED),
        CORNER(TrajectoryState.CCOLLISION, TrajectoryState.CSCATTER, TrajectoryState.CREFLECT, TrajectoryState.CABSORBED);

        private final TrajectoryState collision;
        private final TrajectoryState scatter;
        private final TrajectoryState reflect;
        private final TrajectoryState absorbed;

        ImpactKind(TrajectoryState collision, TrajectoryState scatter, TrajectoryState reflect, TrajectoryState absorbed) {
            this.collision = collision;
            this.scatter = scatter;
            this.reflect = reflect;
            this.absorbed = absorbed;
        }
    }

    /**
     * Impacto ya localizado. {@code second} es nulo en un impacto simple.
     */
    private record Impact(ImpactKind kind, FermiState truncated, double x, double y,
                          BoundarySegment counted, BoundarySegment first, BoundarySegment second,
                          double originX, double originY) {
    }

    private final Bandstructure bandstructure;
    private final DeviceFrame frame;
    private final BoundaryIntersectionEngine intersectionEngine;
    private final IScatterSampler scatterSampler;
    private final IReflectionSolver reflectionSolver;

    private final double pScatter;
    private final double pOhmicAbsorb;
    private final double cornerTolerance;
    private final boolean debug;

    public TrajectoryStepper(Bandstructure bandstructure, DeviceFrame frame,
                             BoundaryIntersectionEngine intersectionEngine,
                             IScatterSampler scatterSampler, IReflectionSolver reflectionSolver,
                             SimulationConfig config) {
        this.bandstructure = bandstructure;
        this.frame = frame;
        this.intersectionEngine = intersectionEngine;
        this.scatterSampler = scatterSampler;
        this.reflectionSolver = reflectionSolver;
        this.pScatter = config.getPScatter();
        this.pOhmicAbsorb = config.getPOhmicAbsorb();
        this.cornerTolerance = config.getCornerTolerance();
        this.debug = config.isDebug();
    }

    /**
     * Da un paso desde (x, y) con el estado {@code fermiState}.
     */
    public StepResult step(FermiState fermiState, double x, double y, RandomGenerator rng) {
        if (debug && !frame.contains(x, y)) {
            log.warn("Portador fuera del dispositivo en ({}, {}) con estado {}. Se termina la trayectoria.", x, y, fermiState);
            return new StepResult(List.of(Waypoint.of(fermiState, x, y, TrajectoryState.ERROR)), List.of(), true);
        }
        double xNew = x + bandstructure.stepX(fermiState);
        double yNew = y + bandstructure.stepY(fermiState);
        return resolveStep(fermiState, x, y, xNew, yNew, rng);
    }

    /**
     * Resuelve el tramo (x, y)->(xNew, yNew). Separado de {@link #step} para poder
     * probar geometrías concretas sin depender de la órbita.
     */
    StepResult resolveStep(FermiState fermiState, double x, double y, double xNew, double yNew, RandomGenerator rng) {
        List<BoundaryIntersection> hits = intersectionEngine.findSortedIntersections(x, y, xNew, yNew);
        if (hits.isEmpty()) {
            Waypoint propagated = Waypoint.of(fermiState.next(bandstructure.getBinCount()), xNew, yNew, TrajectoryState.PROPAGATE);
            return new StepResult(List.of(propagated), intersectionEngine.findAuxiliaryCrossings(x, y, xNew, yNew), false);
        }

        BoundaryIntersection nearest = hits.get(0);
        FermiState truncated = truncate(fermiState, x, y, xNew, yNew, nearest);
        List<BoundarySegment> crossings = intersectionEngine.findAuxiliaryCrossings(x, y, nearest.x(), nearest.y());

        Impact impact;
        if (hits.size() > 1 && hits.get(1).distance() - nearest.distance() <= cornerTolerance) {
            BoundarySegment first = nearest.segment();
            BoundarySegment second = hits.get(1).segment();
            BoundarySegment counted = second.getLayer() > first.getLayer() ? second : first;
            impact = new Impact(ImpactKind.CORNER, truncated, nearest.x(), nearest.y(), counted, first, second, x, y);
        } else {
            BoundarySegment segment = nearest.segment();
            impact = new Impact(ImpactKind.SINGLE, truncated, nearest.x(), nearest.y(), segment, segment, null, x, y);
        }

        List<Waypoint> waypoints = new ArrayList<>(3);
        boolean terminal = resolveImpact(impact, rng, waypoints);
        return new StepResult(waypoints, crossings, terminal);
    }

    private boolean resolveImpact(Impact impact, RandomGenerator rng, List<Waypoint> waypoints) {
        BoundarySegment counted = impact.counted();
        ImpactKind kind = impact.kind();
        switch (counted.getContactType()) {
            case DEVICE_BOUNDARY -> {
                waypoints.add(new Waypoint(impact.truncated(), impact.x(), impact.y(), kind.collision, counted));
                waypoints.add(deflect(impact, rng));
                return false;
            }
            case GROUNDED_CONTACT -> {
                if (rng.nextDouble() < pOhmicAbsorb) {
                    waypoints.add(new Waypoint(impact.truncated(), impact.x(), impact.y(), kind.absorbed, counted));
                    return true;
                }
                waypoints.add(Waypoint.of(impact.truncated(), impact.x(), impact.y(), kind.collision));
                waypoints.add(deflect(impact, rng));
                return false;
            }
            case FLOATING_CONTACT -> {
                if (rng.nextDouble() < pOhmicAbsorb) {
                    waypoints.add(new Waypoint(impact.truncated(), impact.x(), impact.y(), kind.absorbed, counted));
                    waypoints.add(reinject(counted.getLayer(), rng));
                    return false;
                }
                waypoints.add(Waypoint.of(impact.truncated(), impact.x(), impact.y(), kind.collision));
                waypoints.add(deflect(impact, rng));
                return false;
            }
            default -> throw new IllegalStateException("Tipo de contacto no soportado: " + counted.getContactType());
        }
    }

    private Waypoint deflect(Impact impact, RandomGenerator rng) {
        ImpactKind kind = impact.kind();
        if (rng.nextDouble() < pScatter) {
            FermiState scattered = kind == ImpactKind.CORNER
                    ? scatterSampler.cornerScatter(impact.first(), impact.second(), impact.counted(), rng)
                    : scatterSampler.scatter(impact.counted(), rng);
            return Waypoint.of(scattered, impact.x(), impact.y(), kind.scatter);
        }

        BoundarySegment mirror = kind == ImpactKind.CORNER
                ? CornerResolver.syntheticSegment(impact.first(), impact.second(),
                        impact.originX(), impact.originY(), impact.counted().getLayer())
                : impact.counted();
        return Waypoint.of(reflectionSolver.reflect(impact.truncated(), mirror), impact.x(), impact.y(), kind.reflect);
    }

    private Waypoint reinject(int layer, RandomGenerator rng) {
        InjectionSite site = frame.sampleInjection(layer, rng);
        FermiState injected = scatterSampler.scatter(site.segment(), rng);
        return Waypoint.of(injected, site.x(), site.y(), TrajectoryState.INJECTING);
    }

    /**
     * Estado de Fermi en el punto de impacto: la fracción que queda tras recorrer
     * la parte del paso anterior al contorno.
     */
    private static FermiState truncate(FermiState fermiState, double x, double y, double xNew, double yNew,
                                       BoundaryIntersection hit) {
        double fullSquared = (xNew - x) * (xNew - x) + (yNew - y) * (yNew - y);
        double hitSquared = (hit.x() - x) * (hit.x() - x) + (hit.y() - y) * (hit.y() - y);
        double remaining = fermiState.fraction() * (1.0 - Math.sqrt(hitSquared / fullSquared));
        return new FermiState(fermiState.bin(), Math.min(fermiState.fraction(), Math.max(0.0, remaining)));
    }
}
