package ballisticmc.domain.trajectory;

import ballisticmc.domain.geometry.BoundarySegment;

import java.util.Objects;
import java.util.Optional;

/**
 * Punto registrado de una trayectoria.
 *
 * @param fermiState Estado sobre la superficie de Fermi en este punto.
 * @param x          Coordenada x en el plano del dispositivo.
 * @param y          Coordenada y en el plano del dispositivo.
 * @param state      Etiqueta del evento.
 * @param segment    Segmento asociado (cuenta para el contador) o {@code null}.
 */
public record Waypoint(FermiState fermiState, double x, double y, TrajectoryState state, BoundarySegment segment) {

    public Waypoint {
        Objects.requireNonNull(fermiState, "El estado de Fermi no puede ser nulo.");
        Objects.requireNonNull(state, "El estado de la trayectoria no puede ser nulo.");
    }

    public static Waypoint of(FermiState fermiState, double x, double y, TrajectoryState state) {
        return new Waypoint(fermiState, x, y, state, null);
    }

    public Optional<BoundarySegment> associatedSegment() {
        return Optional.ofNullable(segment);
    }
}
