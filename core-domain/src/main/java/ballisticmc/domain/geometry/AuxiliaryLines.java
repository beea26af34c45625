package ballisticmc.domain.geometry;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Líneas auxiliares (óhmicas) que solo cuentan cruces y nunca alteran la dinámica.
 * <p>
 * Sus capas se desplazan más allá de las del dispositivo para que ambos espacios
 * de numeración no colisionen en los contadores por capa.
 */
public final class AuxiliaryLines {

    @Getter
    private final List<BoundarySegment> lines;
    @Getter
    private final IntersectionCoefficients coefficients;

    public AuxiliaryLines(List<BoundarySegment> lines) {
        this.lines = List.copyOf(lines);
        this.coefficients = IntersectionCoefficients.of(this.lines);
    }

    public static AuxiliaryLines none() {
        return new AuxiliaryLines(List.of());
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * Devuelve nuevas líneas con cada capa desplazada en {@code offset}.
     */
    public AuxiliaryLines withLayerOffset(int offset) {
        List<BoundarySegment> shifted = new ArrayList<>(lines.size());
        for (BoundarySegment line : lines) {
            shifted.add(line.withLayer(line.getLayer() + offset));
        }
        return new AuxiliaryLines(shifted);
    }
}
