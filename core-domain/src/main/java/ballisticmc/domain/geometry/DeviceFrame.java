package ballisticmc.domain.geometry;

import ballisticmc.domain.band.Bandstructure;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Contorno cerrado e inmutable de la región simulada.
 * <p>
 * Los segmentos forman un anillo: el final de cada uno coincide con el inicio del
 * siguiente. Además de la lista ordenada de segmentos ofrece el test de pertenencia
 * de un punto (polígono JTS), los coeficientes para el test vectorizado de
 * intersección y el muestreo de puntos de inyección por capa.
 * <p>
 * El anillo debe recorrerse en sentido antihorario para que las normales apunten
 * hacia el interior. {@link ballisticmc.factory.DeviceFrameFactory} reorienta la
 * entrada; este constructor rechaza los anillos horarios.
 */
@Slf4j
public final class DeviceFrame {

    private static final double RING_TOLERANCE = 1e-9;
    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    @Getter
    private final List<BoundarySegment> segments;
    @Getter
    private final IntersectionCoefficients coefficients;
    private final Polygon body;
    private final Map<Integer, List<BoundarySegment>> segmentsByLayer;

    public DeviceFrame(List<BoundarySegment> segments) {
        Objects.requireNonNull(segments, "La lista de segmentos no puede ser nula.");
        if (segments.size() < 3) {
            throw new IllegalArgumentException("Un dispositivo necesita al menos 3 segmentos, recibidos: " + segments.size());
        }
        validateRing(segments);

        this.segments = List.copyOf(segments);
        Coordinate[] ring = ringCoordinates(this.segments);
        if (!Orientation.isCCW(ring)) {
            throw new IllegalArgumentException(
                    "El contorno debe recorrerse en sentido antihorario para que las normales apunten hacia dentro.");
        }
        this.coefficients = IntersectionCoefficients.of(this.segments);
        this.body = buildPolygon(ring);

        Map<Integer, List<BoundarySegment>> byLayer = new LinkedHashMap<>();
        for (BoundarySegment segment : this.segments) {
            byLayer.computeIfAbsent(segment.getLayer(), k -> new ArrayList<>()).add(segment);
        }
        byLayer.replaceAll((layer, list) -> Collections.unmodifiableList(list));
        this.segmentsByLayer = Collections.unmodifiableMap(byLayer);
    }

    /**
     * Devuelve una copia del dispositivo en la que cada segmento lleva la distribución
     * de inyección correspondiente a su orientación. El dispositivo original no cambia.
     */
    public DeviceFrame withInjection(Bandstructure bandstructure) {
        List<BoundarySegment> copies = new ArrayList<>(segments.size());
        for (BoundarySegment segment : segments) {
            copies.add(segment.withInjection(bandstructure.injectionDistribution(segment.getNormalAngle())));
        }
        return new DeviceFrame(copies);
    }

    /**
     * Indica si el punto está dentro del dispositivo o sobre su contorno.
     */
    public boolean contains(double x, double y) {
        return body.intersects(GEOMETRY_FACTORY.createPoint(new Coordinate(x, y)));
    }

    public int getMaxLayer() {
        int max = 0;
        for (int layer : segmentsByLayer.keySet()) {
            max = Math.max(max, layer);
        }
        return max;
    }

    public List<BoundarySegment> getSegmentsOfLayer(int layer) {
        return segmentsByLayer.getOrDefault(layer, List.of());
    }

    public double getArea() {
        return body.getArea();
    }

    /**
     * Muestrea un punto de entrada sobre la capa indicada. El segmento se elige con
     * probabilidad proporcional a su longitud y el punto es uniforme sobre él.
     *
     * @param layer Capa de inyección.
     * @param rng   Generador de la simulación.
     * @return El punto y su segmento.
     * @throws IllegalArgumentException si la capa no tiene segmentos.
     */
    public InjectionSite sampleInjection(int layer, RandomGenerator rng) {
        List<BoundarySegment> candidates = getSegmentsOfLayer(layer);
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No hay segmentos en la capa de inyección " + layer);
        }

        double totalLength = 0.0;
        for (BoundarySegment candidate : candidates) {
            totalLength += candidate.getLength();
        }

        double target = rng.nextDouble() * totalLength;
        BoundarySegment chosen = candidates.get(candidates.size() - 1);
        double accumulated = 0.0;
        for (BoundarySegment candidate : candidates) {
            accumulated += candidate.getLength();
            if (target < accumulated) {
                chosen = candidate;
                break;
            }
        }

        double u = rng.nextDouble();
        return new InjectionSite(chosen.pointX(u), chosen.pointY(u), chosen);
    }

    private static void validateRing(List<BoundarySegment> segments) {
        for (int i = 0; i < segments.size(); i++) {
            BoundarySegment current = segments.get(i);
            BoundarySegment next = segments.get((i + 1) % segments.size());
            double gap = Math.hypot(current.getX1() - next.getX0(), current.getY1() - next.getY0());
            if (gap > RING_TOLERANCE) {
                throw new IllegalArgumentException(String.format(
                        "El contorno no es cerrado: el segmento %d termina en (%.6g, %.6g) y el %d empieza en (%.6g, %.6g).",
                        i, current.getX1(), current.getY1(), (i + 1) % segments.size(), next.getX0(), next.getY0()));
            }
        }
    }

    private static Coordinate[] ringCoordinates(List<BoundarySegment> segments) {
        Coordinate[] ring = new Coordinate[segments.size() + 1];
        for (int i = 0; i < segments.size(); i++) {
            ring[i] = new Coordinate(segments.get(i).getX0(), segments.get(i).getY0());
        }
        ring[segments.size()] = new Coordinate(ring[0]);
        return ring;
    }

    private static Polygon buildPolygon(Coordinate[] ring) {
        Polygon polygon = GEOMETRY_FACTORY.createPolygon(ring);
        if (!polygon.isValid()) {
            log.warn("El polígono del dispositivo no es simple; el test de pertenencia puede ser poco fiable.");
        }
        return polygon;
    }
}
