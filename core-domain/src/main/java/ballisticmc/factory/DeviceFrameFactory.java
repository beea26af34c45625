package ballisticmc.factory;

import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.geometry.DeviceFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fábrica de instancias de {@link DeviceFrame} a partir de vértices.
 * <p>
 * Garantiza la orientación antihoraria del anillo para que todas las normales de
 * los segmentos apunten hacia el interior del dispositivo, independientemente del
 * sentido en que se den los vértices.
 */
@Slf4j
public final class DeviceFrameFactory {

    private DeviceFrameFactory() {
    }

    /**
     * Crea un dispositivo poligonal. El segmento i une el vértice i con el i+1
     * (cíclicamente) y pertenece a la capa {@code layers[i]}.
     *
     * @param xs     Coordenadas x de los vértices.
     * @param ys     Coordenadas y de los vértices.
     * @param layers Capa de cada segmento.
     * @return Un dispositivo con normales interiores.
     */
    public static DeviceFrame polygon(double[] xs, double[] ys, int[] layers) {
        if (xs.length != ys.length || xs.length != layers.length) {
            throw new IllegalArgumentException("xs, ys y layers deben tener la misma longitud.");
        }
        if (xs.length < 3) {
            throw new IllegalArgumentException("Un polígono necesita al menos 3 vértices.");
        }

        List<BoundarySegment> segments = new ArrayList<>(xs.length);
        for (int i = 0; i < xs.length; i++) {
            int next = (i + 1) % xs.length;
            segments.add(new BoundarySegment(xs[i], ys[i], xs[next], ys[next], layers[i]));
        }

        if (signedArea(xs, ys) < 0.0) {
            // Recorrido horario: invertimos el anillo para que el interior quede a la izquierda
            List<BoundarySegment> reversed = new ArrayList<>(segments.size());
            for (BoundarySegment segment : segments) {
                reversed.add(segment.reversed());
            }
            Collections.reverse(reversed);
            segments = reversed;
        }

        DeviceFrame frame = new DeviceFrame(segments);
        log.debug("Dispositivo poligonal creado: {} segmentos, área {}", segments.size(), frame.getArea());
        return frame;
    }

    /**
     * Crea un rectángulo con esquina inferior izquierda en el origen.
     * Las capas se dan en el orden inferior, derecho, superior, izquierdo.
     */
    public static DeviceFrame rectangle(double width, double height,
                                        int bottomLayer, int rightLayer, int topLayer, int leftLayer) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Las dimensiones del rectángulo deben ser positivas.");
        }
        return polygon(
                new double[]{0.0, width, width, 0.0},
                new double[]{0.0, 0.0, height, height},
                new int[]{bottomLayer, rightLayer, topLayer, leftLayer});
    }

    private static double signedArea(double[] xs, double[] ys) {
        double area = 0.0;
        for (int i = 0; i < xs.length; i++) {
            int next = (i + 1) % xs.length;
            area += xs[i] * ys[next] - xs[next] * ys[i];
        }
        return area / 2.0;
    }
}
