package ballisticmc.domain.geometry;

import ballisticmc.domain.band.InjectionDistribution;
import lombok.Getter;

/**
 * Segmento orientado del contorno del dispositivo (o línea auxiliar de conteo).
 * <p>
 * La normal apunta hacia el interior de la región simulada: un paso que la
 * atraviesa con producto escalar negativo contra ella viaja hacia la pared.
 * Las instancias son inmutables; la distribución de inyección se adjunta
 * creando una copia con {@link #withInjection(InjectionDistribution)}.
 * <p>
 * La igualdad es por identidad: dos segmentos geométricamente iguales son
 * contadores distintos.
 */
@Getter
public final class BoundarySegment {

    private final double x0;
    private final double y0;
    private final double x1;
    private final double y1;
    private final int layer;
    private final double normalX;
    private final double normalY;
    private final InjectionDistribution injection;

    /**
     * Crea un segmento cuya normal interior es la normal izquierda de (x0,y0)->(x1,y1),
     * es decir, el interior queda a la izquierda (recorrido antihorario).
     */
    public BoundarySegment(double x0, double y0, double x1, double y1, int layer) {
        this(x0, y0, x1, y1, layer, leftNormalX(x0, y0, x1, y1), leftNormalY(x0, y0, x1, y1), null);
    }

    private BoundarySegment(double x0, double y0, double x1, double y1, int layer,
                            double normalX, double normalY, InjectionDistribution injection) {
        if (x0 == x1 && y0 == y1) {
            throw new IllegalArgumentException(String.format(
                    "Segmento degenerado: ambos extremos son (%.6g, %.6g).", x0, y0));
        }
        if (layer < 0) {
            throw new IllegalArgumentException("La capa no puede ser negativa: " + layer);
        }
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
        this.layer = layer;
        this.normalX = normalX;
        this.normalY = normalY;
        this.injection = injection;
    }

    public BoundarySegment withInjection(InjectionDistribution injection) {
        return new BoundarySegment(x0, y0, x1, y1, layer, normalX, normalY, injection);
    }

    public BoundarySegment withLayer(int layer) {
        return new BoundarySegment(x0, y0, x1, y1, layer, normalX, normalY, injection);
    }

    /**
     * Copia con la orientación invertida (y por tanto la normal opuesta).
     */
    public BoundarySegment reversed() {
        return new BoundarySegment(x1, y1, x0, y0, layer, -normalX, -normalY, injection);
    }

    public ContactType getContactType() {
        return ContactType.fromLayer(layer);
    }

    /**
     * Ángulo de la normal interior, en radianes.
     */
    public double getNormalAngle() {
        return Math.atan2(normalY, normalX);
    }

    public double getLength() {
        return Math.hypot(x1 - x0, y1 - y0);
    }

    public double getDirectionX() {
        return (x1 - x0) / getLength();
    }

    public double getDirectionY() {
        return (y1 - y0) / getLength();
    }

    public boolean hasInjection() {
        return injection != null;
    }

    /**
     * Devuelve la distribución de inyección.
     *
     * @throws IllegalStateException si el segmento todavía no tiene distribución.
     */
    public InjectionDistribution requireInjection() {
        if (injection == null) {
            throw new IllegalStateException("El segmento " + this + " no tiene distribución de inyección.");
        }
        return injection;
    }

    /**
     * Punto del segmento en el parámetro u (0 = inicio, 1 = fin).
     */
    public double pointX(double u) {
        return x0 + u * (x1 - x0);
    }

    public double pointY(double u) {
        return y0 + u * (y1 - y0);
    }

    private static double leftNormalX(double x0, double y0, double x1, double y1) {
        return -(y1 - y0) / Math.hypot(x1 - x0, y1 - y0);
    }

    private static double leftNormalY(double x0, double y0, double x1, double y1) {
        return (x1 - x0) / Math.hypot(x1 - x0, y1 - y0);
    }

    @Override
    public String toString() {
        return String.format("BoundarySegment[(%.4g, %.4g)->(%.4g, %.4g), capa=%d]", x0, y0, x1, y1, layer);
    }
}
