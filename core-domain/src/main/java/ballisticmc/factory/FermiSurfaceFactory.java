package ballisticmc.factory;

import ballisticmc.domain.band.FermiSurface;
import lombok.extern.slf4j.Slf4j;

/**
 * Superficies de Fermi paramétricas de uso habitual.
 */
@Slf4j
public final class FermiSurfaceFactory {

    private FermiSurfaceFactory() {
    }

    public static FermiSurface circle(double radius, int bins) {
        return ellipse(radius, radius, bins);
    }

    public static FermiSurface ellipse(double semiAxisX, double semiAxisY, int bins) {
        return superellipse(semiAxisX, semiAxisY, 2.0, bins);
    }

    /**
     * Superelipse |kx/a|^p + |ky/b|^p = 1 muestreada en {@code bins} ángulos uniformes.
     * Para p menor que 1 la curva deja de ser convexa y la reflexión especular puede fallar.
     *
     * @param semiAxisX Semieje a.
     * @param semiAxisY Semieje b.
     * @param exponent  Exponente p (2 = elipse; valores grandes tienden a un rectángulo).
     * @param bins      Número de bins de la discretización.
     */
    public static FermiSurface superellipse(double semiAxisX, double semiAxisY, double exponent, int bins) {
        if (semiAxisX <= 0 || semiAxisY <= 0) {
            throw new IllegalArgumentException("Los semiejes deben ser positivos.");
        }
        if (exponent <= 0) {
            throw new IllegalArgumentException("El exponente de la superelipse debe ser positivo.");
        }
        if (bins < 3) {
            throw new IllegalArgumentException("Se necesitan al menos 3 bins.");
        }
        if (exponent < 1.0) {
            log.warn("Superelipse no convexa (p={}). La reflexión especular no está garantizada.", exponent);
        }

        double[] kx = new double[bins];
        double[] ky = new double[bins];
        double power = 2.0 / exponent;
        for (int j = 0; j < bins; j++) {
            double theta = 2.0 * Math.PI * j / bins;
            double c = Math.cos(theta);
            double s = Math.sin(theta);
            kx[j] = semiAxisX * Math.signum(c) * Math.pow(Math.abs(c), power);
            ky[j] = semiAxisY * Math.signum(s) * Math.pow(Math.abs(s), power);
        }
        return new FermiSurface(kx, ky);
    }
}
