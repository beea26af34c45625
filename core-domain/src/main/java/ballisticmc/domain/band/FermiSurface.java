package ballisticmc.domain.band;

import java.util.Arrays;

/**
 * Descripción discreta de la superficie de Fermi como polígono cerrado en el espacio k.
 * <p>
 * Si el último punto repite el primero se descarta, de modo que {@code size()} es
 * siempre el número de bins (cuerdas) distintos.
 *
 * @param kx Componentes x de los vectores de onda.
 * @param ky Componentes y de los vectores de onda.
 */
public record FermiSurface(double[] kx, double[] ky) {

    private static final double CLOSURE_TOLERANCE = 1e-12;

    public FermiSurface {
        if (kx == null || ky == null) {
            throw new IllegalArgumentException("Los vectores de onda no pueden ser nulos.");
        }
        if (kx.length != ky.length) {
            throw new IllegalArgumentException("kx y ky deben tener la misma longitud.");
        }
        int n = kx.length;
        if (n > 1 && Math.abs(kx[0] - kx[n - 1]) < CLOSURE_TOLERANCE && Math.abs(ky[0] - ky[n - 1]) < CLOSURE_TOLERANCE) {
            n--;
        }
        if (n < 3) {
            throw new IllegalArgumentException("La superficie de Fermi necesita al menos 3 puntos distintos.");
        }
        kx = Arrays.copyOf(kx, n);
        ky = Arrays.copyOf(ky, n);
    }

    @Override
    public double[] kx() {
        return kx.clone();
    }

    @Override
    public double[] ky() {
        return ky.clone();
    }

    public double kxAt(int bin) {
        return kx[bin];
    }

    public double kyAt(int bin) {
        return ky[bin];
    }

    public int size() {
        return kx.length;
    }

    /**
     * Rota la superficie un ángulo {@code angle} (radianes) alrededor del origen.
     */
    public FermiSurface rotated(double angle) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        double[] rx = new double[kx.length];
        double[] ry = new double[ky.length];
        for (int i = 0; i < kx.length; i++) {
            rx[i] = kx[i] * cos - ky[i] * sin;
            ry[i] = kx[i] * sin + ky[i] * cos;
        }
        return new FermiSurface(rx, ry);
    }
}
