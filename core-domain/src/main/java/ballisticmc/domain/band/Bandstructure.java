package ballisticmc.domain.band;

import ballisticmc.domain.trajectory.FermiState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Parametrización de la órbita real de un portador a partir de la superficie de Fermi.
 * <p>
 * La superficie k se rota el ángulo cristalino y se transforma al espacio real con
 * r = (k_y, -k_x) / B. El polígono resultante es cerrado ({@code r[N] == r[0]}) y cada
 * cuerda {@code dr[j] = r[j+1] - r[j]} es el desplazamiento de un paso balístico
 * completo en el bin j.
 * <p>
 * Una vez construida es inmutable y puede compartirse entre trayectorias.
 */
@Slf4j
public final class Bandstructure {

    private final double[] rx;
    private final double[] ry;
    private final double[] drx;
    private final double[] dry;
    @Getter
    private final int binCount;
    @Getter
    private final double crystalAngle;
    @Getter
    private final double magneticField;

    public Bandstructure(FermiSurface surface, double crystalAngle, double magneticField) {
        if (magneticField == 0.0 || Double.isNaN(magneticField)) {
            throw new IllegalArgumentException("El campo magnético debe ser distinto de cero.");
        }
        FermiSurface rotated = surface.rotated(crystalAngle);
        this.binCount = rotated.size();
        this.crystalAngle = crystalAngle;
        this.magneticField = magneticField;

        this.rx = new double[binCount + 1];
        this.ry = new double[binCount + 1];
        for (int j = 0; j < binCount; j++) {
            rx[j] = rotated.kyAt(j) / magneticField;
            ry[j] = -rotated.kxAt(j) / magneticField;
        }
        rx[binCount] = rx[0];
        ry[binCount] = ry[0];

        this.drx = new double[binCount];
        this.dry = new double[binCount];
        for (int j = 0; j < binCount; j++) {
            drx[j] = rx[j + 1] - rx[j];
            dry[j] = ry[j + 1] - ry[j];
            if (drx[j] == 0.0 && dry[j] == 0.0) {
                throw new IllegalArgumentException("La superficie de Fermi tiene puntos repetidos consecutivos (bin " + j + ").");
            }
        }
        log.debug("Bandstructure construida: {} bins, phi={}, B={}", binCount, crystalAngle, magneticField);
    }

    public double getRx(int index) {
        return rx[index];
    }

    public double getRy(int index) {
        return ry[index];
    }

    public double getDrX(int bin) {
        return drx[bin];
    }

    public double getDrY(int bin) {
        return dry[bin];
    }

    /**
     * Desplazamiento x del paso que consume la fracción restante del bin actual.
     */
    public double stepX(FermiState state) {
        return state.fraction() * drx[state.bin()];
    }

    public double stepY(FermiState state) {
        return state.fraction() * dry[state.bin()];
    }

    /**
     * Punto de la superficie (espacio real) correspondiente al estado: el inicio de la
     * cuerda más la parte ya recorrida.
     */
    public double fermiPointX(FermiState state) {
        return rx[state.bin()] + (1.0 - state.fraction()) * drx[state.bin()];
    }

    public double fermiPointY(FermiState state) {
        return ry[state.bin()] + (1.0 - state.fraction()) * dry[state.bin()];
    }

    /**
     * Distribución de inyección para un contorno cuya normal interior forma el ángulo
     * {@code normalAngle}. Cada cuerda pesa según su proyección sobre la normal
     * (flujo entrante); las cuerdas que salen del dispositivo pesan cero.
     *
     * @throws IllegalStateException si ninguna cuerda entra en el dispositivo.
     */
    public InjectionDistribution injectionDistribution(double normalAngle) {
        double nx = Math.cos(normalAngle);
        double ny = Math.sin(normalAngle);
        double[] weights = new double[binCount];
        double total = 0.0;
        for (int j = 0; j < binCount; j++) {
            weights[j] = Math.max(0.0, drx[j] * nx + dry[j] * ny);
            total += weights[j];
        }
        if (total <= 0.0) {
            throw new IllegalStateException("Ninguna cuerda de la superficie de Fermi entra por la normal de ángulo " + normalAngle);
        }
        return InjectionDistribution.fromWeights(weights);
    }
}
