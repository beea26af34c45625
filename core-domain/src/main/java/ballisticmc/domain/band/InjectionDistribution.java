package ballisticmc.domain.band;

import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Distribución de probabilidad de inyección sobre los bins de Fermi y su acumulada.
 * <p>
 * Invariante: la acumulada es no decreciente y termina en 1 (con tolerancia).
 */
public record InjectionDistribution(double[] probabilities, double[] cumulative) {

    private static final double NORMALIZATION_TOLERANCE = 1e-9;

    public InjectionDistribution {
        if (probabilities.length == 0 || probabilities.length != cumulative.length) {
            throw new IllegalArgumentException("Las distribuciones deben tener la misma longitud no nula.");
        }
        for (int i = 1; i < cumulative.length; i++) {
            if (cumulative[i] < cumulative[i - 1]) {
                throw new IllegalArgumentException("La distribución acumulada debe ser no decreciente (bin " + i + ").");
            }
        }
        if (Math.abs(cumulative[cumulative.length - 1] - 1.0) > NORMALIZATION_TOLERANCE) {
            throw new IllegalArgumentException("La distribución acumulada debe terminar en 1: " + cumulative[cumulative.length - 1]);
        }
        probabilities = probabilities.clone();
        cumulative = cumulative.clone();
    }

    /**
     * Normaliza unos pesos no negativos y calcula la acumulada.
     *
     * @throws IllegalArgumentException si algún peso es negativo o todos son cero.
     */
    public static InjectionDistribution fromWeights(double[] weights) {
        double total = 0.0;
        for (double w : weights) {
            if (w < 0.0 || Double.isNaN(w)) {
                throw new IllegalArgumentException("Los pesos de inyección no pueden ser negativos.");
            }
            total += w;
        }
        if (total <= 0.0) {
            throw new IllegalArgumentException("Los pesos de inyección suman cero.");
        }

        double[] probabilities = new double[weights.length];
        double[] cumulative = new double[weights.length];
        double running = 0.0;
        for (int i = 0; i < weights.length; i++) {
            probabilities[i] = weights[i] / total;
            running += probabilities[i];
            cumulative[i] = running;
        }
        return new InjectionDistribution(probabilities, cumulative);
    }

    @Override
    public double[] probabilities() {
        return probabilities.clone();
    }

    @Override
    public double[] cumulative() {
        return cumulative.clone();
    }

    public int size() {
        return probabilities.length;
    }

    public double probabilityAt(int bin) {
        return probabilities[bin];
    }

    /**
     * Muestrea un bin: el primero cuya acumulada supera un valor uniforme.
     * Los bins con probabilidad cero nunca se eligen.
     */
    public int sampleBin(RandomGenerator rng) {
        double target = rng.nextDouble() * cumulative[cumulative.length - 1];
        int low = 0;
        int high = cumulative.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulative[mid] > target) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    /**
     * Producto punto a punto con otra distribución, renormalizado a 1.
     * Aproxima la intersección de los conos de aceptación de dos segmentos.
     *
     * @return la distribución combinada, o vacío si los soportes no se solapan.
     */
    public Optional<InjectionDistribution> combine(InjectionDistribution other) {
        if (other.size() != size()) {
            throw new IllegalArgumentException("No se pueden combinar distribuciones de distinto tamaño.");
        }
        double[] product = new double[size()];
        double total = 0.0;
        for (int i = 0; i < product.length; i++) {
            product[i] = probabilities[i] * other.probabilities[i];
            total += product[i];
        }
        if (total <= 0.0) {
            return Optional.empty();
        }
        return Optional.of(fromWeights(product));
    }
}
