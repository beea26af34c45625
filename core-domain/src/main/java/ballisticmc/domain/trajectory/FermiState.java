package ballisticmc.domain.trajectory;

/**
 * Posición sobre la superficie de Fermi discretizada (n_f).
 * <p>
 * {@code bin} identifica la cuerda actual y {@code fraction} la parte de esa cuerda
 * que queda por recorrer: 1 significa recién llegado al bin, un valor menor indica
 * que el paso anterior fue truncado por un contorno.
 *
 * @param bin      Índice de la cuerda, en [0, N).
 * @param fraction Fracción restante de la cuerda, en [0, 1].
 */
public record FermiState(int bin, double fraction) {

    public FermiState {
        if (bin < 0) {
            throw new IllegalArgumentException("El índice de bin no puede ser negativo: " + bin);
        }
        if (Double.isNaN(fraction) || fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("La fracción debe estar en [0, 1]: " + fraction);
        }
    }

    /**
     * Estado al inicio de un bin, listo para recorrer la cuerda completa.
     */
    public static FermiState atBin(int bin) {
        return new FermiState(bin, 1.0);
    }

    /**
     * Avanza al siguiente bin de forma cíclica.
     */
    public FermiState next(int binCount) {
        return atBin((bin + 1) % binCount);
    }
}
