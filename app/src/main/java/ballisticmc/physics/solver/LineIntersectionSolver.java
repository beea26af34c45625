package ballisticmc.physics.solver;

import ballisticmc.domain.geometry.IntersectionCoefficients;

/**
 * Intersección paramétrica de dos rectas.
 * <p>
 * Notación de índice cero: el paso va de P (punto 0) a P' (punto 1) y el segmento
 * de su punto 2 a su punto 3. {@code t} es el parámetro sobre el paso y {@code u}
 * sobre el segmento; ambos en [0, 1] significa que los segmentos se cortan.
 * Rectas paralelas o colineales no se cortan nunca: devuelven {@link #PARALLEL}.
 */
public final class LineIntersectionSolver {

    /**
     * Parámetros de la intersección. Para rectas paralelas ambos son NaN.
     */
    public record LineParameters(double t, double u) {

        public boolean isParallel() {
            return Double.isNaN(t) || Double.isNaN(u);
        }

        /**
         * Ambos parámetros en [0, 1]. Falso siempre para rectas paralelas.
         */
        public boolean isWithinBothSegments() {
            return 0 <= t && t <= 1 && 0 <= u && u <= 1;
        }
    }

    public static final LineParameters PARALLEL = new LineParameters(Double.NaN, Double.NaN);

    /**
     * Prohibido construir esta clase utilidad
     */
    private LineIntersectionSolver() {
    }

    /**
     * Resuelve t y u a partir de las diferencias precalculadas.
     *
     * @param x01 x0 - x1 (menos el desplazamiento del paso)
     * @param y01 y0 - y1
     * @param x02 x0 - x2 (origen del paso menos inicio del segmento)
     * @param y02 y0 - y2
     * @param x23 x2 - x3 (inicio menos fin del segmento)
     * @param y23 y2 - y3
     */
    public static LineParameters solve(double x01, double y01, double x02, double y02, double x23, double y23) {
        double denominator = x01 * y23 - y01 * x23;
        if (denominator == 0.0) {
            return PARALLEL;
        }
        double t = (x02 * y23 - y02 * x23) / denominator;
        double u = -(x01 * y02 - y01 * x02) / denominator;
        return new LineParameters(t, u);
    }

    /**
     * Resuelve la intersección del paso (x, y)->(xNew, yNew) con el segmento i del lote.
     */
    public static LineParameters solve(double x, double y, double xNew, double yNew,
                                       IntersectionCoefficients coefficients, int i) {
        return solve(x - xNew, y - yNew,
                x - coefficients.px0(i), y - coefficients.py0(i),
                coefficients.x23(i), coefficients.y23(i));
    }

    /**
     * Intersección de dos rectas infinitas dadas por dos puntos cada una.
     * {@code t} se mide sobre la primera recta y {@code u} sobre la segunda.
     */
    public static LineParameters solveLines(double x0, double y0, double x1, double y1,
                                            double x2, double y2, double x3, double y3) {
        return solve(x0 - x1, y0 - y1, x0 - x2, y0 - y2, x2 - x3, y2 - y3);
    }
}
