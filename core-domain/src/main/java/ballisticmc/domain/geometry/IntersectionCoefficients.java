package ballisticmc.domain.geometry;

import java.util.List;

/**
 * Coeficientes precalculados para el test vectorizado de intersección recta-recta.
 * <p>
 * Para cada segmento i: {@code px0/py0} es el punto inicial y {@code x23/y23} la
 * diferencia inicio - fin. Sigue la notación paramétrica estándar (t sobre el paso,
 * u sobre el segmento).
 */
public record IntersectionCoefficients(double[] px0, double[] py0, double[] x23, double[] y23) {

    public IntersectionCoefficients {
        if (px0.length != py0.length || px0.length != x23.length || px0.length != y23.length) {
            throw new IllegalArgumentException("Todos los arrays de coeficientes deben tener la misma longitud.");
        }
        px0 = px0.clone();
        py0 = py0.clone();
        x23 = x23.clone();
        y23 = y23.clone();
    }

    public static IntersectionCoefficients of(List<BoundarySegment> segments) {
        int n = segments.size();
        double[] px0 = new double[n];
        double[] py0 = new double[n];
        double[] x23 = new double[n];
        double[] y23 = new double[n];
        for (int i = 0; i < n; i++) {
            BoundarySegment s = segments.get(i);
            px0[i] = s.getX0();
            py0[i] = s.getY0();
            x23[i] = s.getX0() - s.getX1();
            y23[i] = s.getY0() - s.getY1();
        }
        return new IntersectionCoefficients(px0, py0, x23, y23);
    }

    @Override
    public double[] px0() {
        return px0.clone();
    }

    @Override
    public double[] py0() {
        return py0.clone();
    }

    @Override
    public double[] x23() {
        return x23.clone();
    }

    @Override
    public double[] y23() {
        return y23.clone();
    }

    public int size() {
        return px0.length;
    }

    public double px0(int i) {
        return px0[i];
    }

    public double py0(int i) {
        return py0[i];
    }

    public double x23(int i) {
        return x23[i];
    }

    public double y23(int i) {
        return y23[i];
    }
}
