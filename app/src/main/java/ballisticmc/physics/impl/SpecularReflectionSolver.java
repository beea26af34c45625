package ballisticmc.physics.impl;

import ballisticmc.domain.band.Bandstructure;
import ballisticmc.domain.geometry.BoundarySegment;
import ballisticmc.domain.trajectory.FermiState;
import ballisticmc.physics.i.IReflectionSolver;
import ballisticmc.physics.solver.LineIntersectionSolver;
import ballisticmc.physics.solver.LineIntersectionSolver.LineParameters;

/**
 * Reflexión especular sobre la superficie de Fermi.
 * <p>
 * Se conserva la componente del momento paralela a la pared. En el espacio real
 * esto equivale a desplazarse por la órbita a lo largo de una recta paralela al
 * segmento: el estado reflejado es el otro corte de esa recta con el polígono.
 */
public class SpecularReflectionSolver implements IReflectionSolver {

    private static final double COINCIDENCE_TOLERANCE = 1e-12;

    private final Bandstructure bandstructure;

    public SpecularReflectionSolver(Bandstructure bandstructure) {
        this.bandstructure = bandstructure;
    }

    @Override
    public String getName() {
        return "Specular";
    }

    @Override
    public String getDescription() {
        return "Reflexión especular conservando el momento tangencial.";
    }

    /**
     * @throws SpecularReflectionException si ninguna otra cuerda corta la recta.
     */
    @Override
    public FermiState reflect(FermiState incoming, BoundarySegment segment) {
        double qx = bandstructure.fermiPointX(incoming);
        double qy = bandstructure.fermiPointY(incoming);
        double directionX = segment.getX1() - segment.getX0();
        double directionY = segment.getY1() - segment.getY0();

        int bestBin = -1;
        double bestFraction = 0.0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int j = 0; j < bandstructure.getBinCount(); j++) {
            if (j == incoming.bin()) {
                continue;
            }
            double startX = bandstructure.getRx(j);
            double startY = bandstructure.getRy(j);
            double endX = bandstructure.getRx(j + 1);
            double endY = bandstructure.getRy(j + 1);
            LineParameters params = LineIntersectionSolver.solveLines(
                    qx, qy, qx + directionX, qy + directionY, startX, startY, endX, endY);
            if (params.isParallel() || params.u() < 0.0 || params.u() > 1.0) {
                continue;
            }
            double crossX = startX + params.u() * (endX - startX);
            double crossY = startY + params.u() * (endY - startY);
            if (Math.hypot(crossX - qx, crossY - qy) <= COINCIDENCE_TOLERANCE) {
                continue;
            }
            double distance = Math.hypot(startX - qx, startY - qy);
            if (distance < bestDistance) {
                bestDistance = distance;
                bestBin = j;
                bestFraction = 1.0 - params.u();
            }
        }

        if (bestBin < 0) {
            throw new SpecularReflectionException(incoming, segment);
        }
        return new FermiState(bestBin, Math.min(1.0, Math.max(0.0, bestFraction)));
    }
}
