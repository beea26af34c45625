package ballisticmc.config;

import ballisticmc.domain.trajectory.TrajectoryState;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Contenedor principal para todas las configuraciones de una simulación Monte Carlo.
 * Agrupa los parámetros de la banda (ángulo cristalino, campo), las probabilidades
 * de los contornos y los controles de ejecución.
 */
@Value
@Builder
@With
public class SimulationConfig {

    /**
     * Número de portadores inyectados (trayectorias independientes).
     */
    int injectionCount;

    /**
     * Semilla del generador pseudoaleatorio de la simulación.
     */
    long seed;

    /**
     * Ángulo del eje cristalino respecto al dispositivo, en radianes.
     */
    double crystalAngle;

    /**
     * Campo magnético. Escala el radio de las órbitas (r = k x z / B). No puede ser cero.
     */
    double magneticField;

    /**
     * Probabilidad de dispersión difusa en un borde (frente a reflexión especular).
     */
    @Builder.Default
    double pScatter = 1.0;

    /**
     * Probabilidad de que un contacto óhmico absorba al portador que lo alcanza.
     */
    @Builder.Default
    double pOhmicAbsorb = 1.0;

    /**
     * Capa desde la que se inyectan los portadores (contacto fuente).
     */
    @Builder.Default
    int injectionLayer = 1;

    /**
     * Estados que se guardan en cada trayectoria. No altera la dinámica, solo la memoria.
     */
    @Builder.Default
    Set<TrajectoryState> storedStates = Collections.unmodifiableSet(EnumSet.allOf(TrajectoryState.class));

    /**
     * Comprueba que la posición sigue dentro del dispositivo antes de cada paso.
     */
    boolean debug;

    /**
     * Máximo de pasos por trayectoria. 0 = sin límite.
     */
    long maxStepsPerTrajectory;

    /**
     * Desplazamiento con el que se retrae cada intersección hacia el origen del paso.
     */
    @Builder.Default
    double intersectionBias = 1e-10;

    /**
     * Diferencia máxima de distancia para considerar que dos intersecciones forman una esquina.
     */
    @Builder.Default
    double cornerTolerance = 1e-12;

    /**
     * Número de núcleos CPU a utilizar en los barridos de campo.
     */
    @Builder.Default
    int cpuProcessorCount = 1;

    /**
     * Valida los rangos de los parámetros.
     *
     * @throws IllegalArgumentException si algún parámetro está fuera de rango.
     */
    public void validate() {
        if (injectionCount <= 0) {
            throw new IllegalArgumentException("El número de inyecciones debe ser positivo.");
        }
        if (pScatter < 0.0 || pScatter > 1.0) {
            throw new IllegalArgumentException("pScatter debe estar en [0, 1]: " + pScatter);
        }
        if (pOhmicAbsorb < 0.0 || pOhmicAbsorb > 1.0) {
            throw new IllegalArgumentException("pOhmicAbsorb debe estar en [0, 1]: " + pOhmicAbsorb);
        }
        if (magneticField == 0.0 || Double.isNaN(magneticField)) {
            throw new IllegalArgumentException("El campo magnético debe ser distinto de cero.");
        }
        if (maxStepsPerTrajectory < 0) {
            throw new IllegalArgumentException("maxStepsPerTrajectory no puede ser negativo.");
        }
        if (intersectionBias < 0.0 || cornerTolerance < 0.0) {
            throw new IllegalArgumentException("Las tolerancias numéricas no pueden ser negativas.");
        }
        if (storedStates == null) {
            throw new IllegalArgumentException("storedStates no puede ser nulo.");
        }
    }

    public boolean isStepBounded() {
        return maxStepsPerTrajectory > 0;
    }

    /**
     * Configuración de referencia usada en pruebas: dispersión total y absorción total.
     */
    public static SimulationConfig getTestingSimulation() {
        return SimulationConfig.builder()
                .injectionCount(100)
                .seed(12345L)
                .crystalAngle(0.0)
                .magneticField(1.0)
                .pScatter(1.0)
                .pOhmicAbsorb(1.0)
                .build();
    }
}
