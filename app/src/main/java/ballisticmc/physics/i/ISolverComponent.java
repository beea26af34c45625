package ballisticmc.physics.i;

/**
 * Contrato base para los componentes numéricos del motor de trayectorias.
 * Permite identificarlos en los logs sin depender de su implementación.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Specular", "Diffuse").
     */
    String getName();

    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
