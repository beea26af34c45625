package ballisticmc.domain.trajectory;

/**
 * Etiqueta de cada punto registrado en una trayectoria.
 * Las variantes con prefijo C corresponden a impactos en esquina (dos segmentos a la vez).
 */
public enum TrajectoryState {
    INJECTING,   // Portador colocado en un contacto
    PROPAGATE,   // Paso libre completo
    COLLISION,   // Impacto con un único segmento
    SCATTER,     // Dispersión difusa tras el impacto
    REFLECT,     // Reflexión especular tras el impacto
    ABSORBED,    // Absorbido por un contacto
    CCOLLISION,
    CSCATTER,
    CREFLECT,
    CABSORBED,
    ERROR;       // Fuera del dispositivo o límite de pasos alcanzado

    public boolean isAbsorption() {
        return this == ABSORBED || this == CABSORBED;
    }
}
