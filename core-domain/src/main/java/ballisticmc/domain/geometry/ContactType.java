package ballisticmc.domain.geometry;

/**
 * Clasificación física de un segmento según su capa.
 * <ul>
 * <li>{@link #DEVICE_BOUNDARY}: borde exterior del dispositivo (capa 0). Dispersa o refleja.</li>
 * <li>{@link #GROUNDED_CONTACT}: contacto a tierra (capa 2). Absorbe y termina la trayectoria.</li>
 * <li>{@link #FLOATING_CONTACT}: cualquier otra capa. Absorbe y reinyecta en la misma capa.</li>
 * </ul>
 */
public enum ContactType {
    DEVICE_BOUNDARY,
    GROUNDED_CONTACT,
    FLOATING_CONTACT;

    public static final int DEVICE_BOUNDARY_LAYER = 0;
    public static final int GROUNDED_LAYER = 2;

    public static ContactType fromLayer(int layer) {
        if (layer == DEVICE_BOUNDARY_LAYER) {
            return DEVICE_BOUNDARY;
        }
        if (layer == GROUNDED_LAYER) {
            return GROUNDED_CONTACT;
        }
        return FLOATING_CONTACT;
    }
}
