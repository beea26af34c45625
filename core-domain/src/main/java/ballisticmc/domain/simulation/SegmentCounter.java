package ballisticmc.domain.simulation;

import ballisticmc.domain.geometry.BoundarySegment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Contador de cruces por segmento (o línea auxiliar).
 * <p>
 * Las claves se comparan por identidad y se conservan en orden de registro. Solo se
 * incrementan segmentos registrados de antemano; el resto se ignora. Es la única
 * estructura mutable de una ejecución y no es thread-safe: en ejecución paralela
 * cada trabajador mantiene el suyo y se combinan con {@link #merge(SegmentCounter)}.
 */
public final class SegmentCounter {

    private final Map<BoundarySegment, Integer> order = new IdentityHashMap<>();
    private final List<BoundarySegment> segments = new ArrayList<>();
    private long[] counts = new long[0];

    /**
     * Registra los segmentos con contador a cero. Un segmento ya registrado se ignora.
     */
    public void registerAll(Collection<BoundarySegment> toRegister) {
        for (BoundarySegment segment : toRegister) {
            register(segment);
        }
    }

    public void register(BoundarySegment segment) {
        if (order.containsKey(segment)) {
            return;
        }
        order.put(segment, segments.size());
        segments.add(segment);
        long[] grown = new long[segments.size()];
        System.arraycopy(counts, 0, grown, 0, counts.length);
        counts = grown;
    }

    /**
     * Posición de registro del segmento, o -1 si no está registrado.
     */
    public int indexOf(BoundarySegment segment) {
        Integer index = order.get(segment);
        return index == null ? -1 : index;
    }

    public boolean isRegistered(BoundarySegment segment) {
        return order.containsKey(segment);
    }

    /**
     * Incrementa en uno el contador del segmento, si está registrado.
     *
     * @return true si el segmento estaba registrado.
     */
    public boolean increment(BoundarySegment segment) {
        Integer index = order.get(segment);
        if (index == null) {
            return false;
        }
        counts[index]++;
        return true;
    }

    public long get(BoundarySegment segment) {
        Integer index = order.get(segment);
        if (index == null) {
            throw new IllegalArgumentException("Segmento no registrado: " + segment);
        }
        return counts[index];
    }

    public long total() {
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        return total;
    }

    /**
     * Suma de los contadores agrupada por capa, ordenada por capa.
     */
    public Map<Integer, Long> totalsByLayer() {
        Map<Integer, Long> totals = new TreeMap<>();
        for (int i = 0; i < segments.size(); i++) {
            totals.merge(segments.get(i).getLayer(), counts[i], Long::sum);
        }
        return totals;
    }

    /**
     * Suma los contadores de otro contador parcial. Los segmentos desconocidos se registran.
     */
    public void merge(SegmentCounter other) {
        for (int i = 0; i < other.segments.size(); i++) {
            BoundarySegment segment = other.segments.get(i);
            register(segment);
            counts[order.get(segment)] += other.counts[i];
        }
    }

    public List<BoundarySegment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    /**
     * Copia de solo lectura segmento -> contador en orden de registro.
     */
    public Map<BoundarySegment, Long> asMap() {
        Map<BoundarySegment, Long> view = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            view.put(segments.get(i), counts[i]);
        }
        return Collections.unmodifiableMap(view);
    }
}
