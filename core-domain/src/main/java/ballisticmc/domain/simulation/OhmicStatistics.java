package ballisticmc.domain.simulation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Contadores agregados por capa a lo largo de un barrido de campo magnético.
 *
 * @param fields      Valores de campo simulados.
 * @param layerCounts Para cada capa, el total de cruces indexado como {@code fields}.
 */
public record OhmicStatistics(double[] fields, Map<Integer, double[]> layerCounts) {

    public OhmicStatistics {
        fields = fields.clone();
        Map<Integer, double[]> copy = new LinkedHashMap<>();
        layerCounts.forEach((layer, counts) -> copy.put(layer, counts.clone()));
        layerCounts = Collections.unmodifiableMap(copy);
    }

    /**
     * Agrega los contadores de cada resultado por capa. El resultado i corresponde a fields[i].
     */
    public static OhmicStatistics aggregate(double[] fields, List<SimulationResult> results) {
        if (fields.length != results.size()) {
            throw new IllegalArgumentException("Debe haber un resultado por cada valor de campo.");
        }
        Map<Integer, double[]> layerCounts = new TreeMap<>();
        for (int i = 0; i < results.size(); i++) {
            for (Map.Entry<Integer, Long> entry : results.get(i).getCounts().totalsByLayer().entrySet()) {
                layerCounts.computeIfAbsent(entry.getKey(), k -> new double[fields.length])[i] += entry.getValue();
            }
        }
        return new OhmicStatistics(fields, layerCounts);
    }

    @Override
    public double[] fields() {
        return fields.clone();
    }

    /**
     * Copia de los contadores por capa; modificarla no altera las estadísticas.
     */
    @Override
    public Map<Integer, double[]> layerCounts() {
        Map<Integer, double[]> copy = new LinkedHashMap<>();
        layerCounts.forEach((layer, counts) -> copy.put(layer, counts.clone()));
        return copy;
    }

    public double[] countsForLayer(int layer) {
        double[] counts = layerCounts.get(layer);
        return counts == null ? new double[fields.length] : counts.clone();
    }
}
