package ballisticmc.physics.simulator;

import ballisticmc.config.SimulationConfig;
import ballisticmc.domain.band.FermiSurface;
import ballisticmc.domain.geometry.AuxiliaryLines;
import ballisticmc.domain.geometry.DeviceFrame;
import ballisticmc.domain.simulation.OhmicStatistics;
import ballisticmc.domain.simulation.SimulationResult;
import ballisticmc.physics.impl.FieldSimulationTask;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Barrido de campo magnético: una simulación independiente por valor de campo.
 * <p>
 * Las simulaciones se reparten en un pool fijo de {@code cpuProcessorCount} hilos.
 * La simulación i usa la semilla {@code seed + i}, de modo que el resultado no
 * depende del número de hilos.
 */
@Slf4j
public class FieldSweepProcessor implements AutoCloseable {

    private final FermiSurface surface;
    private final DeviceFrame device;
    private final AuxiliaryLines lines;
    private final SimulationConfig config;
    private final ExecutorService threadPool;

    public FieldSweepProcessor(FermiSurface surface, DeviceFrame device, AuxiliaryLines lines, SimulationConfig config) {
        this.surface = surface;
        this.device = device;
        this.lines = lines;
        this.config = config;
        this.threadPool = Executors.newFixedThreadPool(Math.max(config.getCpuProcessorCount(), 1));
        log.info("FieldSweepProcessor inicializado. (Hilos: {})", Math.max(config.getCpuProcessorCount(), 1));
    }

    /**
     * Ejecuta el barrido y agrega los cruces por capa.
     *
     * @param fields Valores de campo a simular. Ninguno puede ser cero.
     * @return Totales por capa indexados como {@code fields}.
     */
    public OhmicStatistics process(double[] fields) {
        long startTime = System.currentTimeMillis();

        List<FieldSimulationTask> tasks = new ArrayList<>(fields.length);
        for (int i = 0; i < fields.length; i++) {
            SimulationConfig fieldConfig = config
                    .withMagneticField(fields[i])
                    .withSeed(config.getSeed() + i);
            fieldConfig.validate();
            tasks.add(new FieldSimulationTask(surface, device, lines, fieldConfig));
        }

        List<Future<SimulationResult>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Barrido de campo interrumpido.", e);
        }

        List<SimulationResult> results = new ArrayList<>(fields.length);
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Barrido de campo interrumpido.", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Error en la simulación del campo B=" + fields[i], e.getCause());
            }
        }

        log.info("Barrido de {} campos completado en {} ms.", fields.length, System.currentTimeMillis() - startTime);
        return OhmicStatistics.aggregate(fields, results);
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("FieldSweepProcessor cerrado.");
    }
}
