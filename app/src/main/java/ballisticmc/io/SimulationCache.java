package ballisticmc.io;

import ballisticmc.domain.simulation.SimulationSnapshot;
import ballisticmc.physics.simulator.MonteCarloSimulator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Caché en disco de resultados de simulación, indexada por un identificador elegido
 * por el llamador. El identificador debe codificar todos los parámetros relevantes:
 * la caché no comprueba que el simulador coincida con el que generó el fichero.
 */
@Slf4j
public class SimulationCache {

    private static final String EXTENSION = ".json";

    @Getter
    private final Path directory;
    private final JsonFileHandler fileHandler;

    public SimulationCache(Path directory, JsonFileHandler fileHandler) {
        this.directory = directory;
        this.fileHandler = fileHandler;
    }

    public Path pathFor(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("El identificador de caché no puede estar vacío.");
        }
        return directory.resolve(identifier + EXTENSION);
    }

    /**
     * Devuelve el resultado guardado con {@code identifier} o, si no existe, ejecuta
     * la simulación y lo guarda.
     *
     * @throws IOException Si falla la lectura o escritura del fichero.
     */
    public SimulationSnapshot runWithCache(MonteCarloSimulator simulator, String identifier) throws IOException {
        Path path = pathFor(identifier);
        if (Files.exists(path)) {
            log.info("Resultado en caché para '{}', cargando {}", identifier, path);
            return fileHandler.readFromFile(path, SimulationSnapshot.class);
        }

        log.info("Sin resultado en caché para '{}', ejecutando simulación.", identifier);
        SimulationSnapshot snapshot = SimulationSnapshot.from(simulator.runSimulation());
        fileHandler.writeToFile(snapshot, path);
        return snapshot;
    }
}
