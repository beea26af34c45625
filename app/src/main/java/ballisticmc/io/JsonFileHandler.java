package ballisticmc.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura de objetos en ficheros JSON con Jackson.
 * <p>
 * Genérica: sirve para cualquier record o POJO que Jackson sepa (de)serializar.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una sola instancia
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa {@code data} en {@code path}, creando los directorios que falten.
     * Un fichero existente se sobrescribe.
     *
     * @throws IOException Si falla la escritura.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Guardando {} en {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Reconstruye un objeto de tipo {@code objectType} a partir de {@code path}.
     *
     * @throws IOException Si el fichero no existe o su contenido no es válido.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Cargando {} desde {}", objectType.getSimpleName(), path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o interpretar el JSON de {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
