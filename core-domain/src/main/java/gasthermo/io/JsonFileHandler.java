package gasthermo.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Lectura y escritura de objetos en JSON: tablas de especies y configuración de solvers.
 * <p>
 * Genérica sobre cualquier tipo compatible con Jackson (POJOs y records).
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una única instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, se sobrescribe.
     *
     * @param data     El objeto a serializar. No puede ser nulo.
     * @param filePath Ruta del archivo de destino (ej: "data/species/combustion.json").
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @throws IOException Si el archivo no existe o hay un error de lectura o formato.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Deserializando archivo {} a un objeto de tipo {}", path, objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path, e);
            throw e;
        }
    }

    /**
     * Deserializa un recurso JSON del classpath (ej: "species/nasa9-species.json").
     *
     * @throws IOException Si el recurso no existe o no se puede parsear.
     */
    public <T> T readFromClasspath(String resource, Class<T> objectType) throws IOException {
        log.info("Deserializando recurso de classpath {} a un objeto de tipo {}", resource, objectType.getSimpleName());

        try (InputStream in = JsonFileHandler.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("El recurso especificado no existe en el classpath: " + resource);
            }
            return objectMapper.readValue(in, objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el recurso JSON {}", resource, e);
            throw e;
        }
    }
}
