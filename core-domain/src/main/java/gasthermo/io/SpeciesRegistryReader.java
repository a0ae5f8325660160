package gasthermo.io;

import gasthermo.domain.species.SpeciesRegistry;
import gasthermo.domain.species.SpeciesTable;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Construye registros de especies a partir de tablas JSON.
 * <p>
 * El parseo vive fuera del modelo: el registro solo conoce especies ya validadas.
 */
@Slf4j
public class SpeciesRegistryReader {

    /** Tabla NASA Glenn incluida en el jar: Air, Ar, CH4, CO, CO2, H2, H2O, N2, O2. */
    public static final String DEFAULT_RESOURCE = "species/nasa9-species.json";

    private static volatile SpeciesRegistry defaultRegistry;

    private final JsonFileHandler jsonFileHandler;

    public SpeciesRegistryReader() {
        this(new JsonFileHandler());
    }

    public SpeciesRegistryReader(JsonFileHandler jsonFileHandler) {
        this.jsonFileHandler = Objects.requireNonNull(jsonFileHandler, "El JsonFileHandler no puede ser nulo.");
    }

    /**
     * Registro de la tabla incluida en el jar. Se carga una única vez por proceso.
     *
     * @throws UncheckedIOException si el recurso falta o está corrupto (error de empaquetado).
     */
    public static SpeciesRegistry loadDefault() {
        SpeciesRegistry registry = defaultRegistry;
        if (registry == null) {
            synchronized (SpeciesRegistryReader.class) {
                registry = defaultRegistry;
                if (registry == null) {
                    try {
                        registry = new SpeciesRegistryReader().readFromClasspath(DEFAULT_RESOURCE);
                    } catch (IOException e) {
                        throw new UncheckedIOException("No se pudo cargar la tabla de especies por defecto", e);
                    }
                    defaultRegistry = registry;
                }
            }
        }
        return registry;
    }

    public SpeciesRegistry readFromFile(String filePath) throws IOException {
        return toRegistry(jsonFileHandler.readFromFile(filePath, SpeciesTable.class), filePath);
    }

    public SpeciesRegistry readFromClasspath(String resource) throws IOException {
        return toRegistry(jsonFileHandler.readFromClasspath(resource, SpeciesTable.class), resource);
    }

    /**
     * Escribe el registro como tabla JSON, en el mismo formato que se lee.
     */
    public void writeToFile(SpeciesRegistry registry, String filePath) throws IOException {
        Objects.requireNonNull(registry, "El registro no puede ser nulo.");
        jsonFileHandler.writeToFile(new SpeciesTable(registry.source(), registry.species()), filePath);
    }

    private SpeciesRegistry toRegistry(SpeciesTable table, String origin) throws IOException {
        if (table == null || table.species() == null) {
            throw new IOException("La tabla de especies en " + origin + " está vacía.");
        }
        SpeciesRegistry registry;
        try {
            registry = SpeciesRegistry.of(table);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.error("Tabla de especies inválida en {}: {}", origin, e.getMessage());
            throw new IOException("Tabla de especies inválida en " + origin + ": " + e.getMessage(), e);
        }
        log.info("Registro de especies cargado desde {}: {} especies ({})", origin, registry.size(), registry.source());
        return registry;
    }
}
