package gasthermo.domain.species;

import gasthermo.domain.exception.UnknownSpeciesException;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registro ordenado e inmutable de especies.
 * <p>
 * Se construye una vez al arrancar el proceso y se comparte por referencia entre todos
 * los estados de gas. Al ser de solo lectura es seguro compartirlo entre hilos sin
 * sincronización.
 * <p>
 * El orden de las especies define el orden de todos los vectores de composición.
 */
public final class SpeciesRegistry {

    private final List<Species> species;
    private final Map<String, Integer> indexByName;
    private final String source;

    // Tablas planas para el camino caliente (evaluación en cada cambio de T).
    private final double[] molecularWeights;
    private final double[][] lowCoefficients;
    private final double[][] highCoefficients;
    private final double[] formationEnthalpies;

    private SpeciesRegistry(List<Species> species, String source) {
        Objects.requireNonNull(species, "La lista de especies no puede ser nula.");
        if (species.isEmpty()) {
            throw new IllegalArgumentException("El registro de especies debe contener al menos una especie.");
        }

        int n = species.size();
        Map<String, Integer> index = new HashMap<>(n * 2);
        this.molecularWeights = new double[n];
        this.lowCoefficients = new double[n][];
        this.highCoefficients = new double[n][];
        this.formationEnthalpies = new double[n];

        for (int i = 0; i < n; i++) {
            Species sp = Objects.requireNonNull(species.get(i), "Especie nula en la posición " + i);
            if (index.put(sp.name(), i) != null) {
                throw new IllegalArgumentException("Especie duplicada en el registro: " + sp.name());
            }
            molecularWeights[i] = sp.molecularWeight();
            lowCoefficients[i] = sp.lowCoefficients();
            highCoefficients[i] = sp.highCoefficients();
            formationEnthalpies[i] = sp.formationEnthalpy();
        }

        this.species = List.copyOf(species);
        this.indexByName = Collections.unmodifiableMap(index);
        this.source = source;
    }

    public static SpeciesRegistry of(List<Species> species) {
        return new SpeciesRegistry(species, "in-memory");
    }

    public static SpeciesRegistry of(SpeciesTable table) {
        Objects.requireNonNull(table, "La tabla de especies no puede ser nula.");
        return new SpeciesRegistry(table.species(), table.source());
    }

    public int size() {
        return species.size();
    }

    public Species get(int index) {
        return species.get(index);
    }

    public List<Species> species() {
        return species;
    }

    public List<String> names() {
        return species.stream().map(Species::name).toList();
    }

    public String source() {
        return source;
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * Posición de la especie en los vectores de composición.
     *
     * @throws UnknownSpeciesException si la especie no existe en el registro.
     */
    public int indexOf(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new UnknownSpeciesException(name);
        }
        return index;
    }

    public double molecularWeightAt(int index) {
        return molecularWeights[index];
    }

    public double formationEnthalpyAt(int index) {
        return formationEnthalpies[index];
    }

    /**
     * Juego de coeficientes de la especie {@code index} válido a la temperatura dada.
     * <p>
     * Devuelve el array interno sin copiar; el llamador no debe modificarlo.
     */
    public double[] coefficientsAt(int index, boolean highTemperature) {
        return highTemperature ? highCoefficients[index] : lowCoefficients[index];
    }

    @Override
    public String toString() {
        return "SpeciesRegistry[" + size() + " species from " + source + ": " + names() + "]";
    }
}
