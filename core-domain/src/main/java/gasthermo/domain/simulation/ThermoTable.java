package gasthermo.domain.simulation;

import lombok.Builder;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tabla de propiedades termodinámicas de una mezcla en un barrido de temperaturas.
 * <p>
 * Inmutable: los arrays se copian al construir y al leer.
 *
 * @param composition         Fracciones molares de la mezcla barrida (especies presentes).
 * @param pressure            Presión a la que se evalúa la entropía [Pa].
 * @param temperatures        Temperaturas [K].
 * @param specificHeats       cp [J/kg/K].
 * @param enthalpies          h [J/kg].
 * @param entropyComplements  φ [J/kg/K].
 * @param entropies           s [J/kg/K].
 */
@Builder
public record ThermoTable(
        Map<String, Double> composition,
        double pressure,
        double[] temperatures,
        double[] specificHeats,
        double[] enthalpies,
        double[] entropyComplements,
        double[] entropies
) {
    public ThermoTable {
        Objects.requireNonNull(temperatures, "temperatures no puede ser nulo.");
        Objects.requireNonNull(specificHeats, "specificHeats no puede ser nulo.");
        Objects.requireNonNull(enthalpies, "enthalpies no puede ser nulo.");
        Objects.requireNonNull(entropyComplements, "entropyComplements no puede ser nulo.");
        Objects.requireNonNull(entropies, "entropies no puede ser nulo.");
        int n = temperatures.length;
        if (specificHeats.length != n || enthalpies.length != n || entropyComplements.length != n || entropies.length != n) {
            throw new IllegalArgumentException("Todas las columnas de la tabla deben tener " + n + " filas.");
        }
        composition = composition == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(composition));
        temperatures = temperatures.clone();
        specificHeats = specificHeats.clone();
        enthalpies = enthalpies.clone();
        entropyComplements = entropyComplements.clone();
        entropies = entropies.clone();
    }

    public int size() {
        return temperatures.length;
    }

    @Override
    public double[] temperatures() {
        return temperatures.clone();
    }

    @Override
    public double[] specificHeats() {
        return specificHeats.clone();
    }

    @Override
    public double[] enthalpies() {
        return enthalpies.clone();
    }

    @Override
    public double[] entropyComplements() {
        return entropyComplements.clone();
    }

    @Override
    public double[] entropies() {
        return entropies.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThermoTable other = (ThermoTable) o;
        return Double.compare(pressure, other.pressure) == 0
                && composition.equals(other.composition)
                && Arrays.equals(temperatures, other.temperatures)
                && Arrays.equals(specificHeats, other.specificHeats)
                && Arrays.equals(enthalpies, other.enthalpies)
                && Arrays.equals(entropyComplements, other.entropyComplements)
                && Arrays.equals(entropies, other.entropies);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(composition, pressure);
        result = 31 * result + Arrays.hashCode(temperatures);
        result = 31 * result + Arrays.hashCode(specificHeats);
        result = 31 * result + Arrays.hashCode(enthalpies);
        result = 31 * result + Arrays.hashCode(entropyComplements);
        result = 31 * result + Arrays.hashCode(entropies);
        return result;
    }

    @Override
    public String toString() {
        return String.format("ThermoTable[%d rows, T = %.2f..%.2f K, P = %.1f Pa, composition = %s]",
                size(), size() == 0 ? Double.NaN : temperatures[0],
                size() == 0 ? Double.NaN : temperatures[size() - 1], pressure, composition);
    }
}
