package gasthermo.domain.species;

import java.util.List;

/**
 * Representación en disco (JSON) de una tabla de especies.
 *
 * @param source  Procedencia de los datos (ej: "NASA Glenn CEA thermo.inp").
 * @param species Especies en el orden en el que formarán el registro.
 */
public record SpeciesTable(String source, List<Species> species) {
}
