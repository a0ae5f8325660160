package gasthermo.physics.model;

import lombok.Builder;

/**
 * Copia inmutable de las magnitudes principales de un {@link GasState} en un instante.
 *
 * @param temperature     Temperatura [K].
 * @param pressure        Presión [Pa].
 * @param specificHeat    cp [J/kg/K].
 * @param enthalpy        h [J/kg].
 * @param entropy         s [J/kg/K].
 * @param molecularWeight MW [g/mol].
 */
@Builder
public record GasSnapshot(
        double temperature,
        double pressure,
        double specificHeat,
        double enthalpy,
        double entropy,
        double molecularWeight
) {
    @Override
    public String toString() {
        // Valores molares, como se suelen tabular.
        double toMolar = molecularWeight / 1000.0;
        return String.format("Ideal Gas at T = %.3f K, P = %.3f kPa, cp = %.3f J/K/mol, h = %.3f kJ/mol, s = %.3f kJ/K/mol",
                temperature, pressure / 1000.0, specificHeat * toMolar,
                enthalpy * toMolar / 1000.0, entropy * toMolar / 1000.0);
    }
}
