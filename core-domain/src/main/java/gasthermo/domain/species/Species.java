package gasthermo.domain.species;

import gasthermo.config.ThermoConstants;
import gasthermo.physics.model.NasaPolynomial;
import gasthermo.physics.model.TemperatureArray;
import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Especie química con sus datos termodinámicos en formato NASA de 9 coeficientes.
 * <p>
 * Objeto de valor inmutable. Los coeficientes son adimensionales ({@code cp/R}) y
 * siguen la forma:
 * <pre>
 * cp/R = a1·T⁻² + a2·T⁻¹ + a3 + a4·T + a5·T² + a6·T³ + a7·T⁴
 * </pre>
 * con {@code a8} y {@code a9} como constantes de integración de entalpía y entropía.
 *
 * @param name              Nombre único de la especie (ej: "N2", "Air").
 * @param molecularWeight   Peso molecular [g/mol].
 * @param lowCoefficients   9 coeficientes válidos por debajo de {@code switchTemperature}.
 * @param highCoefficients  9 coeficientes válidos en {@code switchTemperature} y por encima.
 * @param formationEnthalpy Entalpía de formación a 298.15 K [J/mol].
 * @param switchTemperature Temperatura de cambio entre ambos juegos [K]. Debe ser 1000 K.
 */
@Builder
public record Species(
        String name,
        double molecularWeight,
        double[] lowCoefficients,
        double[] highCoefficients,
        double formationEnthalpy,
        double switchTemperature
) {
    public static final int COEFFICIENT_COUNT = 9;

    /**
     * Constructor canónico: valida los datos una única vez (no se revalidan por evaluación)
     * y guarda copias de los arrays de coeficientes.
     */
    public Species {
        Objects.requireNonNull(name, "El nombre de la especie no puede ser nulo.");
        Objects.requireNonNull(lowCoefficients, "Los coeficientes de baja temperatura no pueden ser nulos.");
        Objects.requireNonNull(highCoefficients, "Los coeficientes de alta temperatura no pueden ser nulos.");

        if (name.isBlank()) {
            throw new IllegalArgumentException("El nombre de la especie no puede estar vacío.");
        }
        if (!(molecularWeight > 0.0)) {
            throw new IllegalArgumentException("El peso molecular de " + name + " debe ser positivo: " + molecularWeight);
        }
        if (lowCoefficients.length != COEFFICIENT_COUNT || highCoefficients.length != COEFFICIENT_COUNT) {
            throw new IllegalArgumentException(String.format(
                    "La especie %s debe tener %d coeficientes por rango (bajo=%d, alto=%d).",
                    name, COEFFICIENT_COUNT, lowCoefficients.length, highCoefficients.length));
        }
        if (switchTemperature != ThermoConstants.T_SWITCH) {
            throw new IllegalArgumentException(String.format(
                    "La especie %s cambia de rango en %.3f K; solo se admite %.1f K.",
                    name, switchTemperature, ThermoConstants.T_SWITCH));
        }

        lowCoefficients = lowCoefficients.clone();
        highCoefficients = highCoefficients.clone();
    }

    @Override
    public double[] lowCoefficients() {
        return lowCoefficients.clone();
    }

    @Override
    public double[] highCoefficients() {
        return highCoefficients.clone();
    }

    /**
     * Calor específico de la especie pura [J/kg/K].
     */
    public double specificHeat(double temperature) {
        return NasaPolynomial.specificHeat(TemperatureArray.of(temperature), coefficientsAt(temperature))
                * ThermoConstants.GRAMS_PER_KG / molecularWeight;
    }

    /**
     * Entalpía específica de la especie pura [J/kg].
     */
    public double enthalpy(double temperature) {
        return NasaPolynomial.enthalpy(TemperatureArray.of(temperature), coefficientsAt(temperature))
                * ThermoConstants.GRAMS_PER_KG / molecularWeight;
    }

    /**
     * Entropía específica de la especie pura a (T, P) [J/kg/K].
     */
    public double entropy(double temperature, double pressure) {
        double phi = NasaPolynomial.entropyComplement(TemperatureArray.of(temperature), coefficientsAt(temperature));
        double so = phi - ThermoConstants.R_UNIV * Math.log(pressure / ThermoConstants.P_STD);
        return so * ThermoConstants.GRAMS_PER_KG / molecularWeight;
    }

    private double[] coefficientsAt(double temperature) {
        return temperature < switchTemperature ? lowCoefficients : highCoefficients;
    }

    // equals y hashCode estándar para records con arrays.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Species that = (Species) o;
        return name.equals(that.name)
                && Double.compare(molecularWeight, that.molecularWeight) == 0
                && Double.compare(formationEnthalpy, that.formationEnthalpy) == 0
                && Double.compare(switchTemperature, that.switchTemperature) == 0
                && Arrays.equals(lowCoefficients, that.lowCoefficients)
                && Arrays.equals(highCoefficients, that.highCoefficients);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, molecularWeight, formationEnthalpy, switchTemperature);
        result = 31 * result + Arrays.hashCode(lowCoefficients);
        result = 31 * result + Arrays.hashCode(highCoefficients);
        return result;
    }

    @Override
    public String toString() {
        return "Species[" + name + ", MW=" + molecularWeight + " g/mol, Hf=" + formationEnthalpy + " J/mol]";
    }
}
