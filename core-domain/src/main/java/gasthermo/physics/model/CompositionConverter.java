package gasthermo.physics.model;

import gasthermo.domain.exception.InvalidPropertyAssignmentException;
import gasthermo.domain.species.SpeciesRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conversiones de composición entre fracciones másicas (Y) y molares (X), y entre
 * mapas dispersos nombre → valor y vectores densos en el orden del registro.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class CompositionConverter {

    private CompositionConverter() {}

    /**
     * Y → X: {@code Xi = (Yi/MWi) / Σj(Yj/MWj)}. La entrada no necesita sumar 1.
     *
     * @throws InvalidPropertyAssignmentException si la suma ponderada no es positiva y finita.
     */
    public static double[] massToMole(double[] massFractions, SpeciesRegistry registry) {
        checkLength(massFractions, registry, "Y");
        double[] x = new double[massFractions.length];
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            x[i] = massFractions[i] / registry.molecularWeightAt(i);
            sum += x[i];
        }
        requirePositiveSum(sum, "Y");
        for (int i = 0; i < x.length; i++) {
            x[i] /= sum;
        }
        return x;
    }

    /**
     * X → Y: {@code Yi = (Xi·MWi) / Σj(Xj·MWj)}. La entrada no necesita sumar 1.
     *
     * @throws InvalidPropertyAssignmentException si la suma ponderada no es positiva y finita.
     */
    public static double[] moleToMass(double[] moleFractions, SpeciesRegistry registry) {
        checkLength(moleFractions, registry, "X");
        double[] y = new double[moleFractions.length];
        double sum = 0.0;
        for (int i = 0; i < y.length; i++) {
            y[i] = moleFractions[i] * registry.molecularWeightAt(i);
            sum += y[i];
        }
        requirePositiveSum(sum, "X");
        for (int i = 0; i < y.length; i++) {
            y[i] /= sum;
        }
        return y;
    }

    /**
     * Peso molecular medio de la mezcla {@code MW = 1 / Σ(Yi/MWi)} [g/mol].
     */
    public static double mixtureMolecularWeight(double[] massFractions, SpeciesRegistry registry) {
        double inverse = 0.0;
        for (int i = 0; i < massFractions.length; i++) {
            inverse += massFractions[i] / registry.molecularWeightAt(i);
        }
        return 1.0 / inverse;
    }

    /**
     * Mapa disperso → vector denso en el orden del registro. Las especies no nombradas
     * quedan a cero. No normaliza.
     *
     * @throws gasthermo.domain.exception.UnknownSpeciesException si algún nombre no está en el registro.
     */
    public static double[] toVector(Map<String, Double> values, SpeciesRegistry registry) {
        Objects.requireNonNull(values, "El mapa de composición no puede ser nulo.");
        double[] vector = new double[registry.size()];
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            int index = registry.indexOf(entry.getKey());
            Double value = entry.getValue();
            if (value == null) {
                throw new InvalidPropertyAssignmentException("Fracción nula (null) para la especie '" + entry.getKey() + "'.");
            }
            vector[index] = value;
        }
        return vector;
    }

    /**
     * Vector denso → mapa ordenado según el registro.
     *
     * @param nonZeroOnly si es {@code true}, omite las especies con valor cero.
     */
    public static Map<String, Double> toMap(double[] values, SpeciesRegistry registry, boolean nonZeroOnly) {
        checkLength(values, registry, "composición");
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            if (!nonZeroOnly || values[i] != 0.0) {
                map.put(registry.get(i).name(), values[i]);
            }
        }
        return map;
    }

    /**
     * Valida y normaliza un vector de fracciones para que sume 1.
     * <p>
     * Política única para todas las entradas de composición (másica o molar, vector o
     * mapa): los valores deben ser finitos y no negativos, con suma positiva.
     *
     * @return Un vector nuevo que suma 1. El de entrada no se modifica.
     * @throws InvalidPropertyAssignmentException si la longitud o los valores no son válidos.
     */
    public static double[] normalize(double[] fractions, SpeciesRegistry registry, String label) {
        checkLength(fractions, registry, label);
        double sum = 0.0;
        for (int i = 0; i < fractions.length; i++) {
            double f = fractions[i];
            if (!Double.isFinite(f) || f < 0.0) {
                throw new InvalidPropertyAssignmentException(String.format(
                        "Fracción no válida para la especie '%s' (fracciones %s): %s. Debe ser finita y >= 0.",
                        registry.get(i).name(), label, f));
            }
            sum += f;
        }
        if (!(sum > 0.0)) {
            throw new InvalidPropertyAssignmentException("Las fracciones " + label + " deben tener suma positiva.");
        }
        double[] normalized = new double[fractions.length];
        for (int i = 0; i < fractions.length; i++) {
            normalized[i] = fractions[i] / sum;
        }
        return normalized;
    }

    private static void requirePositiveSum(double sum, String label) {
        if (!(Double.isFinite(sum) && sum > 0.0)) {
            throw new InvalidPropertyAssignmentException(
                    "No se puede convertir " + label + ": la suma ponderada debe ser positiva y finita (suma = " + sum + ").");
        }
    }

    private static void checkLength(double[] values, SpeciesRegistry registry, String label) {
        Objects.requireNonNull(values, "El vector de composición no puede ser nulo.");
        if (values.length != registry.size()) {
            throw new InvalidPropertyAssignmentException(String.format(
                    "El vector (%s) tiene %d entradas pero el registro tiene %d especies.",
                    label, values.length, registry.size()));
        }
    }
}
