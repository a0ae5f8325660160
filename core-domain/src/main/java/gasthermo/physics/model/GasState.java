package gasthermo.physics.model;

import gasthermo.config.SolverConfig;
import gasthermo.config.ThermoConstants;
import gasthermo.domain.exception.InvalidPropertyAssignmentException;
import gasthermo.domain.species.SpeciesRegistry;
import gasthermo.physics.solver.EnthalpySolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;

import static gasthermo.config.ThermoConstants.GRAMS_PER_KG;
import static gasthermo.config.ThermoConstants.P_STD;
import static gasthermo.config.ThermoConstants.R_UNIV;
import static gasthermo.config.ThermoConstants.T_STD;
import static gasthermo.config.ThermoConstants.T_SWITCH;

/**
 * Estado mutable de un gas ideal de composición variable.
 * <p>
 * Variables independientes: temperatura {@code T}, presión {@code P} y composición
 * (fracciones másicas {@code Y}). Las magnitudes dependientes de (T, Y) se mantienen en
 * caché y se recalculan de forma determinista y completa en cada mutación:
 * <ul>
 * <li><b>Cambio de T:</b> vector base de temperatura, cp, dcp/dT, h y φ.</li>
 * <li><b>Cambio de Y:</b> peso molecular y, después, todo lo anterior a la T actual.</li>
 * <li><b>Cambio de P:</b> solo se guarda P. La entropía combina φ con P al leerse.</li>
 * </ul>
 * Las magnitudes en caché son específicas (por kg): cp [J/kg/K], h [J/kg], φ [J/kg/K].
 * Los getters {@code getMolar*} devuelven los valores molares.
 * <p>
 * No es thread-safe: cada instancia pertenece en exclusiva a quien la crea. El registro
 * de especies, inmutable, sí puede compartirse entre instancias e hilos.
 */
@Slf4j
public class GasState {

    @Getter
    private final SpeciesRegistry registry;
    @Getter
    private final SolverConfig solverConfig;

    @Getter
    private double temperature;        // [K]
    @Getter
    private double pressure;           // [Pa]

    // Buffer propio y reutilizable: [T⁻², T⁻¹, 1, T, T², T³, T⁴, ln T]
    private final double[] temperatureArray = new double[TemperatureArray.SIZE];

    @Getter
    private double specificHeat;           // cp [J/kg/K]
    @Getter
    private double specificHeatDerivative; // dcp/dT [J/kg/K²]
    @Getter
    private double enthalpy;               // h [J/kg]
    @Getter
    private double entropyComplement;      // φ [J/kg/K]

    private double[] massFractions;        // Y, suma 1
    @Getter
    private double molecularWeight;        // [g/mol]

    /**
     * Aire a condiciones estándar (298.15 K, 101325 Pa).
     *
     * @throws gasthermo.domain.exception.UnknownSpeciesException si el registro no contiene "Air".
     */
    public GasState(SpeciesRegistry registry) {
        this(registry, SolverConfig.defaults());
    }

    public GasState(SpeciesRegistry registry, SolverConfig solverConfig) {
        this(registry, solverConfig, pureSpecies(registry, ThermoConstants.DEFAULT_SPECIES), T_STD, P_STD);
    }

    /**
     * Gas con la composición másica dada a condiciones estándar. El vector se normaliza.
     */
    public GasState(SpeciesRegistry registry, double[] massFractions) {
        this(registry, SolverConfig.defaults(), massFractions);
    }

    public GasState(SpeciesRegistry registry, SolverConfig solverConfig, double[] massFractions) {
        this(registry, solverConfig,
                CompositionConverter.normalize(massFractions, requireRegistry(registry), "másicas"),
                T_STD, P_STD);
    }

    private GasState(SpeciesRegistry registry, SolverConfig solverConfig, double[] normalizedY,
                     double temperature, double pressure) {
        this.registry = requireRegistry(registry);
        this.solverConfig = Objects.requireNonNull(solverConfig, "La configuración del solver no puede ser nula.");
        this.pressure = pressure;
        applyComposition(normalizedY, temperature);
    }

    /**
     * Gas a condiciones estándar a partir de un mapa disperso de fracciones másicas.
     */
    public static GasState ofMassFractions(SpeciesRegistry registry, Map<String, Double> massFractions) {
        return new GasState(registry, CompositionConverter.toVector(massFractions, requireRegistry(registry)));
    }

    /**
     * Gas a condiciones estándar a partir de un mapa disperso de fracciones molares.
     */
    public static GasState ofMoleFractions(SpeciesRegistry registry, Map<String, Double> moleFractions) {
        GasState gas = new GasState(registry);
        gas.setMoleFractions(moleFractions);
        return gas;
    }

    /**
     * Copia profunda independiente. Solo comparte el registro (inmutable) y la configuración.
     */
    public GasState copy() {
        GasState copy = new GasState(registry, solverConfig, massFractions.clone(), temperature, pressure);
        log.trace("Copia del estado del gas: {}", copy);
        return copy;
    }

    // ------------------------------------------------------------------
    // Variables independientes
    // ------------------------------------------------------------------

    /**
     * Fija la temperatura y recalcula cp, dcp/dT, h y φ.
     *
     * @throws InvalidPropertyAssignmentException si T no es finita y positiva.
     */
    public void setTemperature(double temperature) {
        requirePositive(temperature, "temperature");
        updateTemperature(temperature);
    }

    /**
     * Fija la presión. cp, h, dcp/dT y φ no dependen de P, así que no se recalculan.
     *
     * @throws InvalidPropertyAssignmentException si P no es finita y positiva.
     */
    public void setPressure(double pressure) {
        requirePositive(pressure, "pressure");
        this.pressure = pressure;
    }

    public void setMassFractions(double[] massFractions) {
        applyComposition(CompositionConverter.normalize(massFractions, registry, "másicas"), temperature);
    }

    /**
     * Las especies no nombradas quedan a cero; el resultado se normaliza.
     */
    public void setMassFractions(Map<String, Double> massFractions) {
        double[] y = CompositionConverter.toVector(massFractions, registry);
        applyComposition(CompositionConverter.normalize(y, registry, "másicas"), temperature);
    }

    public void setMoleFractions(double[] moleFractions) {
        double[] x = CompositionConverter.normalize(moleFractions, registry, "molares");
        applyComposition(CompositionConverter.moleToMass(x, registry), temperature);
    }

    /**
     * Las especies no nombradas quedan a cero; el resultado se normaliza.
     */
    public void setMoleFractions(Map<String, Double> moleFractions) {
        double[] x = CompositionConverter.normalize(CompositionConverter.toVector(moleFractions, registry), registry, "molares");
        applyComposition(CompositionConverter.moleToMass(x, registry), temperature);
    }

    // ------------------------------------------------------------------
    // Setters compuestos (temperatura/entalpía primero, presión después)
    // ------------------------------------------------------------------

    /**
     * Busca la temperatura cuya entalpía es {@code targetEnthalpy} [J/kg] (Newton-Raphson).
     *
     * @throws gasthermo.domain.exception.ConvergenceException si no converge.
     */
    public void setEnthalpy(double targetEnthalpy) {
        if (!Double.isFinite(targetEnthalpy)) {
            throw new InvalidPropertyAssignmentException("No se puede asignar gas.h a un valor no finito: " + targetEnthalpy);
        }
        EnthalpySolver.solve(this, targetEnthalpy, solverConfig);
    }

    /**
     * Añade (o extrae) un salto de entalpía {@code deltaEnthalpy} [J/kg] con eficiencia
     * politrópica {@code polytropicEfficiency}, actualizando la presión a partir de Δφ:
     * <pre>
     * Δφ ≥ 0 (trabajo aportado):  P = P₀·exp(ηp·Δφ/R)
     * Δφ &lt; 0 (trabajo extraído):  P = P₀·exp(Δφ/(ηp·R))
     * </pre>
     * En la rama de extracción ηp divide, no multiplica: una turbina con pérdidas necesita
     * una caída de presión mayor que la isentrópica para extraer el mismo Δh. Es la misma
     * relación que usan {@code expand} y {@code changeMach}. Con ηp = 1 ambas ramas coinciden.
     *
     * @throws InvalidPropertyAssignmentException si ηp ∉ (0, 1].
     */
    public void setEnthalpyChange(double deltaEnthalpy, double polytropicEfficiency) {
        if (!(polytropicEfficiency > 0.0 && polytropicEfficiency <= 1.0)) {
            throw new InvalidPropertyAssignmentException(
                    "La eficiencia politrópica debe estar en (0, 1]. Recibido ηp = " + polytropicEfficiency);
        }
        double p0 = pressure;
        double phi0 = entropyComplement;
        setEnthalpy(enthalpy + deltaEnthalpy);
        double deltaPhi = entropyComplement - phi0;
        double exponent = deltaPhi >= 0.0
                ? polytropicEfficiency * deltaPhi / getGasConstant()
                : deltaPhi / (polytropicEfficiency * getGasConstant());
        setPressure(p0 * Math.exp(exponent));
    }

    public void setEnthalpyChange(double deltaEnthalpy) {
        setEnthalpyChange(deltaEnthalpy, 1.0);
    }

    public void setEnthalpyAndPressure(double targetEnthalpy, double pressure) {
        requirePositive(pressure, "pressure");
        setEnthalpy(targetEnthalpy);
        setPressure(pressure);
    }

    public void setTemperatureAndPressure(double temperature, double pressure) {
        requirePositive(temperature, "temperature");
        requirePositive(pressure, "pressure");
        setTemperature(temperature);
        setPressure(pressure);
    }

    /**
     * Asignación por nombre de propiedad. Solo T, P y h son asignables.
     *
     * @throws InvalidPropertyAssignmentException si la propiedad es de solo lectura.
     */
    public void set(GasProperty property, double value) {
        Objects.requireNonNull(property, "La propiedad no puede ser nula.");
        switch (property) {
            case TEMPERATURE:
                setTemperature(value);
                break;
            case PRESSURE:
                setPressure(value);
                break;
            case ENTHALPY:
                setEnthalpy(value);
                break;
            default:
                throw new InvalidPropertyAssignmentException(
                        "You tried setting gas." + property + " to " + value
                                + ". It is a derived, read-only property; set T, P, h or the composition instead.");
        }
    }

    /**
     * Lectura por nombre de propiedad.
     */
    public double get(GasProperty property) {
        Objects.requireNonNull(property, "La propiedad no puede ser nula.");
        switch (property) {
            case TEMPERATURE:
                return temperature;
            case PRESSURE:
                return pressure;
            case ENTHALPY:
                return enthalpy;
            case SPECIFIC_HEAT:
                return specificHeat;
            case SPECIFIC_HEAT_DERIVATIVE:
                return specificHeatDerivative;
            case ENTROPY_COMPLEMENT:
                return entropyComplement;
            case ENTROPY:
                return getEntropy();
            case MOLECULAR_WEIGHT:
                return molecularWeight;
            case GAS_CONSTANT:
                return getGasConstant();
            case GAMMA:
                return getGamma();
            case DENSITY:
                return getDensity();
            case SPECIFIC_VOLUME:
                return getSpecificVolume();
            case FORMATION_ENTHALPY:
                return getFormationEnthalpy();
            default:
                throw new IllegalStateException("Propiedad no soportada: " + property);
        }
    }

    // ------------------------------------------------------------------
    // Propiedades derivadas (sin caché)
    // ------------------------------------------------------------------

    /**
     * Entropía específica [J/kg/K]: {@code s = φ - R·(ln(P/Pstd) + Σ Xi·ln Xi)}.
     */
    public double getEntropy() {
        double mixing = 0.0;
        for (int i = 0; i < massFractions.length; i++) {
            if (massFractions[i] != 0.0) {
                double x = massFractions[i] / registry.molecularWeightAt(i) * molecularWeight;
                mixing += x * Math.log(x);
            }
        }
        return entropyComplement - getGasConstant() * (Math.log(pressure / P_STD) + mixing);
    }

    /**
     * Constante específica del gas R = Runiv/MW [J/kg/K].
     */
    public double getGasConstant() {
        return R_UNIV / molecularWeight * GRAMS_PER_KG;
    }

    /**
     * Relación de calores específicos γ = cp/(cp - R).
     */
    public double getGamma() {
        double r = getGasConstant();
        return specificHeat / (specificHeat - r);
    }

    /**
     * Densidad ρ = P/(R·T) [kg/m³].
     */
    public double getDensity() {
        return pressure / (getGasConstant() * temperature);
    }

    /**
     * Volumen específico ν = 1/ρ [m³/kg].
     */
    public double getSpecificVolume() {
        return 1.0 / getDensity();
    }

    /**
     * Entalpía de formación de la mezcla Σ Xi·Hfi [J/mol].
     */
    public double getFormationEnthalpy() {
        double hf = 0.0;
        for (int i = 0; i < massFractions.length; i++) {
            double x = massFractions[i] / registry.molecularWeightAt(i) * molecularWeight;
            hf += x * registry.formationEnthalpyAt(i);
        }
        return hf;
    }

    /** dh/dT = cp [J/kg/K]. */
    public double getEnthalpyDerivative() {
        return specificHeat;
    }

    /** dφ/dT = ∂s/∂T = cp/T [J/kg/K²]. */
    public double getEntropyComplementDerivative() {
        return specificHeat / temperature;
    }

    public double getMolarSpecificHeat() {
        return specificHeat * molecularWeight / GRAMS_PER_KG;
    }

    public double getMolarEnthalpy() {
        return enthalpy * molecularWeight / GRAMS_PER_KG;
    }

    public double getMolarEntropy() {
        return getEntropy() * molecularWeight / GRAMS_PER_KG;
    }

    public double[] getMassFractions() {
        return massFractions.clone();
    }

    public double[] getMoleFractions() {
        return CompositionConverter.massToMole(massFractions, registry);
    }

    /** Fracciones másicas de todas las especies, en el orden del registro. */
    public Map<String, Double> getMassFractionMap() {
        return CompositionConverter.toMap(massFractions, registry, false);
    }

    /** Fracciones molares de las especies presentes (no nulas). */
    public Map<String, Double> getMoleFractionMap() {
        return CompositionConverter.toMap(getMoleFractions(), registry, true);
    }

    public GasSnapshot snapshot() {
        return GasSnapshot.builder()
                .temperature(temperature)
                .pressure(pressure)
                .specificHeat(specificHeat)
                .enthalpy(enthalpy)
                .entropy(getEntropy())
                .molecularWeight(molecularWeight)
                .build();
    }

    @Override
    public String toString() {
        return snapshot() + " with composition " + getMassFractionMap();
    }

    // ------------------------------------------------------------------
    // Reglas de actualización
    // ------------------------------------------------------------------

    private void applyComposition(double[] normalizedY, double temperatureToKeep) {
        this.massFractions = normalizedY;
        this.molecularWeight = CompositionConverter.mixtureMolecularWeight(normalizedY, registry);
        // La ponderación ha cambiado: se fuerza la reevaluación a la T actual.
        updateTemperature(temperatureToKeep);
        log.trace("Composición actualizada: MW = {} g/mol", molecularWeight);
    }

    private void updateTemperature(double newTemperature) {
        this.temperature = newTemperature;
        final double[] tt = TemperatureArray.update(newTemperature, temperatureArray);
        final boolean high = newTemperature >= T_SWITCH;

        double cpTemp = 0.0;
        double hTemp = 0.0;
        double phiTemp = 0.0;
        double cpTTemp = 0.0;

        // Solo las especies presentes: una fracción nula no aporta nada.
        for (int i = 0; i < massFractions.length; i++) {
            final double y = massFractions[i];
            if (y != 0.0) {
                final double[] a = registry.coefficientsAt(i, high);
                final double weight = y / registry.molecularWeightAt(i);
                cpTemp += weight * NasaPolynomial.specificHeat(tt, a);
                hTemp += weight * NasaPolynomial.enthalpy(tt, a);
                phiTemp += weight * NasaPolynomial.entropyComplement(tt, a);
                cpTTemp += weight * NasaPolynomial.specificHeatDerivative(tt, a);
            }
        }

        this.specificHeat = cpTemp * GRAMS_PER_KG;
        this.enthalpy = hTemp * GRAMS_PER_KG;
        this.entropyComplement = phiTemp * GRAMS_PER_KG;
        this.specificHeatDerivative = cpTTemp * GRAMS_PER_KG;
    }

    private static void requirePositive(double value, String name) {
        if (!(Double.isFinite(value) && value > 0.0)) {
            throw new InvalidPropertyAssignmentException(
                    "No se puede asignar gas." + name + " = " + value + ": debe ser finita y positiva.");
        }
    }

    private static SpeciesRegistry requireRegistry(SpeciesRegistry registry) {
        return Objects.requireNonNull(registry, "El registro de especies no puede ser nulo.");
    }

    private static double[] pureSpecies(SpeciesRegistry registry, String name) {
        double[] y = new double[requireRegistry(registry).size()];
        y[registry.indexOf(name)] = 1.0;
        return y;
    }
}
