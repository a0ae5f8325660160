package gasthermo.physics.model;

/**
 * Propiedades del estado del gas accesibles por nombre.
 * <p>
 * Solo las variables independientes (T, P) y la entalpía (que pasa por el solver)
 * se pueden asignar; el resto son magnitudes derivadas de solo lectura.
 */
public enum GasProperty {
    TEMPERATURE(true),
    PRESSURE(true),
    ENTHALPY(true),
    SPECIFIC_HEAT(false),
    SPECIFIC_HEAT_DERIVATIVE(false),
    ENTROPY_COMPLEMENT(false),
    ENTROPY(false),
    MOLECULAR_WEIGHT(false),
    GAS_CONSTANT(false),
    GAMMA(false),
    DENSITY(false),
    SPECIFIC_VOLUME(false),
    FORMATION_ENTHALPY(false);

    private final boolean writable;

    GasProperty(boolean writable) {
        this.writable = writable;
    }

    public boolean isWritable() {
        return writable;
    }
}
