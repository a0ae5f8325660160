package gasthermo.config;

/**
 * Constantes físicas y de referencia compartidas por todo el modelo termodinámico.
 * <p>
 * Unidades fijas del sistema: Kelvin, Pascal, Julios y gramos/mol.
 */
public final class ThermoConstants {

    private ThermoConstants() {}

    /** Constante universal de los gases [J/K/mol]. */
    public static final double R_UNIV = 8.3145;

    /** Presión estándar de referencia [Pa]. */
    public static final double P_STD = 101325.0;

    /** Temperatura estándar de referencia [K]. */
    public static final double T_STD = 298.15;

    /**
     * Temperatura de cambio entre el juego de coeficientes de baja y alta temperatura [K].
     * Por debajo se usan los coeficientes bajos; en el valor exacto y por encima, los altos.
     */
    public static final double T_SWITCH = 1000.0;

    /** Factor de conversión de base gramo a base kilogramo (MW viene en g/mol). */
    public static final double GRAMS_PER_KG = 1000.0;

    /** Nombre de la especie usada como composición por defecto. */
    public static final String DEFAULT_SPECIES = "Air";
}
