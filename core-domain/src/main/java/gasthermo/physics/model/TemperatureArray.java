package gasthermo.physics.model;

/**
 * Vector base de potencias de temperatura usado por todas las evaluaciones polinómicas:
 * <pre>
 * [T⁻², T⁻¹, 1, T, T², T³, T⁴, ln T]
 * </pre>
 * La variante {@link #update(double, double[])} escribe sobre un buffer existente y no
 * reserva memoria: es la que usa el estado del gas en cada cambio de temperatura.
 */
public final class TemperatureArray {

    public static final int SIZE = 8;

    public static final int T_INV2 = 0;
    public static final int T_INV = 1;
    public static final int ONE = 2;
    public static final int T = 3;
    public static final int T2 = 4;
    public static final int T3 = 5;
    public static final int T4 = 6;
    public static final int LN_T = 7;

    private TemperatureArray() {}

    /**
     * Crea un vector base nuevo para la temperatura dada.
     */
    public static double[] of(double temperature) {
        return update(temperature, new double[SIZE]);
    }

    /**
     * Recalcula el vector base en el buffer {@code target} (sin reservar memoria).
     *
     * @param temperature Temperatura [K].
     * @param target      Buffer de al menos 8 posiciones.
     * @return El mismo buffer {@code target}, para encadenar.
     */
    public static double[] update(double temperature, double[] target) {
        target[T_INV2] = 1.0 / (temperature * temperature);
        target[T_INV] = target[T_INV2] * temperature;
        target[ONE] = 1.0;
        target[T] = temperature;
        target[T2] = temperature * temperature;
        target[T3] = temperature * target[T2];
        target[T4] = temperature * target[T3];
        target[LN_T] = Math.log(temperature);
        return target;
    }
}
