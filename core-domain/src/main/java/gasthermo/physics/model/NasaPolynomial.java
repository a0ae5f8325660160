package gasthermo.physics.model;

import static gasthermo.config.ThermoConstants.R_UNIV;

/**
 * Evaluador de los polinomios NASA de 9 coeficientes.
 * <p>
 * Funciones puras sobre el vector base {@code TT} (ver {@link TemperatureArray}) y un
 * juego de 9 coeficientes {@code a}. Sin reservas de memoria ni ramas: están en el
 * camino caliente de cada mutación del estado del gas. La validación de la entrada es
 * responsabilidad del llamador.
 * <p>
 * Todos los resultados son molares.
 */
public final class NasaPolynomial {

    private NasaPolynomial() {}

    /**
     * Calor específico molar [J/mol/K].
     * <pre>
     * Cp/R = a1·T⁻² + a2·T⁻¹ + a3 + a4·T + a5·T² + a6·T³ + a7·T⁴
     * </pre>
     */
    public static double specificHeat(double[] tt, double[] a) {
        double cpR = a[0] * tt[0]
                + a[1] * tt[1]
                + a[2] * tt[2]
                + a[3] * tt[3]
                + a[4] * tt[4]
                + a[5] * tt[5]
                + a[6] * tt[6];
        return cpR * R_UNIV;
    }

    /**
     * Derivada del calor específico molar dCp/dT [J/mol/K²].
     * <pre>
     * dCp/dT / R = -2·a1·T⁻³ - a2·T⁻² + a4 + 2·a5·T + 3·a6·T² + 4·a7·T³
     * </pre>
     */
    public static double specificHeatDerivative(double[] tt, double[] a) {
        double dcpRdT = -2.0 * a[0] * tt[0] * tt[1]
                - a[1] * tt[0]
                + a[3]
                + 2.0 * a[4] * tt[3]
                + 3.0 * a[5] * tt[4]
                + 4.0 * a[6] * tt[5];
        return dcpRdT * R_UNIV;
    }

    /**
     * Entalpía molar [J/mol].
     * <pre>
     * H/RT = -a1·T⁻² + a2·T⁻¹·ln T + a3 + a4·T/2 + a5·T²/3 + a6·T³/4 + a7·T⁴/5 + a8·T⁻¹
     * </pre>
     */
    public static double enthalpy(double[] tt, double[] a) {
        double hRT = -a[0] * tt[0]
                + a[1] * tt[7] * tt[1]
                + a[2]
                + 0.5 * a[3] * tt[3]
                + a[4] * tt[4] / 3.0
                + 0.25 * a[5] * tt[5]
                + 0.20 * a[6] * tt[6]
                + a[7] * tt[1];
        return hRT * tt[3] * R_UNIV;
    }

    /**
     * Función complemento de entropía φ = ∫(cp/T)dT en estado estándar [J/mol/K]
     * (Tref = 298.15 K, Pref = 101325 Pa).
     * <pre>
     * S°/R = -a1·T⁻²/2 - a2·T⁻¹ + a3·ln T + a4·T + a5·T²/2 + a6·T³/3 + a7·T⁴/4 + a9
     * </pre>
     */
    public static double entropyComplement(double[] tt, double[] a) {
        double sR = -0.5 * a[0] * tt[0]
                - a[1] * tt[1]
                + a[2] * tt[7]
                + a[3] * tt[3]
                + 0.5 * a[4] * tt[4]
                + a[5] * tt[5] / 3.0
                + 0.25 * a[6] * tt[6]
                + a[8];
        return sR * R_UNIV;
    }
}
