package gasthermo.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de los solvers Newton-Raphson de temperatura.
 * <p>
 * Objeto de valor inmutable. Los límites de iteraciones garantizan que ninguna
 * operación sobre el estado del gas pueda quedarse colgada.
 *
 * @param enthalpyMaxIterations Iteraciones máximas de la inversión entalpía → temperatura.
 * @param entropyMaxIterations  Iteraciones máximas de la inversión φ → temperatura (compresión/expansión).
 * @param machMaxIterations     Iteraciones máximas del cambio de Mach a entalpía total constante.
 * @param temperatureTolerance  Tolerancia absoluta sobre el paso de temperatura |ΔT| [K].
 */
@Builder
@With
public record SolverConfig(
        int enthalpyMaxIterations,
        int entropyMaxIterations,
        int machMaxIterations,
        double temperatureTolerance
) {
    public SolverConfig {
        if (enthalpyMaxIterations < 1 || entropyMaxIterations < 1 || machMaxIterations < 1) {
            throw new IllegalArgumentException(String.format(
                    "Los límites de iteraciones deben ser >= 1 (h=%d, φ=%d, Mach=%d).",
                    enthalpyMaxIterations, entropyMaxIterations, machMaxIterations));
        }
        if (!(temperatureTolerance > 0.0) || Double.isInfinite(temperatureTolerance)) {
            throw new IllegalArgumentException("La tolerancia de temperatura debe ser finita y positiva: " + temperatureTolerance);
        }
    }

    /**
     * Configuración por defecto: 20 / 25 / 20 iteraciones y ε = 1e-12 K.
     */
    public static SolverConfig defaults() {
        return SolverConfig.builder()
                .enthalpyMaxIterations(20)
                .entropyMaxIterations(25)
                .machMaxIterations(20)
                .temperatureTolerance(1e-12)
                .build();
    }
}
