package gasthermo.domain.exception;

import gasthermo.physics.model.GasSnapshot;
import lombok.Getter;

/**
 * Una iteración Newton no alcanzó la tolerancia dentro de su límite de iteraciones.
 * <p>
 * El estado del gas queda en la última iteración (no convergida) y el llamador debe
 * tratarlo como inutilizable. No se reintenta automáticamente.
 */
@Getter
public class ConvergenceException extends GasThermoException {

    /** Nombre de la operación que falló (ej: "setEnthalpy", "compress"). */
    private final String operation;
    /** Iteraciones consumidas. */
    private final int iterations;
    /** Magnitud del último paso |ΔT| [K]. */
    private final double residual;
    /** Tolerancia exigida [K]. */
    private final double tolerance;
    /** Estado del gas en la última iteración. */
    private final GasSnapshot lastState;

    public ConvergenceException(String operation, int iterations, double residual, double tolerance, GasSnapshot lastState) {
        super(String.format("`%s` did not converge after %d iterations: abs(dT) = %.6e > ε (%.1e). Last state: %s",
                operation, iterations, residual, tolerance, lastState));
        this.operation = operation;
        this.iterations = iterations;
        this.residual = residual;
        this.tolerance = tolerance;
        this.lastState = lastState;
    }
}
