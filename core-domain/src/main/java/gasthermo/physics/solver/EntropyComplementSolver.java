package gasthermo.physics.solver;

import gasthermo.config.SolverConfig;
import gasthermo.physics.model.GasState;

/**
 * Inversión de la función complemento de entropía: busca T tal que
 * {@code (φ(T) - φ₁)/R = objetivo}.
 * <p>
 * Derivada {@code dφ/dT / R = cp/(T·R)}. Es la relación que gobierna la compresión y
 * la expansión politrópicas.
 */
public final class EntropyComplementSolver {

    private EntropyComplementSolver() {}

    /**
     * @param gas               Gas con la temperatura inicial ya fijada (semilla).
     * @param referencePhi      φ₁ del estado de partida [J/kg/K].
     * @param target            Valor adimensional buscado de (φ₂ - φ₁)/R.
     * @param operation         Nombre de la operación, para los errores.
     * @return Iteraciones usadas.
     */
    public static int solve(GasState gas, double referencePhi, double target, String operation, SolverConfig config) {
        TemperatureResidual residual = new TemperatureResidual() {
            @Override
            public double residual(GasState g) {
                return (g.getEntropyComplement() - referencePhi) / g.getGasConstant() - target;
            }

            @Override
            public double derivative(GasState g) {
                return g.getSpecificHeat() / (g.getTemperature() * g.getGasConstant());
            }
        };
        return NewtonTemperatureSolver.solve(gas, residual, operation,
                config.entropyMaxIterations(), config.temperatureTolerance());
    }
}
