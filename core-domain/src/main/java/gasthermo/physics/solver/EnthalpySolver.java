package gasthermo.physics.solver;

import gasthermo.config.SolverConfig;
import gasthermo.physics.model.GasState;

/**
 * Inversión entalpía → temperatura: busca T tal que h(T) = h_objetivo.
 * <p>
 * Residuo {@code h - h_objetivo}; derivada {@code dh/dT = cp}.
 */
public final class EnthalpySolver {

    public static final String OPERATION = "setEnthalpy";

    private EnthalpySolver() {}

    /**
     * @param targetEnthalpy Entalpía objetivo [J/kg].
     * @return Iteraciones usadas.
     */
    public static int solve(GasState gas, double targetEnthalpy, SolverConfig config) {
        TemperatureResidual residual = new TemperatureResidual() {
            @Override
            public double residual(GasState g) {
                return g.getEnthalpy() - targetEnthalpy;
            }

            @Override
            public double derivative(GasState g) {
                return g.getSpecificHeat();
            }
        };
        return NewtonTemperatureSolver.solve(gas, residual, OPERATION,
                config.enthalpyMaxIterations(), config.temperatureTolerance());
    }
}
