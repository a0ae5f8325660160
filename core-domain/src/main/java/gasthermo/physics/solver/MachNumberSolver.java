package gasthermo.physics.solver;

import gasthermo.config.SolverConfig;
import gasthermo.physics.model.GasState;

/**
 * Temperatura estática a entalpía total constante para un número de Mach dado.
 * <pre>
 * f(T)  = h + ½·M²·γ·R·T - ht
 * f'(T) = cp + ½·M²·R·(γ + T·dγ/dT),   dγ/dT = -R·cp_T / (cp - R)²
 * </pre>
 */
public final class MachNumberSolver {

    public static final String OPERATION = "changeMach";

    private MachNumberSolver() {}

    /**
     * @param totalEnthalpy Entalpía total ht [J/kg].
     * @param mach          Número de Mach final.
     * @return Iteraciones usadas.
     */
    public static int solve(GasState gas, double totalEnthalpy, double mach, SolverConfig config) {
        final double halfM2 = 0.5 * mach * mach;
        TemperatureResidual residual = new TemperatureResidual() {
            @Override
            public double residual(GasState g) {
                double r = g.getGasConstant();
                return g.getEnthalpy() + halfM2 * g.getGamma() * r * g.getTemperature() - totalEnthalpy;
            }

            @Override
            public double derivative(GasState g) {
                double r = g.getGasConstant();
                double cp = g.getSpecificHeat();
                double dGammaDT = -r * g.getSpecificHeatDerivative() / ((cp - r) * (cp - r));
                return cp + halfM2 * r * (g.getGamma() + g.getTemperature() * dGammaDT);
            }
        };
        return NewtonTemperatureSolver.solve(gas, residual, OPERATION,
                config.machMaxIterations(), config.temperatureTolerance());
    }
}
