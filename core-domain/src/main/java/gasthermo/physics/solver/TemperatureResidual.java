package gasthermo.physics.solver;

import gasthermo.physics.model.GasState;

/**
 * Función objetivo f(T) = 0 de una inversión en temperatura.
 * <p>
 * Ambos métodos leen las magnitudes ya cacheadas del estado del gas en su temperatura
 * actual; el solver se encarga de mover esa temperatura.
 */
public interface TemperatureResidual {

    /**
     * Residuo f(T) en la temperatura actual del gas.
     */
    double residual(GasState gas);

    /**
     * Derivada df/dT en la temperatura actual del gas.
     */
    double derivative(GasState gas);
}
