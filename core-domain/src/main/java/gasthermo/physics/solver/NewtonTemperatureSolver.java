package gasthermo.physics.solver;

import gasthermo.domain.exception.ConvergenceException;
import gasthermo.physics.model.GasState;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Motor Newton-Raphson amortiguado sobre la temperatura de un {@link GasState}.
 * <p>
 * Arranca desde la temperatura actual del gas (warm start) y aplica cada paso con
 * {@link GasState#setTemperature(double)}, de modo que las magnitudes cacheadas son
 * coherentes en cada iteración. En la segunda mitad del presupuesto de iteraciones el
 * paso se escala por {@code i/maxIterations}: la discontinuidad de coeficientes en
 * 1000 K puede provocar un ciclo de periodo 2 a ambos lados de la frontera.
 * <p>
 * Stateless y Thread-Safe (el gas pertenece al llamador).
 */
@Slf4j
public final class NewtonTemperatureSolver {

    private NewtonTemperatureSolver() {}

    /**
     * Resuelve {@code residual(T) = 0} moviendo la temperatura del gas.
     *
     * @param gas           Estado a modificar in situ.
     * @param residual      Función objetivo y su derivada.
     * @param operation     Nombre de la operación, para los mensajes de error.
     * @param maxIterations Límite de iteraciones (≥ 1).
     * @param tolerance     Tolerancia sobre |ΔT| [K].
     * @return Número de iteraciones usadas.
     * @throws ConvergenceException si no converge; el gas queda en la última iteración.
     */
    public static int solve(GasState gas, TemperatureResidual residual, String operation,
                            int maxIterations, double tolerance) {
        Objects.requireNonNull(gas, "El estado del gas no puede ser nulo.");
        Objects.requireNonNull(residual, "El residuo no puede ser nulo.");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations debe ser >= 1. Recibido: " + maxIterations);
        }

        double dT = Double.NaN;
        for (int i = 1; i <= maxIterations; i++) {
            // 1. Paso Newton
            double f = residual.residual(gas);
            double df = residual.derivative(gas);
            dT = -f / df;
            log.trace("[{}] iter {}: T = {} K, f = {}, dT = {}", operation, i, gas.getTemperature(), f, dT);

            // 2. Convergencia (NaN nunca converge)
            if (Math.abs(dT) <= tolerance) {
                log.debug("[{}] convergió en {} iteraciones (|dT| = {}). T = {} K",
                        operation, i, Math.abs(dT), gas.getTemperature());
                return i;
            }

            // 3. Amortiguación en la segunda mitad del presupuesto
            if (i > maxIterations / 2.0) {
                dT = dT * i / maxIterations;
            }

            // 4. Nuevo iterado
            double next = gas.getTemperature() + dT;
            if (!Double.isFinite(next) || next <= 0.0) {
                log.error("[{}] iterado no físico en la iteración {}: T = {} K", operation, i, next);
                throw new ConvergenceException(operation, i, Math.abs(dT), tolerance, gas.snapshot());
            }
            gas.setTemperature(next);
        }

        log.error("[{}] no convergió tras {} iteraciones. |dT| = {} > {}", operation, maxIterations, Math.abs(dT), tolerance);
        throw new ConvergenceException(operation, maxIterations, Math.abs(dT), tolerance, gas.snapshot());
    }
}
