package gasthermo.physics.process;

import gasthermo.domain.exception.InvalidProcessParameterException;
import gasthermo.physics.model.GasState;
import gasthermo.physics.solver.EntropyComplementSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Compresión y expansión politrópicas de un gas ideal.
 * <p>
 * Ambas modifican el gas in situ y lo devuelven. La temperatura final se obtiene
 * invirtiendo la función complemento de entropía:
 * <pre>
 * compresión: (φ₂ - φ₁)/R = ln(PR)/ηp
 * expansión:  (φ₂ - φ₁)/R = ηp·ln(PR)
 * </pre>
 * Para ηp = 1 ambas relaciones coinciden (proceso isentrópico).
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class Turbomachinery {

    private Turbomachinery() {}

    /**
     * Compresión isentrópica (ηp = 1).
     */
    public static GasState compress(GasState gas, double pressureRatio) {
        return compress(gas, pressureRatio, 1.0);
    }

    /**
     * Compresión politrópica: P ← P·PR y T₂ según la relación de φ.
     *
     * @param pressureRatio        PR ≥ 1.
     * @param polytropicEfficiency ηp ∈ (0, 1].
     * @throws InvalidProcessParameterException si PR &lt; 1 o ηp fuera de rango (el gas no se modifica).
     */
    public static GasState compress(GasState gas, double pressureRatio, double polytropicEfficiency) {
        Objects.requireNonNull(gas, "El gas no puede ser nulo.");
        if (!(pressureRatio >= 1.0) || Double.isInfinite(pressureRatio)) {
            throw new InvalidProcessParameterException(
                    "The specified pressure ratio (PR) to compress by needs to be ≥ 1.0. Provided PR = "
                            + pressureRatio + ". Did you mean to use `expand`?");
        }
        validateEfficiency(polytropicEfficiency);

        double t1 = gas.getTemperature();
        double exponent = gas.getGasConstant() / (gas.getSpecificHeat() * polytropicEfficiency);
        double target = Math.log(pressureRatio) / polytropicEfficiency;

        solve(gas, t1 * Math.pow(pressureRatio, exponent), target, "compress");
        gas.setPressure(gas.getPressure() * pressureRatio);

        log.debug("Compresión PR = {}, ηp = {}: T {} K -> {} K", pressureRatio, polytropicEfficiency, t1, gas.getTemperature());
        return gas;
    }

    /**
     * Expansión isentrópica (ηp = 1).
     */
    public static GasState expand(GasState gas, double pressureRatio) {
        return expand(gas, pressureRatio, 1.0);
    }

    /**
     * Expansión politrópica: P ← P·PR y T₂ según la relación de φ.
     *
     * @param pressureRatio        0 &lt; PR ≤ 1.
     * @param polytropicEfficiency ηp ∈ (0, 1].
     * @throws InvalidProcessParameterException si PR &gt; 1, PR ≤ 0 o ηp fuera de rango.
     */
    public static GasState expand(GasState gas, double pressureRatio, double polytropicEfficiency) {
        Objects.requireNonNull(gas, "El gas no puede ser nulo.");
        if (!(pressureRatio <= 1.0)) {
            throw new InvalidProcessParameterException(
                    "The specified pressure ratio (PR) to expand by needs to be ≤ 1.0. Provided PR = "
                            + pressureRatio + ". Did you mean to use `compress`?");
        }
        if (!(pressureRatio > 0.0)) {
            throw new InvalidProcessParameterException(
                    "La relación de presiones de la expansión debe ser > 0. Recibido PR = " + pressureRatio + ".");
        }
        validateEfficiency(polytropicEfficiency);

        double t1 = gas.getTemperature();
        double exponent = gas.getGasConstant() * polytropicEfficiency / gas.getSpecificHeat();
        double target = polytropicEfficiency * Math.log(pressureRatio);

        solve(gas, t1 * Math.pow(pressureRatio, exponent), target, "expand");
        gas.setPressure(gas.getPressure() * pressureRatio);

        log.debug("Expansión PR = {}, ηp = {}: T {} K -> {} K", pressureRatio, polytropicEfficiency, t1, gas.getTemperature());
        return gas;
    }

    private static void solve(GasState gas, double initialGuess, double target, String operation) {
        double phi1 = gas.getEntropyComplement();
        gas.setTemperature(initialGuess);
        EntropyComplementSolver.solve(gas, phi1, target, operation, gas.getSolverConfig());
    }

    static void validateEfficiency(double polytropicEfficiency) {
        if (!(polytropicEfficiency > 0.0 && polytropicEfficiency <= 1.0)) {
            throw new InvalidProcessParameterException(
                    "La eficiencia politrópica debe estar en (0, 1]. Recibido ηp = " + polytropicEfficiency + ".");
        }
    }
}
