package gasthermo.physics.process;

import gasthermo.domain.exception.InvalidProcessParameterException;
import gasthermo.physics.model.GasState;
import gasthermo.physics.solver.MachNumberSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Cambios de velocidad del flujo a entalpía total constante.
 * <p>
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class GasDynamics {

    private GasDynamics() {}

    public static GasState changeMach(GasState gas, double initialMach, double finalMach) {
        return changeMach(gas, initialMach, finalMach, 1.0);
    }

    /**
     * Lleva el gas (estado estático) de Mach M₀ a Mach M conservando la entalpía total
     * {@code ht = h + ½·M₀²·γ·R·T}. La presión estática se actualiza con Δφ y la
     * eficiencia politrópica:
     * <pre>
     * Δφ &gt; 0: P = P₀·exp(ηp·Δφ/R)
     * Δφ ≤ 0: P = P₀·exp(Δφ/(R·ηp))
     * </pre>
     *
     * @throws InvalidProcessParameterException si algún Mach no es finito y ≥ 0, o ηp ∉ (0, 1].
     */
    public static GasState changeMach(GasState gas, double initialMach, double finalMach, double polytropicEfficiency) {
        Objects.requireNonNull(gas, "El gas no puede ser nulo.");
        validateMach(initialMach, "inicial");
        validateMach(finalMach, "final");
        Turbomachinery.validateEfficiency(polytropicEfficiency);

        double t0 = gas.getTemperature();
        double p0 = gas.getPressure();
        double phi0 = gas.getEntropyComplement();
        double totalEnthalpy = gas.getEnthalpy()
                + 0.5 * initialMach * initialMach * gas.getGamma() * gas.getGasConstant() * t0;

        MachNumberSolver.solve(gas, totalEnthalpy, finalMach, gas.getSolverConfig());

        double deltaPhi = gas.getEntropyComplement() - phi0;
        double r = gas.getGasConstant();
        double exponent = deltaPhi > 0.0
                ? polytropicEfficiency * deltaPhi / r
                : deltaPhi / (r * polytropicEfficiency);
        gas.setPressure(p0 * Math.exp(exponent));

        log.debug("Cambio de Mach {} -> {} (ηp = {}): T {} K -> {} K, P {} Pa -> {} Pa",
                initialMach, finalMach, polytropicEfficiency, t0, gas.getTemperature(), p0, gas.getPressure());
        return gas;
    }

    private static void validateMach(double mach, String label) {
        if (!(Double.isFinite(mach) && mach >= 0.0)) {
            throw new InvalidProcessParameterException(
                    "El número de Mach " + label + " debe ser finito y ≥ 0. Recibido M = " + mach + ".");
        }
    }
}
