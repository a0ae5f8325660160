package gasthermo.physics.process;

import gasthermo.domain.exception.InvalidProcessParameterException;
import gasthermo.physics.model.GasState;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Mezcla adiabática de dos corrientes de gas.
 * <p>
 * {@code ratio} es el gasto másico de B por unidad de gasto másico de A. La composición
 * y la entalpía específica de la mezcla son las medias ponderadas por gasto; la
 * temperatura sale de invertir la entalpía (conservación de la energía). La presión de
 * la mezcla es la menor de las dos de entrada.
 * <p>
 * Las corrientes de entrada no se modifican. Stateless y Thread-Safe.
 */
@Slf4j
public final class GasMixer {

    private GasMixer() {}

    /**
     * @return Un gas nuevo con el estado de la mezcla.
     * @throws InvalidProcessParameterException si el ratio no es finito y ≥ 0, o si los
     *                                          gases no comparten registro de especies.
     */
    public static GasState mix(GasState gasA, GasState gasB, double ratio) {
        Objects.requireNonNull(gasA, "El gas A no puede ser nulo.");
        Objects.requireNonNull(gasB, "El gas B no puede ser nulo.");
        if (!(Double.isFinite(ratio) && ratio >= 0.0)) {
            throw new InvalidProcessParameterException(
                    "La relación de gastos debe ser finita y ≥ 0. Recibido ratio = " + ratio + ".");
        }
        if (gasA.getRegistry() != gasB.getRegistry()) {
            throw new InvalidProcessParameterException(
                    "Ambos gases deben compartir el mismo registro de especies para mezclarse.");
        }

        final double weight = 1.0 / (1.0 + ratio);
        double[] yA = gasA.getMassFractions();
        double[] yB = gasB.getMassFractions();
        double[] y = new double[yA.length];
        for (int i = 0; i < y.length; i++) {
            y[i] = (yA[i] + ratio * yB[i]) * weight;
        }

        double h = (gasA.getEnthalpy() + ratio * gasB.getEnthalpy()) * weight;
        double tGuess = (gasA.getTemperature() + ratio * gasB.getTemperature()) * weight;
        double p = Math.min(gasA.getPressure(), gasB.getPressure());

        GasState mixed = new GasState(gasA.getRegistry(), gasA.getSolverConfig(), y);
        mixed.setTemperatureAndPressure(tGuess, p);
        mixed.setEnthalpy(h);

        log.debug("Mezcla con ratio {}: T_A = {} K, T_B = {} K -> T = {} K, P = {} Pa",
                ratio, gasA.getTemperature(), gasB.getTemperature(), mixed.getTemperature(), p);
        return mixed;
    }
}
