package gasthermo.physics.simulator;

import gasthermo.config.ThermoConstants;
import gasthermo.domain.simulation.ThermoTable;
import gasthermo.physics.model.GasState;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Genera tablas de cp, h, φ y s de una mezcla sobre un rango de temperaturas.
 * <p>
 * El barrido se hace sobre una copia: el gas de entrada no se modifica.
 * Stateless y Thread-Safe.
 */
@Slf4j
public final class ThermoSweep {

    public static final double DEFAULT_END_TEMPERATURE = 2000.0;
    public static final double DEFAULT_STEP = 100.0;

    /** Máximo de filas de una tabla generada a partir de un rango. */
    public static final int MAX_ROWS = 1_000_000;

    // Holgura para que el extremo superior entre en el rango pese al redondeo.
    private static final double RANGE_SLACK = 1e-9;

    private ThermoSweep() {}

    /**
     * Rango por defecto: de 298.15 K a 2000 K cada 100 K.
     */
    public static ThermoTable sweep(GasState gas) {
        return sweep(gas, ThermoConstants.T_STD, DEFAULT_END_TEMPERATURE, DEFAULT_STEP);
    }

    /**
     * Barre {@code start, start+step, ...} mientras no se supere {@code end}.
     *
     * @throws IllegalArgumentException si el rango no es válido o genera más de {@link #MAX_ROWS} filas.
     */
    public static ThermoTable sweep(GasState gas, double start, double end, double step) {
        if (!(Double.isFinite(start) && start > 0.0)) {
            throw new IllegalArgumentException("La temperatura inicial debe ser finita y positiva: " + start);
        }
        if (!(Double.isFinite(end) && end >= start)) {
            throw new IllegalArgumentException("La temperatura final debe ser finita y >= " + start + ": " + end);
        }
        if (!(Double.isFinite(step) && step > 0.0)) {
            throw new IllegalArgumentException("El paso de temperatura debe ser finito y positivo: " + step);
        }

        double intervals = Math.floor((end - start) / step + RANGE_SLACK);
        if (!(intervals < MAX_ROWS)) {
            throw new IllegalArgumentException(String.format(
                    "El rango [%s, %s] con paso %s genera más de %d filas.", start, end, step, MAX_ROWS));
        }
        int count = (int) intervals + 1;
        double[] temperatures = new double[count];
        for (int i = 0; i < count; i++) {
            temperatures[i] = start + i * step;
        }
        return sweep(gas, temperatures);
    }

    /**
     * Evalúa la tabla en las temperaturas dadas, en el orden dado.
     */
    public static ThermoTable sweep(GasState gas, double[] temperatures) {
        Objects.requireNonNull(gas, "El gas no puede ser nulo.");
        Objects.requireNonNull(temperatures, "Las temperaturas no pueden ser nulas.");

        GasState work = gas.copy();
        int n = temperatures.length;
        double[] cp = new double[n];
        double[] h = new double[n];
        double[] phi = new double[n];
        double[] s = new double[n];

        for (int i = 0; i < n; i++) {
            work.setTemperature(temperatures[i]);
            cp[i] = work.getSpecificHeat();
            h[i] = work.getEnthalpy();
            phi[i] = work.getEntropyComplement();
            s[i] = work.getEntropy();
        }

        log.debug("Barrido termodinámico de {} temperaturas a P = {} Pa", n, work.getPressure());
        return ThermoTable.builder()
                .composition(work.getMoleFractionMap())
                .pressure(work.getPressure())
                .temperatures(temperatures)
                .specificHeats(cp)
                .enthalpies(h)
                .entropyComplements(phi)
                .entropies(s)
                .build();
    }
}
