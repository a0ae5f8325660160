package gasthermo.domain.exception;

/**
 * Parámetro de proceso inválido: relación de presiones en sentido contrario a la
 * operación, eficiencia fuera de (0, 1], número de Mach negativo, relación de mezcla
 * negativa, etc. Se detecta antes de mutar el gas.
 */
public class InvalidProcessParameterException extends GasThermoException {

    public InvalidProcessParameterException(String message) {
        super(message);
    }
}
