package gasthermo.domain.exception;

/**
 * Raíz de la jerarquía de errores del modelo termodinámico.
 * Todas son no comprobadas: representan errores de uso o fallos numéricos fatales
 * para la operación en curso.
 */
public abstract class GasThermoException extends RuntimeException {

    protected GasThermoException(String message) {
        super(message);
    }
}
