package gasthermo.domain.exception;

/**
 * Intento de asignar una propiedad derivada de solo lectura, o una composición con
 * valores no admitidos. La asignación es todo o nada: el estado no se modifica.
 */
public class InvalidPropertyAssignmentException extends GasThermoException {

    public InvalidPropertyAssignmentException(String message) {
        super(message);
    }
}
