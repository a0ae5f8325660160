package gasthermo.domain.exception;

import lombok.Getter;

/**
 * Una composición hace referencia a una especie que no existe en el registro.
 */
@Getter
public class UnknownSpeciesException extends GasThermoException {

    private final String speciesName;

    public UnknownSpeciesException(String speciesName) {
        super("La especie '" + speciesName + "' no está en el registro de especies.");
        this.speciesName = speciesName;
    }
}
