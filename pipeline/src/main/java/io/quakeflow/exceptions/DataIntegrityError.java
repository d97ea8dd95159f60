package io.quakeflow.exceptions;

/**
 * Raised by the feature transform when the input has no usable records or a
 * core column is entirely absent. Fatal: imputation must never mask it.
 */
public class DataIntegrityError extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public DataIntegrityError(String message) {
        super(message);
    }
}
