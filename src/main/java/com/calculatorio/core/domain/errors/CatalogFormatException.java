package com.calculatorio.core.domain.errors;

/**
 * A catalog source could not be read or does not describe valid components.
 */
public class CatalogFormatException extends CalculatorException {

    public CatalogFormatException(String message) {
        super(message);
    }

    public CatalogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
