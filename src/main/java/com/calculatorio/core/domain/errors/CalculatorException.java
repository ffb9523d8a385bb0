package com.calculatorio.core.domain.errors;

/**
 * Base type for every failure raised by the catalog, the resolution engine and the catalog loader.
 * All subclasses are unchecked: inputs are local and deterministic, so callers either fix them or abort.
 */
public abstract class CalculatorException extends RuntimeException {

    protected CalculatorException(String message) {
        super(message);
    }

    protected CalculatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
