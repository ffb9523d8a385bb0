package com.calculatorio.core.domain.errors;

/**
 * A time window, a unit count or a speed multiplier outside its valid range.
 */
public class InvalidRateException extends CalculatorException {

    public InvalidRateException(String message) {
        super(message);
    }
}
