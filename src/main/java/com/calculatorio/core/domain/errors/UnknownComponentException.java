package com.calculatorio.core.domain.errors;

public class UnknownComponentException extends CalculatorException {

    private final String componentName;

    public UnknownComponentException(String componentName) {
        super("Unknown component: " + componentName);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
