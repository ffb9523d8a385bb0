package com.calculatorio.core.domain.errors;

public class DuplicateComponentException extends CalculatorException {

    private final String componentName;

    public DuplicateComponentException(String componentName) {
        super("Component already registered: " + componentName);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
