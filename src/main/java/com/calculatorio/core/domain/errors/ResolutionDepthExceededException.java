package com.calculatorio.core.domain.errors;

public class ResolutionDepthExceededException extends CalculatorException {

    private final String componentName;
    private final int maxDepth;

    public ResolutionDepthExceededException(String componentName, int maxDepth) {
        super("Ingredient chain of '" + componentName + "' is deeper than " + maxDepth + " levels");
        this.componentName = componentName;
        this.maxDepth = maxDepth;
    }

    public String getComponentName() {
        return componentName;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
