package com.calculatorio.core.domain.errors;

/**
 * Raised when a component references an ingredient that is not registered yet.
 * Ingredients must be registered first, which keeps cycles out of the catalog.
 */
public class UnknownIngredientException extends CalculatorException {

    private final String componentName;
    private final String ingredientName;

    public UnknownIngredientException(String componentName, String ingredientName) {
        super("Component '" + componentName + "' references unregistered ingredient '" + ingredientName + "'");
        this.componentName = componentName;
        this.ingredientName = ingredientName;
    }

    public String getComponentName() {
        return componentName;
    }

    public String getIngredientName() {
        return ingredientName;
    }
}
