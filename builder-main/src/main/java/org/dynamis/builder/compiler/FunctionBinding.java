package org.dynamis.builder.compiler;

/**
 * Declares that every method named {@code methodName} of {@code className} is a builder function
 * whose body is combined through {@code builderName}. Class names may be simple or fully qualified.
 */
public record FunctionBinding(String className, String methodName, String builderName) {

    public static FunctionBinding of(String className, String methodName, String builderName) {
        return new FunctionBinding(className, methodName, builderName);
    }
}
