package org.dynamis.builder.compiler;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Map;

import org.dynamis.builder.TransformResult;

/**
 * Output of {@link BuilderFunctionCompiler#compile}: the printed sources, the transform outcome of
 * every bound method (keyed {@code Class.method(ParameterTypes)}) and the loaded classes.
 */
public record CompiledFunctions(Map<String, String> generatedSources,
                                Map<String, TransformResult> transforms,
                                ClassManager classes) {

    public CompiledFunctions {
        generatedSources = Map.copyOf(generatedSources);
        transforms = Map.copyOf(transforms);
    }

    public Class<?> getClass(String binaryName) {
        Class<?> type = classes.getClass(binaryName);
        if (type == null) {
            throw new IllegalArgumentException("No compiled class " + binaryName);
        }
        return type;
    }

    /** Invokes the static method {@code methodName} of {@code binaryName} with the given arguments. */
    public Object invokeStatic(String binaryName, String methodName, Object... arguments) {
        Method method = Arrays.stream(getClass(binaryName).getDeclaredMethods())
                .filter(candidate -> candidate.getName().equals(methodName))
                .filter(candidate -> candidate.getParameterCount() == arguments.length)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No method " + methodName + "/" + arguments.length
                                                                + " on " + binaryName));
        try {
            method.setAccessible(true);
            return method.invoke(null, arguments);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot invoke " + binaryName + "." + methodName, e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(binaryName + "." + methodName + " failed", cause);
        }
    }
}
