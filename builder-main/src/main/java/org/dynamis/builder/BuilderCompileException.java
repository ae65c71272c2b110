package org.dynamis.builder;

public class BuilderCompileException extends DynamisBuilderException {

    private final String generatedSource;
    private final String diagnostics;

    public BuilderCompileException(String message, String generatedSource, String diagnostics) {
        super(message);
        this.generatedSource = generatedSource;
        this.diagnostics = diagnostics;
    }

    public BuilderCompileException(String message, String generatedSource, String diagnostics, Throwable cause) {
        super(message, cause);
        this.generatedSource = generatedSource;
        this.diagnostics = diagnostics;
    }

    public String getGeneratedSource() {
        return generatedSource;
    }

    public String getDiagnostics() {
        return diagnostics;
    }
}
