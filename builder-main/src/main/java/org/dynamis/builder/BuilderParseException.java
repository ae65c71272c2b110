package org.dynamis.builder;

public class BuilderParseException extends DynamisBuilderException {

    private final String source;
    private final int line;
    private final int column;

    public BuilderParseException(String message, String source, int line, int column) {
        super(message);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public BuilderParseException(String message, String source, int line, int column, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
