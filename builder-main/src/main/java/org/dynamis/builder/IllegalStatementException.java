package org.dynamis.builder;

import org.dynamis.builder.classify.StatementKind;

public class IllegalStatementException extends BuilderTransformException {

    private final String construct;

    public IllegalStatementException(String construct, String nodeDescription) {
        super("'" + construct + "' is not allowed in a builder body", nodeDescription);
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }

    public StatementKind getKind() {
        return StatementKind.ILLEGAL;
    }
}
