package org.dynamis.builder;

/**
 * Base type of every failure that aborts the transform of one body. The node description
 * identifies the offending construct, usually its source text followed by its position.
 */
public class BuilderTransformException extends DynamisBuilderException {

    private final String nodeDescription;

    public BuilderTransformException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public BuilderTransformException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
