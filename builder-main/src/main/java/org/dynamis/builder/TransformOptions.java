package org.dynamis.builder;

/**
 * Settings of one transform. Defaults come from system properties so a build can switch them
 * without code changes, e.g. {@code -Ddynamis.builder.liftAssignments=false}.
 *
 * @param liftAssignments    contribute a {@code (Void) null} partial result for assignments and void calls
 * @param availabilityMethod name of the call that marks an {@code if} as an availability check
 * @param variablePrefix     prefix of the locals the transform declares
 * @param typeCheck          resolve every combinator call against the builder's declared overloads
 */
public record TransformOptions(boolean liftAssignments,
                               String availabilityMethod,
                               String variablePrefix,
                               boolean typeCheck) {

    public static final String LIFT_ASSIGNMENTS_PROPERTY = "dynamis.builder.liftAssignments";
    public static final String AVAILABILITY_METHOD_PROPERTY = "dynamis.builder.availabilityMethod";
    public static final String VARIABLE_PREFIX_PROPERTY = "dynamis.builder.variablePrefix";
    public static final String TYPE_CHECK_PROPERTY = "dynamis.builder.typeCheck";

    public TransformOptions {
        if (variablePrefix == null || variablePrefix.isEmpty()) {
            throw new IllegalArgumentException("variablePrefix must not be empty");
        }
    }

    public static TransformOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .liftAssignments(liftAssignments)
                .availabilityMethod(availabilityMethod)
                .variablePrefix(variablePrefix)
                .typeCheck(typeCheck);
    }

    public static final class Builder {

        private boolean liftAssignments = Boolean.parseBoolean(System.getProperty(LIFT_ASSIGNMENTS_PROPERTY, "true"));
        private String availabilityMethod = System.getProperty(AVAILABILITY_METHOD_PROPERTY, "isAvailable");
        private String variablePrefix = System.getProperty(VARIABLE_PREFIX_PROPERTY, "__builder");
        private boolean typeCheck = Boolean.parseBoolean(System.getProperty(TYPE_CHECK_PROPERTY, "true"));

        private Builder() {
        }

        public Builder liftAssignments(boolean liftAssignments) {
            this.liftAssignments = liftAssignments;
            return this;
        }

        public Builder availabilityMethod(String availabilityMethod) {
            this.availabilityMethod = availabilityMethod;
            return this;
        }

        public Builder variablePrefix(String variablePrefix) {
            this.variablePrefix = variablePrefix;
            return this;
        }

        public Builder typeCheck(boolean typeCheck) {
            this.typeCheck = typeCheck;
            return this;
        }

        public TransformOptions build() {
            return new TransformOptions(liftAssignments, availabilityMethod, variablePrefix, typeCheck);
        }
    }
}
