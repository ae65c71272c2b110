package org.dynamis.builder.capability;

/**
 * One combinator method of the builder protocol, with the parameter shape the capability
 * resolver checks before recording it as present.
 */
public enum Combinator {

    EXPRESSION("buildExpression", Capability.EXPRESSION, Shape.UNARY),
    BLOCK("buildBlock", Capability.BLOCK, Shape.VARIADIC),
    FINAL_RESULT("buildFinalResult", Capability.FINAL_RESULT, Shape.UNARY),
    DO("buildDo", Capability.DO, Shape.VARIADIC),
    OPTIONAL("buildOptional", Capability.OPTIONAL, Shape.UNARY),
    EITHER_FIRST("buildEitherFirst", Capability.EITHER, Shape.UNARY),
    EITHER_SECOND("buildEitherSecond", Capability.EITHER, Shape.UNARY),
    ARRAY("buildArray", Capability.ARRAY, Shape.UNARY),
    LIMITED_AVAILABILITY("buildLimitedAvailability", Capability.LIMITED_AVAILABILITY, Shape.UNARY);

    public enum Shape {
        /** Exactly one non-varargs parameter. */
        UNARY,
        /** Any number of parameters, fixed or varargs. */
        VARIADIC
    }

    private final String methodName;
    private final Capability capability;
    private final Shape shape;

    Combinator(String methodName, Capability capability, Shape shape) {
        this.methodName = methodName;
        this.capability = capability;
        this.shape = shape;
    }

    public String methodName() {
        return methodName;
    }

    public Capability capability() {
        return capability;
    }

    public Shape shape() {
        return shape;
    }

    public boolean matchesShape(CombinatorSignature signature) {
        if (shape == Shape.VARIADIC) {
            return true;
        }
        return signature.parameterTypes().size() == 1 && !signature.varArgs();
    }
}
