package org.dynamis.builder;

import org.dynamis.builder.capability.Capability;

public class MissingCapabilityException extends BuilderTransformException {

    private final String builderName;
    private final Capability capability;

    public MissingCapabilityException(String builderName, Capability capability, String construct, String nodeDescription) {
        super("Builder '" + builderName + "' does not support " + construct + ": missing "
              + capability.describeMethods(), nodeDescription);
        this.builderName = builderName;
        this.capability = capability;
    }

    public String getBuilderName() {
        return builderName;
    }

    public Capability getCapability() {
        return capability;
    }
}
