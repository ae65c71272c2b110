package org.dynamis.builder.capability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The eight optional operations a builder type may supply. {@link #EITHER} is the only one
 * backed by two methods and counts as present only when both are.
 */
public enum Capability {

    EXPRESSION,
    BLOCK,
    FINAL_RESULT,
    DO,
    OPTIONAL,
    EITHER,
    ARRAY,
    LIMITED_AVAILABILITY;

    public List<Combinator> combinators() {
        List<Combinator> combinators = new ArrayList<>();
        for (Combinator combinator : Combinator.values()) {
            if (combinator.capability() == this) {
                combinators.add(combinator);
            }
        }
        return combinators;
    }

    public String describeMethods() {
        return combinators().stream().map(Combinator::methodName).collect(Collectors.joining("/"));
    }
}
