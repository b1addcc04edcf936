package com.confidence.schema;

import java.util.List;

/**
 * Thrown when resolving a schema revisits a name already seen on its inheritance chain.
 */
public class CircularInheritanceException extends SchemaRegistrationException {

    private final List<String> chain;

    public CircularInheritanceException(List<String> chain) {
        super("Circular inheritance detected: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }
}
