package org.example.pgr.model;

import java.util.List;
import java.util.Objects;

/**
 * A product a package exposes to its dependents: a named set of its targets.
 */
public class ProductDescription {

    /**
     * Product type.
     */
    public enum Type {
        LIBRARY,
        EXECUTABLE
    }

    private final String name;
    private final Type type;
    private final List<String> targets;

    public ProductDescription(String name, Type type, List<String> targets) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.type = type != null ? type : Type.LIBRARY;
        this.targets = List.copyOf(targets != null ? targets : List.of());
    }

    public static ProductDescription library(String name, String... targets) {
        return new ProductDescription(name, Type.LIBRARY, List.of(targets));
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public List<String> getTargets() {
        return targets;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProductDescription that = (ProductDescription) o;
        return name.equals(that.name) && type == that.type && targets.equals(that.targets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, targets);
    }

    @Override
    public String toString() {
        return name + " " + targets;
    }
}
