package org.example.pgr.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A target declared in a package manifest.
 */
public class TargetDescription {

    /**
     * Target type.
     */
    public enum Type {
        REGULAR,
        EXECUTABLE,
        TEST
    }

    private final String name;
    private final Type type;
    private final List<TargetDependency> dependencies;

    public TargetDescription(String name, Type type, List<TargetDependency> dependencies) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.type = type != null ? type : Type.REGULAR;
        this.dependencies = List.copyOf(dependencies != null ? dependencies : List.of());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public List<TargetDependency> getDependencies() {
        return dependencies;
    }

    public boolean isTest() {
        return type == Type.TEST;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetDescription that = (TargetDescription) o;
        return name.equals(that.name) && type == that.type && dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, dependencies);
    }

    @Override
    public String toString() {
        return name + " (" + type.name().toLowerCase() + ")";
    }

    /**
     * Builder for TargetDescription.
     */
    public static class Builder {
        private final String name;
        private Type type = Type.REGULAR;
        private final List<TargetDependency> dependencies = new ArrayList<>();

        public Builder(String name) {
            this.name = name;
        }

        public Builder type(Type type) {
            this.type = type;
            return this;
        }

        public Builder dependsOnTarget(String target) {
            dependencies.add(TargetDependency.target(target));
            return this;
        }

        public Builder dependsOnProduct(String product, String packageName) {
            dependencies.add(TargetDependency.product(product, PackageIdentity.of(packageName)));
            return this;
        }

        public Builder dependsOn(TargetDependency dependency) {
            dependencies.add(dependency);
            return this;
        }

        public TargetDescription build() {
            return new TargetDescription(name, type, dependencies);
        }
    }
}
