package org.example.pgr.graph;

import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.TargetDescription;

import java.util.List;
import java.util.Objects;

/**
 * A build unit of the package graph. Each module corresponds to one target of a resolved
 * package; its name is the target name, or the alias a consumer gave it.
 */
public class ResolvedModule {

    private final String name;
    private final String targetName;
    private final PackageIdentity packageIdentity;
    private final TargetDescription.Type type;
    private final List<ResolvedModule> dependencies;

    public ResolvedModule(String name, String targetName, PackageIdentity packageIdentity,
                          TargetDescription.Type type, List<ResolvedModule> dependencies) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.targetName = Objects.requireNonNull(targetName, "targetName cannot be null");
        this.packageIdentity = Objects.requireNonNull(packageIdentity, "packageIdentity cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.dependencies = List.copyOf(dependencies);
    }

    // Getters

    public String getName() {
        return name;
    }

    /**
     * The name of the target in its package manifest, which differs from {@link #getName()}
     * when the module is aliased.
     */
    public String getTargetName() {
        return targetName;
    }

    public PackageIdentity getPackageIdentity() {
        return packageIdentity;
    }

    public TargetDescription.Type getType() {
        return type;
    }

    /**
     * Direct module dependencies, same-package targets and modules of depended-upon products.
     */
    public List<ResolvedModule> getDependencies() {
        return dependencies;
    }

    public boolean isAliased() {
        return !name.equals(targetName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedModule that = (ResolvedModule) o;
        return name.equals(that.name) && packageIdentity.equals(that.packageIdentity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, packageIdentity);
    }

    @Override
    public String toString() {
        return isAliased() ? name + " (" + packageIdentity + ":" + targetName + ")" : name + " (" + packageIdentity + ")";
    }
}
