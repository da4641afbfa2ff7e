package org.example.pgr.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A dependency a package manifest declares on another package.
 */
public class PackageDependency {

    private final PackageIdentity identity;
    private final Requirement requirement;
    private final Map<String, String> moduleAliases;

    public PackageDependency(PackageIdentity identity, Requirement requirement) {
        this(identity, requirement, Map.of());
    }

    /**
     * @param identity      the package depended upon
     * @param requirement   the acceptable versions
     * @param moduleAliases renames applied to modules of the dependency (original name to alias)
     */
    public PackageDependency(PackageIdentity identity, Requirement requirement, Map<String, String> moduleAliases) {
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        this.requirement = Objects.requireNonNull(requirement, "requirement cannot be null");
        this.moduleAliases = Collections.unmodifiableMap(new LinkedHashMap<>(
                moduleAliases != null ? moduleAliases : Map.of()));
    }

    public PackageIdentity getIdentity() {
        return identity;
    }

    public Requirement getRequirement() {
        return requirement;
    }

    public Map<String, String> getModuleAliases() {
        return moduleAliases;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageDependency that = (PackageDependency) o;
        return identity.equals(that.identity) &&
               requirement.equals(that.requirement) &&
               moduleAliases.equals(that.moduleAliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, requirement, moduleAliases);
    }

    @Override
    public String toString() {
        return identity + " " + requirement;
    }
}
