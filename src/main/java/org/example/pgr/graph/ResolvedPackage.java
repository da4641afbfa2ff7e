package org.example.pgr.graph;

import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.Version;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A package of the graph at its resolved state, with the modules and products kept after
 * pruning.
 */
public class ResolvedPackage {

    private final PackageIdentity identity;
    private final String displayName;
    private final BoundVersion boundVersion;
    private final Map<String, Version> platforms;
    private final List<ResolvedModule> modules;
    private final List<ResolvedProduct> products;

    /**
     * @param boundVersion the resolved state, null for the root package
     */
    public ResolvedPackage(PackageIdentity identity, String displayName, BoundVersion boundVersion,
                           Map<String, Version> platforms, List<ResolvedModule> modules,
                           List<ResolvedProduct> products) {
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        this.displayName = Objects.requireNonNull(displayName, "displayName cannot be null");
        this.boundVersion = boundVersion;
        this.platforms = Collections.unmodifiableMap(new TreeMap<>(platforms));
        this.modules = List.copyOf(modules);
        this.products = List.copyOf(products);
    }

    // Getters

    public PackageIdentity getIdentity() {
        return identity;
    }

    public String getDisplayName() {
        return displayName;
    }

    public BoundVersion getBoundVersion() {
        return boundVersion;
    }

    public boolean isRoot() {
        return boundVersion == null;
    }

    public Map<String, Version> getPlatforms() {
        return platforms;
    }

    public List<ResolvedModule> getModules() {
        return modules;
    }

    public List<ResolvedProduct> getProducts() {
        return products;
    }

    public Optional<ResolvedProduct> findProduct(String name) {
        return products.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedPackage that = (ResolvedPackage) o;
        return identity.equals(that.identity) && Objects.equals(boundVersion, that.boundVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, boundVersion);
    }

    @Override
    public String toString() {
        return isRoot() ? identity + " (root)" : identity + " " + boundVersion;
    }
}
