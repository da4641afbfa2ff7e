package org.example.pgr.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The structured description of one package at one version: its dependencies, targets,
 * products and minimum platform versions.
 */
public class PackageManifest {

    private final PackageIdentity identity;
    private final String displayName;
    private final List<PackageDependency> dependencies;
    private final List<TargetDescription> targets;
    private final List<ProductDescription> products;
    private final Map<String, Version> platforms;

    private PackageManifest(Builder builder) {
        this.identity = Objects.requireNonNull(builder.identity, "identity cannot be null");
        this.displayName = builder.displayName != null ? builder.displayName : identity.getKey();
        this.dependencies = List.copyOf(builder.dependencies);
        this.targets = List.copyOf(builder.targets);
        this.products = List.copyOf(builder.products);
        this.platforms = Collections.unmodifiableMap(new TreeMap<>(builder.platforms));
    }

    /**
     * Creates a new PackageManifest using the builder pattern.
     */
    public static Builder builder(String name) {
        return new Builder(PackageIdentity.of(name)).displayName(name);
    }

    public static Builder builder(PackageIdentity identity) {
        return new Builder(identity);
    }

    // Getters

    public PackageIdentity getIdentity() {
        return identity;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<PackageDependency> getDependencies() {
        return dependencies;
    }

    public List<TargetDescription> getTargets() {
        return targets;
    }

    public List<ProductDescription> getProducts() {
        return products;
    }

    /**
     * Minimum deployment version per platform name, sorted by platform.
     */
    public Map<String, Version> getPlatforms() {
        return platforms;
    }

    // Query methods

    public Optional<TargetDescription> findTarget(String name) {
        return targets.stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    public Optional<ProductDescription> findProduct(String name) {
        return products.stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    public Optional<PackageDependency> findDependency(PackageIdentity dependency) {
        return dependencies.stream().filter(d -> d.getIdentity().equals(dependency)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageManifest that = (PackageManifest) o;
        return identity.equals(that.identity) &&
               displayName.equals(that.displayName) &&
               dependencies.equals(that.dependencies) &&
               targets.equals(that.targets) &&
               products.equals(that.products) &&
               platforms.equals(that.platforms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, displayName, dependencies, targets, products, platforms);
    }

    @Override
    public String toString() {
        return "PackageManifest{" +
                "identity=" + identity +
                ", dependencies=" + dependencies +
                ", targets=" + targets.size() +
                ", products=" + products.size() +
                '}';
    }

    /**
     * Builder for PackageManifest.
     */
    public static class Builder {
        private final PackageIdentity identity;
        private String displayName;
        private final List<PackageDependency> dependencies = new ArrayList<>();
        private final List<TargetDescription> targets = new ArrayList<>();
        private final List<ProductDescription> products = new ArrayList<>();
        private final Map<String, Version> platforms = new LinkedHashMap<>();

        public Builder(PackageIdentity identity) {
            this.identity = identity;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder dependency(PackageDependency dependency) {
            dependencies.add(dependency);
            return this;
        }

        public Builder dependency(String name, Requirement requirement) {
            return dependency(new PackageDependency(PackageIdentity.of(name), requirement));
        }

        public Builder target(TargetDescription target) {
            targets.add(target);
            return this;
        }

        public Builder product(ProductDescription product) {
            products.add(product);
            return this;
        }

        public Builder platform(String platform, Version minimum) {
            platforms.put(platform.toLowerCase(Locale.ROOT), minimum);
            return this;
        }

        public PackageManifest build() {
            return new PackageManifest(this);
        }
    }
}
