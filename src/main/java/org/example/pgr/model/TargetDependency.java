package org.example.pgr.model;

import java.util.Objects;
import java.util.Set;

/**
 * A dependency of a target: another target of the same package, a product of another package,
 * or a name resolved against both.
 */
public final class TargetDependency {

    /**
     * How the dependency names what it depends on.
     */
    public enum Kind {
        TARGET,
        PRODUCT,
        BY_NAME
    }

    private final Kind kind;
    private final String name;
    private final PackageIdentity packageIdentity;
    private final Set<String> platforms;

    private TargetDependency(Kind kind, String name, PackageIdentity packageIdentity, Set<String> platforms) {
        this.kind = kind;
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.packageIdentity = packageIdentity;
        this.platforms = platforms != null ? Set.copyOf(platforms) : Set.of();
    }

    public static TargetDependency target(String name) {
        return new TargetDependency(Kind.TARGET, name, null, null);
    }

    public static TargetDependency product(String name, PackageIdentity packageIdentity) {
        return new TargetDependency(Kind.PRODUCT, name,
                Objects.requireNonNull(packageIdentity, "packageIdentity cannot be null"), null);
    }

    public static TargetDependency byName(String name) {
        return new TargetDependency(Kind.BY_NAME, name, null, null);
    }

    /**
     * Restricts this dependency to the given platforms (empty means all).
     */
    public TargetDependency onPlatforms(Set<String> platforms) {
        return new TargetDependency(kind, name, packageIdentity, platforms);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /**
     * The package exposing the product; only set for {@link Kind#PRODUCT}.
     */
    public PackageIdentity getPackageIdentity() {
        return packageIdentity;
    }

    public Set<String> getPlatforms() {
        return platforms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetDependency that = (TargetDependency) o;
        return kind == that.kind &&
               name.equals(that.name) &&
               Objects.equals(packageIdentity, that.packageIdentity) &&
               platforms.equals(that.platforms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, packageIdentity, platforms);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TARGET -> "target " + name;
            case PRODUCT -> "product " + name + " (" + packageIdentity + ")";
            case BY_NAME -> name;
        };
    }
}
