package org.example.pgr.graph;

import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.ProductDescription;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A product of a resolved package with the modules it exposes.
 */
public class ResolvedProduct {

    private final String name;
    private final PackageIdentity packageIdentity;
    private final ProductDescription.Type type;
    private final List<ResolvedModule> modules;

    public ResolvedProduct(String name, PackageIdentity packageIdentity, ProductDescription.Type type,
                           List<ResolvedModule> modules) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.packageIdentity = Objects.requireNonNull(packageIdentity, "packageIdentity cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.modules = List.copyOf(modules);
    }

    public String getName() {
        return name;
    }

    public PackageIdentity getPackageIdentity() {
        return packageIdentity;
    }

    public ProductDescription.Type getType() {
        return type;
    }

    public List<ResolvedModule> getModules() {
        return modules;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedProduct that = (ResolvedProduct) o;
        return name.equals(that.name) && packageIdentity.equals(that.packageIdentity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, packageIdentity);
    }

    @Override
    public String toString() {
        return name + " (" + packageIdentity + ", " + type.name().toLowerCase(Locale.ROOT) + ")";
    }
}
