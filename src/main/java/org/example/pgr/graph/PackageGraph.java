package org.example.pgr.graph;

import org.example.pgr.model.PackageIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The validated build graph of a resolution.
 * Contains the resolved packages with their modules and products, root package first.
 */
public class PackageGraph {

    private final ResolvedPackage rootPackage;
    private final List<ResolvedPackage> packages;
    private final Map<String, ResolvedModule> modules;
    private final Map<String, List<ResolvedModule>> requiredModules;

    /**
     * @param rootPackage     the package being resolved
     * @param dependencies    the other packages, in identity order
     * @param requiredModules per root target, the modules it needs transitively
     */
    public PackageGraph(ResolvedPackage rootPackage, List<ResolvedPackage> dependencies,
                        Map<String, List<ResolvedModule>> requiredModules) {
        this.rootPackage = Objects.requireNonNull(rootPackage, "rootPackage cannot be null");
        List<ResolvedPackage> all = new ArrayList<>();
        all.add(rootPackage);
        all.addAll(dependencies);
        this.packages = Collections.unmodifiableList(all);

        Map<String, ResolvedModule> byName = new LinkedHashMap<>();
        for (ResolvedPackage resolvedPackage : all) {
            for (ResolvedModule module : resolvedPackage.getModules()) {
                byName.put(module.getName(), module);
            }
        }
        this.modules = Collections.unmodifiableMap(byName);

        Map<String, List<ResolvedModule>> required = new LinkedHashMap<>();
        requiredModules.forEach((target, list) -> required.put(target, List.copyOf(list)));
        this.requiredModules = Collections.unmodifiableMap(required);
    }

    // Getters

    public ResolvedPackage getRootPackage() {
        return rootPackage;
    }

    public List<ResolvedPackage> getPackages() {
        return packages;
    }

    public List<ResolvedModule> getModules() {
        return List.copyOf(modules.values());
    }

    // Query methods

    public Optional<ResolvedPackage> findPackage(PackageIdentity identity) {
        return packages.stream().filter(p -> p.getIdentity().equals(identity)).findFirst();
    }

    public Optional<ResolvedModule> findModule(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    /**
     * Returns the modules a root target needs, direct and transitive, excluding itself.
     */
    public List<ResolvedModule> getRequiredModules(String rootTarget) {
        List<ResolvedModule> required = requiredModules.get(rootTarget);
        if (required == null) {
            throw new IllegalArgumentException("Not a root target: " + rootTarget);
        }
        return required;
    }

    public int getPackageCount() {
        return packages.size();
    }

    public int getModuleCount() {
        return modules.size();
    }

    @Override
    public String toString() {
        return "PackageGraph{" +
                "root=" + rootPackage.getIdentity() +
                ", packageCount=" + packages.size() +
                ", moduleCount=" + modules.size() +
                '}';
    }

    /**
     * Returns a detailed string representation of the graph.
     */
    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("PackageGraph:\n");
        sb.append("  Root: ").append(rootPackage.getDisplayName()).append("\n");
        sb.append("  Packages (").append(packages.size()).append("):\n");
        for (ResolvedPackage resolvedPackage : packages) {
            sb.append("    - ").append(resolvedPackage).append("\n");
        }
        sb.append("  Modules (").append(modules.size()).append("):\n");
        for (ResolvedModule module : modules.values()) {
            sb.append("    - ").append(module);
            if (!module.getDependencies().isEmpty()) {
                sb.append(" -> ");
                sb.append(module.getDependencies().stream().map(ResolvedModule::getName).collect(Collectors.joining(", ")));
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
