package org.example.pgr.graph;

import org.example.pgr.exception.GraphException;
import org.example.pgr.exception.ManifestException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageDependency;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.ProductDescription;
import org.example.pgr.model.TargetDependency;
import org.example.pgr.model.TargetDescription;
import org.example.pgr.model.Version;
import org.example.pgr.provider.ContainerProvider;
import org.example.pgr.solver.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Builds the package graph of a solution.
 *
 * <p>Manifests of all resolved packages are fetched concurrently and joined before validation.
 * Validation runs in a fixed order: module name uniqueness, target and product references,
 * acyclicity, platform compatibility. The graph is then pruned to the modules reachable from
 * the root package's targets.</p>
 */
public class PackageGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(PackageGraphBuilder.class);

    private static final Version OLDEST = new Version(0, 0, 0);

    private final ContainerProvider provider;

    public PackageGraphBuilder(ContainerProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
    }

    /**
     * Builds and validates the graph.
     *
     * @param rootManifest manifest of the package being resolved
     * @param solution     resolved versions of all other packages
     * @throws GraphException if a manifest cannot be loaded or the graph is invalid
     */
    public PackageGraph build(PackageManifest rootManifest, Solution solution) throws GraphException {
        Objects.requireNonNull(rootManifest, "rootManifest cannot be null");
        Objects.requireNonNull(solution, "solution cannot be null");
        log.info("Building package graph for {} with {} dependencies", rootManifest.getIdentity(), solution.size());
        try {
            Map<PackageIdentity, PackageManifest> manifests = loadManifests(rootManifest, solution);
            Builder builder = new Builder(rootManifest.getIdentity(), manifests, solution);
            PackageGraph graph = builder.build();
            log.info("Package graph has {} packages and {} modules", graph.getPackageCount(), graph.getModuleCount());
            return graph;
        } catch (CancellationException e) {
            throw new GraphException(GraphException.Kind.CANCELLED, "Graph construction was cancelled", List.of(), e);
        }
    }

    private Map<PackageIdentity, PackageManifest> loadManifests(PackageManifest rootManifest, Solution solution)
            throws GraphException {
        Map<PackageIdentity, CompletableFuture<PackageManifest>> futures = new LinkedHashMap<>();
        solution.getBindings().forEach((identity, bound) -> futures.put(identity, provider.manifestFuture(identity, bound)));

        Map<PackageIdentity, PackageManifest> manifests = new LinkedHashMap<>();
        manifests.put(rootManifest.getIdentity(), rootManifest);
        for (Map.Entry<PackageIdentity, CompletableFuture<PackageManifest>> entry : futures.entrySet()) {
            PackageIdentity identity = entry.getKey();
            try {
                manifests.put(identity, provider.getToken().await(entry.getValue()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() instanceof ManifestException ? e.getCause() : e;
                BoundVersion bound = solution.getBindings().get(identity);
                throw new GraphException(GraphException.Kind.MANIFEST_UNAVAILABLE,
                        "Manifest of " + identity + " at " + bound + " could not be loaded: " + cause.getMessage(),
                        List.of(identity.toString()), cause);
            }
        }
        return manifests;
    }

    /**
     * State of one call to {@link #build}.
     */
    private static final class Builder {

        private final PackageIdentity root;
        private final Map<PackageIdentity, PackageManifest> manifests;
        private final Solution solution;

        private final Map<PackageIdentity, Map<String, String>> aliases = new HashMap<>();
        private final Map<ModuleKey, TargetDescription> targets = new LinkedHashMap<>();
        private final Map<ModuleKey, String> names = new HashMap<>();
        private final Map<ModuleKey, List<Edge>> edges = new HashMap<>();

        Builder(PackageIdentity root, Map<PackageIdentity, PackageManifest> manifests, Solution solution) {
            this.root = root;
            this.manifests = manifests;
            this.solution = solution;
        }

        PackageGraph build() throws GraphException {
            collectAliases();
            collectModules();
            resolveReferences();

            List<ModuleKey> rootModules = new ArrayList<>();
            for (TargetDescription target : manifests.get(root).getTargets()) {
                rootModules.add(new ModuleKey(root, target.getName()));
            }
            Set<ModuleKey> reachable = checkAcyclic(rootModules);
            checkPlatforms(reachable);
            return assemble(rootModules, reachable);
        }

        // Module identities

        private void collectAliases() {
            for (PackageManifest manifest : manifests.values()) {
                for (PackageDependency dependency : manifest.getDependencies()) {
                    Map<String, String> packageAliases = aliases.computeIfAbsent(dependency.getIdentity(), k -> new HashMap<>());
                    dependency.getModuleAliases().forEach(packageAliases::putIfAbsent);
                }
            }
        }

        private void collectModules() throws GraphException {
            Map<String, ModuleKey> byName = new HashMap<>();
            for (PackageManifest manifest : manifests.values()) {
                PackageIdentity identity = manifest.getIdentity();
                for (TargetDescription target : manifest.getTargets()) {
                    if (target.isTest() && !identity.equals(root)) {
                        continue;
                    }
                    ModuleKey key = new ModuleKey(identity, target.getName());
                    String name = aliases.getOrDefault(identity, Map.of()).getOrDefault(target.getName(), target.getName());
                    ModuleKey existing = byName.putIfAbsent(name, key);
                    if (existing != null) {
                        throw new GraphException(GraphException.Kind.DUPLICATE_MODULE,
                                "Module '" + name + "' is declared by both " + existing.identity() + " and " + identity
                                        + "; rename one of them with a module alias",
                                List.of(name, existing.identity().toString(), identity.toString()));
                    }
                    targets.put(key, target);
                    names.put(key, name);
                }
            }
        }

        // References

        private void resolveReferences() throws GraphException {
            for (PackageManifest manifest : manifests.values()) {
                for (ProductDescription product : manifest.getProducts()) {
                    for (String target : product.getTargets()) {
                        if (!targets.containsKey(new ModuleKey(manifest.getIdentity(), target))) {
                            throw new GraphException(GraphException.Kind.UNRESOLVED_TARGET_REFERENCE,
                                    "Product '" + product.getName() + "' of " + manifest.getIdentity()
                                            + " lists unknown target '" + target + "'",
                                    List.of(product.getName(), target));
                        }
                    }
                }
            }
            for (Map.Entry<ModuleKey, TargetDescription> entry : targets.entrySet()) {
                ModuleKey module = entry.getKey();
                Set<Edge> resolved = new LinkedHashSet<>();
                for (TargetDependency dependency : entry.getValue().getDependencies()) {
                    resolved.addAll(resolve(module, dependency));
                }
                edges.put(module, new ArrayList<>(resolved));
            }
        }

        private List<Edge> resolve(ModuleKey module, TargetDependency dependency) throws GraphException {
            PackageIdentity identity = module.identity();
            switch (dependency.getKind()) {
                case TARGET: {
                    ModuleKey target = new ModuleKey(identity, dependency.getName());
                    if (!targets.containsKey(target)) {
                        throw unresolvedTarget(module, dependency.getName());
                    }
                    return List.of(new Edge(target, null));
                }
                case PRODUCT:
                    return productEdges(module, dependency.getName(), dependency.getPackageIdentity());
                case BY_NAME: {
                    ModuleKey target = new ModuleKey(identity, dependency.getName());
                    if (targets.containsKey(target)) {
                        return List.of(new Edge(target, null));
                    }
                    List<PackageIdentity> candidates = new ArrayList<>();
                    for (PackageDependency declared : manifests.get(identity).getDependencies()) {
                        PackageManifest manifest = manifests.get(declared.getIdentity());
                        if (manifest != null && manifest.findProduct(dependency.getName()).isPresent()) {
                            candidates.add(declared.getIdentity());
                        }
                    }
                    if (candidates.isEmpty()) {
                        throw unresolvedTarget(module, dependency.getName());
                    }
                    if (candidates.size() > 1) {
                        throw new GraphException(GraphException.Kind.UNRESOLVED_PRODUCT_REFERENCE,
                                "Target '" + module.target() + "' refers to product '" + dependency.getName()
                                        + "' which is exposed by several dependencies: " + candidates,
                                List.of(module.target(), dependency.getName()));
                    }
                    return productEdges(module, dependency.getName(), candidates.get(0));
                }
                default:
                    throw new IllegalStateException("Unknown dependency kind " + dependency.getKind());
            }
        }

        private List<Edge> productEdges(ModuleKey module, String productName, PackageIdentity productPackage)
                throws GraphException {
            PackageManifest consumer = manifests.get(module.identity());
            boolean declared = productPackage.equals(module.identity())
                    || consumer.findDependency(productPackage).isPresent();
            PackageManifest provider = manifests.get(productPackage);
            Optional<ProductDescription> product = declared && provider != null
                    ? provider.findProduct(productName) : Optional.empty();
            if (product.isEmpty()) {
                String reason = !declared ? "is not a declared dependency"
                        : provider == null ? "is not part of the resolution"
                        : "has no such product at " + solution.find(productPackage).map(Object::toString).orElse("the root");
                throw new GraphException(GraphException.Kind.UNRESOLVED_PRODUCT_REFERENCE,
                        "Target '" + module.target() + "' refers to product '" + productName + "' of "
                                + productPackage + ", which " + reason,
                        List.of(module.target(), productName, productPackage.toString()));
            }
            List<Edge> result = new ArrayList<>();
            for (String target : product.get().getTargets()) {
                result.add(new Edge(new ModuleKey(productPackage, target), productName));
            }
            return result;
        }

        private GraphException unresolvedTarget(ModuleKey module, String reference) {
            return new GraphException(GraphException.Kind.UNRESOLVED_TARGET_REFERENCE,
                    "Target '" + module.target() + "' of " + module.identity() + " depends on unknown target '"
                            + reference + "'",
                    List.of(module.target(), reference));
        }

        // Cycles

        /**
         * Depth-first search from the root targets; a dependency on a module still on the stack
         * closes a cycle.
         *
         * @return the modules reachable from the root targets, in discovery order
         */
        private Set<ModuleKey> checkAcyclic(List<ModuleKey> rootModules) throws GraphException {
            Set<ModuleKey> visited = new LinkedHashSet<>();
            List<ModuleKey> stack = new ArrayList<>();
            Set<ModuleKey> onStack = new HashSet<>();
            for (ModuleKey module : rootModules) {
                visit(module, visited, stack, onStack);
            }
            return visited;
        }

        private void visit(ModuleKey module, Set<ModuleKey> visited, List<ModuleKey> stack, Set<ModuleKey> onStack)
                throws GraphException {
            if (onStack.contains(module)) {
                List<String> cycle = new ArrayList<>();
                for (ModuleKey member : stack.subList(stack.indexOf(module), stack.size())) {
                    cycle.add(names.get(member));
                }
                throw new GraphException(GraphException.Kind.DEPENDENCY_CYCLE,
                        "Cyclic dependency between modules: " + String.join(" -> ", cycle) + " -> " + names.get(module),
                        cycle);
            }
            if (!visited.add(module)) {
                return;
            }
            stack.add(module);
            onStack.add(module);
            for (Edge edge : edges.get(module)) {
                visit(edge.to(), visited, stack, onStack);
            }
            stack.remove(stack.size() - 1);
            onStack.remove(module);
        }

        // Platforms

        private void checkPlatforms(Set<ModuleKey> reachable) throws GraphException {
            for (ModuleKey module : reachable) {
                PackageManifest consumer = manifests.get(module.identity());
                for (Edge edge : edges.get(module)) {
                    PackageIdentity dependencyPackage = edge.to().identity();
                    if (dependencyPackage.equals(module.identity())) {
                        continue;
                    }
                    for (Map.Entry<String, Version> platform : manifests.get(dependencyPackage).getPlatforms().entrySet()) {
                        Version consumerMinimum = consumer.getPlatforms().getOrDefault(platform.getKey(), OLDEST);
                        if (consumerMinimum.compareTo(platform.getValue()) < 0) {
                            throw new GraphException(GraphException.Kind.INCOMPATIBLE_PLATFORM,
                                    "Module '" + names.get(module) + "' supports " + platform.getKey() + " "
                                            + consumerMinimum + " but product '" + edge.product() + "' of "
                                            + dependencyPackage + " requires " + platform.getKey() + " "
                                            + platform.getValue(),
                                    List.of(names.get(module), edge.product(), platform.getKey()));
                        }
                    }
                }
            }
        }

        // Assembly

        private PackageGraph assemble(List<ModuleKey> rootModules, Set<ModuleKey> reachable) {
            Map<ModuleKey, ResolvedModule> resolved = new HashMap<>();
            for (ModuleKey module : reachable) {
                resolveModule(module, resolved);
            }

            Set<String> referencedProducts = new HashSet<>();
            for (ModuleKey module : reachable) {
                for (Edge edge : edges.get(module)) {
                    if (edge.product() != null) {
                        referencedProducts.add(edge.to().identity() + "/" + edge.product());
                    }
                }
            }

            ResolvedPackage rootPackage = null;
            List<ResolvedPackage> dependencies = new ArrayList<>();
            for (PackageManifest manifest : manifests.values()) {
                PackageIdentity identity = manifest.getIdentity();
                boolean isRoot = identity.equals(root);

                List<ResolvedModule> modules = new ArrayList<>();
                for (TargetDescription target : manifest.getTargets()) {
                    ResolvedModule module = resolved.get(new ModuleKey(identity, target.getName()));
                    if (module != null) {
                        modules.add(module);
                    }
                }
                List<ResolvedProduct> products = new ArrayList<>();
                for (ProductDescription product : manifest.getProducts()) {
                    if (!isRoot && !referencedProducts.contains(identity + "/" + product.getName())) {
                        log.debug("Pruning unused product {} of {}", product.getName(), identity);
                        continue;
                    }
                    List<ResolvedModule> productModules = new ArrayList<>();
                    for (String target : product.getTargets()) {
                        productModules.add(resolveModule(new ModuleKey(identity, target), resolved));
                    }
                    products.add(new ResolvedProduct(product.getName(), identity, product.getType(), productModules));
                }

                ResolvedPackage resolvedPackage = new ResolvedPackage(identity, manifest.getDisplayName(),
                        isRoot ? null : solution.getBindings().get(identity), manifest.getPlatforms(), modules, products);
                if (isRoot) {
                    rootPackage = resolvedPackage;
                } else {
                    dependencies.add(resolvedPackage);
                }
            }

            Map<String, List<ResolvedModule>> required = new LinkedHashMap<>();
            for (ModuleKey module : rootModules) {
                Set<ResolvedModule> closure = new LinkedHashSet<>();
                collectRequired(resolved.get(module), closure);
                required.put(names.get(module), new ArrayList<>(closure));
            }
            return new PackageGraph(rootPackage, dependencies, required);
        }

        private ResolvedModule resolveModule(ModuleKey key, Map<ModuleKey, ResolvedModule> resolved) {
            ResolvedModule existing = resolved.get(key);
            if (existing != null) {
                return existing;
            }
            List<ResolvedModule> dependencies = new ArrayList<>();
            for (Edge edge : edges.get(key)) {
                dependencies.add(resolveModule(edge.to(), resolved));
            }
            TargetDescription target = targets.get(key);
            ResolvedModule module = new ResolvedModule(names.get(key), target.getName(), key.identity(),
                    target.getType(), dependencies);
            resolved.put(key, module);
            return module;
        }

        private static void collectRequired(ResolvedModule module, Set<ResolvedModule> closure) {
            for (ResolvedModule dependency : module.getDependencies()) {
                if (closure.add(dependency)) {
                    collectRequired(dependency, closure);
                }
            }
        }
    }

    private record ModuleKey(PackageIdentity identity, String target) {}

    /**
     * A module dependency; {@code product} names the product it came through, null for
     * same-package targets.
     */
    private record Edge(ModuleKey to, String product) {}
}
