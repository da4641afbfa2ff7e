package org.example.pgr.solver;

import org.example.pgr.exception.ManifestException;
import org.example.pgr.exception.ProviderException;
import org.example.pgr.exception.ResolutionException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageDependency;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.Requirement;
import org.example.pgr.model.Version;
import org.example.pgr.model.VersionSet;
import org.example.pgr.provider.ContainerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;

/**
 * Conflict-driven version solver.
 *
 * <p>Resolution alternates unit propagation, which derives every term forced by the known
 * incompatibilities, and decisions, which pick a version for one required package. When
 * propagation finds an incompatibility whose terms all hold, conflict resolution derives the
 * root cause, backjumps and learns it. Failures are explained by {@link FailureReporter}.</p>
 *
 * <p>Branch, revision and local-path dependencies of the root are bound before the search and
 * override versioned requirements on the same package.</p>
 *
 * <p>Provider queries go through a {@link ContainerProvider}, which makes every query happen at
 * most once and observes cancellation.</p>
 */
public class PubGrubResolver {

    private static final Logger log = LoggerFactory.getLogger(PubGrubResolver.class);

    /**
     * Version assigned to the root package inside the search.
     */
    static final Version ROOT_VERSION = new Version(0, 0, 0);

    private final ContainerProvider provider;

    public PubGrubResolver(ContainerProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
    }

    /**
     * Resolves the dependencies declared by a root manifest.
     *
     * @see #solve(PackageIdentity, List, Map)
     */
    public Solution solve(PackageManifest rootManifest, Map<PackageIdentity, BoundVersion> preferred)
            throws ResolutionException {
        return solve(rootManifest.getIdentity(), rootManifest.getDependencies(), preferred);
    }

    /**
     * Finds one version of every package reachable from the root dependencies.
     *
     * @param root             identity of the package being resolved
     * @param rootDependencies the dependencies it declares
     * @param preferred        versions to choose when they are still allowed, typically the
     *                         previous lockfile pins; may be empty
     * @return the bound version of every reachable package
     * @throws ResolutionException if no consistent set of versions exists, a package is
     *                             unknown, a provider fails or the resolution is cancelled
     */
    public Solution solve(PackageIdentity root, List<PackageDependency> rootDependencies,
                          Map<PackageIdentity, BoundVersion> preferred) throws ResolutionException {
        Objects.requireNonNull(root, "root cannot be null");
        Objects.requireNonNull(rootDependencies, "rootDependencies cannot be null");
        long start = System.currentTimeMillis();
        log.info("Resolving {} root dependencies of {}", rootDependencies.size(), root);
        try {
            Search search = new Search(root, preferred != null ? preferred : Map.of());
            Solution solution = search.run(rootDependencies);
            log.info("Resolved {} packages in {} ms ({} decisions, {} backtracks)",
                    solution.size(), System.currentTimeMillis() - start,
                    search.decisionCount, search.solution.getBacktrackCount());
            return solution;
        } catch (CancellationException e) {
            log.info("Resolution of {} cancelled", root);
            throw ResolutionException.cancelled();
        }
    }

    /**
     * State of one call to {@link #solve}.
     */
    private final class Search {

        private final PackageIdentity root;
        private final Map<PackageIdentity, BoundVersion> preferred;
        private final PartialSolution solution = new PartialSolution();
        private final Map<PackageIdentity, List<Incompatibility>> incompatibilities = new HashMap<>();

        private final Map<PackageIdentity, BoundVersion> overrides = new LinkedHashMap<>();
        private final List<Incompatibility> rootConstraints = new ArrayList<>();

        private final Map<PackageIdentity, Set<Version>> unreadable = new HashMap<>();
        private int decisionCount;

        Search(PackageIdentity root, Map<PackageIdentity, BoundVersion> preferred) {
            this.root = root;
            this.preferred = preferred;
        }

        Solution run(List<PackageDependency> rootDependencies) throws ResolutionException {
            bindUnversioned(rootDependencies);

            addIncompatibility(Incompatibility.external(
                    List.of(Term.negative(root, VersionSet.any())), Incompatibility.Cause.ROOT));

            PackageIdentity next = root;
            while (next != null) {
                provider.getToken().throwIfCancelled();
                propagate(next);
                next = choosePackageVersion();
            }
            return buildSolution();
        }

        // Unversioned bindings

        private void bindUnversioned(List<PackageDependency> rootDependencies) throws ResolutionException {
            List<Declared> versioned = new ArrayList<>();
            Deque<Declared> pending = new ArrayDeque<>();
            rootDependencies.forEach(dependency -> pending.addLast(new Declared(dependency, null)));

            while (!pending.isEmpty()) {
                Declared declared = pending.removeFirst();
                PackageIdentity identity = declared.dependency().getIdentity();
                Requirement requirement = declared.dependency().getRequirement();
                if (identity.equals(root)) {
                    continue;
                }
                if (requirement.isVersioned()) {
                    versioned.add(declared);
                    continue;
                }
                BoundVersion bound = bind(identity, requirement);
                BoundVersion existing = overrides.get(identity);
                if (existing != null) {
                    if (!existing.equals(bound)) {
                        String explanation = "Because " + identity + " is required both at " + existing
                                + " and at " + bound + ", version solving failed.";
                        throw ResolutionException.versionConflict(explanation, List.of(identity));
                    }
                    continue;
                }
                overrides.put(identity, bound);
                log.debug("Bound {} to {}", identity, bound);

                PackageManifest manifest;
                try {
                    manifest = provider.getManifest(identity, bound);
                } catch (ManifestException e) {
                    log.warn("Manifest of {} at {} could not be loaded: {}", identity, bound, e.getMessage());
                    throw ResolutionException.noUsableVersion(identity);
                }
                for (PackageDependency transitive : manifest.getDependencies()) {
                    pending.addLast(new Declared(transitive, identity));
                }
            }

            for (Declared declared : versioned) {
                PackageIdentity identity = declared.dependency().getIdentity();
                if (overrides.containsKey(identity)) {
                    log.debug("{} is overridden by {}", identity, overrides.get(identity));
                    continue;
                }
                String origin = declared.owner() != null ? declared.owner() + " " + overrides.get(declared.owner()) : null;
                rootConstraints.add(Incompatibility.external(List.of(
                                Term.positive(root, VersionSet.exact(ROOT_VERSION)),
                                Term.negative(identity, declared.dependency().getRequirement().getVersions())),
                        Incompatibility.Cause.DEPENDENCY, origin));
            }
        }

        private BoundVersion bind(PackageIdentity identity, Requirement requirement) throws ResolutionException {
            return switch (requirement.getKind()) {
                case LOCAL -> BoundVersion.local(requirement.getPath());
                case REVISION -> BoundVersion.revision(requirement.getRevision());
                case BRANCH -> {
                    try {
                        yield BoundVersion.branch(requirement.getBranch(),
                                provider.resolveBranch(identity, requirement.getBranch()));
                    } catch (ProviderException e) {
                        throw ResolutionException.providerFailure(identity, e);
                    }
                }
                default -> throw new IllegalArgumentException("Not an unversioned requirement: " + requirement);
            };
        }

        // Propagation

        private void addIncompatibility(Incompatibility incompatibility) {
            log.debug("Fact: {}", incompatibility);
            for (Term term : incompatibility.getTerms()) {
                incompatibilities.computeIfAbsent(term.getIdentity(), k -> new ArrayList<>()).add(incompatibility);
            }
        }

        private void propagate(PackageIdentity identity) throws ResolutionException {
            Set<PackageIdentity> changed = new LinkedHashSet<>();
            changed.add(identity);
            while (!changed.isEmpty()) {
                Iterator<PackageIdentity> iterator = changed.iterator();
                PackageIdentity current = iterator.next();
                iterator.remove();

                List<Incompatibility> candidates = new ArrayList<>(incompatibilities.getOrDefault(current, List.of()));
                for (int i = candidates.size() - 1; i >= 0; i--) {
                    Propagation result = propagate(candidates.get(i));
                    if (result.conflict()) {
                        Incompatibility rootCause = resolveConflict(candidates.get(i));
                        Propagation derived = propagate(rootCause);
                        if (derived.conflict() || derived.identity() == null) {
                            throw new IllegalStateException("Learned incompatibility " + rootCause + " did not propagate");
                        }
                        changed.clear();
                        changed.add(derived.identity());
                        break;
                    }
                    if (result.identity() != null) {
                        changed.add(result.identity());
                    }
                }
            }
        }

        private Propagation propagate(Incompatibility incompatibility) {
            Term unsatisfied = null;
            for (Term term : incompatibility.getTerms()) {
                Term.Relation relation = solution.relation(term);
                if (relation == Term.Relation.CONTRADICTED) {
                    return Propagation.NONE;
                }
                if (relation == Term.Relation.INCONCLUSIVE) {
                    if (unsatisfied != null) {
                        return Propagation.NONE;
                    }
                    unsatisfied = term;
                }
            }
            if (unsatisfied == null) {
                return Propagation.CONFLICT;
            }
            log.debug("Derived: {} from {}", unsatisfied.negate(), incompatibility);
            solution.derive(unsatisfied.negate(), incompatibility);
            return new Propagation(false, unsatisfied.getIdentity());
        }

        // Conflict resolution

        private Incompatibility resolveConflict(Incompatibility incompatibility) throws ResolutionException {
            log.debug("Conflict: {}", incompatibility);
            boolean learned = false;
            while (!incompatibility.isFailure(root)) {
                Term mostRecentTerm = null;
                Assignment mostRecentSatisfier = null;
                Term difference = null;
                int previousSatisfierLevel = 1;

                for (Term term : incompatibility.getTerms()) {
                    Assignment satisfier = solution.satisfier(term);
                    if (mostRecentSatisfier == null) {
                        mostRecentTerm = term;
                        mostRecentSatisfier = satisfier;
                    } else if (mostRecentSatisfier.getIndex() < satisfier.getIndex()) {
                        previousSatisfierLevel = Math.max(previousSatisfierLevel, mostRecentSatisfier.getDecisionLevel());
                        mostRecentTerm = term;
                        mostRecentSatisfier = satisfier;
                        difference = null;
                    } else {
                        previousSatisfierLevel = Math.max(previousSatisfierLevel, satisfier.getDecisionLevel());
                    }

                    if (mostRecentTerm == term) {
                        difference = mostRecentSatisfier.getTerm().difference(mostRecentTerm);
                        if (difference != null) {
                            previousSatisfierLevel = Math.max(previousSatisfierLevel,
                                    solution.satisfier(difference.negate()).getDecisionLevel());
                        }
                    }
                }

                if (previousSatisfierLevel < mostRecentSatisfier.getDecisionLevel() || mostRecentSatisfier.isDecision()) {
                    log.debug("Backtracking to level {}", previousSatisfierLevel);
                    solution.backtrack(previousSatisfierLevel);
                    if (learned) {
                        addIncompatibility(incompatibility);
                    }
                    return incompatibility;
                }

                List<Term> terms = new ArrayList<>();
                for (Term term : incompatibility.getTerms()) {
                    if (term != mostRecentTerm) {
                        terms.add(term);
                    }
                }
                Incompatibility cause = mostRecentSatisfier.getCause();
                for (Term term : cause.getTerms()) {
                    if (!term.getIdentity().equals(mostRecentSatisfier.getTerm().getIdentity())) {
                        terms.add(term);
                    }
                }
                if (difference != null) {
                    terms.add(difference.negate());
                }
                incompatibility = Incompatibility.derived(withoutRoot(terms), incompatibility, cause);
                learned = true;
                log.debug("Learned: {}", incompatibility);
            }

            FailureReporter reporter = new FailureReporter(root);
            String explanation = reporter.report(incompatibility);
            log.debug("Resolution failed:\n{}", explanation);
            throw ResolutionException.versionConflict(explanation, reporter.getCitedPackages());
        }

        /**
         * The root is always selected, so a positive root term adds nothing to a derived
         * incompatibility that has other terms.
         */
        private List<Term> withoutRoot(List<Term> terms) {
            if (terms.size() <= 1) {
                return terms;
            }
            List<Term> result = new ArrayList<>();
            for (Term term : terms) {
                if (!(term.isPositive() && term.getIdentity().equals(root))) {
                    result.add(term);
                }
            }
            return result.isEmpty() ? terms : result;
        }

        // Decisions

        private PackageIdentity choosePackageVersion() throws ResolutionException {
            List<Term> undecided = solution.undecided();
            if (undecided.isEmpty()) {
                return null;
            }
            undecided.sort(Comparator.comparing(Term::getIdentity));

            Term chosen = null;
            List<Version> chosenCandidates = null;
            for (Term term : undecided) {
                List<Version> candidates = term.getVersions().select(versionsOf(term.getIdentity()));
                if (chosen == null || candidates.size() < chosenCandidates.size()) {
                    chosen = term;
                    chosenCandidates = candidates;
                }
            }

            PackageIdentity identity = chosen.getIdentity();
            if (chosenCandidates.isEmpty()) {
                Set<Version> skipped = unreadable.get(identity);
                if (skipped != null && skipped.containsAll(versionsOf(identity))) {
                    throw ResolutionException.noUsableVersion(identity);
                }
                addIncompatibility(Incompatibility.external(List.of(chosen), Incompatibility.Cause.NO_VERSIONS));
                return identity;
            }

            Version version = pick(identity, chosenCandidates);
            List<Incompatibility> dependencies;
            if (identity.equals(root)) {
                dependencies = rootConstraints;
            } else {
                try {
                    dependencies = dependencyIncompatibilities(identity, version,
                            provider.getManifest(identity, BoundVersion.version(version)));
                } catch (ManifestException e) {
                    log.warn("Skipping {} {}: {}", identity, version, e.getMessage());
                    unreadable.computeIfAbsent(identity, k -> new HashSet<>()).add(version);
                    addIncompatibility(Incompatibility.external(
                            List.of(Term.positive(identity, VersionSet.exact(version))),
                            Incompatibility.Cause.UNAVAILABLE, e.getMessage()));
                    return identity;
                }
            }

            boolean conflict = false;
            for (Incompatibility incompatibility : dependencies) {
                addIncompatibility(incompatibility);
                conflict = conflict || incompatibility.getTerms().stream()
                        .allMatch(term -> term.getIdentity().equals(identity) || solution.satisfies(term));
            }

            if (!conflict) {
                solution.decide(identity, version);
                decisionCount++;
                log.debug("Selecting {} {}", identity, version);
                List<PackageIdentity> next = new ArrayList<>();
                for (Incompatibility incompatibility : dependencies) {
                    for (Term term : incompatibility.getTerms()) {
                        if (!term.getIdentity().equals(identity)) {
                            next.add(term.getIdentity());
                        }
                    }
                }
                provider.prefetchVersions(next);
            }
            return identity;
        }

        private List<Version> versionsOf(PackageIdentity identity) throws ResolutionException {
            if (identity.equals(root)) {
                return List.of(ROOT_VERSION);
            }
            List<Version> versions;
            try {
                versions = provider.getVersions(identity);
            } catch (ProviderException e) {
                throw ResolutionException.providerFailure(identity, e);
            }
            if (versions.isEmpty()) {
                throw ResolutionException.packageNotFound(identity);
            }
            return versions;
        }

        /**
         * The pinned version when it is still a candidate, else the highest candidate.
         */
        private Version pick(PackageIdentity identity, List<Version> candidates) {
            BoundVersion pinned = preferred.get(identity);
            if (pinned != null && pinned.isVersion() && candidates.contains(pinned.getVersion())) {
                return pinned.getVersion();
            }
            return candidates.get(candidates.size() - 1);
        }

        private List<Incompatibility> dependencyIncompatibilities(PackageIdentity identity, Version version,
                                                                  PackageManifest manifest) {
            Term depender = Term.positive(identity, VersionSet.exact(version));
            List<Incompatibility> result = new ArrayList<>();
            for (PackageDependency dependency : manifest.getDependencies()) {
                if (overrides.containsKey(dependency.getIdentity())) {
                    continue;
                }
                Requirement requirement = dependency.getRequirement();
                if (!requirement.isVersioned()) {
                    result.add(Incompatibility.external(List.of(depender),
                            Incompatibility.Cause.UNVERSIONED_DEPENDENCY, dependency.toString()));
                    continue;
                }
                result.add(Incompatibility.external(
                        List.of(depender, Term.negative(dependency.getIdentity(), requirement.getVersions())),
                        Incompatibility.Cause.DEPENDENCY));
            }
            return result;
        }

        private Solution buildSolution() {
            Map<PackageIdentity, BoundVersion> bindings = new TreeMap<>();
            for (Map.Entry<PackageIdentity, Version> decision : solution.getDecisions().entrySet()) {
                if (!decision.getKey().equals(root)) {
                    bindings.put(decision.getKey(), BoundVersion.version(decision.getValue()));
                }
            }
            overrides.forEach((identity, bound) -> {
                if (!identity.equals(root)) {
                    bindings.put(identity, bound);
                }
            });
            return new Solution(root, bindings);
        }
    }

    /**
     * A dependency found while binding unversioned packages; {@code owner} is null for the root.
     */
    private record Declared(PackageDependency dependency, PackageIdentity owner) {}

    private record Propagation(boolean conflict, PackageIdentity identity) {
        static final Propagation NONE = new Propagation(false, null);
        static final Propagation CONFLICT = new Propagation(true, null);
    }
}
