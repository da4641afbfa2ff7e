package org.example.pgr.lockfile;

import org.example.pgr.exception.ManifestException;
import org.example.pgr.exception.ResolutionException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageDependency;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.Requirement;
import org.example.pgr.provider.ContainerProvider;
import org.example.pgr.solver.PubGrubResolver;
import org.example.pgr.solver.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;

/**
 * Decides whether a lockfile still describes a valid resolution of the root manifest.
 *
 * <p>The lockfile is reused as is when every requirement reachable from the root is satisfied
 * by a pin, using the live manifests at the pinned states, and the pinned packages are exactly
 * the reachable ones. No version is listed and the solver does not run on that path. Otherwise
 * the solver runs with the pins as preferred versions so that unrelated packages keep their
 * locked versions.</p>
 */
public class LockfileReconciler {

    private static final Logger log = LoggerFactory.getLogger(LockfileReconciler.class);

    private final ContainerProvider provider;
    private final boolean resolvedVersionsOnly;

    /**
     * @param provider             provider cache of the current resolution
     * @param resolvedVersionsOnly fail instead of resolving when the lockfile is out of date
     */
    public LockfileReconciler(ContainerProvider provider, boolean resolvedVersionsOnly) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.resolvedVersionsOnly = resolvedVersionsOnly;
    }

    /**
     * Reuses the lockfile when it is up to date, else resolves preferring its pins.
     *
     * @param lockfile the current lockfile, or null if there is none
     * @throws ResolutionException if resolution fails, or with kind
     *                             {@link ResolutionException.Kind#LOCKFILE_OUT_OF_DATE} in
     *                             resolved-versions-only mode when the lockfile is stale
     */
    public ReconcileResult reconcile(PackageManifest rootManifest, Lockfile lockfile) throws ResolutionException {
        Objects.requireNonNull(rootManifest, "rootManifest cannot be null");
        Lockfile current = lockfile != null ? lockfile : Lockfile.empty();

        Check check;
        try {
            check = lockfile != null ? checkLockfile(rootManifest, current) : Check.stale("no lockfile");
        } catch (CancellationException e) {
            throw ResolutionException.cancelled();
        }
        if (check.solution() != null) {
            log.info("Lockfile is up to date ({} pins), skipping resolution", current.getPins().size());
            return ReconcileResult.fromLockfile(check.solution());
        }

        log.info("Lockfile is out of date: {}", check.reason());
        if (resolvedVersionsOnly) {
            throw ResolutionException.lockfileOutOfDate(check.reason());
        }
        Solution solution = new PubGrubResolver(provider).solve(rootManifest, current.toPreferences());
        return ReconcileResult.resolved(solution, check.reason());
    }

    /**
     * Resolves again, ignoring the pins of the given packages, or of all packages when
     * {@code packages} is empty.
     *
     * @throws ResolutionException if resolution fails
     */
    public ReconcileResult update(PackageManifest rootManifest, Lockfile lockfile,
                                  Collection<PackageIdentity> packages) throws ResolutionException {
        Objects.requireNonNull(rootManifest, "rootManifest cannot be null");
        Map<PackageIdentity, BoundVersion> preferences = new TreeMap<>();
        if (lockfile != null && packages != null && !packages.isEmpty()) {
            preferences.putAll(lockfile.toPreferences());
            preferences.keySet().removeAll(packages);
        }
        log.info("Updating {}", packages == null || packages.isEmpty() ? "all packages" : packages);
        Solution solution = new PubGrubResolver(provider).solve(rootManifest, preferences);
        return ReconcileResult.resolved(solution, "update requested");
    }

    private Check checkLockfile(PackageManifest rootManifest, Lockfile lockfile) {
        PackageIdentity root = rootManifest.getIdentity();
        Map<PackageIdentity, BoundVersion> overrides = new TreeMap<>();
        List<PackageDependency> versioned = new ArrayList<>();

        // Branch, revision and path requirements reachable through unversioned packages win
        // over versioned requirements on the same package, wherever those are declared.
        Deque<PackageDependency> pending = new ArrayDeque<>(rootManifest.getDependencies());
        while (!pending.isEmpty()) {
            PackageDependency dependency = pending.removeFirst();
            PackageIdentity identity = dependency.getIdentity();
            Requirement requirement = dependency.getRequirement();
            if (identity.equals(root)) {
                continue;
            }
            if (requirement.isVersioned()) {
                versioned.add(dependency);
                continue;
            }

            BoundVersion bound;
            if (requirement.getKind() == Requirement.Kind.LOCAL) {
                bound = BoundVersion.local(requirement.getPath());
            } else {
                Optional<Pin> pin = lockfile.findPin(identity);
                if (pin.isEmpty()) {
                    return Check.stale("no pin for " + identity);
                }
                if (!requirement.isSatisfiedBy(pin.get().getState())) {
                    return Check.stale("pin " + pin.get() + " does not satisfy " + requirement);
                }
                bound = pin.get().getState();
            }

            BoundVersion existing = overrides.get(identity);
            if (existing != null) {
                if (!existing.equals(bound)) {
                    return Check.stale(identity + " is required both at " + existing + " and at " + bound);
                }
                continue;
            }
            overrides.put(identity, bound);
            Optional<Check> unavailable = enqueueDependencies(identity, bound, pending);
            if (unavailable.isPresent()) {
                return unavailable.get();
            }
        }

        Map<PackageIdentity, BoundVersion> bindings = new TreeMap<>(overrides);
        pending.addAll(versioned);
        while (!pending.isEmpty()) {
            PackageDependency dependency = pending.removeFirst();
            PackageIdentity identity = dependency.getIdentity();
            Requirement requirement = dependency.getRequirement();
            if (identity.equals(root) || overrides.containsKey(identity)) {
                continue;
            }
            if (!requirement.isVersioned()) {
                return Check.stale("released package depends on " + identity + " at " + requirement);
            }

            Optional<Pin> pin = lockfile.findPin(identity);
            if (pin.isEmpty()) {
                return Check.stale("no pin for " + identity);
            }
            if (!requirement.isSatisfiedBy(pin.get().getState())) {
                return Check.stale("pin " + pin.get() + " does not satisfy " + requirement);
            }
            if (bindings.containsKey(identity)) {
                continue;
            }
            bindings.put(identity, pin.get().getState());
            Optional<Check> unavailable = enqueueDependencies(identity, pin.get().getState(), pending);
            if (unavailable.isPresent()) {
                return unavailable.get();
            }
        }

        Set<PackageIdentity> pinned = new HashSet<>();
        bindings.forEach((identity, bound) -> {
            if (bound.getKind() != BoundVersion.Kind.LOCAL) {
                pinned.add(identity);
            }
        });
        if (!pinned.equals(lockfile.getIdentities())) {
            Set<PackageIdentity> unused = new TreeSet<>(lockfile.getIdentities());
            unused.removeAll(pinned);
            return Check.stale("pinned packages no longer required: " + unused);
        }
        return new Check(new Solution(root, bindings), null);
    }

    private Optional<Check> enqueueDependencies(PackageIdentity identity, BoundVersion bound,
                                                Deque<PackageDependency> pending) {
        try {
            pending.addAll(provider.getManifest(identity, bound).getDependencies());
            return Optional.empty();
        } catch (ManifestException e) {
            return Optional.of(Check.stale("manifest of " + identity + " at " + bound + " is unavailable: " + e.getMessage()));
        }
    }

    private record Check(Solution solution, String reason) {
        static Check stale(String reason) {
            return new Check(null, reason);
        }
    }
}
