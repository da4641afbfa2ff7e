package org.example.pgr.resolver;

import org.example.pgr.config.ResolverConfiguration;
import org.example.pgr.exception.PgrException;
import org.example.pgr.exception.ResolutionException;
import org.example.pgr.graph.PackageGraph;
import org.example.pgr.graph.PackageGraphBuilder;
import org.example.pgr.lockfile.Lockfile;
import org.example.pgr.lockfile.LockfileReconciler;
import org.example.pgr.lockfile.LockfileStore;
import org.example.pgr.lockfile.ReconcileResult;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.provider.CancellationToken;
import org.example.pgr.provider.ContainerProvider;
import org.example.pgr.provider.ManifestProvider;
import org.example.pgr.provider.VersionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of a resolution: lockfile, reconciliation, graph, lockfile again.
 *
 * <p>Each call owns a fresh {@link ContainerProvider}, closed when the call ends. The lockfile
 * is written only after the graph was built from a full resolution, and only when its content
 * changed. Nothing is written when a step fails.</p>
 */
public class DependencyResolutionService {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolutionService.class);

    private final ManifestProvider manifestProvider;
    private final VersionProvider versionProvider;
    private final LockfileStore lockfileStore;
    private final int parallelism;
    private final boolean resolvedVersionsOnly;

    public DependencyResolutionService(ManifestProvider manifestProvider, VersionProvider versionProvider,
                                       ResolverConfiguration configuration) {
        this(manifestProvider, versionProvider, new LockfileStore(),
                configuration.getParallelism(), configuration.isResolvedVersionsOnly());
    }

    public DependencyResolutionService(ManifestProvider manifestProvider, VersionProvider versionProvider,
                                       LockfileStore lockfileStore, int parallelism, boolean resolvedVersionsOnly) {
        this.manifestProvider = Objects.requireNonNull(manifestProvider, "manifestProvider cannot be null");
        this.versionProvider = Objects.requireNonNull(versionProvider, "versionProvider cannot be null");
        this.lockfileStore = Objects.requireNonNull(lockfileStore, "lockfileStore cannot be null");
        this.parallelism = parallelism;
        this.resolvedVersionsOnly = resolvedVersionsOnly;
    }

    /**
     * Resolves the root manifest, reusing the lockfile when it is up to date.
     *
     * @throws PgrException if the lockfile cannot be read or written, resolution fails or the
     *                      graph is invalid
     */
    public ResolutionOutcome resolve(PackageManifest rootManifest, Path lockfilePath) throws PgrException {
        return resolve(rootManifest, lockfilePath, CancellationToken.create());
    }

    /**
     * Resolves the root manifest, observing the given cancellation token.
     *
     * @throws PgrException if the lockfile cannot be read or written, resolution fails, the
     *                      graph is invalid or the token is cancelled
     */
    public ResolutionOutcome resolve(PackageManifest rootManifest, Path lockfilePath, CancellationToken token)
            throws PgrException {
        return execute(rootManifest, lockfilePath, token, null);
    }

    /**
     * Resolves the root manifest again without preferring the pins of {@code packages}, or of
     * any package when it is empty.
     *
     * @throws PgrException if the lockfile cannot be read or written, resolution fails or the
     *                      graph is invalid
     */
    public ResolutionOutcome update(PackageManifest rootManifest, Path lockfilePath,
                                    Collection<PackageIdentity> packages) throws PgrException {
        return execute(rootManifest, lockfilePath, CancellationToken.create(),
                packages != null ? packages : List.of());
    }

    private ResolutionOutcome execute(PackageManifest rootManifest, Path lockfilePath, CancellationToken token,
                                      Collection<PackageIdentity> updatePackages) throws PgrException {
        Objects.requireNonNull(rootManifest, "rootManifest cannot be null");
        Objects.requireNonNull(lockfilePath, "lockfilePath cannot be null");
        long start = System.currentTimeMillis();

        Optional<Lockfile> existing = lockfileStore.load(lockfilePath);
        try (ContainerProvider provider = new ContainerProvider(manifestProvider, versionProvider, parallelism, token)) {
            LockfileReconciler reconciler = new LockfileReconciler(provider, resolvedVersionsOnly);
            ReconcileResult reconciled = updatePackages == null
                    ? reconciler.reconcile(rootManifest, existing.orElse(null))
                    : reconciler.update(rootManifest, existing.orElse(null), updatePackages);

            PackageGraph graph = new PackageGraphBuilder(provider).build(rootManifest, reconciled.getSolution());
            log.debug("{}", graph.toDetailedString());

            Lockfile lockfile = Lockfile.fromSolution(reconciled.getSolution());
            boolean written = false;
            if (!reconciled.isFastPath() && !existing.map(lockfile::equals).orElse(false)) {
                if (token.isCancelled()) {
                    throw ResolutionException.cancelled();
                }
                lockfileStore.save(lockfile, lockfilePath);
                written = true;
            }

            log.info("Resolution of {} completed in {} ms: {} packages, fast path: {}, lockfile written: {}",
                    rootManifest.getIdentity(), System.currentTimeMillis() - start,
                    reconciled.getSolution().size(), reconciled.isFastPath(), written);
            return new ResolutionOutcome(reconciled.getSolution(), graph, lockfile, reconciled.isFastPath(), written);
        }
    }
}
