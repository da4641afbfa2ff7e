package org.example.pgr.provider;

import org.example.pgr.exception.ManifestException;
import org.example.pgr.exception.ProviderException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Memoizing front of the manifest and version providers, owned by one resolution.
 *
 * <p>Each version listing and each manifest is fetched at most once: the first request starts
 * the query on the executor, later and concurrent requests join the same future. Results are
 * only consumed through {@link CancellationToken#await}, so a cancelled resolution stops at the
 * next wait. Closing the provider shuts the executor down and drops the cache.</p>
 */
public class ContainerProvider implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ContainerProvider.class);

    private final ManifestProvider manifestProvider;
    private final VersionProvider versionProvider;
    private final CancellationToken token;
    private final ExecutorService executor;

    private final Map<PackageIdentity, CompletableFuture<List<Version>>> versions = new ConcurrentHashMap<>();
    private final Map<ManifestKey, CompletableFuture<PackageManifest>> manifests = new ConcurrentHashMap<>();
    private final Map<BranchKey, CompletableFuture<String>> branches = new ConcurrentHashMap<>();

    private final AtomicInteger versionQueries = new AtomicInteger();
    private final AtomicInteger manifestQueries = new AtomicInteger();

    /**
     * Creates a ContainerProvider with its own executor.
     *
     * @param manifestProvider the manifest source
     * @param versionProvider  the version source
     * @param parallelism      number of provider queries that may run at once
     * @param token            cancellation signal of the owning resolution
     */
    public ContainerProvider(ManifestProvider manifestProvider, VersionProvider versionProvider,
                             int parallelism, CancellationToken token) {
        this.manifestProvider = Objects.requireNonNull(manifestProvider, "manifestProvider cannot be null");
        this.versionProvider = Objects.requireNonNull(versionProvider, "versionProvider cannot be null");
        this.token = Objects.requireNonNull(token, "token cannot be null");
        this.executor = Executors.newFixedThreadPool(Math.max(1, parallelism), new ProviderThreadFactory());
    }

    public CancellationToken getToken() {
        return token;
    }

    // Versions

    /**
     * Starts fetching version lists for packages that have not been requested yet.
     */
    public void prefetchVersions(Collection<PackageIdentity> identities) {
        for (PackageIdentity identity : identities) {
            versionsFuture(identity);
        }
    }

    /**
     * Returns the ascending, duplicate-free versions of a package.
     *
     * @throws ProviderException if the version provider fails
     */
    public List<Version> getVersions(PackageIdentity identity) throws ProviderException {
        try {
            return token.await(versionsFuture(identity));
        } catch (ExecutionException e) {
            throw unwrap(e, ProviderException.class, identity);
        }
    }

    private CompletableFuture<List<Version>> versionsFuture(PackageIdentity identity) {
        return versions.computeIfAbsent(identity, id -> CompletableFuture.supplyAsync(() -> {
            versionQueries.incrementAndGet();
            log.debug("Listing versions of {}", id);
            try {
                return versionProvider.availableVersions(id).stream()
                        .distinct()
                        .sorted()
                        .collect(Collectors.toUnmodifiableList());
            } catch (ProviderException e) {
                throw new CompletionException(e);
            }
        }, executor));
    }

    // Branches

    /**
     * Returns the revision a branch points at.
     *
     * @throws ProviderException if the branch cannot be resolved
     */
    public String resolveBranch(PackageIdentity identity, String branch) throws ProviderException {
        CompletableFuture<String> future = branches.computeIfAbsent(new BranchKey(identity, branch),
                key -> CompletableFuture.supplyAsync(() -> {
                    try {
                        return versionProvider.resolveBranch(key.identity(), key.branch());
                    } catch (ProviderException e) {
                        throw new CompletionException(e);
                    }
                }, executor));
        try {
            return token.await(future);
        } catch (ExecutionException e) {
            throw unwrap(e, ProviderException.class, identity);
        }
    }

    // Manifests

    /**
     * Returns the manifest of a package at a bound version.
     *
     * @throws ManifestException if the manifest cannot be loaded
     */
    public PackageManifest getManifest(PackageIdentity identity, BoundVersion version) throws ManifestException {
        try {
            return token.await(manifestFuture(identity, version));
        } catch (ExecutionException e) {
            throw unwrap(e, ManifestException.class, identity);
        }
    }

    /**
     * Returns the shared future of a manifest query, starting it if needed.
     */
    public CompletableFuture<PackageManifest> manifestFuture(PackageIdentity identity, BoundVersion version) {
        return manifests.computeIfAbsent(new ManifestKey(identity, version), key -> CompletableFuture.supplyAsync(() -> {
            manifestQueries.incrementAndGet();
            log.debug("Loading manifest of {} at {}", key.identity(), key.version());
            try {
                return manifestProvider.loadManifest(key.identity(), key.version());
            } catch (ManifestException e) {
                throw new CompletionException(e);
            }
        }, executor));
    }

    // Statistics

    public int getVersionQueryCount() {
        return versionQueries.get();
    }

    public int getManifestQueryCount() {
        return manifestQueries.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.debug("Provider cache closed after {} version and {} manifest queries",
                versionQueries.get(), manifestQueries.get());
        versions.clear();
        manifests.clear();
        branches.clear();
    }

    private static <E extends Exception> E unwrap(ExecutionException e, Class<E> type, PackageIdentity identity) {
        Throwable cause = e.getCause();
        if (type.isInstance(cause)) {
            return type.cast(cause);
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        String message = "Provider query for " + identity + " failed: " + (cause != null ? cause.getMessage() : e.getMessage());
        if (type == ManifestException.class) {
            return type.cast(new ManifestException(message, cause));
        }
        return type.cast(new ProviderException(message, cause));
    }

    private record ManifestKey(PackageIdentity identity, BoundVersion version) {}

    private record BranchKey(PackageIdentity identity, String branch) {}

    private static final class ProviderThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "pgr-provider-" + pool + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
