package org.example.pgr.resolver;

import org.example.pgr.exception.GraphException;
import org.example.pgr.exception.ResolutionException;
import org.example.pgr.lockfile.Lockfile;
import org.example.pgr.lockfile.LockfileStore;
import org.example.pgr.lockfile.Pin;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.ProductDescription;
import org.example.pgr.model.Requirement;
import org.example.pgr.model.TargetDescription;
import org.example.pgr.provider.CancellationToken;
import org.example.pgr.support.InMemoryPackageRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.example.pgr.support.InMemoryPackageRegistry.from;
import static org.example.pgr.support.InMemoryPackageRegistry.v;

/**
 * Unit tests for DependencyResolutionService.
 */
class DependencyResolutionServiceTest {

    private static final PackageIdentity CORE = PackageIdentity.of("core");

    @TempDir
    Path tempDir;

    private InMemoryPackageRegistry registry;
    private LockfileStore store;
    private Path lockfilePath;

    @BeforeEach
    void setUp() {
        registry = new InMemoryPackageRegistry()
                .add("core", "1.0.0", DependencyResolutionServiceTest::coreLibrary)
                .add("core", "1.2.0", DependencyResolutionServiceTest::coreLibrary);
        store = new LockfileStore();
        lockfilePath = tempDir.resolve("package.lock.json");
    }

    private static void coreLibrary(PackageManifest.Builder core) {
        core.target(TargetDescription.builder("Core").build())
                .product(ProductDescription.library("Core", "Core"));
    }

    private static PackageManifest app(Requirement onCore, String product) {
        return PackageManifest.builder("app")
                .dependency("core", onCore)
                .target(TargetDescription.builder("App").dependsOnProduct(product, "core").build())
                .build();
    }

    private DependencyResolutionService service(boolean resolvedVersionsOnly) {
        return new DependencyResolutionService(registry, registry, store, 2, resolvedVersionsOnly);
    }

    @Nested
    @DisplayName("Resolve")
    class Resolve {

        @Test
        @DisplayName("should resolve and write lockfile on first run")
        void shouldResolveAndWriteLockfileOnFirstRun() throws Exception {
            ResolutionOutcome outcome = service(false).resolve(app(from("1.0.0"), "Core"), lockfilePath);

            assertThat(outcome.isFastPath()).isFalse();
            assertThat(outcome.isLockfileWritten()).isTrue();
            assertThat(outcome.getSolution().find(CORE)).contains(v("1.2.0"));
            assertThat(outcome.getGraph().findModule("Core")).isPresent();
            assertThat(store.load(lockfilePath)).contains(new Lockfile(List.of(new Pin(CORE, v("1.2.0")))));
        }

        @Test
        @DisplayName("should reuse lockfile on second run without rewriting it")
        void shouldReuseLockfileOnSecondRun() throws Exception {
            service(false).resolve(app(from("1.0.0"), "Core"), lockfilePath);
            String written = Files.readString(lockfilePath);
            int queriesAfterFirstRun = registry.totalVersionQueries();

            ResolutionOutcome outcome = service(false).resolve(app(from("1.0.0"), "Core"), lockfilePath);

            assertThat(outcome.isFastPath()).isTrue();
            assertThat(outcome.isLockfileWritten()).isFalse();
            assertThat(outcome.getSolution().find(CORE)).contains(v("1.2.0"));
            assertThat(registry.totalVersionQueries()).isEqualTo(queriesAfterFirstRun);
            assertThat(Files.readString(lockfilePath)).isEqualTo(written);
        }

        @Test
        @DisplayName("should keep locked version older than the newest release")
        void shouldKeepLockedVersion() throws Exception {
            store.save(new Lockfile(List.of(new Pin(CORE, v("1.0.0")))), lockfilePath);

            ResolutionOutcome outcome = service(false).resolve(app(from("1.0.0"), "Core"), lockfilePath);

            assertThat(outcome.isFastPath()).isTrue();
            assertThat(outcome.getSolution().find(CORE)).contains(v("1.0.0"));
        }

        @Test
        @DisplayName("should fail with out of date lockfile in resolved versions only mode")
        void shouldFailWithOutOfDateLockfileInResolvedVersionsOnlyMode() throws Exception {
            store.save(new Lockfile(List.of(new Pin(CORE, v("1.0.0")))), lockfilePath);
            String before = Files.readString(lockfilePath);

            assertThatThrownBy(() -> service(true).resolve(app(from("1.2.0"), "Core"), lockfilePath))
                    .isInstanceOfSatisfying(ResolutionException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.LOCKFILE_OUT_OF_DATE));
            assertThat(Files.readString(lockfilePath)).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("Update")
    class Update {

        @Test
        @DisplayName("should move pinned packages to newest versions")
        void shouldMovePinnedPackagesToNewestVersions() throws Exception {
            store.save(new Lockfile(List.of(new Pin(CORE, v("1.0.0")))), lockfilePath);

            ResolutionOutcome outcome = service(false).update(app(from("1.0.0"), "Core"), lockfilePath, List.of());

            assertThat(outcome.isFastPath()).isFalse();
            assertThat(outcome.isLockfileWritten()).isTrue();
            assertThat(store.load(lockfilePath).orElseThrow().findPin(CORE).orElseThrow().getState())
                    .isEqualTo(v("1.2.0"));
        }

        @Test
        @DisplayName("should not rewrite lockfile when update changes nothing")
        void shouldNotRewriteLockfileWhenUpdateChangesNothing() throws Exception {
            store.save(new Lockfile(List.of(new Pin(CORE, v("1.2.0")))), lockfilePath);

            ResolutionOutcome outcome = service(false).update(app(from("1.0.0"), "Core"), lockfilePath, List.of(CORE));

            assertThat(outcome.isLockfileWritten()).isFalse();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should not write lockfile when resolution fails")
        void shouldNotWriteLockfileWhenResolutionFails() {
            assertThatThrownBy(() -> service(false).resolve(app(from("5.0.0"), "Core"), lockfilePath))
                    .isInstanceOfSatisfying(ResolutionException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.VERSION_CONFLICT));
            assertThat(lockfilePath).doesNotExist();
        }

        @Test
        @DisplayName("should not write lockfile when graph is invalid")
        void shouldNotWriteLockfileWhenGraphIsInvalid() {
            assertThatThrownBy(() -> service(false).resolve(app(from("1.0.0"), "Networking"), lockfilePath))
                    .isInstanceOfSatisfying(GraphException.class,
                            e -> assertThat(e.getKind()).isEqualTo(GraphException.Kind.UNRESOLVED_PRODUCT_REFERENCE));
            assertThat(lockfilePath).doesNotExist();
        }

        @Test
        @DisplayName("should stop when cancelled")
        void shouldStopWhenCancelled() {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            assertThatThrownBy(() -> service(false).resolve(app(from("1.0.0"), "Core"), lockfilePath, token))
                    .isInstanceOfSatisfying(ResolutionException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.CANCELLED));
            assertThat(lockfilePath).doesNotExist();
        }
    }
}
