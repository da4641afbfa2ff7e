package org.example.pgr.solver;

import org.example.pgr.exception.ResolutionException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.Requirement;
import org.example.pgr.provider.CancellationToken;
import org.example.pgr.provider.ContainerProvider;
import org.example.pgr.provider.ManifestProvider;
import org.example.pgr.provider.VersionProvider;
import org.example.pgr.support.InMemoryPackageRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;
import static org.example.pgr.support.InMemoryPackageRegistry.exact;
import static org.example.pgr.support.InMemoryPackageRegistry.from;
import static org.example.pgr.support.InMemoryPackageRegistry.range;
import static org.example.pgr.support.InMemoryPackageRegistry.v;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PubGrubResolver.
 */
class PubGrubResolverTest {

    private InMemoryPackageRegistry registry;
    private final List<ContainerProvider> providers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new InMemoryPackageRegistry();
    }

    @AfterEach
    void tearDown() {
        providers.forEach(ContainerProvider::close);
    }

    private ContainerProvider provider(CancellationToken token) {
        ContainerProvider provider = new ContainerProvider(registry, registry, 4, token);
        providers.add(provider);
        return provider;
    }

    private Solution solve(Consumer<PackageManifest.Builder> root) throws ResolutionException {
        return solve(root, Map.of());
    }

    private Solution solve(Consumer<PackageManifest.Builder> root, Map<PackageIdentity, BoundVersion> preferred)
            throws ResolutionException {
        PackageManifest.Builder builder = PackageManifest.builder("app");
        root.accept(builder);
        return new PubGrubResolver(provider(CancellationToken.create())).solve(builder.build(), preferred);
    }

    private static PackageIdentity id(String name) {
        return PackageIdentity.of(name);
    }

    @Nested
    @DisplayName("Version Selection")
    class VersionSelection {

        @Test
        @DisplayName("should select highest version in range")
        void shouldSelectHighestVersionInRange() throws Exception {
            registry.add("a", "1.0.0").add("a", "1.2.0").add("a", "2.0.0");

            Solution solution = solve(root -> root.dependency("a", from("1.0.0")));

            assertThat(solution.getBindings()).containsExactly(entry(id("a"), v("1.2.0")));
        }

        @Test
        @DisplayName("should resolve transitive dependencies")
        void shouldResolveTransitiveDependencies() throws Exception {
            registry.add("a", "1.0.0", a -> a.dependency("b", from("2.0.0")))
                    .add("b", "2.0.0", b -> b.dependency("c", exact("0.3.0")))
                    .add("b", "2.1.0", b -> b.dependency("c", exact("0.3.0")))
                    .add("c", "0.3.0").add("c", "0.4.0");

            Solution solution = solve(root -> root.dependency("a", from("1.0.0")));

            assertThat(solution.getBindings()).containsExactly(
                    entry(id("a"), v("1.0.0")),
                    entry(id("b"), v("2.1.0")),
                    entry(id("c"), v("0.3.0")));
        }

        @Test
        @DisplayName("should pick highest version in intersection of shared dependency")
        void shouldPickHighestVersionInIntersection() throws Exception {
            registry.add("a", "1.0.0", a -> a.dependency("shared", range("1.0.0", "1.5.0")))
                    .add("b", "1.0.0", b -> b.dependency("shared", range("1.2.0", "2.0.0")))
                    .add("shared", "1.1.0").add("shared", "1.3.0").add("shared", "1.4.0").add("shared", "1.6.0");

            Solution solution = solve(root -> root
                    .dependency("a", from("1.0.0"))
                    .dependency("b", from("1.0.0")));

            assertThat(solution.find(id("shared"))).contains(v("1.4.0"));
        }

        @Test
        @DisplayName("should skip version that conflicts with already selected package")
        void shouldSkipVersionThatConflicts() throws Exception {
            registry.add("a", "1.0.0")
                    .add("a", "1.5.0", a -> a.dependency("b", range("1.0.0", "1.1.0")))
                    .add("a", "1.9.0", a -> a.dependency("b", range("1.2.0", "2.0.0")))
                    .add("b", "1.0.0").add("b", "1.0.5").add("b", "1.2.0");

            Solution solution = solve(root -> root
                    .dependency("a", range("1.0.0", "2.0.0"))
                    .dependency("b", range("1.0.0", "1.1.0")));

            assertThat(solution.getBindings()).containsExactly(
                    entry(id("a"), v("1.5.0")),
                    entry(id("b"), v("1.0.5")));
        }

        @Test
        @DisplayName("should backjump out of a conflict found deep in the search")
        void shouldBackjumpOutOfDeepConflict() throws Exception {
            registry.add("foo", "1.0.0")
                    .add("foo", "1.1.0", foo -> foo
                            .dependency("left", from("1.0.0"))
                            .dependency("right", from("1.0.0")))
                    .add("left", "1.0.0", left -> left.dependency("shared", range("1.0.0", "99.0.0")))
                    .add("right", "1.0.0", right -> right.dependency("shared", range("0.0.1", "2.0.0")))
                    .add("shared", "1.0.0", shared -> shared.dependency("target", from("1.0.0")))
                    .add("shared", "2.0.0")
                    .add("target", "1.0.0").add("target", "2.0.0");

            Solution solution = solve(root -> root
                    .dependency("foo", from("1.0.0"))
                    .dependency("target", from("2.0.0")));

            assertThat(solution.getBindings()).containsExactly(
                    entry(id("foo"), v("1.0.0")),
                    entry(id("target"), v("2.0.0")));
        }

        @Test
        @DisplayName("should return empty solution for root without dependencies")
        void shouldReturnEmptySolutionForRootWithoutDependencies() throws Exception {
            Solution solution = solve(root -> { });

            assertThat(solution.size()).isZero();
            assertThat(solution.getRoot()).isEqualTo(id("app"));
        }

        @Test
        @DisplayName("should produce identical solutions for identical inputs")
        void shouldProduceIdenticalSolutionsForIdenticalInputs() throws Exception {
            registry.add("a", "1.0.0", a -> a.dependency("c", from("1.0.0")))
                    .add("b", "1.0.0", b -> b.dependency("c", range("1.0.0", "1.3.0")))
                    .add("c", "1.0.0").add("c", "1.2.0").add("c", "1.4.0");
            Consumer<PackageManifest.Builder> root = r -> r
                    .dependency("a", from("1.0.0"))
                    .dependency("b", from("1.0.0"));

            Solution first = solve(root);
            Solution second = solve(root);

            assertThat(first).isEqualTo(second);
            assertThat(first.find(id("c"))).contains(v("1.2.0"));
        }

        @Test
        @DisplayName("should query each package and manifest at most once")
        void shouldQueryEachPackageAndManifestAtMostOnce() throws Exception {
            registry.add("a", "1.0.0", a -> a.dependency("c", from("1.0.0")))
                    .add("a", "1.1.0", a -> a.dependency("c", from("2.0.0")))
                    .add("b", "1.0.0", b -> b.dependency("c", range("1.0.0", "2.0.0")))
                    .add("c", "1.0.0").add("c", "2.0.0");

            solve(root -> root.dependency("a", from("1.0.0")).dependency("b", from("1.0.0")));

            assertThat(registry.versionQueryCount("a")).isEqualTo(1);
            assertThat(registry.versionQueryCount("b")).isEqualTo(1);
            assertThat(registry.versionQueryCount("c")).isEqualTo(1);
            assertThat(registry.maxManifestQueriesPerKey()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Preferred Versions")
    class PreferredVersions {

        @Test
        @DisplayName("should keep preferred version while it is allowed")
        void shouldKeepPreferredVersionWhileAllowed() throws Exception {
            registry.add("a", "1.0.0").add("a", "1.1.0").add("a", "1.2.0");

            Solution solution = solve(root -> root.dependency("a", from("1.0.0")),
                    Map.of(id("a"), v("1.1.0")));

            assertThat(solution.find(id("a"))).contains(v("1.1.0"));
        }

        @Test
        @DisplayName("should fall back to highest when preferred version is excluded")
        void shouldFallBackToHighestWhenPreferredExcluded() throws Exception {
            registry.add("a", "1.0.0").add("a", "1.1.0").add("a", "1.2.0");

            Solution solution = solve(root -> root.dependency("a", range("1.1.0", "2.0.0")),
                    Map.of(id("a"), v("1.0.0")));

            assertThat(solution.find(id("a"))).contains(v("1.2.0"));
        }
    }

    @Nested
    @DisplayName("Unversioned Requirements")
    class UnversionedRequirements {

        @Test
        @DisplayName("should bind local path without querying versions")
        void shouldBindLocalPathWithoutQueryingVersions() throws Exception {
            ManifestProvider manifests = mock(ManifestProvider.class);
            VersionProvider versions = mock(VersionProvider.class);
            when(manifests.loadManifest(eq(id("util")), any())).thenReturn(PackageManifest.builder("util").build());
            PackageManifest root = PackageManifest.builder("app")
                    .dependency("util", Requirement.local("../util"))
                    .build();

            Solution solution;
            try (ContainerProvider provider = new ContainerProvider(manifests, versions, 2, CancellationToken.create())) {
                solution = new PubGrubResolver(provider).solve(root, Map.of());
            }

            assertThat(solution.find(id("util"))).contains(BoundVersion.local("../util"));
            verify(versions, never()).availableVersions(any());
            verify(manifests).loadManifest(id("util"), BoundVersion.local("../util"));
        }

        @Test
        @DisplayName("should override versioned requirements with branch binding")
        void shouldOverrideVersionedRequirementsWithBranchBinding() throws Exception {
            registry.addBranch("core", "main", "abc123")
                    .addRevision("core", "abc123", core -> core.dependency("log", from("1.0.0")))
                    .add("core", "1.0.0")
                    .add("a", "1.0.0", a -> a.dependency("core", from("1.0.0")))
                    .add("log", "1.0.0").add("log", "1.3.0");

            Solution solution = solve(root -> root
                    .dependency("a", from("1.0.0"))
                    .dependency("core", Requirement.branch("main")));

            assertThat(solution.getBindings()).containsExactly(
                    entry(id("a"), v("1.0.0")),
                    entry(id("core"), BoundVersion.branch("main", "abc123")),
                    entry(id("log"), v("1.3.0")));
            assertThat(registry.versionQueryCount("core")).isZero();
        }

        @Test
        @DisplayName("should fail when one package is bound to two different revisions")
        void shouldFailWhenPackageBoundToTwoRevisions() {
            registry.addBranch("core", "main", "abc123")
                    .addRevision("core", "abc123", core -> { })
                    .addLocal("../util", "util", util -> util.dependency("core", Requirement.revision("def456")));

            assertThatThrownBy(() -> solve(root -> root
                    .dependency("core", Requirement.branch("main"))
                    .dependency("util", Requirement.local("../util"))))
                    .isInstanceOfSatisfying(ResolutionException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.VERSION_CONFLICT);
                        assertThat(e.getPackages()).containsExactly(id("core"));
                        assertThat(e.getExplanation()).isEqualTo(
                                "Because core is required both at main@abc123 and at def456, version solving failed.");
                    });
        }

        @Test
        @DisplayName("should avoid released version that depends on a branch")
        void shouldAvoidReleasedVersionThatDependsOnBranch() throws Exception {
            registry.add("a", "1.0.0")
                    .add("a", "1.1.0", a -> a.dependency("tool", Requirement.branch("main")));

            Solution solution = solve(root -> root.dependency("a", from("1.0.0")));

            assertThat(solution.getBindings()).containsExactly(entry(id("a"), v("1.0.0")));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should explain unsatisfiable root requirement")
        void shouldExplainUnsatisfiableRootRequirement() {
            registry.add("a", "1.0.0");

            assertThatThrownBy(() -> solve(root -> root.dependency("a", range("5.0.0", "6.0.0"))))
                    .isInstanceOfSatisfying(ResolutionException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.VERSION_CONFLICT);
                        assertThat(e.getPackages()).containsExactly(id("a"));
                        assertThat(e.getExplanation()).isEqualTo("Because no versions of a match 5.0.0..<6.0.0"
                                + " and root depends on a 5.0.0..<6.0.0, version solving failed.");
                    });
        }

        @Test
        @DisplayName("should report conflict citing both packages")
        void shouldReportConflictCitingBothPackages() {
            registry.add("a", "1.0.0", a -> a.dependency("b", range("2.0.0", "3.0.0")))
                    .add("b", "1.0.0").add("b", "2.0.0");

            assertThatThrownBy(() -> solve(root -> root
                    .dependency("a", range("1.0.0", "2.0.0"))
                    .dependency("b", range("1.0.0", "2.0.0"))))
                    .isInstanceOfSatisfying(ResolutionException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.VERSION_CONFLICT);
                        assertThat(e.getPackages()).containsExactly(id("a"), id("b"));
                        assertThat(e.getExplanation())
                                .contains("a 1.0.0 depends on b 2.0.0..<3.0.0")
                                .endsWith("version solving failed.");
                        assertThat(e.getMessage()).startsWith("Dependencies could not be resolved:\n");
                    });
        }

        @Test
        @DisplayName("should fail when package has no versions")
        void shouldFailWhenPackageHasNoVersions() {
            assertThatThrownBy(() -> solve(root -> root.dependency("ghost", from("1.0.0"))))
                    .isInstanceOfSatisfying(ResolutionException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.PACKAGE_NOT_FOUND);
                        assertThat(e.getPackages()).containsExactly(id("ghost"));
                    });
        }

        @Test
        @DisplayName("should skip versions with unreadable manifests")
        void shouldSkipVersionsWithUnreadableManifests() throws Exception {
            registry.add("a", "1.0.0").add("a", "1.1.0").breakManifest("a", "1.1.0");

            Solution solution = solve(root -> root.dependency("a", from("1.0.0")));

            assertThat(solution.find(id("a"))).contains(v("1.0.0"));
        }

        @Test
        @DisplayName("should backtrack to an older parent when the only allowed version is unreadable")
        void shouldBacktrackWhenOnlyAllowedVersionIsUnreadable() throws Exception {
            registry.add("a", "1.0.0", a -> a.dependency("b", range("1.0.0", "1.5.0")))
                    .add("a", "2.0.0", a -> a.dependency("b", range("1.5.0", "3.0.0")))
                    .add("b", "1.0.0")
                    .add("b", "2.0.0")
                    .breakManifest("b", "2.0.0");

            Solution solution = solve(root -> root.dependency("a", range("1.0.0", "3.0.0")));

            assertThat(solution.getBindings()).containsExactly(entry(id("a"), v("1.0.0")), entry(id("b"), v("1.0.0")));
        }

        @Test
        @DisplayName("should fail when no version has a readable manifest")
        void shouldFailWhenNoVersionHasReadableManifest() {
            registry.add("a", "1.0.0").add("a", "1.1.0")
                    .breakManifest("a", "1.0.0").breakManifest("a", "1.1.0");

            assertThatThrownBy(() -> solve(root -> root.dependency("a", from("1.0.0"))))
                    .isInstanceOfSatisfying(ResolutionException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.NO_USABLE_VERSION);
                        assertThat(e.getPackages()).containsExactly(id("a"));
                    });
        }

        @Test
        @DisplayName("should report provider failure")
        void shouldReportProviderFailure() {
            registry.failVersions("a");

            assertThatThrownBy(() -> solve(root -> root.dependency("a", from("1.0.0"))))
                    .isInstanceOfSatisfying(ResolutionException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.PROVIDER_FAILURE);
                        assertThat(e.getMessage()).contains("Registry unavailable for a");
                    });
        }

        @Test
        @DisplayName("should stop when cancelled")
        void shouldStopWhenCancelled() {
            registry.add("a", "1.0.0");
            CancellationToken token = CancellationToken.create();
            token.cancel();
            PubGrubResolver resolver = new PubGrubResolver(provider(token));
            PackageManifest root = PackageManifest.builder("app").dependency("a", from("1.0.0")).build();

            assertThatThrownBy(() -> resolver.solve(root, Map.of()))
                    .isInstanceOfSatisfying(ResolutionException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ResolutionException.Kind.CANCELLED));
            assertThat(registry.totalVersionQueries()).isZero();
        }
    }
}
