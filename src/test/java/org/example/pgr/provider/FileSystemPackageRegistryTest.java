package org.example.pgr.provider;

import org.example.pgr.exception.ManifestException;
import org.example.pgr.exception.ProviderException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.Version;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FileSystemPackageRegistry.
 */
class FileSystemPackageRegistryTest {

    private static final PackageIdentity CORE = PackageIdentity.of("core");

    @TempDir
    Path tempDir;

    private Path registryDir;
    private Path projectDir;
    private FileSystemPackageRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        registryDir = Files.createDirectories(tempDir.resolve("registry"));
        projectDir = Files.createDirectories(tempDir.resolve("project"));
        registry = new FileSystemPackageRegistry(registryDir, projectDir);
    }

    private void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    @DisplayName("should list versions sorted and skip non-version files")
    void shouldListVersionsSortedAndSkipNonVersionFiles() throws Exception {
        Path versions = registryDir.resolve("core").resolve("versions");
        write(versions.resolve("1.10.0.json"), "{ \"name\": \"core\" }");
        write(versions.resolve("1.2.0.json"), "{ \"name\": \"core\" }");
        write(versions.resolve("latest.json"), "{ \"name\": \"core\" }");
        write(versions.resolve("README.md"), "notes");

        List<Version> result = registry.availableVersions(CORE);

        assertThat(result).containsExactly(Version.parse("1.2.0"), Version.parse("1.10.0"));
    }

    @Test
    @DisplayName("should return no versions for unknown package")
    void shouldReturnNoVersionsForUnknownPackage() throws Exception {
        assertThat(registry.availableVersions(PackageIdentity.of("missing"))).isEmpty();
    }

    @Test
    @DisplayName("should load manifest of version, revision and local path")
    void shouldLoadManifestOfVersionRevisionAndLocalPath() throws Exception {
        write(registryDir.resolve("core/versions/1.0.0.json"), "{ \"name\": \"core\", \"platforms\": { \"linux\": \"1.0\" } }");
        write(registryDir.resolve("core/revisions/abc.json"), "{ \"name\": \"core\", \"platforms\": { \"linux\": \"2.0\" } }");
        write(tempDir.resolve("libs/util/package.json"), "{ \"name\": \"util\" }");

        PackageManifest released = registry.loadManifest(CORE, BoundVersion.version(Version.parse("1.0.0")));
        PackageManifest revision = registry.loadManifest(CORE, BoundVersion.branch("main", "abc"));
        PackageManifest local = registry.loadManifest(PackageIdentity.of("util"), BoundVersion.local("../libs/util"));

        assertThat(released.getPlatforms()).containsEntry("linux", Version.parse("1.0.0"));
        assertThat(revision.getPlatforms()).containsEntry("linux", Version.parse("2.0.0"));
        assertThat(local.getIdentity()).isEqualTo(PackageIdentity.of("util"));
    }

    @Test
    @DisplayName("should fail when manifest is missing")
    void shouldFailWhenManifestMissing() {
        assertThatThrownBy(() -> registry.loadManifest(CORE, BoundVersion.version(Version.parse("9.0.0"))))
                .isInstanceOf(ManifestException.class)
                .hasMessageStartingWith("Manifest not found");
    }

    @Test
    @DisplayName("should resolve branch to revision")
    void shouldResolveBranchToRevision() throws Exception {
        write(registryDir.resolve("core/branches.json"), "{ \"main\": \"abc\", \"dev\": \"def\" }");

        assertThat(registry.resolveBranch(CORE, "dev")).isEqualTo("def");
        assertThatThrownBy(() -> registry.resolveBranch(CORE, "release"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Package core has no branch 'release'");
    }

    @Test
    @DisplayName("should locate checked out sources")
    void shouldLocateCheckedOutSources() throws Exception {
        Path sources = Files.createDirectories(registryDir.resolve("core/sources/1.0.0"));

        assertThat(registry.checkout(CORE, BoundVersion.version(Version.parse("1.0.0")))).isEqualTo(sources);
        assertThatThrownBy(() -> registry.checkout(CORE, BoundVersion.revision("zzz")))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("No sources for core at zzz");
    }
}
