package org.example.pgr.provider;

import org.example.pgr.exception.ManifestException;
import org.example.pgr.model.PackageDependency;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.Requirement;
import org.example.pgr.model.TargetDependency;
import org.example.pgr.model.TargetDescription;
import org.example.pgr.model.Version;
import org.example.pgr.model.VersionSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ManifestReader.
 */
class ManifestReaderTest {

    private ManifestReader reader;

    @BeforeEach
    void setUp() {
        reader = new ManifestReader();
    }

    private PackageManifest read(String json) throws ManifestException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "test.json");
    }

    @Nested
    @DisplayName("Dependencies")
    class Dependencies {

        @Test
        @DisplayName("should read every requirement kind")
        void shouldReadEveryRequirementKind() throws Exception {
            PackageManifest manifest = read("{\n"
                    + "  \"name\": \"App\",\n"
                    + "  \"dependencies\": [\n"
                    + "    { \"identity\": \"core\", \"from\": \"1.0.0\" },\n"
                    + "    { \"identity\": \"log\", \"exact\": \"2.1.0\" },\n"
                    + "    { \"identity\": \"net\", \"upToNextMinor\": \"1.4.0\" },\n"
                    + "    { \"identity\": \"json\", \"range\": { \"lower\": \"1.0.0\", \"upper\": \"1.5.0\" } },\n"
                    + "    { \"location\": \"https://example.com/Tools.git\", \"branch\": \"main\" },\n"
                    + "    { \"identity\": \"pinned\", \"revision\": \"abc123\" },\n"
                    + "    { \"path\": \"../local-lib\" }\n"
                    + "  ]\n"
                    + "}");

            assertThat(manifest.getIdentity()).isEqualTo(PackageIdentity.of("app"));
            assertThat(manifest.getDisplayName()).isEqualTo("App");
            assertThat(manifest.getDependencies()).extracting(PackageDependency::getRequirement).containsExactly(
                    Requirement.upToNextMajor(Version.parse("1.0.0")),
                    Requirement.exact(Version.parse("2.1.0")),
                    Requirement.upToNextMinor(Version.parse("1.4.0")),
                    Requirement.range(VersionSet.between(Version.parse("1.0.0"), Version.parse("1.5.0"))),
                    Requirement.branch("main"),
                    Requirement.revision("abc123"),
                    Requirement.local("../local-lib"));
            assertThat(manifest.getDependencies()).extracting(d -> d.getIdentity().getKey())
                    .containsExactly("core", "log", "net", "json", "tools", "pinned", "local-lib");
        }

        @Test
        @DisplayName("should read module aliases")
        void shouldReadModuleAliases() throws Exception {
            PackageManifest manifest = read("{ \"name\": \"app\", \"dependencies\": ["
                    + "{ \"identity\": \"core\", \"from\": \"1.0.0\", \"moduleAliases\": { \"Utils\": \"CoreUtils\" } } ] }");

            assertThat(manifest.getDependencies().get(0).getModuleAliases())
                    .isEqualTo(Map.of("Utils", "CoreUtils"));
        }

        @Test
        @DisplayName("should fail when dependency declares no requirement")
        void shouldFailWhenDependencyDeclaresNoRequirement() {
            assertThatThrownBy(() -> read("{ \"name\": \"app\", \"dependencies\": [ { \"identity\": \"core\" } ] }"))
                    .isInstanceOf(ManifestException.class)
                    .hasMessageContaining("dependency on core declares no requirement");
        }
    }

    @Nested
    @DisplayName("Targets and Products")
    class TargetsAndProducts {

        @Test
        @DisplayName("should read targets with every dependency form")
        void shouldReadTargetsWithEveryDependencyForm() throws Exception {
            PackageManifest manifest = read("{\n"
                    + "  \"name\": \"app\",\n"
                    + "  \"platforms\": { \"macos\": \"12.0\" },\n"
                    + "  // comments are allowed\n"
                    + "  \"targets\": [\n"
                    + "    { \"name\": \"App\", \"type\": \"executable\", \"dependencies\": [\n"
                    + "      \"AppCore\",\n"
                    + "      { \"target\": \"Support\" },\n"
                    + "      { \"product\": \"Core\", \"package\": \"core\", \"platforms\": [ \"Linux\" ] }\n"
                    + "    ] },\n"
                    + "    { \"name\": \"AppCore\" },\n"
                    + "    { \"name\": \"Support\" },\n"
                    + "    { \"name\": \"AppTests\", \"type\": \"test\", \"dependencies\": [ { \"byName\": \"App\" } ] }\n"
                    + "  ],\n"
                    + "  \"products\": [ { \"name\": \"App\", \"type\": \"executable\", \"targets\": [ \"App\" ] } ]\n"
                    + "}");

            assertThat(manifest.getPlatforms()).containsEntry("macos", Version.parse("12.0.0"));
            TargetDescription app = manifest.findTarget("App").orElseThrow();
            assertThat(app.getType()).isEqualTo(TargetDescription.Type.EXECUTABLE);
            assertThat(app.getDependencies()).containsExactly(
                    TargetDependency.byName("AppCore"),
                    TargetDependency.target("Support"),
                    TargetDependency.product("Core", PackageIdentity.of("core")).onPlatforms(Set.of("linux")));
            assertThat(manifest.findTarget("AppCore").orElseThrow().getType()).isEqualTo(TargetDescription.Type.REGULAR);
            assertThat(manifest.findTarget("AppTests").orElseThrow().isTest()).isTrue();
            assertThat(manifest.findProduct("App").orElseThrow().getTargets()).containsExactly("App");
        }

        @Test
        @DisplayName("should fail on unknown target type")
        void shouldFailOnUnknownTargetType() {
            assertThatThrownBy(() -> read("{ \"name\": \"app\", \"targets\": [ { \"name\": \"A\", \"type\": \"plugin-ish\" } ] }"))
                    .isInstanceOf(ManifestException.class)
                    .hasMessageContaining("unknown type 'plugin-ish'");
        }
    }

    @Nested
    @DisplayName("Malformed Input")
    class MalformedInput {

        @Test
        @DisplayName("should fail when name is missing")
        void shouldFailWhenNameMissing() {
            assertThatThrownBy(() -> read("{ \"targets\": [] }"))
                    .isInstanceOf(ManifestException.class)
                    .hasMessageContaining("manifest is missing 'name'");
        }

        @Test
        @DisplayName("should fail on invalid JSON")
        void shouldFailOnInvalidJson() {
            assertThatThrownBy(() -> read("{ \"name\": "))
                    .isInstanceOf(ManifestException.class)
                    .hasMessageStartingWith("Malformed manifest test.json");
        }

        @Test
        @DisplayName("should fail when document is not an object")
        void shouldFailWhenDocumentNotObject() {
            assertThatThrownBy(() -> read("[ 1, 2 ]"))
                    .isInstanceOf(ManifestException.class)
                    .hasMessageContaining("must be a JSON object");
        }

        @Test
        @DisplayName("should fail when file does not exist")
        void shouldFailWhenFileDoesNotExist(@TempDir Path dir) {
            Path missing = dir.resolve("package.json");

            assertThatThrownBy(() -> reader.read(missing))
                    .isInstanceOf(ManifestException.class)
                    .hasMessage("Manifest not found: " + missing);
        }
    }
}
