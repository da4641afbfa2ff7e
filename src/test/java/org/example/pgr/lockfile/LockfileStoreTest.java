package org.example.pgr.lockfile;

import org.example.pgr.exception.LockfileException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.Version;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LockfileStore.
 */
class LockfileStoreTest {

    private static final String EXPECTED_JSON = "{\n"
            + "  \"pins\" : [ {\n"
            + "    \"identity\" : \"a\",\n"
            + "    \"kind\" : \"version\",\n"
            + "    \"state\" : {\n"
            + "      \"version\" : \"1.2.0\"\n"
            + "    }\n"
            + "  }, {\n"
            + "    \"identity\" : \"core\",\n"
            + "    \"kind\" : \"branch\",\n"
            + "    \"state\" : {\n"
            + "      \"branch\" : \"main\",\n"
            + "      \"revision\" : \"abc123\"\n"
            + "    }\n"
            + "  }, {\n"
            + "    \"identity\" : \"tools\",\n"
            + "    \"kind\" : \"revision\",\n"
            + "    \"state\" : {\n"
            + "      \"revision\" : \"def456\"\n"
            + "    }\n"
            + "  } ],\n"
            + "  \"version\" : 1\n"
            + "}\n";

    @TempDir
    Path tempDir;

    private LockfileStore store;

    @BeforeEach
    void setUp() {
        store = new LockfileStore();
    }

    private static Lockfile sampleLockfile() {
        return new Lockfile(List.of(
                new Pin(PackageIdentity.of("tools"), BoundVersion.revision("def456")),
                new Pin(PackageIdentity.of("core"), BoundVersion.branch("main", "abc123")),
                new Pin(PackageIdentity.of("a"), BoundVersion.version(Version.parse("1.2.0")))));
    }

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("should serialize pins sorted by identity")
        void shouldSerializePinsSortedByIdentity() throws Exception {
            assertThat(store.toJson(sampleLockfile())).isEqualTo(EXPECTED_JSON);
        }

        @Test
        @DisplayName("should write identical bytes for identical lockfiles")
        void shouldWriteIdenticalBytesForIdenticalLockfiles() throws Exception {
            Path first = tempDir.resolve("first.lock.json");
            Path second = tempDir.resolve("second.lock.json");

            store.save(sampleLockfile(), first);
            store.save(sampleLockfile(), second);

            assertThat(Files.readAllBytes(first))
                    .isEqualTo(Files.readAllBytes(second))
                    .isEqualTo(EXPECTED_JSON.getBytes(StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("should serialize empty lockfile")
        void shouldSerializeEmptyLockfile() throws Exception {
            assertThat(store.toJson(Lockfile.empty())).isEqualTo("{\n  \"pins\" : [ ],\n  \"version\" : 1\n}\n");
        }

        @Test
        @DisplayName("should replace existing file without leaving temporary files")
        void shouldReplaceExistingFileWithoutLeavingTemporaryFiles() throws Exception {
            Path path = tempDir.resolve("nested").resolve("package.lock.json");
            store.save(Lockfile.empty(), path);

            store.save(sampleLockfile(), path);

            assertThat(Files.readString(path)).isEqualTo(EXPECTED_JSON);
            try (Stream<Path> files = Files.list(path.getParent())) {
                assertThat(files).containsExactly(path);
            }
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("should read back what was written")
        void shouldReadBackWhatWasWritten() throws Exception {
            Path path = tempDir.resolve("package.lock.json");
            store.save(sampleLockfile(), path);

            Optional<Lockfile> loaded = store.load(path);

            assertThat(loaded).contains(sampleLockfile());
        }

        @Test
        @DisplayName("should return empty when file does not exist")
        void shouldReturnEmptyWhenFileDoesNotExist() throws Exception {
            assertThat(store.load(tempDir.resolve("missing.json"))).isEmpty();
        }

        @Test
        @DisplayName("should ignore unknown properties")
        void shouldIgnoreUnknownProperties() throws Exception {
            Path path = tempDir.resolve("package.lock.json");
            Files.writeString(path, "{ \"version\": 1, \"generator\": \"other\", \"pins\": [ "
                    + "{ \"identity\": \"a\", \"kind\": \"version\", \"state\": { \"version\": \"1.0.0\", \"checksum\": \"x\" } } ] }");

            Lockfile lockfile = store.load(path).orElseThrow();

            assertThat(lockfile.findPin(PackageIdentity.of("a")).orElseThrow().getState())
                    .isEqualTo(BoundVersion.version(Version.parse("1.0.0")));
        }

        @Test
        @DisplayName("should fail on malformed JSON")
        void shouldFailOnMalformedJson() throws Exception {
            Path path = tempDir.resolve("package.lock.json");
            Files.writeString(path, "{ \"pins\": [ ");

            assertThatThrownBy(() -> store.load(path))
                    .isInstanceOf(LockfileException.class)
                    .hasMessageStartingWith("Malformed lockfile");
        }

        @Test
        @DisplayName("should fail on unsupported format version")
        void shouldFailOnUnsupportedFormatVersion() throws Exception {
            Path path = tempDir.resolve("package.lock.json");
            Files.writeString(path, "{ \"version\": 7, \"pins\": [] }");

            assertThatThrownBy(() -> store.load(path))
                    .isInstanceOf(LockfileException.class)
                    .hasMessageContaining("unsupported format version 7");
        }

        @Test
        @DisplayName("should fail on unknown pin kind")
        void shouldFailOnUnknownPinKind() throws Exception {
            Path path = tempDir.resolve("package.lock.json");
            Files.writeString(path, "{ \"version\": 1, \"pins\": [ "
                    + "{ \"identity\": \"a\", \"kind\": \"tarball\", \"state\": { \"version\": \"1.0.0\" } } ] }");

            assertThatThrownBy(() -> store.load(path))
                    .isInstanceOf(LockfileException.class)
                    .hasMessageContaining("unknown pin kind 'tarball'");
        }

        @Test
        @DisplayName("should fail on duplicate pins")
        void shouldFailOnDuplicatePins() throws Exception {
            Path path = tempDir.resolve("package.lock.json");
            Files.writeString(path, "{ \"version\": 1, \"pins\": [ "
                    + "{ \"identity\": \"a\", \"kind\": \"version\", \"state\": { \"version\": \"1.0.0\" } },"
                    + "{ \"identity\": \"A\", \"kind\": \"revision\", \"state\": { \"revision\": \"abc\" } } ] }");

            assertThatThrownBy(() -> store.load(path))
                    .isInstanceOf(LockfileException.class)
                    .hasMessageContaining("Package a is pinned twice");
        }
    }
}
