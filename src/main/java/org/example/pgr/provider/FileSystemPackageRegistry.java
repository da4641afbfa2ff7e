package org.example.pgr.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.pgr.exception.ManifestException;
import org.example.pgr.exception.ProviderException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Package registry laid out as a directory tree.
 *
 * <pre>
 * &lt;registry&gt;/&lt;identity&gt;/versions/&lt;version&gt;.json    manifest of a released version
 * &lt;registry&gt;/&lt;identity&gt;/revisions/&lt;revision&gt;.json  manifest of a revision
 * &lt;registry&gt;/&lt;identity&gt;/branches.json             { "branch": "revision" }
 * &lt;registry&gt;/&lt;identity&gt;/sources/&lt;version|revision&gt;  checked out sources
 * &lt;path&gt;/package.json                             manifest of a local package
 * </pre>
 *
 * <p>Local paths are resolved against the base directory of the root package.</p>
 */
public class FileSystemPackageRegistry implements ManifestProvider, VersionProvider {

    private static final Logger log = LoggerFactory.getLogger(FileSystemPackageRegistry.class);

    public static final String MANIFEST_FILE = "package.json";
    private static final String JSON = ".json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path registryDirectory;
    private final Path baseDirectory;
    private final ManifestReader reader;

    public FileSystemPackageRegistry(Path registryDirectory, Path baseDirectory) {
        this.registryDirectory = Objects.requireNonNull(registryDirectory, "registryDirectory cannot be null");
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory cannot be null");
        this.reader = new ManifestReader();
    }

    @Override
    public List<Version> availableVersions(PackageIdentity identity) throws ProviderException {
        Path versionsDir = packageDirectory(identity).resolve("versions");
        if (!Files.isDirectory(versionsDir)) {
            log.debug("No versions directory for {}", identity);
            return Collections.emptyList();
        }
        List<Version> versions = new ArrayList<>();
        try (Stream<Path> files = Files.list(versionsDir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(JSON))
                    .map(name -> name.substring(0, name.length() - JSON.length()))
                    .forEach(name -> {
                        if (Version.isValid(name)) {
                            versions.add(Version.parse(name));
                        } else {
                            log.warn("Ignoring {} in {}: not a version", name, versionsDir);
                        }
                    });
        } catch (IOException e) {
            throw new ProviderException("Failed to list versions of " + identity + ": " + e.getMessage(), e);
        }
        Collections.sort(versions);
        return versions;
    }

    @Override
    public String resolveBranch(PackageIdentity identity, String branch) throws ProviderException {
        Path branchesFile = packageDirectory(identity).resolve("branches.json");
        if (!Files.isRegularFile(branchesFile)) {
            throw new ProviderException("Package " + identity + " has no branches");
        }
        Map<String, String> branches;
        try {
            branches = MAPPER.readValue(branchesFile.toFile(), new TypeReference<Map<String, String>>() {});
        } catch (IOException e) {
            throw new ProviderException("Failed to read branches of " + identity + ": " + e.getMessage(), e);
        }
        String revision = branches.get(branch);
        if (revision == null) {
            throw new ProviderException("Package " + identity + " has no branch '" + branch + "'");
        }
        return revision;
    }

    @Override
    public Path checkout(PackageIdentity identity, BoundVersion version) throws ProviderException {
        Path location = switch (version.getKind()) {
            case LOCAL -> localDirectory(version.getPath());
            case VERSION -> packageDirectory(identity).resolve("sources").resolve(version.getVersion().toString());
            case BRANCH, REVISION -> packageDirectory(identity).resolve("sources").resolve(version.getRevision());
        };
        if (!Files.isDirectory(location)) {
            throw new ProviderException("No sources for " + identity + " at " + version + " (" + location + ")");
        }
        return location;
    }

    @Override
    public PackageManifest loadManifest(PackageIdentity identity, BoundVersion version) throws ManifestException {
        Path file = switch (version.getKind()) {
            case LOCAL -> localDirectory(version.getPath()).resolve(MANIFEST_FILE);
            case VERSION -> packageDirectory(identity).resolve("versions").resolve(version.getVersion() + JSON);
            case BRANCH, REVISION -> packageDirectory(identity).resolve("revisions").resolve(version.getRevision() + JSON);
        };
        return reader.read(file);
    }

    public Path getRegistryDirectory() {
        return registryDirectory;
    }

    private Path packageDirectory(PackageIdentity identity) {
        return registryDirectory.resolve(identity.getKey());
    }

    private Path localDirectory(String path) {
        return baseDirectory.resolve(path).normalize();
    }
}
