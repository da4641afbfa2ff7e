package org.example.pgr.provider;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.pgr.exception.ManifestException;
import org.example.pgr.model.PackageDependency;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.model.ProductDescription;
import org.example.pgr.model.Requirement;
import org.example.pgr.model.TargetDependency;
import org.example.pgr.model.TargetDescription;
import org.example.pgr.model.Version;
import org.example.pgr.model.VersionSet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads JSON package manifests.
 *
 * <pre>
 * {
 *   "name": "app",
 *   "platforms": { "macos": "12.0" },
 *   "dependencies": [
 *     { "identity": "core", "from": "1.0.0" },
 *     { "location": "https://example.com/tools.git", "branch": "main" }
 *   ],
 *   "targets": [
 *     { "name": "App", "type": "executable",
 *       "dependencies": [ { "target": "AppCore" }, { "product": "Core", "package": "core" } ] }
 *   ],
 *   "products": [ { "name": "App", "type": "executable", "targets": [ "App" ] } ]
 * }
 * </pre>
 */
public class ManifestReader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonParser.Feature.ALLOW_COMMENTS);

    /**
     * Reads a manifest file.
     *
     * @throws ManifestException if the file is missing or not a valid manifest
     */
    public PackageManifest read(Path file) throws ManifestException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (NoSuchFileException e) {
            throw new ManifestException("Manifest not found: " + file, e);
        } catch (IOException e) {
            throw new ManifestException("Failed to read manifest " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a manifest from a stream.
     *
     * @param source description of the stream used in error messages
     * @throws ManifestException if the content is not a valid manifest
     */
    public PackageManifest read(InputStream in, String source) throws ManifestException {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Malformed manifest " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ManifestException("Failed to read manifest " + source + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestException("Manifest " + source + " must be a JSON object");
        }
        try {
            return toManifest(root);
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Invalid manifest " + source + ": " + e.getMessage(), e);
        }
    }

    private PackageManifest toManifest(JsonNode root) {
        String name = requiredText(root, "name", "manifest");
        PackageManifest.Builder builder = PackageManifest.builder(name);

        Iterator<Map.Entry<String, JsonNode>> platforms = root.path("platforms").fields();
        while (platforms.hasNext()) {
            Map.Entry<String, JsonNode> platform = platforms.next();
            builder.platform(platform.getKey(), Version.parse(platform.getValue().asText()));
        }
        for (JsonNode dependency : root.path("dependencies")) {
            builder.dependency(toDependency(dependency));
        }
        for (JsonNode target : root.path("targets")) {
            builder.target(toTarget(target));
        }
        for (JsonNode product : root.path("products")) {
            builder.product(toProduct(product));
        }
        return builder.build();
    }

    private PackageDependency toDependency(JsonNode node) {
        PackageIdentity identity;
        if (node.hasNonNull("identity")) {
            identity = PackageIdentity.of(node.get("identity").asText());
        } else if (node.hasNonNull("location")) {
            identity = PackageIdentity.fromLocation(node.get("location").asText());
        } else if (node.hasNonNull("path")) {
            identity = PackageIdentity.fromLocation(node.get("path").asText());
        } else {
            throw new IllegalArgumentException("dependency needs an identity, location or path: " + node);
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.path("moduleAliases").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> alias = entries.next();
            aliases.put(alias.getKey(), alias.getValue().asText());
        }
        return new PackageDependency(identity, toRequirement(node, identity), aliases);
    }

    private Requirement toRequirement(JsonNode node, PackageIdentity identity) {
        if (node.hasNonNull("exact")) {
            return Requirement.exact(Version.parse(node.get("exact").asText()));
        }
        if (node.hasNonNull("from")) {
            return Requirement.upToNextMajor(Version.parse(node.get("from").asText()));
        }
        if (node.hasNonNull("upToNextMinor")) {
            return Requirement.upToNextMinor(Version.parse(node.get("upToNextMinor").asText()));
        }
        if (node.has("range")) {
            JsonNode range = node.get("range");
            Version lower = range.hasNonNull("lower") ? Version.parse(range.get("lower").asText()) : null;
            Version upper = range.hasNonNull("upper") ? Version.parse(range.get("upper").asText()) : null;
            return Requirement.range(VersionSet.range(
                    lower, range.path("lowerInclusive").asBoolean(true),
                    upper, range.path("upperInclusive").asBoolean(false)));
        }
        if (node.hasNonNull("branch")) {
            return Requirement.branch(node.get("branch").asText());
        }
        if (node.hasNonNull("revision")) {
            return Requirement.revision(node.get("revision").asText());
        }
        if (node.hasNonNull("path")) {
            return Requirement.local(node.get("path").asText());
        }
        throw new IllegalArgumentException("dependency on " + identity + " declares no requirement");
    }

    private TargetDescription toTarget(JsonNode node) {
        TargetDescription.Builder builder = TargetDescription.builder(requiredText(node, "name", "target"))
                .type(enumValue(TargetDescription.Type.class, node.path("type").asText("regular")));
        for (JsonNode dependency : node.path("dependencies")) {
            TargetDependency parsed;
            if (dependency.isTextual()) {
                parsed = TargetDependency.byName(dependency.asText());
            } else if (dependency.hasNonNull("target")) {
                parsed = TargetDependency.target(dependency.get("target").asText());
            } else if (dependency.hasNonNull("product")) {
                parsed = TargetDependency.product(dependency.get("product").asText(),
                        PackageIdentity.of(requiredText(dependency, "package", "product dependency")));
            } else if (dependency.hasNonNull("byName")) {
                parsed = TargetDependency.byName(dependency.get("byName").asText());
            } else {
                throw new IllegalArgumentException("unknown target dependency: " + dependency);
            }
            Set<String> platforms = new LinkedHashSet<>();
            for (JsonNode platform : dependency.path("platforms")) {
                platforms.add(platform.asText().toLowerCase(Locale.ROOT));
            }
            builder.dependsOn(platforms.isEmpty() ? parsed : parsed.onPlatforms(platforms));
        }
        return builder.build();
    }

    private ProductDescription toProduct(JsonNode node) {
        List<String> targets = new ArrayList<>();
        for (JsonNode target : node.path("targets")) {
            targets.add(target.asText());
        }
        return new ProductDescription(
                requiredText(node, "name", "product"),
                enumValue(ProductDescription.Type.class, node.path("type").asText("library")),
                targets);
    }

    private static String requiredText(JsonNode node, String field, String what) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException(what + " is missing '" + field + "'");
        }
        return value.asText();
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + type.getSimpleName().toLowerCase(Locale.ROOT)
                    + " '" + value + "'", e);
        }
    }
}
