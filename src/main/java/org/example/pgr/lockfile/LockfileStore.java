package org.example.pgr.lockfile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.example.pgr.exception.LockfileException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes lockfiles as JSON.
 *
 * <p>Output is deterministic: pins sorted by identity, fixed property order, two-space
 * indentation, {@code \n} line endings and a trailing newline. Files are written to a temporary
 * file next to the target and moved over it, so readers never observe a partial lockfile.</p>
 */
public class LockfileStore {

    private static final Logger log = LoggerFactory.getLogger(LockfileStore.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private static final ObjectWriter WRITER = MAPPER.writer(new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n")));

    /**
     * Loads a lockfile.
     *
     * @return the lockfile, or empty if the file does not exist
     * @throws LockfileException if the file cannot be read or is not a valid lockfile
     */
    public Optional<Lockfile> load(Path path) throws LockfileException {
        if (!Files.exists(path)) {
            log.debug("No lockfile at {}", path);
            return Optional.empty();
        }
        LockfileJson json;
        try {
            json = MAPPER.readValue(path.toFile(), LockfileJson.class);
        } catch (JsonProcessingException e) {
            throw new LockfileException("Malformed lockfile " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LockfileException("Failed to read lockfile " + path + ": " + e.getMessage(), e);
        }
        if (json == null) {
            throw new LockfileException("Lockfile " + path + " is empty");
        }
        if (json.getVersion() > Lockfile.FORMAT_VERSION) {
            throw new LockfileException("Lockfile " + path + " has unsupported format version " + json.getVersion());
        }
        List<Pin> pins = new ArrayList<>();
        if (json.getPins() != null) {
            for (PinJson pin : json.getPins()) {
                pins.add(toPin(pin, path));
            }
        }
        try {
            Lockfile lockfile = new Lockfile(json.getVersion(), pins);
            log.debug("Loaded {} pins from {}", pins.size(), path);
            return Optional.of(lockfile);
        } catch (IllegalArgumentException e) {
            throw new LockfileException("Invalid lockfile " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes a lockfile, replacing any previous file at {@code path}.
     *
     * @throws LockfileException if the file cannot be written
     */
    public void save(Lockfile lockfile, Path path) throws LockfileException {
        String content = toJson(lockfile);
        Path target = path.toAbsolutePath();
        Path directory = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
            temp = null;
            log.info("Wrote {} pins to {}", lockfile.getPins().size(), target);
        } catch (IOException e) {
            throw new LockfileException("Failed to write lockfile " + target + ": " + e.getMessage(), e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Serializes a lockfile exactly as {@link #save} writes it.
     */
    public String toJson(Lockfile lockfile) throws LockfileException {
        LockfileJson json = new LockfileJson();
        json.setVersion(lockfile.getVersion());
        List<PinJson> pins = new ArrayList<>();
        for (Pin pin : lockfile.getPins()) {
            pins.add(toJson(pin));
        }
        json.setPins(pins);
        try {
            return WRITER.writeValueAsString(json) + "\n";
        } catch (JsonProcessingException e) {
            throw new LockfileException("Failed to serialize lockfile: " + e.getOriginalMessage(), e);
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary lockfile {}: {}", path, e.getMessage());
        }
    }

    private static PinJson toJson(Pin pin) {
        BoundVersion state = pin.getState();
        StateJson stateJson = new StateJson();
        stateJson.setVersion(state.isVersion() ? state.getVersion().toString() : null);
        stateJson.setRevision(state.getRevision());
        stateJson.setBranch(state.getBranch());

        PinJson json = new PinJson();
        json.setIdentity(pin.getIdentity().getKey());
        json.setKind(pin.getKind());
        json.setState(stateJson);
        return json;
    }

    private static Pin toPin(PinJson json, Path path) throws LockfileException {
        if (json.getIdentity() == null || json.getKind() == null || json.getState() == null) {
            throw new LockfileException("Lockfile " + path + " has an incomplete pin");
        }
        StateJson state = json.getState();
        try {
            PackageIdentity identity = PackageIdentity.of(json.getIdentity());
            BoundVersion bound = switch (json.getKind()) {
                case "version" -> BoundVersion.version(Version.parse(require(state.getVersion(), "version")));
                case "branch" -> BoundVersion.branch(require(state.getBranch(), "branch"),
                        require(state.getRevision(), "revision"));
                case "revision" -> BoundVersion.revision(require(state.getRevision(), "revision"));
                default -> throw new IllegalArgumentException("unknown pin kind '" + json.getKind() + "'");
            };
            return new Pin(identity, bound);
        } catch (IllegalArgumentException e) {
            throw new LockfileException("Invalid pin '" + json.getIdentity() + "' in " + path + ": " + e.getMessage(), e);
        }
    }

    private static String require(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing state." + field);
        }
        return value;
    }

    // JSON documents

    @JsonPropertyOrder({"pins", "version"})
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LockfileJson {
        private List<PinJson> pins;
        private int version;

        public List<PinJson> getPins() {
            return pins;
        }

        public void setPins(List<PinJson> pins) {
            this.pins = pins;
        }

        public int getVersion() {
            return version;
        }

        public void setVersion(int version) {
            this.version = version;
        }
    }

    @JsonPropertyOrder({"identity", "kind", "state"})
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PinJson {
        private String identity;
        private String kind;
        private StateJson state;

        public String getIdentity() {
            return identity;
        }

        public void setIdentity(String identity) {
            this.identity = identity;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public StateJson getState() {
            return state;
        }

        public void setState(StateJson state) {
            this.state = state;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"branch", "revision", "version"})
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StateJson {
        private String branch;
        private String revision;
        private String version;

        public String getBranch() {
            return branch;
        }

        public void setBranch(String branch) {
            this.branch = branch;
        }

        public String getRevision() {
            return revision;
        }

        public void setRevision(String revision) {
            this.revision = revision;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }
    }
}
