package org.example.pgr.lockfile;

import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.solver.Solution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The persisted result of a resolution: pins sorted by identity.
 */
public class Lockfile {

    /**
     * Format version written by this implementation.
     */
    public static final int FORMAT_VERSION = 1;

    private final int version;
    private final List<Pin> pins;

    public Lockfile(Collection<Pin> pins) {
        this(FORMAT_VERSION, pins);
    }

    public Lockfile(int version, Collection<Pin> pins) {
        Objects.requireNonNull(pins, "pins cannot be null");
        List<Pin> sorted = new ArrayList<>(pins);
        Collections.sort(sorted);
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).getIdentity().equals(sorted.get(i).getIdentity())) {
                throw new IllegalArgumentException("Package " + sorted.get(i).getIdentity() + " is pinned twice");
            }
        }
        this.version = version;
        this.pins = Collections.unmodifiableList(sorted);
    }

    /**
     * Pins every package of a solution except local-path ones.
     */
    public static Lockfile fromSolution(Solution solution) {
        List<Pin> pins = new ArrayList<>();
        solution.getBindings().forEach((identity, bound) -> {
            if (bound.getKind() != BoundVersion.Kind.LOCAL) {
                pins.add(new Pin(identity, bound));
            }
        });
        return new Lockfile(pins);
    }

    public static Lockfile empty() {
        return new Lockfile(List.of());
    }

    public int getVersion() {
        return version;
    }

    public List<Pin> getPins() {
        return pins;
    }

    public Optional<Pin> findPin(PackageIdentity identity) {
        return pins.stream().filter(p -> p.getIdentity().equals(identity)).findFirst();
    }

    public Set<PackageIdentity> getIdentities() {
        Set<PackageIdentity> identities = new LinkedHashSet<>();
        pins.forEach(p -> identities.add(p.getIdentity()));
        return identities;
    }

    /**
     * The pinned states keyed by identity, as solver preferences.
     */
    public Map<PackageIdentity, BoundVersion> toPreferences() {
        Map<PackageIdentity, BoundVersion> preferences = new LinkedHashMap<>();
        pins.forEach(p -> preferences.put(p.getIdentity(), p.getState()));
        return preferences;
    }

    public boolean isEmpty() {
        return pins.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Lockfile lockfile = (Lockfile) o;
        return version == lockfile.version && pins.equals(lockfile.pins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, pins);
    }

    @Override
    public String toString() {
        return "Lockfile{" +
               "version=" + version +
               ", pins=" + pins +
               '}';
    }
}
