package org.example.pgr.lockfile;

import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;

import java.util.Locale;
import java.util.Objects;

/**
 * One lockfile entry: the state a package was resolved to.
 * Local-path packages are never pinned.
 */
public class Pin implements Comparable<Pin> {

    private final PackageIdentity identity;
    private final BoundVersion state;

    public Pin(PackageIdentity identity, BoundVersion state) {
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        this.state = Objects.requireNonNull(state, "state cannot be null");
        if (state.getKind() == BoundVersion.Kind.LOCAL) {
            throw new IllegalArgumentException("Local package " + identity + " cannot be pinned");
        }
    }

    public PackageIdentity getIdentity() {
        return identity;
    }

    public BoundVersion getState() {
        return state;
    }

    /**
     * The pin kind as written to the lockfile: {@code version}, {@code branch} or {@code revision}.
     */
    public String getKind() {
        return state.getKind().name().toLowerCase(Locale.ROOT);
    }

    @Override
    public int compareTo(Pin other) {
        return identity.compareTo(other.identity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Pin pin = (Pin) o;
        return identity.equals(pin.identity) && state.equals(pin.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, state);
    }

    @Override
    public String toString() {
        return identity + "@" + state;
    }
}
