package org.example.pgr.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Canonical identity of a package.
 * Two requirement sites naming the same identity always resolve to one version.
 */
public final class PackageIdentity implements Comparable<PackageIdentity> {

    private final String key;

    private PackageIdentity(String key) {
        this.key = key;
    }

    /**
     * Creates an identity from a package name.
     */
    public static PackageIdentity of(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("package identity cannot be blank");
        }
        return new PackageIdentity(trimmed.toLowerCase(Locale.ROOT));
    }

    /**
     * Derives an identity from a repository URL or a filesystem path.
     * Uses the last path component with any trailing ".git" removed.
     */
    public static PackageIdentity fromLocation(String location) {
        Objects.requireNonNull(location, "location cannot be null");
        String path = location.trim().replace('\\', '/');
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        String last = slash >= 0 ? path.substring(slash + 1) : path;
        int colon = last.lastIndexOf(':');
        if (colon >= 0) {
            // scp-like git@host:repo
            last = last.substring(colon + 1);
        }
        if (last.toLowerCase(Locale.ROOT).endsWith(".git")) {
            last = last.substring(0, last.length() - 4);
        }
        return of(last);
    }

    public String getKey() {
        return key;
    }

    @Override
    public int compareTo(PackageIdentity other) {
        return key.compareTo(other.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageIdentity that = (PackageIdentity) o;
        return key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
