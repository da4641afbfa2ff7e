package org.example.pgr.model;

import java.util.Objects;

/**
 * A constraint a dependency declaration places on acceptable versions of a package.
 */
public final class Requirement {

    /**
     * The kind of requirement.
     */
    public enum Kind {
        EXACT,
        RANGE,
        BRANCH,
        REVISION,
        LOCAL
    }

    private final Kind kind;
    private final VersionSet versions;
    private final String reference;

    private Requirement(Kind kind, VersionSet versions, String reference) {
        this.kind = kind;
        this.versions = versions;
        this.reference = reference;
    }

    public static Requirement exact(Version version) {
        return new Requirement(Kind.EXACT, VersionSet.exact(version), null);
    }

    public static Requirement range(VersionSet versions) {
        Objects.requireNonNull(versions, "versions cannot be null");
        return new Requirement(Kind.RANGE, versions, null);
    }

    /**
     * {@code from: version}, i.e. {@code [version, nextMajor)}.
     */
    public static Requirement upToNextMajor(Version from) {
        return range(VersionSet.upToNextMajor(from));
    }

    public static Requirement upToNextMinor(Version from) {
        return range(VersionSet.upToNextMinor(from));
    }

    public static Requirement branch(String branch) {
        return new Requirement(Kind.BRANCH, null, requireText(branch, "branch"));
    }

    public static Requirement revision(String revision) {
        return new Requirement(Kind.REVISION, null, requireText(revision, "revision"));
    }

    public static Requirement local(String path) {
        return new Requirement(Kind.LOCAL, null, requireText(path, "path"));
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
        return value.trim();
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns true for requirements the solver resolves against released versions.
     */
    public boolean isVersioned() {
        return kind == Kind.EXACT || kind == Kind.RANGE;
    }

    /**
     * Acceptable versions. Only defined for versioned requirements.
     */
    public VersionSet getVersions() {
        if (!isVersioned()) {
            throw new IllegalStateException(kind + " requirement has no version set");
        }
        return versions;
    }

    public String getBranch() {
        return kind == Kind.BRANCH ? reference : null;
    }

    public String getRevision() {
        return kind == Kind.REVISION ? reference : null;
    }

    public String getPath() {
        return kind == Kind.LOCAL ? reference : null;
    }

    /**
     * Returns true if the given bound version fulfils this requirement.
     */
    public boolean isSatisfiedBy(BoundVersion bound) {
        return switch (kind) {
            case EXACT, RANGE -> bound.isVersion() && versions.contains(bound.getVersion());
            case BRANCH -> bound.getKind() == BoundVersion.Kind.BRANCH && reference.equals(bound.getBranch());
            case REVISION -> bound.getKind() == BoundVersion.Kind.REVISION && reference.equals(bound.getRevision());
            case LOCAL -> bound.getKind() == BoundVersion.Kind.LOCAL && reference.equals(bound.getPath());
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Requirement that = (Requirement) o;
        return kind == that.kind &&
               Objects.equals(versions, that.versions) &&
               Objects.equals(reference, that.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, versions, reference);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EXACT, RANGE -> versions.toString();
            case BRANCH -> "branch " + reference;
            case REVISION -> "revision " + reference;
            case LOCAL -> "path " + reference;
        };
    }
}
