package org.example.pgr.model;

import java.util.Objects;

/**
 * The concrete state a package resolved to: a released version, a revision (optionally the
 * head of a branch) or a local path.
 */
public final class BoundVersion {

    /**
     * What the package is bound to.
     */
    public enum Kind {
        VERSION,
        BRANCH,
        REVISION,
        LOCAL
    }

    private final Kind kind;
    private final Version version;
    private final String revision;
    private final String branch;
    private final String path;

    private BoundVersion(Kind kind, Version version, String revision, String branch, String path) {
        this.kind = kind;
        this.version = version;
        this.revision = revision;
        this.branch = branch;
        this.path = path;
    }

    public static BoundVersion version(Version version) {
        return new BoundVersion(Kind.VERSION, Objects.requireNonNull(version, "version cannot be null"),
                null, null, null);
    }

    public static BoundVersion revision(String revision) {
        return new BoundVersion(Kind.REVISION, null,
                Objects.requireNonNull(revision, "revision cannot be null"), null, null);
    }

    public static BoundVersion branch(String branch, String revision) {
        return new BoundVersion(Kind.BRANCH, null,
                Objects.requireNonNull(revision, "revision cannot be null"),
                Objects.requireNonNull(branch, "branch cannot be null"), null);
    }

    public static BoundVersion local(String path) {
        return new BoundVersion(Kind.LOCAL, null, null, null,
                Objects.requireNonNull(path, "path cannot be null"));
    }

    public Kind getKind() {
        return kind;
    }

    public Version getVersion() {
        return version;
    }

    public String getRevision() {
        return revision;
    }

    public String getBranch() {
        return branch;
    }

    public String getPath() {
        return path;
    }

    public boolean isVersion() {
        return kind == Kind.VERSION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BoundVersion that = (BoundVersion) o;
        return kind == that.kind &&
               Objects.equals(version, that.version) &&
               Objects.equals(revision, that.revision) &&
               Objects.equals(branch, that.branch) &&
               Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, version, revision, branch, path);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case VERSION -> version.toString();
            case BRANCH -> branch + "@" + revision;
            case REVISION -> revision;
            case LOCAL -> path;
        };
    }
}
