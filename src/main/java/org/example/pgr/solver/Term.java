package org.example.pgr.solver;

import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.VersionSet;

import java.util.Objects;

/**
 * A statement about one package: its selected version is in {@code versions} (positive) or is
 * not in {@code versions} (negative, which also holds when the package is not selected at all).
 */
public final class Term {

    /**
     * How a term relates to what is currently known about its package.
     */
    public enum Relation {
        /** Everything known implies the term. */
        SATISFIED,
        /** Everything known excludes the term. */
        CONTRADICTED,
        /** The term may or may not hold. */
        INCONCLUSIVE
    }

    private final PackageIdentity identity;
    private final VersionSet versions;
    private final boolean positive;

    public Term(PackageIdentity identity, VersionSet versions, boolean positive) {
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        this.versions = Objects.requireNonNull(versions, "versions cannot be null");
        this.positive = positive;
    }

    public static Term positive(PackageIdentity identity, VersionSet versions) {
        return new Term(identity, versions, true);
    }

    public static Term negative(PackageIdentity identity, VersionSet versions) {
        return new Term(identity, versions, false);
    }

    public PackageIdentity getIdentity() {
        return identity;
    }

    public VersionSet getVersions() {
        return versions;
    }

    public boolean isPositive() {
        return positive;
    }

    public Term negate() {
        return new Term(identity, versions, !positive);
    }

    /**
     * True if no assignment can make this term hold: a positive term over no versions.
     */
    public boolean isUnsatisfiable() {
        return positive && versions.isEmpty();
    }

    /**
     * The versions a selection may have while this term holds.
     */
    private VersionSet allowed() {
        return positive ? versions : versions.complement();
    }

    /**
     * The term that holds exactly when both terms hold.
     */
    public Term intersect(Term other) {
        requireSamePackage(other);
        if (positive || other.positive) {
            return new Term(identity, allowed().intersect(other.allowed()), true);
        }
        return new Term(identity, versions.union(other.versions), false);
    }

    /**
     * The term that holds when this term holds and {@code other} does not, or null if there is none.
     */
    public Term difference(Term other) {
        Term result = intersect(other.negate());
        return result.isUnsatisfiable() ? null : result;
    }

    /**
     * True if this term holding implies {@code other} holds.
     */
    public boolean satisfies(Term other) {
        requireSamePackage(other);
        if (positive && other.positive) {
            return versions.isSubsetOf(other.versions);
        }
        if (positive) {
            return versions.isDisjointFrom(other.versions);
        }
        if (other.positive) {
            return false;
        }
        return other.versions.isSubsetOf(versions);
    }

    /**
     * True if this term and {@code other} can never hold together.
     */
    public boolean contradicts(Term other) {
        requireSamePackage(other);
        if (positive && other.positive) {
            return versions.isDisjointFrom(other.versions);
        }
        if (positive) {
            return versions.isSubsetOf(other.versions);
        }
        if (other.positive) {
            return other.versions.isSubsetOf(versions);
        }
        return false;
    }

    /**
     * Relation of this term to the accumulated knowledge {@code known} about the same package.
     */
    public Relation relationTo(Term known) {
        if (known.satisfies(this)) {
            return Relation.SATISFIED;
        }
        if (known.contradicts(this)) {
            return Relation.CONTRADICTED;
        }
        return Relation.INCONCLUSIVE;
    }

    private void requireSamePackage(Term other) {
        if (!identity.equals(other.identity)) {
            throw new IllegalArgumentException("Terms refer to different packages: " + identity + ", " + other.identity);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Term term = (Term) o;
        return positive == term.positive && identity.equals(term.identity) && versions.equals(term.versions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, versions, positive);
    }

    @Override
    public String toString() {
        return (positive ? "" : "not ") + identity + " " + versions;
    }
}
