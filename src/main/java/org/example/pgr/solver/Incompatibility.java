package org.example.pgr.solver;

import org.example.pgr.model.PackageIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A set of terms that cannot all hold at once, with the reason it is known.
 *
 * <p>External incompatibilities come from the root, manifests and version listings. Derived
 * ones ({@link Cause#CONFLICT}) are produced by conflict resolution from two earlier ones and
 * keep references to them, forming the derivation graph used to explain failures.</p>
 */
public final class Incompatibility {

    /**
     * Why an incompatibility holds.
     */
    public enum Cause {
        /** The root package must be selected. */
        ROOT,
        /** A package version declares a dependency. */
        DEPENDENCY,
        /** No available version matches. */
        NO_VERSIONS,
        /** The manifest of a version could not be loaded. */
        UNAVAILABLE,
        /** A released version depends on a branch, revision or path requirement. */
        UNVERSIONED_DEPENDENCY,
        /** Derived from two other incompatibilities. */
        CONFLICT
    }

    private final List<Term> terms;
    private final Cause cause;
    private final Incompatibility conflict;
    private final Incompatibility other;
    private final String detail;

    private Incompatibility(List<Term> terms, Cause cause, Incompatibility conflict, Incompatibility other, String detail) {
        this.terms = mergeByPackage(terms);
        this.cause = Objects.requireNonNull(cause, "cause cannot be null");
        this.conflict = conflict;
        this.other = other;
        this.detail = detail;
    }

    public static Incompatibility external(List<Term> terms, Cause cause) {
        return external(terms, cause, null);
    }

    /**
     * @param detail extra text shown when explaining the incompatibility
     */
    public static Incompatibility external(List<Term> terms, Cause cause, String detail) {
        if (cause == Cause.CONFLICT) {
            throw new IllegalArgumentException("external incompatibility cannot have a conflict cause");
        }
        return new Incompatibility(terms, cause, null, null, detail);
    }

    public static Incompatibility derived(List<Term> terms, Incompatibility conflict, Incompatibility other) {
        return new Incompatibility(terms, Cause.CONFLICT,
                Objects.requireNonNull(conflict, "conflict cannot be null"),
                Objects.requireNonNull(other, "other cannot be null"), null);
    }

    private static List<Term> mergeByPackage(List<Term> terms) {
        Map<PackageIdentity, Term> merged = new LinkedHashMap<>();
        for (Term term : terms) {
            merged.merge(term.getIdentity(), term, Term::intersect);
        }
        return Collections.unmodifiableList(new ArrayList<>(merged.values()));
    }

    public List<Term> getTerms() {
        return terms;
    }

    public Cause getCause() {
        return cause;
    }

    public boolean isDerived() {
        return cause == Cause.CONFLICT;
    }

    /**
     * For derived incompatibilities, the incompatibility that was in conflict.
     */
    public Incompatibility getConflict() {
        return conflict;
    }

    /**
     * For derived incompatibilities, the cause of the satisfier it was resolved against.
     */
    public Incompatibility getOther() {
        return other;
    }

    public String getDetail() {
        return detail;
    }

    public Term termFor(PackageIdentity identity) {
        for (Term term : terms) {
            if (term.getIdentity().equals(identity)) {
                return term;
            }
        }
        return null;
    }

    /**
     * True if this incompatibility rules out every solution: it has no terms, or its only term
     * requires the root package to be absent.
     */
    public boolean isFailure(PackageIdentity root) {
        return terms.isEmpty()
                || (terms.size() == 1 && terms.get(0).isPositive() && terms.get(0).getIdentity().equals(root));
    }

    @Override
    public String toString() {
        return "{" + terms.stream().map(Term::toString).collect(Collectors.joining(", ")) + "} (" + cause + ")";
    }
}
