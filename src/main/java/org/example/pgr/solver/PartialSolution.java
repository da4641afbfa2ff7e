package org.example.pgr.solver;

import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.Version;
import org.example.pgr.model.VersionSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The solver's current knowledge: an append-only log of assignments.
 *
 * <p>Decision levels never decrease along the log, so backtracking to a level is a truncation
 * of the log. The per-package accumulated terms and the decisions are indices over the log and
 * are rebuilt after truncation.</p>
 */
final class PartialSolution {

    private final List<Assignment> assignments = new ArrayList<>();
    private final Map<PackageIdentity, Term> accumulated = new LinkedHashMap<>();
    private final Map<PackageIdentity, Version> decisions = new LinkedHashMap<>();
    private int backtracks;

    int getDecisionLevel() {
        return decisions.size();
    }

    int getBacktrackCount() {
        return backtracks;
    }

    Map<PackageIdentity, Version> getDecisions() {
        return Collections.unmodifiableMap(decisions);
    }

    /**
     * Records a decision, opening a new decision level.
     */
    void decide(PackageIdentity identity, Version version) {
        decisions.put(identity, version);
        append(Term.positive(identity, VersionSet.exact(version)), null);
    }

    /**
     * Records a term forced by {@code cause} at the current decision level.
     */
    void derive(Term term, Incompatibility cause) {
        append(term, cause);
    }

    private void append(Term term, Incompatibility cause) {
        Assignment assignment = new Assignment(term, getDecisionLevel(), assignments.size(), cause);
        assignments.add(assignment);
        accumulated.merge(term.getIdentity(), term, Term::intersect);
    }

    /**
     * Drops every assignment made above {@code level}.
     */
    void backtrack(int level) {
        int keep = assignments.size();
        while (keep > 0 && assignments.get(keep - 1).getDecisionLevel() > level) {
            keep--;
        }
        assignments.subList(keep, assignments.size()).clear();
        accumulated.clear();
        decisions.clear();
        for (Assignment assignment : assignments) {
            Term term = assignment.getTerm();
            accumulated.merge(term.getIdentity(), term, Term::intersect);
            if (assignment.isDecision()) {
                decisions.put(term.getIdentity(), term.getVersions().singleVersion());
            }
        }
        backtracks++;
    }

    /**
     * Relation of a term to everything known about its package.
     */
    Term.Relation relation(Term term) {
        Term known = accumulated.get(term.getIdentity());
        if (known == null) {
            return Term.Relation.INCONCLUSIVE;
        }
        return term.relationTo(known);
    }

    boolean satisfies(Term term) {
        return relation(term) == Term.Relation.SATISFIED;
    }

    /**
     * The earliest assignment after which the accumulated knowledge satisfies {@code term}.
     */
    Assignment satisfier(Term term) {
        Term known = null;
        for (Assignment assignment : assignments) {
            if (!assignment.getTerm().getIdentity().equals(term.getIdentity())) {
                continue;
            }
            known = known == null ? assignment.getTerm() : known.intersect(assignment.getTerm());
            if (known.satisfies(term)) {
                return assignment;
            }
        }
        throw new IllegalStateException("No assignment satisfies " + term);
    }

    /**
     * Packages required by a positive derivation that have no decision yet.
     */
    List<Term> undecided() {
        List<Term> result = new ArrayList<>();
        for (Term term : accumulated.values()) {
            if (term.isPositive() && !decisions.containsKey(term.getIdentity())) {
                result.add(term);
            }
        }
        return result;
    }

    /**
     * Accumulated term per package, in first-assignment order.
     */
    Map<PackageIdentity, Term> snapshot() {
        return new HashMap<>(accumulated);
    }
}
