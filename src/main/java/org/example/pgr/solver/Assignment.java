package org.example.pgr.solver;

/**
 * One entry of the partial solution log: a decision (no cause) or a derivation (caused by an
 * incompatibility that became almost satisfied).
 */
final class Assignment {

    private final Term term;
    private final int decisionLevel;
    private final int index;
    private final Incompatibility cause;

    Assignment(Term term, int decisionLevel, int index, Incompatibility cause) {
        this.term = term;
        this.decisionLevel = decisionLevel;
        this.index = index;
        this.cause = cause;
    }

    Term getTerm() {
        return term;
    }

    int getDecisionLevel() {
        return decisionLevel;
    }

    int getIndex() {
        return index;
    }

    Incompatibility getCause() {
        return cause;
    }

    boolean isDecision() {
        return cause == null;
    }

    @Override
    public String toString() {
        return (isDecision() ? "decision " : "derived ") + term + " @" + decisionLevel + "#" + index;
    }
}
