package org.example.pgr.lockfile;

import org.example.pgr.solver.Solution;

import java.util.Objects;

/**
 * Outcome of reconciling a root manifest with its lockfile.
 */
public class ReconcileResult {

    private final Solution solution;
    private final boolean fastPath;
    private final String staleReason;

    private ReconcileResult(Solution solution, boolean fastPath, String staleReason) {
        this.solution = Objects.requireNonNull(solution, "solution cannot be null");
        this.fastPath = fastPath;
        this.staleReason = staleReason;
    }

    static ReconcileResult fromLockfile(Solution solution) {
        return new ReconcileResult(solution, true, null);
    }

    static ReconcileResult resolved(Solution solution, String staleReason) {
        return new ReconcileResult(solution, false, staleReason);
    }

    public Solution getSolution() {
        return solution;
    }

    /**
     * True if the solution was taken from the lockfile without running the solver.
     */
    public boolean isFastPath() {
        return fastPath;
    }

    /**
     * Why the lockfile could not be reused, null on the fast path.
     */
    public String getStaleReason() {
        return staleReason;
    }

    @Override
    public String toString() {
        return "ReconcileResult{" +
               "fastPath=" + fastPath +
               ", packages=" + solution.size() +
               (staleReason != null ? ", staleReason='" + staleReason + '\'' : "") +
               '}';
    }
}
