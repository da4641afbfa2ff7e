package org.example.pgr.resolver;

import org.example.pgr.graph.PackageGraph;
import org.example.pgr.lockfile.Lockfile;
import org.example.pgr.solver.Solution;

import java.util.Objects;

/**
 * Result of a successful resolution.
 */
public class ResolutionOutcome {

    private final Solution solution;
    private final PackageGraph graph;
    private final Lockfile lockfile;
    private final boolean fastPath;
    private final boolean lockfileWritten;

    public ResolutionOutcome(Solution solution, PackageGraph graph, Lockfile lockfile,
                             boolean fastPath, boolean lockfileWritten) {
        this.solution = Objects.requireNonNull(solution, "solution cannot be null");
        this.graph = Objects.requireNonNull(graph, "graph cannot be null");
        this.lockfile = Objects.requireNonNull(lockfile, "lockfile cannot be null");
        this.fastPath = fastPath;
        this.lockfileWritten = lockfileWritten;
    }

    // Getters

    public Solution getSolution() {
        return solution;
    }

    public PackageGraph getGraph() {
        return graph;
    }

    /**
     * The lockfile matching the solution, whether or not it was written.
     */
    public Lockfile getLockfile() {
        return lockfile;
    }

    public boolean isFastPath() {
        return fastPath;
    }

    public boolean isLockfileWritten() {
        return lockfileWritten;
    }

    @Override
    public String toString() {
        return "ResolutionOutcome{" +
                "packages=" + solution.size() +
                ", modules=" + graph.getModuleCount() +
                ", fastPath=" + fastPath +
                ", lockfileWritten=" + lockfileWritten +
                '}';
    }
}
