package org.example.pgr.exception;

import java.util.List;

/**
 * Exception thrown when the resolved packages do not form a valid package graph.
 *
 * <p>{@link #getSubjects()} lists the offending names: module names for duplicates, the
 * referencing target and the missing reference for unresolved references, the cycle path for
 * cycles.</p>
 */
public class GraphException extends PgrException {

    /**
     * Closed set of graph validation failures.
     */
    public enum Kind {
        MANIFEST_UNAVAILABLE,
        DUPLICATE_MODULE,
        UNRESOLVED_TARGET_REFERENCE,
        UNRESOLVED_PRODUCT_REFERENCE,
        DEPENDENCY_CYCLE,
        INCOMPATIBLE_PLATFORM,
        CANCELLED
    }

    private final Kind kind;
    private final List<String> subjects;

    public GraphException(Kind kind, String message, List<String> subjects) {
        this(kind, message, subjects, null);
    }

    public GraphException(Kind kind, String message, List<String> subjects, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subjects = List.copyOf(subjects);
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getSubjects() {
        return subjects;
    }
}
