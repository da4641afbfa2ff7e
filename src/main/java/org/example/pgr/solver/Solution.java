package org.example.pgr.solver;

import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The result of a successful resolution: the bound version of every package reachable from the
 * root, ordered by identity. The root itself is not part of the bindings.
 */
public class Solution {

    private final PackageIdentity root;
    private final Map<PackageIdentity, BoundVersion> bindings;

    public Solution(PackageIdentity root, Map<PackageIdentity, BoundVersion> bindings) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
        Objects.requireNonNull(bindings, "bindings cannot be null");
        if (bindings.containsKey(root)) {
            throw new IllegalArgumentException("Root package " + root + " cannot be bound");
        }
        this.bindings = Collections.unmodifiableMap(new TreeMap<>(bindings));
    }

    public PackageIdentity getRoot() {
        return root;
    }

    public Map<PackageIdentity, BoundVersion> getBindings() {
        return bindings;
    }

    public Optional<BoundVersion> find(PackageIdentity identity) {
        return Optional.ofNullable(bindings.get(identity));
    }

    public boolean contains(PackageIdentity identity) {
        return bindings.containsKey(identity);
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Solution solution = (Solution) o;
        return root.equals(solution.root) && bindings.equals(solution.bindings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, bindings);
    }

    @Override
    public String toString() {
        return "Solution{" +
               "root=" + root +
               ", bindings=" + bindings +
               '}';
    }
}
