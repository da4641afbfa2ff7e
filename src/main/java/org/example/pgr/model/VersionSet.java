package org.example.pgr.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable set of versions, stored as a sorted union of disjoint intervals.
 *
 * <p>Each interval has an optional lower and upper bound, each inclusive or exclusive.
 * Intervals are kept normalized (sorted, non-empty, overlapping and touching intervals merged)
 * so two sets holding the same versions are {@code equals}.</p>
 */
public final class VersionSet {

    private static final VersionSet ANY = new VersionSet(List.of(new Interval(null, null)));
    private static final VersionSet NONE = new VersionSet(List.of());

    private final List<Interval> intervals;

    private VersionSet(List<Interval> intervals) {
        this.intervals = List.copyOf(intervals);
    }

    // Factories

    public static VersionSet any() {
        return ANY;
    }

    public static VersionSet none() {
        return NONE;
    }

    public static VersionSet exact(Version version) {
        Objects.requireNonNull(version, "version cannot be null");
        return new VersionSet(List.of(new Interval(new Bound(version, true), new Bound(version, true))));
    }

    /**
     * Creates an interval set. A null bound means unbounded on that side.
     */
    public static VersionSet range(Version lower, boolean lowerInclusive, Version upper, boolean upperInclusive) {
        Bound lo = lower != null ? new Bound(lower, lowerInclusive) : null;
        Bound hi = upper != null ? new Bound(upper, upperInclusive) : null;
        return normalize(List.of(new Interval(lo, hi)));
    }

    /**
     * The half-open range {@code [lower, upper)}.
     */
    public static VersionSet between(Version lower, Version upper) {
        return range(lower, true, upper, false);
    }

    public static VersionSet atLeast(Version lower) {
        return range(lower, true, null, false);
    }

    public static VersionSet upToNextMajor(Version from) {
        return between(from, from.nextMajor());
    }

    public static VersionSet upToNextMinor(Version from) {
        return between(from, from.nextMinor());
    }

    // Set algebra

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public boolean isAny() {
        return equals(ANY);
    }

    public boolean contains(Version version) {
        for (Interval interval : intervals) {
            if (interval.contains(version)) {
                return true;
            }
        }
        return false;
    }

    public VersionSet intersect(VersionSet other) {
        List<Interval> result = new ArrayList<>();
        for (Interval a : intervals) {
            for (Interval b : other.intervals) {
                Bound lower = compareLower(a.lower, b.lower) >= 0 ? a.lower : b.lower;
                Bound upper = compareUpper(a.upper, b.upper) <= 0 ? a.upper : b.upper;
                Interval candidate = new Interval(lower, upper);
                if (!candidate.isEmpty()) {
                    result.add(candidate);
                }
            }
        }
        return normalize(result);
    }

    public VersionSet union(VersionSet other) {
        List<Interval> all = new ArrayList<>(intervals);
        all.addAll(other.intervals);
        return normalize(all);
    }

    public VersionSet complement() {
        if (intervals.isEmpty()) {
            return ANY;
        }
        List<Interval> gaps = new ArrayList<>();
        Interval first = intervals.get(0);
        if (first.lower != null) {
            gaps.add(new Interval(null, first.lower.flip()));
        }
        for (int i = 0; i < intervals.size(); i++) {
            Interval current = intervals.get(i);
            if (current.upper == null) {
                break;
            }
            Bound gapUpper = i + 1 < intervals.size() ? intervals.get(i + 1).lower.flip() : null;
            gaps.add(new Interval(current.upper.flip(), gapUpper));
        }
        return normalize(gaps);
    }

    public VersionSet difference(VersionSet other) {
        return intersect(other.complement());
    }

    public boolean isSubsetOf(VersionSet other) {
        return difference(other).isEmpty();
    }

    public boolean isDisjointFrom(VersionSet other) {
        return intersect(other).isEmpty();
    }

    /**
     * Returns the versions of the given collection that belong to this set, in their original order.
     */
    public List<Version> select(Collection<Version> versions) {
        return versions.stream().filter(this::contains).collect(Collectors.toList());
    }

    /**
     * Returns the single version this set holds, or null if it is not an exact set.
     */
    public Version singleVersion() {
        if (intervals.size() != 1) {
            return null;
        }
        Interval only = intervals.get(0);
        if (only.lower != null && only.upper != null && only.lower.inclusive && only.upper.inclusive
                && only.lower.version.equals(only.upper.version)) {
            return only.lower.version;
        }
        return null;
    }

    // Normalization

    private static VersionSet normalize(List<Interval> input) {
        List<Interval> sorted = input.stream()
                .filter(i -> !i.isEmpty())
                .sorted(Comparator.comparing(Interval::lower, VersionSet::compareLower))
                .collect(Collectors.toList());
        List<Interval> merged = new ArrayList<>();
        for (Interval next : sorted) {
            if (!merged.isEmpty()) {
                Interval last = merged.get(merged.size() - 1);
                if (touches(last.upper, next.lower)) {
                    Bound upper = compareUpper(last.upper, next.upper) >= 0 ? last.upper : next.upper;
                    merged.set(merged.size() - 1, new Interval(last.lower, upper));
                    continue;
                }
            }
            merged.add(next);
        }
        if (merged.isEmpty()) {
            return NONE;
        }
        return new VersionSet(merged);
    }

    private static boolean touches(Bound upper, Bound nextLower) {
        if (upper == null || nextLower == null) {
            return true;
        }
        int c = nextLower.version.compareTo(upper.version);
        if (c != 0) {
            return c < 0;
        }
        return upper.inclusive || nextLower.inclusive;
    }

    /** Null is negative infinity; at equal versions an inclusive bound starts first. */
    private static int compareLower(Bound a, Bound b) {
        if (a == null || b == null) {
            return a == b ? 0 : (a == null ? -1 : 1);
        }
        int c = a.version.compareTo(b.version);
        if (c != 0 || a.inclusive == b.inclusive) {
            return c;
        }
        return a.inclusive ? -1 : 1;
    }

    /** Null is positive infinity; at equal versions an inclusive bound ends last. */
    private static int compareUpper(Bound a, Bound b) {
        if (a == null || b == null) {
            return a == b ? 0 : (a == null ? 1 : -1);
        }
        int c = a.version.compareTo(b.version);
        if (c != 0 || a.inclusive == b.inclusive) {
            return c;
        }
        return a.inclusive ? 1 : -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return intervals.equals(((VersionSet) o).intervals);
    }

    @Override
    public int hashCode() {
        return intervals.hashCode();
    }

    @Override
    public String toString() {
        if (intervals.isEmpty()) {
            return "none";
        }
        return intervals.stream().map(Interval::toString).collect(Collectors.joining(" or "));
    }

    private record Bound(Version version, boolean inclusive) {

        Bound flip() {
            return new Bound(version, !inclusive);
        }
    }

    private record Interval(Bound lower, Bound upper) {

        boolean isEmpty() {
            if (lower == null || upper == null) {
                return false;
            }
            int c = lower.version.compareTo(upper.version);
            return c > 0 || (c == 0 && !(lower.inclusive && upper.inclusive));
        }

        boolean contains(Version v) {
            if (lower != null) {
                int c = v.compareTo(lower.version);
                if (c < 0 || (c == 0 && !lower.inclusive)) {
                    return false;
                }
            }
            if (upper != null) {
                int c = v.compareTo(upper.version);
                return c < 0 || (c == 0 && upper.inclusive);
            }
            return true;
        }

        @Override
        public String toString() {
            if (lower == null && upper == null) {
                return "any";
            }
            if (lower != null && upper != null && lower.inclusive) {
                if (upper.inclusive && lower.version.equals(upper.version)) {
                    return lower.version.toString();
                }
                return lower.version + (upper.inclusive ? "..." : "..<") + upper.version;
            }
            List<String> parts = new ArrayList<>(2);
            if (lower != null) {
                parts.add((lower.inclusive ? ">=" : ">") + lower.version);
            }
            if (upper != null) {
                parts.add((upper.inclusive ? "<=" : "<") + upper.version);
            }
            return String.join(" ", parts);
        }
    }
}
