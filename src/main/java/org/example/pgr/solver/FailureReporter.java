package org.example.pgr.solver;

import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.VersionSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns the derivation graph of a failed resolution into a readable explanation.
 *
 * <p>Every derived incompatibility is explained by the two incompatibilities it was derived from.
 * Derivations that are referenced more than once get a line number so later lines can refer back
 * to them instead of repeating the chain. Example:</p>
 *
 * <pre>
 * Because a 1.0.0 depends on c 1.0.0..&lt;2.0.0 and b 1.0.0 depends on c 2.0.0..&lt;3.0.0, a 1.0.0 is incompatible with b 1.0.0.
 * So, because root depends on a 1.0.0 and root depends on b 1.0.0, version solving failed.
 * </pre>
 */
public class FailureReporter {

    private static final String ROOT_NAME = "root";

    private final PackageIdentity root;
    private final Map<Incompatibility, Integer> derivations = new IdentityHashMap<>();
    private final Map<Incompatibility, Integer> lineNumbers = new IdentityHashMap<>();
    private final List<Line> lines = new ArrayList<>();
    private final Set<PackageIdentity> cited = new TreeSet<>();

    public FailureReporter(PackageIdentity root) {
        this.root = root;
    }

    /**
     * Renders the explanation of {@code failure}, the incompatibility that made resolution fail.
     */
    public String report(Incompatibility failure) {
        derivations.clear();
        lineNumbers.clear();
        lines.clear();
        cited.clear();

        countDerivations(failure);
        if (failure.isDerived()) {
            visit(failure, failure, false);
        } else {
            write(failure, "Because " + describe(failure) + ", version solving failed.", false);
        }
        return render();
    }

    /**
     * Packages named by the last report, root excluded, in identity order.
     */
    public Set<PackageIdentity> getCitedPackages() {
        return Collections.unmodifiableSet(cited);
    }

    private void countDerivations(Incompatibility incompatibility) {
        Integer count = derivations.get(incompatibility);
        if (count != null) {
            derivations.put(incompatibility, count + 1);
            return;
        }
        derivations.put(incompatibility, 1);
        if (incompatibility.isDerived()) {
            countDerivations(incompatibility.getConflict());
            countDerivations(incompatibility.getOther());
        }
    }

    private void visit(Incompatibility incompatibility, Incompatibility failure, boolean conclusion) {
        boolean numbered = conclusion || derivations.get(incompatibility) > 1;
        String conjunction = conclusion || incompatibility == failure ? "So," : "And";
        String text = describe(incompatibility);

        Incompatibility conflict = incompatibility.getConflict();
        Incompatibility other = incompatibility.getOther();

        if (conflict.isDerived() && other.isDerived()) {
            Integer conflictLine = lineNumbers.get(conflict);
            Integer otherLine = lineNumbers.get(other);
            if (conflictLine != null && otherLine != null) {
                write(incompatibility, "Because " + and(conflict, conflictLine, other, otherLine) + ", " + text + ".", numbered);
            } else if (conflictLine != null || otherLine != null) {
                Incompatibility withLine = conflictLine != null ? conflict : other;
                Incompatibility withoutLine = conflictLine != null ? other : conflict;
                int line = conflictLine != null ? conflictLine : otherLine;
                visit(withoutLine, failure, false);
                write(incompatibility, conjunction + " because " + describe(withLine) + " (" + line + "), "
                        + text + ".", numbered);
            } else if (isSingleLine(conflict) || isSingleLine(other)) {
                Incompatibility first = isSingleLine(other) ? conflict : other;
                Incompatibility second = isSingleLine(other) ? other : conflict;
                visit(first, failure, false);
                visit(second, failure, false);
                write(incompatibility, "Thus, " + text + ".", numbered);
            } else {
                visit(conflict, failure, true);
                lines.add(new Line("", null));
                visit(other, failure, false);
                write(incompatibility, conjunction + " because " + describe(conflict) + " ("
                        + lineNumbers.get(conflict) + "), " + text + ".", numbered);
            }
        } else if (conflict.isDerived() || other.isDerived()) {
            Incompatibility derived = conflict.isDerived() ? conflict : other;
            Incompatibility external = conflict.isDerived() ? other : conflict;
            Integer derivedLine = lineNumbers.get(derived);
            if (derivedLine != null) {
                write(incompatibility, "Because " + and(external, null, derived, derivedLine) + ", " + text + ".", numbered);
            } else if (isCollapsible(derived)) {
                Incompatibility collapsedDerived = derived.getConflict().isDerived() ? derived.getConflict() : derived.getOther();
                Incompatibility collapsedExternal = derived.getConflict().isDerived() ? derived.getOther() : derived.getConflict();
                visit(collapsedDerived, failure, false);
                write(incompatibility, conjunction + " because " + and(collapsedExternal, null, external, null)
                        + ", " + text + ".", numbered);
            } else {
                visit(derived, failure, false);
                write(incompatibility, conjunction + " because " + describe(external) + ", " + text + ".", numbered);
            }
        } else {
            write(incompatibility, "Because " + and(conflict, null, other, null) + ", " + text + ".", numbered);
        }
    }

    private boolean isSingleLine(Incompatibility incompatibility) {
        return !incompatibility.getConflict().isDerived() && !incompatibility.getOther().isDerived();
    }

    private boolean isCollapsible(Incompatibility incompatibility) {
        if (derivations.get(incompatibility) > 1) {
            return false;
        }
        boolean conflictDerived = incompatibility.getConflict().isDerived();
        boolean otherDerived = incompatibility.getOther().isDerived();
        if (conflictDerived == otherDerived) {
            return false;
        }
        Incompatibility complex = conflictDerived ? incompatibility.getConflict() : incompatibility.getOther();
        return !lineNumbers.containsKey(complex);
    }

    private void write(Incompatibility incompatibility, String message, boolean numbered) {
        if (numbered) {
            int number = lineNumbers.size() + 1;
            lineNumbers.put(incompatibility, number);
            lines.add(new Line(message, number));
        } else {
            lines.add(new Line(message, null));
        }
    }

    private String render() {
        int padding = lineNumbers.isEmpty() ? 0 : ("(" + lineNumbers.size() + ") ").length();
        List<String> rendered = new ArrayList<>();
        for (Line line : lines) {
            if (line.message().isEmpty()) {
                rendered.add("");
            } else if (line.number() != null) {
                rendered.add(pad("(" + line.number() + ")", padding) + line.message());
            } else {
                rendered.add(" ".repeat(padding) + line.message());
            }
        }
        return String.join("\n", rendered);
    }

    private static String pad(String text, int width) {
        return text.length() >= width ? text + " " : text + " ".repeat(width - text.length());
    }

    private String and(Incompatibility first, Integer firstLine, Incompatibility second, Integer secondLine) {
        return describe(first) + (firstLine != null ? " (" + firstLine + ")" : "")
                + " and " + describe(second) + (secondLine != null ? " (" + secondLine + ")" : "");
    }

    // Incompatibility phrasing

    String describe(Incompatibility incompatibility) {
        List<Term> terms = incompatibility.getTerms();
        terms.forEach(term -> {
            if (!term.getIdentity().equals(root)) {
                cited.add(term.getIdentity());
            }
        });

        switch (incompatibility.getCause()) {
            case ROOT:
                return ROOT_NAME + " is the package being resolved";
            case DEPENDENCY: {
                Term depender = positiveTerm(terms);
                Term target = negativeTerm(terms);
                if (depender != null && target != null) {
                    String subject = incompatibility.getDetail() != null ? incompatibility.getDetail() : terse(depender);
                    return subject + " depends on " + terse(target);
                }
                break;
            }
            case NO_VERSIONS:
                return "no versions of " + name(terms.get(0).getIdentity()) + " match " + terms.get(0).getVersions();
            case UNAVAILABLE:
                return terse(terms.get(0)) + " has a manifest that could not be loaded";
            case UNVERSIONED_DEPENDENCY:
                return terse(terms.get(0)) + " depends on " + incompatibility.getDetail()
                        + ", which is not a released version";
            default:
                break;
        }
        return describeDerived(incompatibility);
    }

    private String describeDerived(Incompatibility incompatibility) {
        if (incompatibility.isFailure(root)) {
            return "version solving failed";
        }
        List<Term> terms = incompatibility.getTerms();
        if (terms.size() == 1) {
            Term term = terms.get(0);
            return terse(term) + (term.isPositive() ? " is forbidden" : " is required");
        }
        List<Term> positive = terms.stream().filter(Term::isPositive).collect(Collectors.toList());
        List<Term> negative = terms.stream().filter(t -> !t.isPositive()).collect(Collectors.toList());
        if (terms.size() == 2) {
            if (positive.size() == 2) {
                return terse(positive.get(0)) + " is incompatible with " + terse(positive.get(1));
            }
            if (negative.size() == 2) {
                return "either " + terse(negative.get(0)) + " or " + terse(negative.get(1)) + " is required";
            }
            return terse(positive.get(0)) + " requires " + terse(negative.get(0));
        }
        if (negative.isEmpty()) {
            return "one of " + join(positive, " or ") + " must be false";
        }
        if (positive.isEmpty()) {
            return "one of " + join(negative, " or ") + " must be true";
        }
        return "if " + join(positive, " and ") + " then " + join(negative, " or ");
    }

    private String join(List<Term> terms, String separator) {
        return terms.stream().map(this::terse).collect(Collectors.joining(separator));
    }

    private static Term positiveTerm(List<Term> terms) {
        return terms.stream().filter(Term::isPositive).findFirst().orElse(null);
    }

    private static Term negativeTerm(List<Term> terms) {
        return terms.stream().filter(t -> !t.isPositive()).findFirst().orElse(null);
    }

    /**
     * A term's package and versions, without its polarity.
     */
    private String terse(Term term) {
        if (term.getIdentity().equals(root)) {
            return ROOT_NAME;
        }
        VersionSet versions = term.getVersions();
        if (versions.isAny()) {
            return name(term.getIdentity());
        }
        return name(term.getIdentity()) + " " + versions;
    }

    private String name(PackageIdentity identity) {
        return identity.equals(root) ? ROOT_NAME : identity.toString();
    }

    private record Line(String message, Integer number) {}
}
