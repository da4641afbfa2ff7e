package org.example.pgr.exception;

import org.example.pgr.model.PackageIdentity;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Exception thrown when dependency resolution fails.
 *
 * <p>The {@link Kind} tells what went wrong; each kind carries only the packages involved
 * and, for conflicts, the derivation explanation.</p>
 */
public class ResolutionException extends PgrException {

    /**
     * Closed set of resolution failures.
     */
    public enum Kind {
        /** The requirement set is unsatisfiable. */
        VERSION_CONFLICT,
        /** The version provider lists no versions for a referenced package. */
        PACKAGE_NOT_FOUND,
        /** No version of a package has a readable manifest. */
        NO_USABLE_VERSION,
        /** A version provider query failed. */
        PROVIDER_FAILURE,
        /** Only the lockfile may be used, but it no longer matches the requirements. */
        LOCKFILE_OUT_OF_DATE,
        /** The resolution was cancelled. */
        CANCELLED
    }

    private final Kind kind;
    private final List<PackageIdentity> packages;
    private final String explanation;

    private ResolutionException(Kind kind, String message, Collection<PackageIdentity> packages,
                                String explanation, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.packages = List.copyOf(packages);
        this.explanation = explanation;
    }

    public static ResolutionException versionConflict(String explanation, Collection<PackageIdentity> packages) {
        Objects.requireNonNull(explanation, "explanation cannot be null");
        return new ResolutionException(Kind.VERSION_CONFLICT,
                "Dependencies could not be resolved:\n" + explanation,
                packages, explanation, null);
    }

    public static ResolutionException packageNotFound(PackageIdentity identity) {
        return new ResolutionException(Kind.PACKAGE_NOT_FOUND,
                "No versions available for package '" + identity + "'", List.of(identity), null, null);
    }

    public static ResolutionException noUsableVersion(PackageIdentity identity) {
        return new ResolutionException(Kind.NO_USABLE_VERSION,
                "No version of package '" + identity + "' has a readable manifest", List.of(identity), null, null);
    }

    public static ResolutionException providerFailure(PackageIdentity identity, Throwable cause) {
        return new ResolutionException(Kind.PROVIDER_FAILURE,
                "Failed to query versions of package '" + identity + "': " + cause.getMessage(),
                List.of(identity), null, cause);
    }

    public static ResolutionException lockfileOutOfDate(String reason) {
        return new ResolutionException(Kind.LOCKFILE_OUT_OF_DATE,
                "The lockfile is out of date and only resolved versions may be used: " + reason,
                List.of(), null, null);
    }

    public static ResolutionException cancelled() {
        return new ResolutionException(Kind.CANCELLED, "Resolution was cancelled", List.of(), null, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Packages the failure is about. For conflicts, every package cited by the explanation.
     */
    public List<PackageIdentity> getPackages() {
        return packages;
    }

    /**
     * The human-readable derivation chain of a {@link Kind#VERSION_CONFLICT}, null otherwise.
     */
    public String getExplanation() {
        return explanation;
    }
}
