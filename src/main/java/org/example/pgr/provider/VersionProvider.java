package org.example.pgr.provider;

import org.example.pgr.exception.ProviderException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.Version;

import java.nio.file.Path;
import java.util.List;

/**
 * Lists the available versions of packages and locates their sources.
 */
public interface VersionProvider {

    /**
     * Returns the released versions of a package, empty if the package is unknown.
     *
     * @throws ProviderException if the query fails
     */
    List<Version> availableVersions(PackageIdentity identity) throws ProviderException;

    /**
     * Returns the revision the given branch currently points at.
     *
     * @throws ProviderException if the branch does not exist or the query fails
     */
    String resolveBranch(PackageIdentity identity, String branch) throws ProviderException;

    /**
     * Returns the location of the sources of a package at the given state.
     * Used by build execution, never by resolution.
     *
     * @throws ProviderException if the state cannot be checked out
     */
    Path checkout(PackageIdentity identity, BoundVersion version) throws ProviderException;
}
