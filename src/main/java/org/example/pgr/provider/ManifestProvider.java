package org.example.pgr.provider;

import org.example.pgr.exception.ManifestException;
import org.example.pgr.model.BoundVersion;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;

/**
 * Loads the manifest of a package at a concrete version, revision or path.
 */
public interface ManifestProvider {

    /**
     * Loads a manifest.
     *
     * @param identity the package
     * @param version  the version, revision or path to read the manifest at
     * @return the manifest
     * @throws ManifestException if the manifest is missing or malformed
     */
    PackageManifest loadManifest(PackageIdentity identity, BoundVersion version) throws ManifestException;
}
