package org.example.pgr.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolver configuration model.
 * Contains all configuration parameters of the resolve goal.
 */
public class ResolverConfiguration {

    public static final int DEFAULT_PARALLELISM = 4;

    /**
     * Manifest of the package being resolved.
     */
    private Path manifestFile;

    /**
     * Root directory of the file-system package registry.
     */
    private Path registryDirectory;

    /**
     * Lockfile read before and written after resolution.
     */
    private Path lockfile;

    /**
     * Number of provider queries that may run concurrently.
     * Default: 4
     */
    private int parallelism = DEFAULT_PARALLELISM;

    /**
     * Whether only the versions recorded in the lockfile may be used.
     * Default: false
     */
    private boolean resolvedVersionsOnly = false;

    /**
     * Whether to resolve again ignoring pins.
     * Default: false
     */
    private boolean update = false;

    /**
     * Packages whose pins are ignored on update; empty means all.
     */
    private List<String> updatePackages = new ArrayList<>();

    /**
     * Whether to fail the build on resolution error.
     * Default: true
     */
    private boolean failOnError = true;

    public ResolverConfiguration() {
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters and Setters

    public Path getManifestFile() {
        return manifestFile;
    }

    public void setManifestFile(Path manifestFile) {
        this.manifestFile = manifestFile;
    }

    public Path getRegistryDirectory() {
        return registryDirectory;
    }

    public void setRegistryDirectory(Path registryDirectory) {
        this.registryDirectory = registryDirectory;
    }

    public Path getLockfile() {
        return lockfile;
    }

    public void setLockfile(Path lockfile) {
        this.lockfile = lockfile;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isResolvedVersionsOnly() {
        return resolvedVersionsOnly;
    }

    public void setResolvedVersionsOnly(boolean resolvedVersionsOnly) {
        this.resolvedVersionsOnly = resolvedVersionsOnly;
    }

    public boolean isUpdate() {
        return update;
    }

    public void setUpdate(boolean update) {
        this.update = update;
    }

    public List<String> getUpdatePackages() {
        return updatePackages;
    }

    public void setUpdatePackages(List<String> updatePackages) {
        this.updatePackages = updatePackages != null ? updatePackages : new ArrayList<>();
    }

    public boolean isFailOnError() {
        return failOnError;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolverConfiguration that = (ResolverConfiguration) o;
        return parallelism == that.parallelism &&
                resolvedVersionsOnly == that.resolvedVersionsOnly &&
                update == that.update &&
                failOnError == that.failOnError &&
                Objects.equals(manifestFile, that.manifestFile) &&
                Objects.equals(registryDirectory, that.registryDirectory) &&
                Objects.equals(lockfile, that.lockfile) &&
                Objects.equals(updatePackages, that.updatePackages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(manifestFile, registryDirectory, lockfile, parallelism,
                resolvedVersionsOnly, update, updatePackages, failOnError);
    }

    @Override
    public String toString() {
        return "ResolverConfiguration{" +
                "manifestFile=" + manifestFile +
                ", registryDirectory=" + registryDirectory +
                ", lockfile=" + lockfile +
                ", parallelism=" + parallelism +
                ", resolvedVersionsOnly=" + resolvedVersionsOnly +
                ", update=" + update +
                ", updatePackages=" + updatePackages +
                ", failOnError=" + failOnError +
                '}';
    }

    /**
     * Builder for ResolverConfiguration.
     */
    public static class Builder {
        private final ResolverConfiguration config = new ResolverConfiguration();

        public Builder manifestFile(Path manifestFile) {
            config.setManifestFile(manifestFile);
            return this;
        }

        public Builder registryDirectory(Path registryDirectory) {
            config.setRegistryDirectory(registryDirectory);
            return this;
        }

        public Builder lockfile(Path lockfile) {
            config.setLockfile(lockfile);
            return this;
        }

        public Builder parallelism(int parallelism) {
            config.setParallelism(parallelism);
            return this;
        }

        public Builder resolvedVersionsOnly(boolean resolvedVersionsOnly) {
            config.setResolvedVersionsOnly(resolvedVersionsOnly);
            return this;
        }

        public Builder update(boolean update) {
            config.setUpdate(update);
            return this;
        }

        public Builder updatePackages(List<String> updatePackages) {
            config.setUpdatePackages(updatePackages);
            return this;
        }

        public Builder failOnError(boolean failOnError) {
            config.setFailOnError(failOnError);
            return this;
        }

        public ResolverConfiguration build() {
            return config;
        }
    }
}
