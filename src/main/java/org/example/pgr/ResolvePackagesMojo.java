package org.example.pgr;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.example.pgr.config.ConfigurationValidator;
import org.example.pgr.config.ResolverConfiguration;
import org.example.pgr.exception.ConfigurationException;
import org.example.pgr.exception.ResolutionException;
import org.example.pgr.graph.PackageGraph;
import org.example.pgr.graph.ResolvedPackage;
import org.example.pgr.model.PackageIdentity;
import org.example.pgr.model.PackageManifest;
import org.example.pgr.provider.FileSystemPackageRegistry;
import org.example.pgr.provider.ManifestReader;
import org.example.pgr.resolver.DependencyResolutionService;
import org.example.pgr.resolver.ResolutionOutcome;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resolves the package dependencies of a manifest against a package registry, validates the
 * resulting package graph and records the resolved versions in a lockfile.
 *
 * Usage: mvn pgr:resolve
 */
@Mojo(name = "resolve", requiresProject = true, threadSafe = true)
public class ResolvePackagesMojo extends AbstractMojo {

    // ========== Required Configuration ==========

    /**
     * Root directory of the package registry.
     */
    @Parameter(property = "pgr.registryDirectory", required = true)
    private File registryDirectory;

    // ========== Optional Configuration ==========

    /**
     * Manifest of the package to resolve.
     */
    @Parameter(property = "pgr.manifestFile", defaultValue = "${project.basedir}/package.json")
    private File manifestFile;

    /**
     * Lockfile read before and written after resolution.
     */
    @Parameter(property = "pgr.lockfile", defaultValue = "${project.basedir}/package.lock.json")
    private File lockfile;

    /**
     * Number of registry queries that may run concurrently.
     */
    @Parameter(property = "pgr.parallelism", defaultValue = "4")
    private int parallelism;

    /**
     * Fail instead of resolving when the lockfile is out of date.
     */
    @Parameter(property = "pgr.resolvedVersionsOnly", defaultValue = "false")
    private boolean resolvedVersionsOnly;

    /**
     * Resolve again, ignoring the versions recorded in the lockfile.
     */
    @Parameter(property = "pgr.update", defaultValue = "false")
    private boolean update;

    /**
     * Packages to update; all packages when empty.
     */
    @Parameter(property = "pgr.updatePackages")
    private List<String> updatePackages;

    /**
     * Whether to fail the build on resolution error.
     */
    @Parameter(property = "pgr.failOnError", defaultValue = "true")
    private boolean failOnError;

    // ========== Maven Injected Components ==========

    @Parameter(defaultValue = "${project}", readonly = true, required = true)
    private MavenProject project;

    // ========== Execution ==========

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        logBanner();

        try {
            // Build configuration
            ResolverConfiguration config = buildConfiguration();

            // Validate configuration
            validateConfiguration(config);

            // Log configuration summary
            logConfigurationSummary(config);

            // Execute resolution
            executeResolution(config);

            logSuccess();

        } catch (ConfigurationException e) {
            // Configuration errors always fail the build (ignore failOnError)
            logError("Configuration validation failed", e);
            throw new MojoExecutionException("Plugin configuration is invalid: " + e.getMessage(), e);

        } catch (Exception e) {
            handleError(e);
        }
    }

    /**
     * Builds the resolver configuration from Mojo parameters.
     */
    ResolverConfiguration buildConfiguration() {
        return ResolverConfiguration.builder()
                .manifestFile(toPath(manifestFile))
                .registryDirectory(toPath(registryDirectory))
                .lockfile(toPath(lockfile))
                .parallelism(parallelism)
                .resolvedVersionsOnly(resolvedVersionsOnly)
                .update(update)
                .updatePackages(updatePackages)
                .failOnError(failOnError)
                .build();
    }

    private void validateConfiguration(ResolverConfiguration config) throws ConfigurationException {
        ConfigurationValidator validator = new ConfigurationValidator();
        validator.validateOrThrow(config);
        getLog().debug("Configuration validated successfully");
    }

    /**
     * Executes the resolution.
     */
    private void executeResolution(ResolverConfiguration config) throws Exception {
        getLog().info("Reading manifest " + config.getManifestFile() + "...");
        PackageManifest rootManifest = new ManifestReader().read(config.getManifestFile());

        Path baseDirectory = config.getManifestFile().toAbsolutePath().getParent();
        FileSystemPackageRegistry registry = new FileSystemPackageRegistry(config.getRegistryDirectory(), baseDirectory);
        DependencyResolutionService service = new DependencyResolutionService(registry, registry, config);

        getLog().info("Resolving dependencies of " + rootManifest.getDisplayName() + "...");
        ResolutionOutcome outcome;
        if (config.isUpdate()) {
            List<PackageIdentity> packages = config.getUpdatePackages().stream()
                    .map(PackageIdentity::of)
                    .collect(Collectors.toList());
            outcome = service.update(rootManifest, config.getLockfile(), packages);
        } else {
            outcome = service.resolve(rootManifest, config.getLockfile());
        }

        logResolutionResult(outcome, config);
    }

    private void logResolutionResult(ResolutionOutcome outcome, ResolverConfiguration config) {
        PackageGraph graph = outcome.getGraph();
        getLog().info("============================================================");
        getLog().info("Resolution Results:");
        getLog().info("  Packages resolved: " + outcome.getSolution().size());
        for (ResolvedPackage resolvedPackage : graph.getPackages()) {
            if (!resolvedPackage.isRoot()) {
                getLog().info("    - " + resolvedPackage.getIdentity() + " " + resolvedPackage.getBoundVersion());
            }
        }
        getLog().info("  Modules in graph: " + graph.getModuleCount());
        getLog().info("  Lockfile: " + (outcome.isFastPath() ? "up to date"
                : outcome.isLockfileWritten() ? "written to " + config.getLockfile() : "unchanged"));
        getLog().info("============================================================");
        if (getLog().isDebugEnabled()) {
            getLog().debug(graph.toDetailedString());
        }
    }

    /**
     * Handles errors based on failOnError flag.
     */
    private void handleError(Exception e) throws MojoExecutionException {
        logError("Resolution failed", e);

        if (failOnError) {
            throw new MojoExecutionException("PGR resolution failed: " + e.getMessage(), e);
        } else {
            getLog().warn("Resolution failed but continuing build (failOnError=false)");
        }
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("PGR Maven Plugin - Package Resolution");
        getLog().info("============================================================");
    }

    private void logConfigurationSummary(ResolverConfiguration config) {
        getLog().info("Configuration:");
        if (project != null) {
            getLog().info("  Project: " + project.getGroupId() + ":" + project.getArtifactId());
        }
        getLog().info("  Manifest: " + config.getManifestFile());
        getLog().info("  Registry: " + config.getRegistryDirectory());
        getLog().info("  Lockfile: " + config.getLockfile());
        getLog().info("  Parallelism: " + config.getParallelism());
        if (config.isUpdate()) {
            getLog().info("  Update: " + (config.getUpdatePackages().isEmpty() ? "[all]" : config.getUpdatePackages()));
        }
        getLog().info("  Resolved versions only: " + config.isResolvedVersionsOnly());
        getLog().info("  Fail on error: " + config.isFailOnError());
        getLog().info("============================================================");
    }

    private void logSuccess() {
        getLog().info("============================================================");
        getLog().info("Resolution completed successfully");
        getLog().info("============================================================");
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("PGR Resolution Failed: " + message);
        getLog().error("============================================================");
        if (e instanceof ResolutionException && ((ResolutionException) e).getExplanation() != null) {
            for (String line : ((ResolutionException) e).getExplanation().split("\n")) {
                getLog().error(line);
            }
        } else {
            getLog().error("Error: " + e.getMessage());
        }
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }

    private static Path toPath(File file) {
        return file != null ? file.toPath() : null;
    }
}
