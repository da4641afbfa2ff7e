package org.example.pgr.config;

import org.example.pgr.exception.ConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates resolver configuration parameters.
 * Throws ConfigurationException if validation fails.
 */
public class ConfigurationValidator {

    /**
     * Upper bound for concurrent provider queries.
     */
    static final int MAX_PARALLELISM = 64;

    /**
     * Validates the resolver configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(ResolverConfiguration config) {
        List<String> errors = new ArrayList<>();

        // Required field validation
        validateRequired(config, errors);

        // Value validation
        validateValues(config, errors);

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(ResolverConfiguration config) throws ConfigurationException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid resolver configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateRequired(ResolverConfiguration config, List<String> errors) {
        if (config.getManifestFile() == null) {
            errors.add("manifestFile is required");
        }

        if (config.getRegistryDirectory() == null) {
            errors.add("registryDirectory is required");
        }

        if (config.getLockfile() == null) {
            errors.add("lockfile is required");
        }
    }

    private void validateValues(ResolverConfiguration config, List<String> errors) {
        Path manifest = config.getManifestFile();
        if (manifest != null && !Files.isRegularFile(manifest)) {
            errors.add("manifestFile does not exist: " + manifest);
        }

        Path registry = config.getRegistryDirectory();
        if (registry != null && !Files.isDirectory(registry)) {
            errors.add("registryDirectory is not a directory: " + registry);
        }

        Path lockfile = config.getLockfile();
        if (lockfile != null && Files.isDirectory(lockfile)) {
            errors.add("lockfile must be a file, but is a directory: " + lockfile);
        }

        if (config.getParallelism() < 1 || config.getParallelism() > MAX_PARALLELISM) {
            errors.add("parallelism must be between 1 and " + MAX_PARALLELISM + ", but was: " +
                       config.getParallelism());
        }

        // Update mode
        if (config.isUpdate() && config.isResolvedVersionsOnly()) {
            errors.add("update cannot be combined with resolvedVersionsOnly");
        }
        if (!config.getUpdatePackages().isEmpty() && !config.isUpdate()) {
            errors.add("updatePackages is only used when update is enabled");
        }
        for (String name : config.getUpdatePackages()) {
            if (name == null || name.trim().isEmpty()) {
                errors.add("updatePackages contains empty package name");
            }
        }
    }
}
