package com.bookshelf.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * ConfigValidator - Validates configuration on startup.
 * Catches bad settings before the first catalog request does.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    /**
     * Validate configuration and return list of errors/warnings
     */
    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateLibrary(config, errors);
        validatePaging(config, errors);
        validateServer(config, errors);

        return errors;
    }

    private void validateLibrary(Configuration config, List<ValidationError> errors) {
        if (config.libraryDir == null || config.libraryDir.isBlank()) {
            errors.add(new ValidationError("No library directory configured", "ERROR"));
            return;
        }

        File libraryDir = new File(config.libraryDir);
        if (!libraryDir.exists()) {
            if (!libraryDir.mkdirs()) {
                errors.add(new ValidationError(
                        "Cannot create library directory: " + config.libraryDir,
                        "ERROR"));
            } else {
                logger.info("✅ Created library directory: {}", config.libraryDir);
            }
        } else if (!libraryDir.isDirectory()) {
            errors.add(new ValidationError(
                    "Library path is not a directory: " + config.libraryDir,
                    "ERROR"));
        } else if (!libraryDir.canRead()) {
            errors.add(new ValidationError(
                    "Library directory is not readable: " + config.libraryDir,
                    "ERROR"));
        }
    }

    private void validatePaging(Configuration config, List<ValidationError> errors) {
        if (config.pageSize <= 0) {
            errors.add(new ValidationError("pageSize must be positive, got " + config.pageSize, "ERROR"));
        }
        if (config.maxPage <= 0) {
            errors.add(new ValidationError("maxPage must be positive, got " + config.maxPage, "ERROR"));
        }
        if (config.recentLimit <= 0) {
            errors.add(new ValidationError(
                    "recentLimit is " + config.recentLimit + " - the recent feed will be empty",
                    "WARNING"));
        }
        if (config.recentCacheTtlSeconds < 0) {
            errors.add(new ValidationError(
                    "recentCacheTtlSeconds must not be negative, got " + config.recentCacheTtlSeconds,
                    "ERROR"));
        }
    }

    private void validateServer(Configuration config, List<ValidationError> errors) {
        if (config.port < 0 || config.port > 65535) {
            errors.add(new ValidationError("Port out of range: " + config.port, "ERROR"));
        }
        if (config.serverThreads <= 0) {
            errors.add(new ValidationError(
                    "serverThreads must be positive, got " + config.serverThreads,
                    "ERROR"));
        }
        if (config.adminToken == null || config.adminToken.isBlank()) {
            errors.add(new ValidationError(
                    "No adminToken configured - admin routes (cache refresh) are open to everyone",
                    "WARNING"));
        }
    }

    /**
     * Validate and report errors to logger.
     * Throws IllegalStateException if critical errors found.
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity.equals("ERROR")) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
