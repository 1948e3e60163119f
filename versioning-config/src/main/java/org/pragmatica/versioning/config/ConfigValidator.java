package org.pragmatica.versioning.config;

import io.vavr.control.Either;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.ConfigurationError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates versioning configuration.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Version names must not be blank</li>
 *   <li>Version names must be unique</li>
 *   <li>Annotation name must be a plain identifier</li>
 * </ul>
 */
public final class ConfigValidator {
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private ConfigValidator() {}

    /**
     * Validate configuration, returning all validation errors.
     */
    public static Either<VersioningError, VersioningConfig> validate(VersioningConfig config) {
        var errors = new ArrayList<String>();
        validateVersions(config.versions(), errors);
        validateAnnotation(config.annotation(), errors);
        if (errors.isEmpty()) {
            return Either.right(config);
        }
        return ConfigurationError.validationFailed(errors)
                                 .result();
    }

    private static void validateVersions(List<String> versions, List<String> errors) {
        var seen = new HashSet<String>();
        var reported = new HashSet<String>();

        for (int i = 0; i < versions.size(); i++) {
            var name = versions.get(i);
            if (name.isBlank()) {
                errors.add("Version name at position " + (i + 1) + " is blank");
            }else if (!seen.add(name) && reported.add(name)) {
                errors.add("Version declared more than once: " + name);
            }
        }
    }

    private static void validateAnnotation(String annotation, List<String> errors) {
        if (annotation.isBlank()) {
            errors.add("Annotation name must not be blank");
        }else if (!IDENTIFIER.matcher(annotation)
                              .matches()) {
            errors.add("Invalid annotation name: " + annotation + ". Use letters, digits and underscores");
        }
    }
}
