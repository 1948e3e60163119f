package org.pragmatica.versioning.error;

import io.vavr.control.Either;
import org.pragmatica.versioning.syntax.SourceLocation;

import java.util.List;

/**
 * Error types raised while parsing, verifying and emitting versioned declarations.
 *
 * <p>Every error is fatal for the invocation that produced it: no variant is emitted once
 * any of these is returned.
 */
public sealed interface VersioningError {
    String message();

    default <T> Either<VersioningError, T> result() {
        return Either.left(this);
    }

    /**
     * Malformed version list or filter expression, including unknown operator names.
     */
    record ParseError(String details, SourceLocation location) implements VersioningError {
        public static ParseError parseError(String details, SourceLocation location) {
            return new ParseError(details, location);
        }

        @Override
        public String message() {
            return "Parse error at " + location.asString() + ": " + details;
        }
    }

    /**
     * Unknown or ill-typed option, or an unusable configuration source.
     */
    record ConfigurationError(String details) implements VersioningError {
        public static ConfigurationError configurationError(String details) {
            return new ConfigurationError(details);
        }

        public static ConfigurationError unknownKey(String key) {
            return new ConfigurationError("Unknown option '" + key + "'");
        }

        public static ConfigurationError notBoolean(String key, String value) {
            return new ConfigurationError("Option '" + key + "' expects true or false, got '" + value + "'");
        }

        public static ConfigurationError validationFailed(List<String> errors) {
            return new ConfigurationError("Validation failed: " + String.join("; ", errors));
        }

        @Override
        public String message() {
            return "Configuration error: " + details;
        }
    }

    /**
     * Positional filter names a version the registry does not declare.
     */
    record UnknownVersionReference(String literal, SourceLocation location) implements VersioningError {
        @Override
        public String message() {
            return "Unknown version '" + literal + "' referenced at " + location.asString();
        }
    }

    /**
     * Registry lookup for a name it does not contain.
     */
    record UnknownVersionError(String name) implements VersioningError {
        @Override
        public String message() {
            return "Unknown version: " + name;
        }
    }

    record DuplicateVersionError(String name) implements VersioningError {
        @Override
        public String message() {
            return "Version declared more than once: " + name;
        }
    }

    /**
     * Forced public visibility requested for a declaration without a visibility marker.
     */
    record UnsupportedVisibilityOverride(String declaration) implements VersioningError {
        @Override
        public String message() {
            return "Cannot force public visibility on " + declaration + ": it has no visibility marker";
        }
    }
}
