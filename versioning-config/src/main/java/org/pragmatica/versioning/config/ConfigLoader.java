package org.pragmatica.versioning.config;

import io.vavr.control.Either;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.ConfigurationError;
import org.pragmatica.versioning.error.VersioningError.ParseError;
import org.pragmatica.versioning.extract.AnnotationExtractor;
import org.pragmatica.versioning.syntax.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads versioning configuration from TOML files.
 *
 * <p>Configuration resolution order (highest priority first):
 * <ol>
 *   <li>Explicit overrides</li>
 *   <li>Values from the {@code [versioning]} table</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <pre>
 * [versioning]
 * versions = ["v1_0_0", "v2_0_0"]
 * annotation = "version"
 * features = false
 * nest_top_level = false
 * parallel = false
 * </pre>
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String TABLE = "versioning";
    public static final String VERSIONS = "versions";
    public static final String ANNOTATION = "annotation";
    public static final String FEATURES = "features";
    public static final String NEST_TOP_LEVEL = "nest_top_level";
    public static final String PARALLEL = "parallel";

    private static final Set<String> KEYS = Set.of(VERSIONS, ANNOTATION, FEATURES, NEST_TOP_LEVEL, PARALLEL);

    private ConfigLoader() {}

    /**
     * Load configuration from file path.
     */
    public static Either<VersioningError, VersioningConfig> load(Path path) {
        return loadWithOverrides(path, Map.of());
    }

    /**
     * Load configuration from TOML string content.
     */
    public static Either<VersioningError, VersioningConfig> loadFromString(String content) {
        return checked(Toml.parse(content))
                      .flatMap(doc -> fromDocument(doc, Map.of()))
                      .flatMap(ConfigValidator::validate);
    }

    /**
     * Load configuration with command-line overrides. Override keys are the table keys;
     * {@code versions} takes a comma-separated list.
     */
    public static Either<VersioningError, VersioningConfig> loadWithOverrides(Path path,
                                                                              Map<String, String> overrides) {
        log.debug("Loading versioning configuration from {}", path);
        return read(path).flatMap(doc -> fromDocument(doc, overrides))
                         .flatMap(ConfigValidator::validate)
                         .peek(config -> log.debug("Loaded {} version(s) from {}",
                                                   config.versions()
                                                         .size(),
                                                   path));
    }

    private static Either<VersioningError, TomlParseResult> read(Path path) {
        try{
            return checked(Toml.parse(path));
        } catch (IOException e) {
            return ConfigurationError.configurationError("Cannot read " + path + ": " + e.getMessage())
                                     .result();
        }
    }

    private static Either<VersioningError, TomlParseResult> checked(TomlParseResult result) {
        if (!result.hasErrors()) {
            return Either.right(result);
        }

        var error = result.errors()
                          .get(0);
        var position = error.position();

        return ParseError.parseError(error.getMessage(),
                                     SourceLocation.sourceLocation(position.line(), position.column()))
                         .result();
    }

    private static Either<VersioningError, VersioningConfig> fromDocument(TomlParseResult doc,
                                                                          Map<String, String> overrides) {
        var table = doc.getTable(TABLE);
        if (table == null) {
            return ConfigurationError.configurationError("Missing [" + TABLE + "] table")
                                     .result();
        }

        var unknown = new ArrayList<String>();
        table.keySet()
             .stream()
             .filter(key -> !KEYS.contains(key))
             .forEach(unknown::add);
        overrides.keySet()
                 .stream()
                 .filter(key -> !KEYS.contains(key))
                 .forEach(unknown::add);
        if (!unknown.isEmpty()) {
            return ConfigurationError.unknownKey(unknown.stream()
                                                        .sorted()
                                                        .findFirst()
                                                        .orElseThrow())
                                     .result();
        }

        return versions(table, overrides).map(VersioningConfig::versioningConfig)
                                         .flatMap(config -> annotation(table, overrides).map(config::withAnnotation))
                                         .flatMap(config -> flag(table, overrides, FEATURES).map(config::withFeatures))
                                         .flatMap(config -> flag(table, overrides, NEST_TOP_LEVEL).map(config::withNestTopLevel))
                                         .flatMap(config -> flag(table, overrides, PARALLEL).map(config::withParallel));
    }

    private static Either<VersioningError, List<String>> versions(TomlTable table, Map<String, String> overrides) {
        if (overrides.containsKey(VERSIONS)) {
            return Either.right(Arrays.stream(overrides.get(VERSIONS)
                                                       .split(","))
                                      .map(String::trim)
                                      .filter(name -> !name.isEmpty())
                                      .toList());
        }
        if (!table.contains(VERSIONS)) {
            return Either.right(List.of());
        }
        if (!table.isArray(VERSIONS)) {
            return notStringArray();
        }

        var array = table.getArray(VERSIONS);
        var names = new ArrayList<String>();

        for (int i = 0; i < array.size(); i++) {
            if (!(array.get(i) instanceof String name)) {
                return notStringArray();
            }
            names.add(name);
        }
        return Either.right(names);
    }

    private static Either<VersioningError, List<String>> notStringArray() {
        return ConfigurationError.configurationError("Option '" + VERSIONS + "' expects an array of strings")
                                 .result();
    }

    private static Either<VersioningError, String> annotation(TomlTable table, Map<String, String> overrides) {
        if (overrides.containsKey(ANNOTATION)) {
            return Either.right(overrides.get(ANNOTATION));
        }
        if (!table.contains(ANNOTATION)) {
            return Either.right(AnnotationExtractor.DEFAULT_ANNOTATION);
        }
        if (!table.isString(ANNOTATION)) {
            return ConfigurationError.configurationError("Option '" + ANNOTATION + "' expects a string")
                                     .result();
        }
        return Either.right(table.getString(ANNOTATION));
    }

    private static Either<VersioningError, Boolean> flag(TomlTable table, Map<String, String> overrides, String key) {
        if (overrides.containsKey(key)) {
            return switch (overrides.get(key)) {
                case "true" -> Either.right(true);
                case "false" -> Either.right(false);
                default -> ConfigurationError.notBoolean(key, overrides.get(key))
                                             .result();
            };
        }
        if (!table.contains(key)) {
            return Either.right(false);
        }
        if (!table.isBoolean(key)) {
            return ConfigurationError.notBoolean(key, String.valueOf(table.get(key)))
                                     .result();
        }
        return Either.right(table.getBoolean(key));
    }
}
