package org.pragmatica.versioning.options;

import io.vavr.control.Either;
import org.pragmatica.versioning.emit.EmitOptions;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.version.VersionRegistry;

/**
 * Version list and emit options of one invocation.
 */
public record VersioningOptions(VersionRegistry registry, EmitOptions emitOptions) {
    /**
     * Parse the inline form, e.g. {@code v1_0_0, v1_1_0, "v2_0_0", features = true}.
     */
    public static Either<VersioningError, VersioningOptions> parse(String text) {
        return VersioningOptionsParser.parse(text);
    }
}
