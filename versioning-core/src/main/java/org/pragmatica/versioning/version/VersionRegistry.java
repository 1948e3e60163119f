package org.pragmatica.versioning.version;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.DuplicateVersionError;
import org.pragmatica.versioning.error.VersioningError.UnknownVersionError;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, duplicate-free list of versions for one invocation.
 *
 * <p>Position in the list is the only ordering signal; names are never parsed or compared as
 * semantic versions.
 */
public interface VersionRegistry {
    List<Version> versions();

    /**
     * Position of the version with exactly this name.
     */
    Either<VersioningError, Integer> indexOf(String name);

    Option<Integer> position(String name);

    default Either<VersioningError, Integer> indexOf(Version version) {
        return indexOf(version.name());
    }

    default boolean contains(String name) {
        return position(name).isDefined();
    }

    default int size() {
        return versions().size();
    }

    default boolean isEmpty() {
        return versions().isEmpty();
    }

    static Either<VersioningError, VersionRegistry> versionRegistry(String... names) {
        return versionRegistry(List.of(names));
    }

    static Either<VersioningError, VersionRegistry> versionRegistry(List<String> names) {
        record versionRegistry(List<Version> versions, Map<String, Integer> positions) implements VersionRegistry {
            @Override
            public Either<VersioningError, Integer> indexOf(String name) {
                return position(name).toEither(() -> new UnknownVersionError(name));
            }

            @Override
            public Option<Integer> position(String name) {
                return Option.of(positions.get(name));
            }

            @Override
            public String toString() {
                return "VersionRegistry" + versions;
            }
        }

        var versions = new ArrayList<Version>(names.size());
        var positions = new HashMap<String, Integer>();

        for (var name : names) {
            if (positions.putIfAbsent(name, versions.size()) != null) {
                return new DuplicateVersionError(name).result();
            }
            versions.add(Version.version(name));
        }

        return Either.right(new versionRegistry(List.copyOf(versions), Map.copyOf(positions)));
    }
}
