package org.pragmatica.versioning.version;

import java.util.Objects;

/**
 * Opaque version name. Ordering comes only from the position inside a {@link VersionRegistry}.
 */
public record Version(String name) {
    public Version {
        Objects.requireNonNull(name, "name");
    }

    public static Version version(String name) {
        return new Version(name);
    }

    public boolean startsWith(String prefix) {
        return name.startsWith(prefix);
    }

    @Override
    public String toString() {
        return name;
    }
}
