package org.pragmatica.versioning.tree;

import org.pragmatica.versioning.syntax.SourceLocation;

import java.util.Objects;

/**
 * Generic annotation attached to a node, such as {@code #[version(min("v2"))]} or a doc comment.
 *
 * @param name      annotation name
 * @param arguments raw text between the parentheses, empty when there are none
 * @param location  where {@code arguments} starts in the source, used to locate parse errors
 */
public record Attribute(String name, String arguments, SourceLocation location) {
    public static final String FEATURE_GATE = "cfg";

    public Attribute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(arguments, "arguments");
        Objects.requireNonNull(location, "location");
    }

    public static Attribute attribute(String name, String arguments) {
        return new Attribute(name, arguments, SourceLocation.UNKNOWN);
    }

    public static Attribute attribute(String name, String arguments, SourceLocation location) {
        return new Attribute(name, arguments, location);
    }

    public static Attribute marker(String name) {
        return new Attribute(name, "", SourceLocation.UNKNOWN);
    }

    /// Conditional-compilation marker selecting the variant built for {@code feature}.
    public static Attribute featureGate(String feature) {
        return new Attribute(FEATURE_GATE, "feature = \"" + feature + "\"", SourceLocation.UNKNOWN);
    }

    public boolean isNamed(String candidate) {
        return name.equals(candidate);
    }

    public String asString() {
        return arguments.isEmpty()
               ? "#[" + name + "]"
               : "#[" + name + "(" + arguments + ")]";
    }
}
