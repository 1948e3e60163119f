package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;
import java.util.Objects;

/**
 * Declaration the engine never looks inside: functions, constants, aliases, imports and so on.
 * Kept or dropped solely by its own filter annotation.
 */
public record Leaf(Kind kind,
                   String name,
                   Option<Visibility> visibility,
                   List<Attribute> attributes,
                   Payload payload) implements Declaration {
    public enum Kind {
        FUNCTION("fn"),
        CONSTANT("const"),
        STATIC("static"),
        TYPE_ALIAS("type"),
        TRAIT_ALIAS("trait alias"),
        UNION("union"),
        IMPORT("use"),
        EXTERN_CRATE("extern crate"),
        MACRO("macro"),
        OTHER("item");
        private final String label;
        Kind(String label) {
            this.label = label;
        }
        public String label() {
            return label;
        }
    }

    public Leaf {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        attributes = List.copyOf(attributes);
        Objects.requireNonNull(payload, "payload");
    }

    public static Leaf function(String name, Visibility visibility, Attribute... attributes) {
        return new Leaf(Kind.FUNCTION, name, Option.some(visibility), List.of(attributes), Payload.none());
    }

    public static Leaf leaf(Kind kind, String name, Visibility visibility, Attribute... attributes) {
        return new Leaf(kind, name, Option.some(visibility), List.of(attributes), Payload.none());
    }

    /// Leaf without a visibility marker, e.g. a macro invocation or a trait method.
    public static Leaf hidden(Kind kind, String name, Attribute... attributes) {
        return new Leaf(kind, name, Option.none(), List.of(attributes), Payload.none());
    }

    @Override
    public String category() {
        return kind.label();
    }

    @Override
    public Option<Visibility> declaredVisibility() {
        return visibility;
    }

    @Override
    public Leaf withAttributes(List<Attribute> attributes) {
        return new Leaf(kind, name, visibility, attributes, payload);
    }

    @Override
    public Option<Declaration> withVisibility(Visibility visibility) {
        return this.visibility.map(current -> new Leaf(kind, name, Option.some(visibility), attributes, payload));
    }
}
