package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;
import java.util.Objects;

/**
 * Field of a struct or enum variant. Positional fields have an empty name.
 */
public record Field(String name,
                    Visibility visibility,
                    List<Attribute> attributes,
                    Payload payload) implements Member {
    public Field {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        attributes = List.copyOf(attributes);
        Objects.requireNonNull(payload, "payload");
    }

    public static Field field(String name, String type, Attribute... attributes) {
        return new Field(name, Visibility.INHERITED, List.of(attributes), Payload.text(type));
    }

    public static Field positional(String type, Attribute... attributes) {
        return new Field("", Visibility.INHERITED, List.of(attributes), Payload.text(type));
    }

    @Override
    public String category() {
        return "field";
    }

    @Override
    public Option<Visibility> declaredVisibility() {
        return Option.some(visibility);
    }

    @Override
    public Field withAttributes(List<Attribute> attributes) {
        return new Field(name, visibility, attributes, payload);
    }
}
