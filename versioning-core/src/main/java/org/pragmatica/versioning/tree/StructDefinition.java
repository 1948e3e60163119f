package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;
import java.util.Objects;

/**
 * Record-like type definition with ordered fields.
 */
public record StructDefinition(String name,
                               Visibility visibility,
                               FieldShape shape,
                               List<Attribute> attributes,
                               List<Field> fields,
                               Payload payload) implements Declaration {
    public StructDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        Objects.requireNonNull(shape, "shape");
        attributes = List.copyOf(attributes);
        fields = List.copyOf(fields);
        Objects.requireNonNull(payload, "payload");
    }

    public static StructDefinition struct(String name, Visibility visibility, List<Field> fields) {
        return new StructDefinition(name, visibility, FieldShape.NAMED, List.of(), fields, Payload.none());
    }

    public static StructDefinition struct(String name,
                                          Visibility visibility,
                                          List<Attribute> attributes,
                                          List<Field> fields) {
        return new StructDefinition(name, visibility, FieldShape.NAMED, attributes, fields, Payload.none());
    }

    @Override
    public String category() {
        return "struct";
    }

    @Override
    public Option<Visibility> declaredVisibility() {
        return Option.some(visibility);
    }

    @Override
    public List<Field> children() {
        return fields;
    }

    @Override
    public StructDefinition withAttributes(List<Attribute> attributes) {
        return new StructDefinition(name, visibility, shape, attributes, fields, payload);
    }

    @Override
    public Option<Declaration> withVisibility(Visibility visibility) {
        return Option.some(new StructDefinition(name, visibility, shape, attributes, fields, payload));
    }

    public StructDefinition withFields(List<Field> fields) {
        return new StructDefinition(name, visibility, shape, attributes, fields, payload);
    }
}
