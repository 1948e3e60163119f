package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;
import java.util.Objects;

/**
 * Variant of an enum, with its own ordered fields.
 */
public record EnumVariant(String name,
                          FieldShape shape,
                          List<Attribute> attributes,
                          List<Field> fields,
                          Payload payload) implements Member {
    public EnumVariant {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(shape, "shape");
        attributes = List.copyOf(attributes);
        fields = List.copyOf(fields);
        Objects.requireNonNull(payload, "payload");
    }

    public static EnumVariant unit(String name, Attribute... attributes) {
        return new EnumVariant(name, FieldShape.UNIT, List.of(attributes), List.of(), Payload.none());
    }

    public static EnumVariant enumVariant(String name, FieldShape shape, List<Attribute> attributes, List<Field> fields) {
        return new EnumVariant(name, shape, attributes, fields, Payload.none());
    }

    @Override
    public String category() {
        return "variant";
    }

    @Override
    public Option<Visibility> declaredVisibility() {
        return Option.none();
    }

    @Override
    public List<Field> children() {
        return fields;
    }

    @Override
    public EnumVariant withAttributes(List<Attribute> attributes) {
        return new EnumVariant(name, shape, attributes, fields, payload);
    }

    public EnumVariant withFields(List<Field> fields) {
        return new EnumVariant(name, shape, attributes, fields, payload);
    }
}
