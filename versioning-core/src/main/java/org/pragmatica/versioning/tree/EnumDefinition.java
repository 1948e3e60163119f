package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;
import java.util.Objects;

/**
 * Sum-type definition with ordered variants.
 */
public record EnumDefinition(String name,
                             Visibility visibility,
                             List<Attribute> attributes,
                             List<EnumVariant> variants,
                             Payload payload) implements Declaration {
    public EnumDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        attributes = List.copyOf(attributes);
        variants = List.copyOf(variants);
        Objects.requireNonNull(payload, "payload");
    }

    public static EnumDefinition enumDefinition(String name, Visibility visibility, List<EnumVariant> variants) {
        return new EnumDefinition(name, visibility, List.of(), variants, Payload.none());
    }

    public static EnumDefinition enumDefinition(String name,
                                                Visibility visibility,
                                                List<Attribute> attributes,
                                                List<EnumVariant> variants) {
        return new EnumDefinition(name, visibility, attributes, variants, Payload.none());
    }

    @Override
    public String category() {
        return "enum";
    }

    @Override
    public Option<Visibility> declaredVisibility() {
        return Option.some(visibility);
    }

    @Override
    public List<EnumVariant> children() {
        return variants;
    }

    @Override
    public EnumDefinition withAttributes(List<Attribute> attributes) {
        return new EnumDefinition(name, visibility, attributes, variants, payload);
    }

    @Override
    public Option<Declaration> withVisibility(Visibility visibility) {
        return Option.some(new EnumDefinition(name, visibility, attributes, variants, payload));
    }

    public EnumDefinition withVariants(List<EnumVariant> variants) {
        return new EnumDefinition(name, visibility, attributes, variants, payload);
    }
}
