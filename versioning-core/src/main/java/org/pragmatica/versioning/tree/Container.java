package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;
import java.util.Objects;

/**
 * Namespace holding an ordered list of declarations.
 */
public record Container(String name,
                        Visibility visibility,
                        List<Attribute> attributes,
                        List<Declaration> children,
                        Payload payload) implements Declaration {
    public Container {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        attributes = List.copyOf(attributes);
        children = List.copyOf(children);
        Objects.requireNonNull(payload, "payload");
    }

    public static Container container(String name, Visibility visibility, List<Declaration> children) {
        return new Container(name, visibility, List.of(), children, Payload.none());
    }

    public static Container container(String name,
                                      Visibility visibility,
                                      List<Attribute> attributes,
                                      List<Declaration> children) {
        return new Container(name, visibility, attributes, children, Payload.none());
    }

    @Override
    public String category() {
        return "container";
    }

    @Override
    public Option<Visibility> declaredVisibility() {
        return Option.some(visibility);
    }

    @Override
    public Container withAttributes(List<Attribute> attributes) {
        return new Container(name, visibility, attributes, children, payload);
    }

    @Override
    public Option<Declaration> withVisibility(Visibility visibility) {
        return Option.some(new Container(name, visibility, attributes, children, payload));
    }

    public Container withName(String name) {
        return new Container(name, visibility, attributes, children, payload);
    }

    public Container withChildren(List<Declaration> children) {
        return new Container(name, visibility, attributes, children, payload);
    }
}
