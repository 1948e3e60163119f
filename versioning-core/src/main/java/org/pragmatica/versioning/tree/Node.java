package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;

/**
 * Any element of the generic declaration tree: a {@link Declaration} or a {@link Member} of one.
 *
 * <p>Nodes are immutable. Every node carries attributes; only some carry a visibility marker or
 * children, which the capability accessors below expose uniformly.
 */
public sealed interface Node permits Declaration, Member {
    /// Name of the node, empty for positional fields and anonymous blocks.
    String name();

    List<Attribute> attributes();

    Payload payload();

    /// Short category label, e.g. {@code "struct"} or {@code "field"}.
    String category();

    /// Visibility marker, or none when this kind of node has no visibility concept.
    Option<Visibility> declaredVisibility();

    default boolean hasVisibility() {
        return declaredVisibility().isDefined();
    }

    default List<? extends Node> children() {
        return List.of();
    }

    default boolean hasChildren() {
        return !children().isEmpty();
    }

    default String describe() {
        return name().isEmpty()
               ? category()
               : category() + " '" + name() + "'";
    }
}
