package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;

/**
 * Top-level or nested item of the declaration tree.
 */
public sealed interface Declaration extends Node
        permits Container, StructDefinition, EnumDefinition, BehaviorDefinition, Leaf {
    Declaration withAttributes(List<Attribute> attributes);

    /**
     * Copy with the given visibility, or none when this declaration has no visibility marker.
     */
    Option<Declaration> withVisibility(Visibility visibility);
}
