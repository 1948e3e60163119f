package org.pragmatica.versioning.tree;

/**
 * How the fields of a struct or enum variant are written.
 */
public enum FieldShape {
    /// {@code { name: Type, ... }}
    NAMED,
    /// {@code (Type, ...)}; fields have no names.
    POSITIONAL,
    /// No field list at all.
    UNIT
}
