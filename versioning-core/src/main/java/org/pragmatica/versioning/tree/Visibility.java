package org.pragmatica.versioning.tree;

/**
 * Declared visibility of a declaration or field.
 */
public enum Visibility {
    /// No explicit marker; visible in the enclosing namespace only.
    INHERITED,
    /// Visible inside an enclosing scope wider than the namespace, but not exported.
    RESTRICTED,
    PUBLIC
}
