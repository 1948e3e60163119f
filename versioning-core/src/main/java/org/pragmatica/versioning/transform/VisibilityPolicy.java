package org.pragmatica.versioning.transform;

/**
 * What happens to the visibility of the top-level node that survives filtering.
 */
public enum VisibilityPolicy {
    /// Keep the declared visibility.
    PRESERVE,
    /// Make the node public, for re-export from a synthesized per-version container.
    FORCE_PUBLIC
}
