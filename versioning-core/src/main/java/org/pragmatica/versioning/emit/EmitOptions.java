package org.pragmatica.versioning.emit;

/**
 * Options controlling how filtered variants are packaged.
 *
 * @param features     tag every variant with a conditional-compilation marker named after its version
 * @param nestTopLevel always wrap the filtered declaration in a new per-version container, even when
 *                     the declaration is itself a container that could simply be renamed
 */
public record EmitOptions(boolean features, boolean nestTopLevel) {
    public static final EmitOptions DEFAULT = new EmitOptions(false, false);

    public static EmitOptions emitOptions() {
        return DEFAULT;
    }

    public static EmitOptions emitOptions(boolean features, boolean nestTopLevel) {
        return new EmitOptions(features, nestTopLevel);
    }

    public EmitOptions withFeatures(boolean features) {
        return new EmitOptions(features, nestTopLevel);
    }

    public EmitOptions withNestTopLevel(boolean nestTopLevel) {
        return new EmitOptions(features, nestTopLevel);
    }
}
