package org.pragmatica.versioning.emit;

import org.pragmatica.versioning.tree.Declaration;
import org.pragmatica.versioning.tree.DeclarationPrinter;
import org.pragmatica.versioning.version.Version;

/**
 * Filtered copy of a declaration for one version.
 */
public record Variant(Version version, Declaration declaration) {
    public static Variant variant(Version version, Declaration declaration) {
        return new Variant(version, declaration);
    }

    public String versionName() {
        return version.name();
    }

    public String outline() {
        return DeclarationPrinter.print(declaration);
    }
}
