package org.pragmatica.versioning.tree;

import java.util.List;

/**
 * Part of a type definition: a struct field or an enum variant.
 */
public sealed interface Member extends Node permits Field, EnumVariant {
    Member withAttributes(List<Attribute> attributes);
}
