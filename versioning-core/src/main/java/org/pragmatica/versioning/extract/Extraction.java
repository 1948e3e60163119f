package org.pragmatica.versioning.extract;

import io.vavr.control.Option;
import org.pragmatica.versioning.filter.FilterExpression;
import org.pragmatica.versioning.tree.Attribute;

import java.util.List;

/**
 * Attributes left on a node after its filter annotation was detached, plus the parsed filter.
 */
public record Extraction(List<Attribute> remaining, Option<FilterExpression> filter) {
    public Extraction {
        remaining = List.copyOf(remaining);
    }

    public static Extraction unfiltered(List<Attribute> attributes) {
        return new Extraction(attributes, Option.none());
    }
}
