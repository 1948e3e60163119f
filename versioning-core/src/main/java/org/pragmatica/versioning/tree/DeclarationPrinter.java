package org.pragmatica.versioning.tree;

import java.util.stream.Collectors;

/**
 * Renders a declaration tree as an indented outline, one node per line.
 *
 * <pre>
 * container 'v1_0_0' pub
 *   struct 'Example' pub
 *     field 'foo': String
 * </pre>
 */
public interface DeclarationPrinter {
    String INDENT = "  ";

    static String print(Node node) {
        var out = new StringBuilder();
        print(node, 0, out);
        return out.toString();
    }

    private static void print(Node node, int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth))
           .append(headline(node))
           .append('\n');
        for (var child : node.children()) {
            print(child, depth + 1, out);
        }
    }

    static String headline(Node node) {
        var line = new StringBuilder(node.describe());
        var summary = node.payload().summary();

        if (!summary.isEmpty()) {
            line.append(": ")
                .append(summary);
        }
        node.declaredVisibility()
            .filter(visibility -> visibility != Visibility.INHERITED)
            .forEach(visibility -> line.append(' ')
                                       .append(marker(visibility)));
        if (!node.attributes().isEmpty()) {
            line.append(' ')
                .append(node.attributes()
                            .stream()
                            .map(Attribute::asString)
                            .collect(Collectors.joining(" ")));
        }
        return line.toString();
    }

    private static String marker(Visibility visibility) {
        return switch (visibility) {
            case PUBLIC -> "pub";
            case RESTRICTED -> "pub(restricted)";
            case INHERITED -> "";
        };
    }
}
