package org.pragmatica.versioning.tree;

/**
 * Concrete-syntax detail carried by a node and never inspected by the engine: signatures,
 * bodies, generic parameters, field types and the like. Filtering passes payloads through
 * unchanged, so front-ends may supply their own implementations.
 */
public interface Payload {
    Payload NONE = new Empty();

    static Payload none() {
        return NONE;
    }

    static Payload text(String source) {
        return new Text(source);
    }

    /// Short human-readable form, used by {@link DeclarationPrinter}.
    String summary();

    record Empty() implements Payload {
        @Override
        public String summary() {
            return "";
        }
    }

    record Text(String source) implements Payload {
        @Override
        public String summary() {
            return source;
        }
    }
}
