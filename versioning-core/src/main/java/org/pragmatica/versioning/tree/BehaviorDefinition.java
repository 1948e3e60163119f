package org.pragmatica.versioning.tree;

import io.vavr.control.Option;

import java.util.List;
import java.util.Objects;

/**
 * Block of behavior members: a trait, an implementation block or a foreign-function block.
 *
 * <p>These blocks carry no visibility marker of their own.
 */
public record BehaviorDefinition(Kind kind,
                                 String name,
                                 List<Attribute> attributes,
                                 List<Declaration> members,
                                 Payload payload) implements Declaration {
    public enum Kind {
        TRAIT("trait"),
        IMPLEMENTATION("impl"),
        FOREIGN_BLOCK("extern block");
        private final String label;
        Kind(String label) {
            this.label = label;
        }
        public String label() {
            return label;
        }
    }

    public BehaviorDefinition {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        attributes = List.copyOf(attributes);
        members = List.copyOf(members);
        Objects.requireNonNull(payload, "payload");
    }

    public static BehaviorDefinition trait(String name, List<Declaration> members) {
        return new BehaviorDefinition(Kind.TRAIT, name, List.of(), members, Payload.none());
    }

    public static BehaviorDefinition implementation(String target, List<Declaration> members) {
        return new BehaviorDefinition(Kind.IMPLEMENTATION, target, List.of(), members, Payload.none());
    }

    public static BehaviorDefinition implementation(String target,
                                                    List<Attribute> attributes,
                                                    List<Declaration> members) {
        return new BehaviorDefinition(Kind.IMPLEMENTATION, target, attributes, members, Payload.none());
    }

    public static BehaviorDefinition foreignBlock(List<Declaration> members) {
        return new BehaviorDefinition(Kind.FOREIGN_BLOCK, "", List.of(), members, Payload.none());
    }

    @Override
    public String category() {
        return kind.label();
    }

    @Override
    public Option<Visibility> declaredVisibility() {
        return Option.none();
    }

    @Override
    public List<Declaration> children() {
        return members;
    }

    @Override
    public BehaviorDefinition withAttributes(List<Attribute> attributes) {
        return new BehaviorDefinition(kind, name, attributes, members, payload);
    }

    @Override
    public Option<Declaration> withVisibility(Visibility visibility) {
        return Option.none();
    }

    public BehaviorDefinition withMembers(List<Declaration> members) {
        return new BehaviorDefinition(kind, name, attributes, members, payload);
    }
}
