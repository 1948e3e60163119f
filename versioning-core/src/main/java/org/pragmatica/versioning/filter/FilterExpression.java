package org.pragmatica.versioning.filter;

import io.vavr.control.Either;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.UnknownVersionReference;
import org.pragmatica.versioning.syntax.SourceLocation;
import org.pragmatica.versioning.version.Version;
import org.pragmatica.versioning.version.VersionRegistry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Boolean predicate over a candidate version.
 *
 * <p>Surface syntax:
 * <pre>
 * expr    := STRING | IDENT "(" arglist ")"
 * arglist := expr ("," expr)*
 * IDENT   := not | any | all | min | max | min_excl | max_excl
 * </pre>
 * A bare string is a prefix match. The four bound operators compare registry positions and
 * take a single string naming a declared version.
 */
public sealed interface FilterExpression {
    /**
     * Check every version this expression references against the registry.
     */
    Either<VersioningError, FilterExpression> verify(VersionRegistry registry);

    /**
     * Evaluate against a candidate from the registry. Bounds naming versions absent from the
     * registry never hold; {@link #verify(VersionRegistry)} reports them.
     */
    boolean evaluate(VersionRegistry registry, Version candidate);

    /// Canonical surface text; parsing it yields an equal expression.
    String asString();

    static Either<VersioningError, FilterExpression> parse(String text) {
        return FilterParser.parse(text, SourceLocation.start());
    }

    static Either<VersioningError, FilterExpression> parse(String text, SourceLocation origin) {
        return FilterParser.parse(text, origin);
    }

    static FilterExpression match(String pattern) {
        return new Match(pattern, SourceLocation.UNKNOWN);
    }

    static FilterExpression atLeast(String name) {
        return new Bound(BoundKind.AT_LEAST, name, SourceLocation.UNKNOWN);
    }

    static FilterExpression atLeastExclusive(String name) {
        return new Bound(BoundKind.AT_LEAST_EXCLUSIVE, name, SourceLocation.UNKNOWN);
    }

    static FilterExpression atMost(String name) {
        return new Bound(BoundKind.AT_MOST, name, SourceLocation.UNKNOWN);
    }

    static FilterExpression atMostExclusive(String name) {
        return new Bound(BoundKind.AT_MOST_EXCLUSIVE, name, SourceLocation.UNKNOWN);
    }

    static FilterExpression not(FilterExpression operand) {
        return new Not(operand);
    }

    static FilterExpression any(FilterExpression... operands) {
        return new Any(List.of(operands));
    }

    static FilterExpression all(FilterExpression... operands) {
        return new All(List.of(operands));
    }

    /// Prefix test; the empty pattern matches every version.
    record Match(String pattern, SourceLocation location) implements FilterExpression {
        @Override
        public Either<VersioningError, FilterExpression> verify(VersionRegistry registry) {
            return Either.right(this);
        }

        @Override
        public boolean evaluate(VersionRegistry registry, Version candidate) {
            return candidate.startsWith(pattern);
        }

        @Override
        public String asString() {
            return quote(pattern);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Match other && pattern.equals(other.pattern);
        }

        @Override
        public int hashCode() {
            return pattern.hashCode();
        }
    }

    enum BoundKind {
        AT_LEAST("min"),
        AT_LEAST_EXCLUSIVE("min_excl"),
        AT_MOST("max"),
        AT_MOST_EXCLUSIVE("max_excl");
        private final String operator;
        BoundKind(String operator) {
            this.operator = operator;
        }
        public String operator() {
            return operator;
        }
        boolean holds(int candidate, int bound) {
            return switch (this) {
                case AT_LEAST -> candidate >= bound;
                case AT_LEAST_EXCLUSIVE -> candidate > bound;
                case AT_MOST -> candidate <= bound;
                case AT_MOST_EXCLUSIVE -> candidate < bound;
            };
        }
    }

    /// Positional comparison against a declared version.
    record Bound(BoundKind kind, String name, SourceLocation location) implements FilterExpression {
        @Override
        public Either<VersioningError, FilterExpression> verify(VersionRegistry registry) {
            return registry.contains(name)
                   ? Either.right(this)
                   : new UnknownVersionReference(name, location).result();
        }

        @Override
        public boolean evaluate(VersionRegistry registry, Version candidate) {
            return registry.position(candidate.name())
                           .flatMap(candidateIndex -> registry.position(name)
                                                              .map(boundIndex -> kind.holds(candidateIndex,
                                                                                            boundIndex)))
                           .getOrElse(false);
        }

        @Override
        public String asString() {
            return kind.operator() + "(" + quote(name) + ")";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bound other && kind == other.kind && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return 31 * kind.hashCode() + name.hashCode();
        }
    }

    record Not(FilterExpression operand) implements FilterExpression {
        @Override
        public Either<VersioningError, FilterExpression> verify(VersionRegistry registry) {
            return operand.verify(registry)
                          .map(verified -> this);
        }

        @Override
        public boolean evaluate(VersionRegistry registry, Version candidate) {
            return !operand.evaluate(registry, candidate);
        }

        @Override
        public String asString() {
            return "not(" + operand.asString() + ")";
        }
    }

    /// Disjunction; an empty list never holds.
    record Any(List<FilterExpression> operands) implements FilterExpression {
        public Any {
            operands = List.copyOf(operands);
        }

        @Override
        public Either<VersioningError, FilterExpression> verify(VersionRegistry registry) {
            return verifyAll(operands, registry).map(verified -> this);
        }

        @Override
        public boolean evaluate(VersionRegistry registry, Version candidate) {
            return operands.stream()
                           .anyMatch(operand -> operand.evaluate(registry, candidate));
        }

        @Override
        public String asString() {
            return "any(" + join(operands) + ")";
        }
    }

    /// Conjunction; an empty list never holds either.
    record All(List<FilterExpression> operands) implements FilterExpression {
        public All {
            operands = List.copyOf(operands);
        }

        @Override
        public Either<VersioningError, FilterExpression> verify(VersionRegistry registry) {
            return verifyAll(operands, registry).map(verified -> this);
        }

        @Override
        public boolean evaluate(VersionRegistry registry, Version candidate) {
            return !operands.isEmpty() && operands.stream()
                                                  .allMatch(operand -> operand.evaluate(registry, candidate));
        }

        @Override
        public String asString() {
            return "all(" + join(operands) + ")";
        }
    }

    private static Either<VersioningError, List<FilterExpression>> verifyAll(List<FilterExpression> operands,
                                                                             VersionRegistry registry) {
        for (var operand : operands) {
            var verified = operand.verify(registry);
            if (verified.isLeft()) {
                return Either.left(verified.getLeft());
            }
        }
        return Either.right(operands);
    }

    private static String join(List<FilterExpression> operands) {
        return operands.stream()
                       .map(FilterExpression::asString)
                       .collect(Collectors.joining(", "));
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\")
                           .replace("\"", "\\\"")
                           .replace("\n", "\\n")
                           .replace("\t", "\\t") + "\"";
    }
}
