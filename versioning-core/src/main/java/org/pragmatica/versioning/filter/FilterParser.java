package org.pragmatica.versioning.filter;

import io.vavr.control.Either;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.ParseError;
import org.pragmatica.versioning.filter.FilterExpression.All;
import org.pragmatica.versioning.filter.FilterExpression.Any;
import org.pragmatica.versioning.filter.FilterExpression.Bound;
import org.pragmatica.versioning.filter.FilterExpression.BoundKind;
import org.pragmatica.versioning.filter.FilterExpression.Match;
import org.pragmatica.versioning.filter.FilterExpression.Not;
import org.pragmatica.versioning.syntax.Lexer;
import org.pragmatica.versioning.syntax.SourceLocation;
import org.pragmatica.versioning.syntax.Token;
import org.pragmatica.versioning.syntax.TokenCursor;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for filter expressions.
 *
 * <p>{@code any} and {@code all} accept an empty argument list and a trailing comma;
 * {@code not} takes exactly one operand; the bound operators take exactly one string literal.
 */
final class FilterParser {
    private static final String OPERATORS = "not, any, all, min, max, min_excl, max_excl";

    private FilterParser() {}

    static Either<VersioningError, FilterExpression> parse(String text, SourceLocation origin) {
        var start = origin.isKnown()
                    ? origin
                    : SourceLocation.start();
        return Lexer.tokenize(text, start)
                    .map(TokenCursor::tokenCursor)
                    .flatMap(FilterParser::parseComplete);
    }

    private static Either<VersioningError, FilterExpression> parseComplete(TokenCursor cursor) {
        var expression = parseExpression(cursor);
        if (expression.isLeft() || cursor.atEnd()) {
            return expression;
        }
        return TokenCursor.unexpected(cursor.peek(), "end of filter expression");
    }

    private static Either<VersioningError, FilterExpression> parseExpression(TokenCursor cursor) {
        var token = cursor.next();

        if (token.is(Token.Type.STRING)) {
            return Either.right(new Match(token.text(), token.location()));
        }
        if (!token.is(Token.Type.IDENTIFIER)) {
            return TokenCursor.unexpected(token, "string or operator (e.g. `all(...)`, `not(...)`)");
        }

        return switch (token.text()) {
            case "not" -> parseNot(cursor);
            case "any" -> parseOperands(cursor).map(Any::new);
            case "all" -> parseOperands(cursor).map(All::new);
            case "min" -> parseBound(cursor, BoundKind.AT_LEAST);
            case "min_excl" -> parseBound(cursor, BoundKind.AT_LEAST_EXCLUSIVE);
            case "max" -> parseBound(cursor, BoundKind.AT_MOST);
            case "max_excl" -> parseBound(cursor, BoundKind.AT_MOST_EXCLUSIVE);
            default -> ParseError.parseError("Unknown operator '" + token.text() + "' (expected one of " + OPERATORS
                                             + ")",
                                             token.location())
                                 .result();
        };
    }

    private static Either<VersioningError, FilterExpression> parseNot(TokenCursor cursor) {
        var open = cursor.expect(Token.Type.LEFT_PAREN);
        if (open.isLeft()) {
            return Either.left(open.getLeft());
        }
        return parseExpression(cursor).flatMap(operand -> cursor.expect(Token.Type.RIGHT_PAREN)
                                                                .map(close -> new Not(operand)));
    }

    private static Either<VersioningError, List<FilterExpression>> parseOperands(TokenCursor cursor) {
        var open = cursor.expect(Token.Type.LEFT_PAREN);
        if (open.isLeft()) {
            return Either.left(open.getLeft());
        }

        var operands = new ArrayList<FilterExpression>();

        while (!cursor.accept(Token.Type.RIGHT_PAREN)) {
            var operand = parseExpression(cursor);
            if (operand.isLeft()) {
                return Either.left(operand.getLeft());
            }
            operands.add(operand.get());

            if (!cursor.accept(Token.Type.COMMA) && !cursor.peek().is(Token.Type.RIGHT_PAREN)) {
                return TokenCursor.unexpected(cursor.peek(), "',' or ')'");
            }
        }

        return Either.right(operands);
    }

    private static Either<VersioningError, FilterExpression> parseBound(TokenCursor cursor, BoundKind kind) {
        var open = cursor.expect(Token.Type.LEFT_PAREN);
        if (open.isLeft()) {
            return Either.left(open.getLeft());
        }

        var literal = cursor.peek();
        if (!literal.is(Token.Type.STRING)) {
            return TokenCursor.unexpected(literal, "version string as the argument of `" + kind.operator() + "`");
        }
        cursor.next();

        return cursor.expect(Token.Type.RIGHT_PAREN)
                     .map(close -> new Bound(kind, literal.text(), literal.location()));
    }
}
