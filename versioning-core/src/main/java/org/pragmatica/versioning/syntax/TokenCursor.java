package org.pragmatica.versioning.syntax;

import io.vavr.control.Either;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.ParseError;

import java.util.List;

/**
 * Forward-only view over a token list used by the recursive-descent parsers.
 */
public final class TokenCursor {
    private final List<Token> tokens;
    private int position;

    private TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static TokenCursor tokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(Token.Type.END)) {
            throw new IllegalArgumentException("Token list must be terminated with an END token");
        }
        return new TokenCursor(tokens);
    }

    public Token peek() {
        return tokens.get(position);
    }

    public Token next() {
        var token = tokens.get(position);
        if (!token.is(Token.Type.END)) {
            position++;
        }
        return token;
    }

    public boolean atEnd() {
        return peek().is(Token.Type.END);
    }

    /// Consume the next token if it has the given type.
    public boolean accept(Token.Type type) {
        if (peek().is(type)) {
            next();
            return true;
        }
        return false;
    }

    public Either<VersioningError, Token> expect(Token.Type type) {
        var token = peek();
        if (!token.is(type)) {
            return unexpected(token, type.description());
        }
        return Either.right(next());
    }

    public static <T> Either<VersioningError, T> unexpected(Token token, String expected) {
        return ParseError.parseError("Expected " + expected + ", found " + token.describe(), token.location())
                         .result();
    }
}
