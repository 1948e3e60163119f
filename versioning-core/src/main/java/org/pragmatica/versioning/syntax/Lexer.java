package org.pragmatica.versioning.syntax;

import io.vavr.control.Either;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.ParseError;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits mini-language text into tokens.
 *
 * <p>Recognizes identifiers ({@code [A-Za-z_][A-Za-z0-9_]*}), double-quoted string literals with
 * {@code \"}, {@code \\}, {@code \n} and {@code \t} escapes, and the punctuation {@code ( ) , =}.
 * Whitespace separates tokens and is otherwise ignored. The returned list always ends with an
 * {@link Token.Type#END} token.
 */
public interface Lexer {
    static Either<VersioningError, List<Token>> tokenize(String text) {
        return tokenize(text, SourceLocation.start());
    }

    /**
     * Tokenize text whose first character sits at {@code origin}, so reported locations point
     * into the enclosing source rather than into the fragment.
     */
    static Either<VersioningError, List<Token>> tokenize(String text, SourceLocation origin) {
        var tokens = new ArrayList<Token>();
        var location = origin;
        int pos = 0;

        while (pos < text.length()) {
            char c = text.charAt(pos);

            if (Character.isWhitespace(c)) {
                location = location.advance(text.substring(pos, pos + 1));
                pos++;
                continue;
            }

            var single = punctuation(c);
            if (single != null) {
                tokens.add(new Token(single, String.valueOf(c), location));
                location = location.advance(text.substring(pos, pos + 1));
                pos++;
                continue;
            }

            if (isIdentifierStart(c)) {
                int end = pos + 1;
                while (end < text.length() && isIdentifierPart(text.charAt(end))) {
                    end++;
                }
                var identifier = text.substring(pos, end);
                tokens.add(new Token(Token.Type.IDENTIFIER, identifier, location));
                location = location.advance(identifier);
                pos = end;
                continue;
            }

            if (c == '"') {
                var start = location;
                var value = new StringBuilder();
                int end = pos + 1;
                boolean closed = false;

                while (end < text.length()) {
                    char ch = text.charAt(end);
                    if (ch == '"') {
                        closed = true;
                        break;
                    }
                    if (ch == '\\') {
                        if (end + 1 >= text.length()) {
                            break;
                        }
                        char escaped = text.charAt(end + 1);
                        switch (escaped) {
                            case '"', '\\' -> value.append(escaped);
                            case 'n' -> value.append('\n');
                            case 't' -> value.append('\t');
                            default -> {
                                return ParseError.parseError("Unsupported escape sequence '\\" + escaped + "'",
                                                             start.advance(text.substring(pos, end)))
                                                 .result();
                            }
                        }
                        end += 2;
                        continue;
                    }
                    value.append(ch);
                    end++;
                }

                if (!closed) {
                    return ParseError.parseError("Unterminated string literal", start)
                                     .result();
                }

                tokens.add(new Token(Token.Type.STRING, value.toString(), start));
                location = location.advance(text.substring(pos, end + 1));
                pos = end + 1;
                continue;
            }

            return ParseError.parseError("Unexpected character '" + c + "'", location)
                             .result();
        }

        tokens.add(new Token(Token.Type.END, "", location));
        return Either.right(List.copyOf(tokens));
    }

    private static Token.Type punctuation(char c) {
        return switch (c) {
            case '(' -> Token.Type.LEFT_PAREN;
            case ')' -> Token.Type.RIGHT_PAREN;
            case ',' -> Token.Type.COMMA;
            case '=' -> Token.Type.EQUALS;
            default -> null;
        };
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
