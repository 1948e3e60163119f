package org.pragmatica.versioning.options;

import io.vavr.control.Either;
import org.pragmatica.versioning.emit.EmitOptions;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.error.VersioningError.ConfigurationError;
import org.pragmatica.versioning.syntax.Lexer;
import org.pragmatica.versioning.syntax.Token;
import org.pragmatica.versioning.syntax.TokenCursor;
import org.pragmatica.versioning.version.VersionRegistry;

import java.util.ArrayList;

/**
 * Parser for the inline version list.
 *
 * <p>Items are version names, written as identifiers or string literals, and
 * {@code key = true|false} settings, separated by commas (repeats allowed) or whitespace.
 * Recognized keys:
 * <ul>
 *   <li>{@code features}: tag variants with a conditional-compilation marker</li>
 *   <li>{@code nestTopLevel} / {@code nest_top_level}: always synthesize a per-version container</li>
 *   <li>{@code visibleModules} / {@code visible_modules}: same as {@code nestTopLevel}</li>
 *   <li>{@code invisibleModules} / {@code invisible_modules}: inverse of {@code nestTopLevel}</li>
 * </ul>
 */
final class VersioningOptionsParser {
    private VersioningOptionsParser() {}

    static Either<VersioningError, VersioningOptions> parse(String text) {
        return Lexer.tokenize(text)
                    .map(TokenCursor::tokenCursor)
                    .flatMap(VersioningOptionsParser::parseItems);
    }

    private static Either<VersioningError, VersioningOptions> parseItems(TokenCursor cursor) {
        var names = new ArrayList<String>();
        var options = EmitOptions.emitOptions();

        while (!cursor.atEnd()) {
            if (cursor.accept(Token.Type.COMMA)) {
                continue;
            }

            var token = cursor.next();

            if (token.is(Token.Type.STRING)) {
                names.add(token.text());
                continue;
            }
            if (!token.is(Token.Type.IDENTIFIER)) {
                return TokenCursor.unexpected(token, "version name or setting");
            }
            if (!cursor.accept(Token.Type.EQUALS)) {
                names.add(token.text());
                continue;
            }

            var value = cursor.next();
            if (value.is(Token.Type.END)) {
                return TokenCursor.unexpected(value, "value for '" + token.text() + "'");
            }

            var applied = apply(options, token.text(), value);
            if (applied.isLeft()) {
                return Either.left(applied.getLeft());
            }
            options = applied.get();
        }

        var emitOptions = options;
        return VersionRegistry.versionRegistry(names)
                              .map(registry -> new VersioningOptions(registry, emitOptions));
    }

    private static Either<VersioningError, EmitOptions> apply(EmitOptions options, String key, Token value) {
        return switch (key) {
            case "features" -> bool(key, value).map(options::withFeatures);
            case "nestTopLevel", "nest_top_level", "visibleModules", "visible_modules" ->
                    bool(key, value).map(options::withNestTopLevel);
            case "invisibleModules", "invisible_modules" -> bool(key, value).map(flag -> options.withNestTopLevel(!flag));
            default -> ConfigurationError.unknownKey(key)
                                         .result();
        };
    }

    private static Either<VersioningError, Boolean> bool(String key, Token value) {
        if (value.isIdentifier("true")) {
            return Either.right(true);
        }
        if (value.isIdentifier("false")) {
            return Either.right(false);
        }
        return ConfigurationError.notBoolean(key, value.text())
                                 .result();
    }
}
