package org.pragmatica.versioning.syntax;

/**
 * Single lexical token of the version-list and filter-expression mini-languages.
 *
 * @param type     token category
 * @param text     identifier text or the unescaped value of a string literal
 * @param location where the token starts
 */
public record Token(Type type, String text, SourceLocation location) {
    public enum Type {
        IDENTIFIER("identifier"),
        STRING("string literal"),
        LEFT_PAREN("'('"),
        RIGHT_PAREN("')'"),
        COMMA("','"),
        EQUALS("'='"),
        END("end of input");
        private final String description;
        Type(String description) {
            this.description = description;
        }
        public String description() {
            return description;
        }
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean isIdentifier(String name) {
        return type == Type.IDENTIFIER && text.equals(name);
    }

    public String describe() {
        return switch (type) {
            case IDENTIFIER -> "identifier '" + text + "'";
            case STRING -> "string \"" + text + "\"";
            default -> type.description();
        };
    }
}
