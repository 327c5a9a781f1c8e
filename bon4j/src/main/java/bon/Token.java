package bon;

import java.util.Objects;

/**
 * A lexical token.
 *
 * @param type     token type
 * @param text     unescaped content for {@link Type#STRING}, the raw literal for {@link Type#NUMBER}, the name for
 *                 {@link Type#IDENTIFIER}, the character itself for punctuation and {@code ""} for {@link Type#EOF}
 * @param position where the token starts
 * @since 0.1.0
 */
public record Token(Type type, String text, Position position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(position, "position");
    }

    /**
     * Human readable form used in error messages, e.g. {@code ';'}, {@code number 12} or {@code end of input}.
     */
    public String describe() {
        return switch (type) {
            case STRING -> "string \"" + text + "\"";
            case NUMBER -> "number " + text;
            case IDENTIFIER -> "identifier " + text;
            default -> type.description();
        };
    }

    public enum Type {
        STRING("string"),
        NUMBER("number"),
        IDENTIFIER("identifier"),
        LBRACE("'{'"),
        RBRACE("'}'"),
        LBRACKET("'['"),
        RBRACKET("']'"),
        COLON("':'"),
        SEMICOLON("';'"),
        COMMA("','"),
        EOF("end of input");

        private final String description;

        Type(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }
}
