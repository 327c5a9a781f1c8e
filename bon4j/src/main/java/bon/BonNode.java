package bon;

import java.util.Objects;

/**
 * A single {@code key: value;} entry of a {@link BonObject}.
 *
 * @param key   plain identifier, never starts with a digit
 * @param value node value
 * @since 0.1.0
 */
public record BonNode(String key, BonValue value) {

    public BonNode {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (!isIdentifier(key)) throw new IllegalArgumentException("Invalid node key: '" + key + "'");
    }

    public static BonNode of(String key, BonValue value) {
        return new BonNode(key, value);
    }

    /**
     * Whether {@code item} is this node's key or its value.
     */
    public boolean contains(Object item) {
        return key.equals(item) || value.equals(item);
    }

    public String stringify() {
        return Bon.compactWriter.write(this);
    }

    static boolean isIdentifier(String s) {
        if (s.isEmpty() || !Bon.Lexer.isIdentifierStart(s.charAt(0))) return false;
        for (int i = 1; i < s.length(); i++) {
            if (!Bon.Lexer.isIdentifierPart(s.charAt(i))) return false;
        }
        return true;
    }
}
