package bon;

import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Structured description of a parse failure.
 *
 * @param kind     error category
 * @param position where the offending token or character starts
 * @param message  message without the position suffix
 * @param expected descriptions of the tokens that would have been accepted, empty for lexical errors
 * @param found    description of the offending token or character, {@code null} when not applicable
 * @since 0.1.0
 */
public record ParseError(
        ErrorKind kind, Position position, String message, Set<String> expected, @Nullable String found) {

    public ParseError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(message, "message");
        expected = Set.copyOf(expected);
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    public int byteOffset() {
        return position.byteOffset();
    }

    @Override
    public String toString() {
        return message + " at " + position;
    }
}
