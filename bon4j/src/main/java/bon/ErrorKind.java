package bon;

/**
 * Category of a {@link ParseError}. Every kind is fatal to the parse call that raised it.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
    /** A quote was opened and the input ended before the matching close. */
    UNTERMINATED_STRING,
    /** Malformed numeric literal, e.g. a bare {@code -}, {@code 1.}, {@code 1.2.3} or {@code 1.5f}. */
    INVALID_NUMBER_LITERAL,
    /** Integer literal outside the signed 64-bit range. */
    INTEGER_OVERFLOW,
    /** A token the grammar does not allow at this position. */
    UNEXPECTED_TOKEN,
    /** Input ended in the middle of a construct. */
    UNEXPECTED_END_OF_INPUT,
    /** A node key position holds something that is not an identifier. */
    INVALID_KEY,
    /** A character that starts no token. */
    UNEXPECTED_CHARACTER,
    /** Malformed {@code \\u} escape inside a string. */
    INVALID_ESCAPE,
    /** More tokens after a complete document. */
    TRAILING_CONTENT,
    /** Lists and objects nested deeper than the parser allows. */
    NESTING_TOO_DEEP,
    /** Input longer than the parser allows. */
    INPUT_TOO_LARGE
}
