package bon;

/**
 * A position in source text.
 *
 * @param line       1-based line
 * @param column     1-based column, counted in UTF-16 code units
 * @param offset     0-based UTF-16 index into the input string
 * @param byteOffset 0-based offset into the UTF-8 encoding of the input
 * @since 0.1.0
 */
public record Position(int line, int column, int offset, int byteOffset) {

    public static final Position START = new Position(1, 1, 0, 0);

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
