package bon;

import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Base exception for all bon4j errors.
 *
 * @since 0.1.0
 */
public class BonException extends RuntimeException {

    public BonException(String message) {
        super(message);
    }

    public BonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Exception thrown when BON text is malformed. The first violation aborts the parse, no partial tree is kept.
     */
    public static class ParseException extends BonException {
        private final ParseError error;

        public ParseException(ParseError error) {
            super(Objects.requireNonNull(error, "error").toString());
            this.error = error;
        }

        public ParseError error() {
            return error;
        }

        public ErrorKind getKind() {
            return error.kind();
        }

        public int getLine() {
            return error.line();
        }

        public int getColumn() {
            return error.column();
        }

        public int getOffset() {
            return error.position().offset();
        }

        public int getByteOffset() {
            return error.byteOffset();
        }

        public Set<String> getExpected() {
            return error.expected();
        }

        public @Nullable String getFound() {
            return error.found();
        }
    }

    /**
     * Exception thrown when a typed accessor of {@link BonValue} is used on a different variant.
     */
    public static class TypeMismatchException extends BonException {
        private final String expectedKind;
        private final String actualKind;

        public TypeMismatchException(String message, String expectedKind, String actualKind) {
            super(message);
            this.expectedKind = expectedKind;
            this.actualKind = actualKind;
        }

        static TypeMismatchException of(BonValue value, String expectedKind) {
            return new TypeMismatchException(
                    String.format("Expected %s but was %s", expectedKind, value.kind()), expectedKind, value.kind());
        }

        public String getExpectedKind() {
            return expectedKind;
        }

        public String getActualKind() {
            return actualKind;
        }
    }
}
