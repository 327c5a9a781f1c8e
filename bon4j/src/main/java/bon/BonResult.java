package bon;

import java.util.Objects;

/**
 * Outcome of {@link Bon#tryParse(String)}: either a value or the error that stopped parsing.
 *
 * @since 0.1.0
 */
public sealed interface BonResult permits BonResult.Success, BonResult.Failure {

    boolean isSuccess();

    /**
     * @return the parsed value
     * @throws IllegalStateException if this is a failure
     */
    BonValue value();

    /**
     * @return the error
     * @throws IllegalStateException if this is a success
     */
    ParseError error();

    /**
     * @return the parsed value
     * @throws BonException.ParseException if this is a failure
     */
    BonValue orElseThrow();

    record Success(BonValue value) implements BonResult {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public ParseError error() {
            throw new IllegalStateException("Parse succeeded, there is no error");
        }

        @Override
        public BonValue orElseThrow() {
            return value;
        }
    }

    record Failure(ParseError error) implements BonResult {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public BonValue value() {
            throw new IllegalStateException("Parse failed: " + error);
        }

        @Override
        public BonValue orElseThrow() {
            throw new BonException.ParseException(error);
        }
    }
}
