package bon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Covers {@link Bon.Parser#classifyNumber(String)} on raw literal text, independent of the lexer.
 */
class NumberClassificationTest {

    @Test
    void classify() {
        // @spotless:off
        var table = new Object[][] {
                {"10", new BonInteger(10)},
                {"-3", new BonInteger(-3)},
                {"-0", new BonInteger(0)},
                {"007", new BonInteger(7)},
                {"9223372036854775807", new BonInteger(Long.MAX_VALUE)},
                {"-9223372036854775808", new BonInteger(Long.MIN_VALUE)},
                {"10.0", new BonFloat(10.0)},
                {"0.5", new BonFloat(0.5)},
                {"5f", new BonFloat(5.0)},
                {"5F", new BonFloat(5.0)},
                {"-2f", new BonFloat(-2.0)},
                {"6.67e-11", new BonFloat(6.67e-11)},
                {"1E3", new BonFloat(1000.0)},
                {"2e+2", new BonFloat(200.0)},
                {"1e999", new BonFloat(Double.POSITIVE_INFINITY)},
                {"-1e999", new BonFloat(Double.NEGATIVE_INFINITY)},
                {"1e-999", new BonFloat(0.0)},
        };
        // @spotless:on

        assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
            var row = table[i];
            var literal = (String) row[0];
            assertThat(Bon.Parser.classifyNumber(literal))
                    .as("Case %d: literal=%s", i, literal)
                    .isEqualTo(row[1]);
        }));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.5f", "1e5f", "2.0E3F", "", "-", "abc", "1.", ".5", "1.2.3", "0x10", "1d", "+1", " 1"})
    void rejectsMalformedLiterals(String literal) {
        assertThatCode(() -> Bon.Parser.classifyNumber(literal)).isInstanceOf(NumberFormatException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"9223372036854775808", "-9223372036854775809", "100000000000000000000000"})
    void integerOverflow(String literal) {
        assertThatCode(() -> Bon.Parser.classifyNumber(literal))
                .isInstanceOf(ArithmeticException.class)
                .hasMessage("Integer literal out of 64-bit range: " + literal);
    }

    @Test
    void largeFloatsDoNotOverflow() {
        assertThat(Bon.Parser.classifyNumber("100000000000000000000000.0")).isEqualTo(new BonFloat(1e23));
        assertThat(Bon.Parser.classifyNumber("100000000000000000000000f")).isEqualTo(new BonFloat(1e23));
    }
}
