package bon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class TokenizeTest {

    @Test
    void tokenTypesAndText() {
        var tokens = tokens("{key: [1, 'x', -2.5e+3, 5f];}");

        assertThat(tokens)
                .extracting(Token::type)
                .containsExactly(
                        Token.Type.LBRACE,
                        Token.Type.IDENTIFIER,
                        Token.Type.COLON,
                        Token.Type.LBRACKET,
                        Token.Type.NUMBER,
                        Token.Type.COMMA,
                        Token.Type.STRING,
                        Token.Type.COMMA,
                        Token.Type.NUMBER,
                        Token.Type.COMMA,
                        Token.Type.NUMBER,
                        Token.Type.RBRACKET,
                        Token.Type.SEMICOLON,
                        Token.Type.RBRACE,
                        Token.Type.EOF);
        assertThat(tokens)
                .extracting(Token::text)
                .containsExactly("{", "key", ":", "[", "1", ",", "x", ",", "-2.5e+3", ",", "5f", "]", ";", "}", "");
    }

    @Test
    void numberLiteralsStayRaw() {
        // @spotless:off
        var table = new Object[][] {
                {"10", "10"},
                {"-3", "-3"},
                {"007", "007"},
                {"6.67e-11", "6.67e-11"},
                {"1E10", "1E10"},
                {"5F", "5F"},
        };
        // @spotless:on

        assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
            var row = table[i];
            var input = (String) row[0];
            var first = tokens(input).get(0);
            assertThat(first.type()).as("Case %d: input=%s", i, input).isEqualTo(Token.Type.NUMBER);
            assertThat(first.text()).as("Case %d: input=%s", i, input).isEqualTo(row[1]);
        }));
    }

    @Test
    void digitLedKeySplitsIntoNumberAndIdentifier() {
        assertThat(tokens("1key"))
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(Token.Type.NUMBER, "1"),
                        tuple(Token.Type.IDENTIFIER, "key"),
                        tuple(Token.Type.EOF, ""));
    }

    @Test
    void positions() {
        var tokens = tokens("{\n  key: \"\u00e9\";\n}");

        var key = tokens.get(1);
        assertThat(key.position()).isEqualTo(new Position(2, 3, 4, 4));
        var string = tokens.get(3);
        assertThat(string.position()).isEqualTo(new Position(2, 8, 9, 9));
        var semicolon = tokens.get(4);
        assertThat(semicolon.position()).isEqualTo(new Position(2, 11, 12, 13));
        var close = tokens.get(5);
        assertThat(close.position()).isEqualTo(new Position(3, 1, 14, 15));
    }

    @Test
    void restartsFromTheBeginning() {
        var iterable = Bon.tokenize("[1, 2]");

        var first = new ArrayList<Token>();
        iterable.forEach(first::add);
        var second = new ArrayList<Token>();
        iterable.forEach(second::add);

        assertThat(first).hasSize(6).isEqualTo(second);
    }

    @Test
    void scansLazily() {
        var iterator = Bon.tokenize("{ @").iterator();

        assertThat(iterator.next().type()).isEqualTo(Token.Type.LBRACE);
        assertThatCode(iterator::next)
                .isInstanceOf(BonException.ParseException.class)
                .hasMessage("Unexpected character: '@' at line 1, column 3");
    }

    @Test
    void stopsAtFirstLexicalError() {
        var iterator = Bon.tokenize("\"\\u12G4\" 1").iterator();

        assertThatCode(iterator::next)
                .isInstanceOf(BonException.ParseException.class)
                .extracting(e -> ((BonException.ParseException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_ESCAPE);
        assertThat(iterator.hasNext()).isFalse();
        assertThatCode(iterator::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void stopsAfterEof() {
        var iterator = Bon.tokenize("").iterator();

        assertThat(iterator.hasNext()).isTrue();
        assertThat(iterator.next().type()).isEqualTo(Token.Type.EOF);
        assertThat(iterator.hasNext()).isFalse();
        assertThatCode(iterator::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void describe() {
        var tokens = tokens("\"s\" 1 id ;");

        assertThat(tokens)
                .extracting(Token::describe)
                .containsExactly("string \"s\"", "number 1", "identifier id", "';'", "end of input");
    }

    @Test
    void controlCharactersAreQuotedInErrors() {
        assertThatCode(() -> tokens("\u0000"))
                .isInstanceOf(BonException.ParseException.class)
                .hasMessage("Unexpected character: '\\u0000' at line 1, column 1");
    }

    private static List<Token> tokens(String text) {
        var tokens = new ArrayList<Token>();
        Bon.tokenize(text).forEach(tokens::add);
        return tokens;
    }
}
