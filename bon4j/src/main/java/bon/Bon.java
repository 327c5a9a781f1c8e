package bon;

import bon.BonException.ParseException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Builder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal BasicObjectNotation (BON) parser and writer.
 *
 * <p> BON is a JSON-like format where objects hold semicolon-terminated {@code key: value;} nodes, keys are plain
 * identifiers, and numbers are typed by their spelling: {@code 10} is an integer while {@code 10.0}, {@code 1e3}
 * and {@code 5f} are floats.
 *
 * @since 0.1.0
 */
public final class Bon {

    private static final Logger LOGGER = LoggerFactory.getLogger(Bon.class);

    private static final Writer defaultWriter = Writer.builder().build();
    private static final Parser defaultParser = Parser.builder().build();

    /**
     * Backs {@link BonValue#stringify()} and {@link BonNode#stringify()}.
     */
    static final Writer compactWriter = Writer.builder().pretty(false).build();

    private Bon() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Parse a BON document.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * BonValue value = Bon.parse("{name: \"Alice\"; age: 30; scores: [1.5, 2f];}");
     * value.asObject().get("age"); // -> Optional[BonInteger[value=30]]
     * }</pre>
     *
     * @param text BON text, not {@code null}
     * @return the document value, any variant is accepted at the top level
     * @throws ParseException on the first syntax error
     */
    public static BonValue parse(String text) {
        return defaultParser.parse(text);
    }

    /**
     * Parse a BON document without throwing on malformed input.
     *
     * @param text BON text, not {@code null}
     * @return success with the value, or failure with the first {@link ParseError}
     */
    public static BonResult tryParse(String text) {
        return defaultParser.tryParse(text);
    }

    /**
     * Parse a document made of a single bare node, e.g. {@code value_1: "value";}.
     *
     * @param text BON text, not {@code null}
     * @return the node
     * @throws ParseException on the first syntax error
     */
    public static BonNode parseNode(String text) {
        return defaultParser.parseNode(text);
    }

    /**
     * Serialize a value to pretty-printed BON text with four-space indentation.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Bon.stringify(BonObject.of(BonNode.of("pi", BonValue.of(3.14))));
     * // -> {
     * //        pi: 3.14;
     * //    }
     * }</pre>
     *
     * @param value value to write, not {@code null}
     * @return non-null BON text that parses back to an equal value
     */
    public static String stringify(BonValue value) {
        return defaultWriter.write(value);
    }

    /**
     * Serialize a value with explicit layout options.
     *
     * @param value       value to write, not {@code null}
     * @param pretty      {@code true} to put object nodes on their own indented lines
     * @param indentWidth spaces per nesting level in pretty mode, {@code >= 0}
     * @return non-null BON text
     */
    public static String stringify(BonValue value, boolean pretty, int indentWidth) {
        return Writer.builder()
                .pretty(pretty)
                .indentWidth(indentWidth)
                .build()
                .write(value);
    }

    /**
     * Lazily tokenize BON text.
     *
     * <p> Every call to {@link Iterable#iterator()} restarts scanning from the beginning. The last token is always
     * {@link Token.Type#EOF}. Lexical errors surface as {@link ParseException} from {@link Iterator#next()},
     * after which the iterator is exhausted.
     *
     * @param text BON text, not {@code null}
     * @return restartable token sequence
     */
    public static Iterable<Token> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        return () -> new Iterator<>() {
            private final Lexer lexer = new Lexer(text);
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public Token next() {
                if (done) throw new NoSuchElementException();
                Token token;
                try {
                    token = lexer.advance();
                } catch (ParseException e) {
                    // the sequence ends at the first lexical error
                    done = true;
                    throw e;
                }
                done = token.type() == Token.Type.EOF;
                return token;
            }
        };
    }

    // ============================================================
    // Lexer
    // ============================================================

    static final class Lexer {
        private final String s;
        private int i = 0, line = 1, col = 1, bytes = 0;
        private @Nullable Token current;

        Lexer(String s) {
            this.s = Objects.requireNonNull(s);
        }

        /**
         * The token produced by the last {@link #advance()}.
         */
        Token current() {
            if (current == null) throw new IllegalStateException("advance() has not been called");
            return current;
        }

        Token advance() {
            current = scan();
            LOGGER.trace("{} at {}", current.type(), current.position());
            return current;
        }

        private Token scan() {
            skipWs();
            var start = position();
            if (eof()) return new Token(Token.Type.EOF, "", start);
            char c = peek();
            return switch (c) {
                case '{' -> punctuation(Token.Type.LBRACE, start);
                case '}' -> punctuation(Token.Type.RBRACE, start);
                case '[' -> punctuation(Token.Type.LBRACKET, start);
                case ']' -> punctuation(Token.Type.RBRACKET, start);
                case ':' -> punctuation(Token.Type.COLON, start);
                case ';' -> punctuation(Token.Type.SEMICOLON, start);
                case ',' -> punctuation(Token.Type.COMMA, start);
                case '"', '\'' -> new Token(Token.Type.STRING, readString(start), start);
                default -> {
                    if (c == '-' || isDigit(c)) yield new Token(Token.Type.NUMBER, readNumber(start), start);
                    if (isIdentifierStart(c)) yield new Token(Token.Type.IDENTIFIER, readIdentifier(), start);
                    throw error(ErrorKind.UNEXPECTED_CHARACTER, start, "Unexpected character: " + quote(c), quote(c));
                }
            };
        }

        private Token punctuation(Token.Type type, Position start) {
            return new Token(type, String.valueOf(consume()), start);
        }

        private void skipWs() {
            while (!eof() && Character.isWhitespace(peek())) consume();
        }

        private String readString(Position start) {
            char quote = consume();
            var sb = new StringBuilder();
            while (!eof()) {
                char c = consume();
                if (c == quote) return sb.toString();
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (eof()) break;
                char e = consume();
                switch (e) {
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> sb.append(readHex4());
                    // \" \' \\ \/ and any other escaped character stand for themselves
                    default -> sb.append(e);
                }
            }
            throw new ParseException(new ParseError(
                    ErrorKind.UNTERMINATED_STRING,
                    start,
                    "Unterminated string literal",
                    Set.of(String.valueOf(quote)),
                    Token.Type.EOF.description()));
        }

        private char readHex4() {
            var escapeStart = position();
            int cp = 0;
            for (int k = 0; k < 4; k++) {
                int v = eof() ? -1 : hexVal(peek());
                if (v < 0) {
                    var found = eof() ? Token.Type.EOF.description() : quote(peek());
                    throw error(ErrorKind.INVALID_ESCAPE, escapeStart, "Invalid \\u escape sequence", found);
                }
                consume();
                cp = (cp << 4) | v;
            }
            return (char) cp;
        }

        private static int hexVal(char c) {
            if (c >= '0' && c <= '9') return c - '0';
            if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
            if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
            return -1;
        }

        /**
         * Scans {@code ['-']digit+['.'digit+][('e'|'E')['+'|'-']digit+][('f'|'F')]} without classifying it.
         */
        private String readNumber(Position start) {
            int from = i;
            if (peek() == '-') consume();
            if (eof() || !isDigit(peek())) throw invalidNumber(start, from, "Expected digit in number");
            digits();
            boolean fraction = false, exponent = false;
            if (!eof() && peek() == '.') {
                consume();
                if (eof() || !isDigit(peek())) throw invalidNumber(start, from, "Expected digit after decimal point");
                digits();
                fraction = true;
                if (!eof() && peek() == '.') throw invalidNumber(start, from, "Multiple decimal points in number");
            }
            if (!eof() && (peek() == 'e' || peek() == 'E')) {
                consume();
                if (!eof() && (peek() == '+' || peek() == '-')) consume();
                if (eof() || !isDigit(peek())) throw invalidNumber(start, from, "Expected digit in exponent");
                digits();
                exponent = true;
            }
            if (!eof() && (peek() == 'f' || peek() == 'F')) {
                if (fraction || exponent) {
                    throw invalidNumber(start, from, "Float suffix cannot follow a decimal point or exponent");
                }
                consume();
            }
            return s.substring(from, i);
        }

        private void digits() {
            while (!eof() && isDigit(peek())) consume();
        }

        private ParseException invalidNumber(Position start, int from, String msg) {
            var found = s.substring(from, Math.min(i + 1, s.length()));
            return error(ErrorKind.INVALID_NUMBER_LITERAL, start, msg + ": '" + found + "'", found);
        }

        private String readIdentifier() {
            int from = i;
            while (!eof() && isIdentifierPart(peek())) consume();
            return s.substring(from, i);
        }

        private boolean eof() {
            return i >= s.length();
        }

        private char peek() {
            return s.charAt(i);
        }

        private char consume() {
            char c = s.charAt(i++);
            bytes += utf8Length(c);
            if (c == '\n') {
                line++;
                col = 1;
            } else col++;
            return c;
        }

        private Position position() {
            return new Position(line, col, i, bytes);
        }

        // A surrogate pair takes four bytes in UTF-8, two per half.
        private static int utf8Length(char c) {
            if (c < 0x80) return 1;
            if (c < 0x800 || Character.isSurrogate(c)) return 2;
            return 3;
        }

        private static String quote(char c) {
            return Character.isISOControl(c) ? String.format("'\\u%04x'", (int) c) : "'" + c + "'";
        }

        private static ParseException error(ErrorKind kind, Position at, String msg, String found) {
            return new ParseException(new ParseError(kind, at, msg, Set.of(), found));
        }

        static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        static boolean isIdentifierStart(char c) {
            return Character.isLetter(c) || c == '_';
        }

        static boolean isIdentifierPart(char c) {
            return isIdentifierStart(c) || isDigit(c);
        }
    }

    // ============================================================
    // Writer
    // ============================================================

    @Builder(toBuilder = true)
    public static final class Writer {

        /**
         * Put each object node on its own indented line.
         */
        @Builder.Default
        private final boolean pretty = true;

        /**
         * Spaces per nesting level in pretty mode.
         */
        @Builder.Default
        private final int indentWidth = 4;

        /**
         * Separate list elements with {@code ", "} instead of {@code ","} in pretty mode.
         */
        @Builder.Default
        private final boolean listSpacing = true;

        public String write(BonValue value) {
            Objects.requireNonNull(value, "value");
            if (indentWidth < 0) throw new IllegalArgumentException("indentWidth must be >= 0, got " + indentWidth);
            var sb = new StringBuilder();
            write(sb, value, 0);
            LOGGER.debug("Wrote {} as {} chars (pretty={})", value.kind(), sb.length(), pretty);
            return sb.toString();
        }

        /**
         * Write a single bare node, e.g. {@code key: value;}, the form {@link Bon#parseNode(String)} reads.
         */
        public String write(BonNode node) {
            Objects.requireNonNull(node, "node");
            if (indentWidth < 0) throw new IllegalArgumentException("indentWidth must be >= 0, got " + indentWidth);
            var sb = new StringBuilder();
            writeNode(sb, node, 0);
            return sb.toString();
        }

        void write(StringBuilder out, BonValue value, int level) {
            if (value instanceof BonString s) {
                writeString(out, s.value());
                return;
            }
            if (value instanceof BonInteger n) {
                out.append(n.value());
                return;
            }
            if (value instanceof BonFloat f) {
                writeFloat(out, f.value());
                return;
            }
            if (value instanceof BonList list) {
                writeList(out, list, level);
                return;
            }
            writeObject(out, (BonObject) value, level);
        }

        private void writeList(StringBuilder out, BonList list, int level) {
            var separator = pretty && listSpacing ? ", " : ",";
            out.append('[');
            for (int k = 0; k < list.size(); k++) {
                if (k > 0) out.append(separator);
                write(out, list.get(k), level);
            }
            out.append(']');
        }

        private void writeObject(StringBuilder out, BonObject object, int level) {
            out.append('{');
            if (object.isEmpty()) {
                out.append('}');
                return;
            }
            for (var node : object) {
                if (pretty) {
                    out.append('\n');
                    indent(out, level + 1);
                }
                writeNode(out, node, level + 1);
            }
            if (pretty) {
                out.append('\n');
                indent(out, level);
            }
            out.append('}');
        }

        private void writeNode(StringBuilder out, BonNode node, int level) {
            out.append(node.key()).append(pretty ? ": " : ":");
            write(out, node.value(), level);
            out.append(';');
        }

        private void indent(StringBuilder out, int level) {
            out.append(" ".repeat(indentWidth * level));
        }

        /**
         * Shortest text that reads back as the same double, always with a decimal point or an exponent so it cannot
         * be taken for an integer. Layout follows {@link Double#toString(double)}: plain notation for magnitudes in
         * {@code [1e-3, 1e7)}, {@code d.dddEn} otherwise. Infinities are written as an overflowing exponent.
         */
        static void writeFloat(StringBuilder out, double d) {
            if (Double.isInfinite(d)) {
                out.append(d > 0 ? "1e999" : "-1e999");
                return;
            }
            if (d == 0) {
                out.append(Double.doubleToRawLongBits(d) < 0 ? "-0.0" : "0.0");
                return;
            }
            var exact = new BigDecimal(d);
            BigDecimal shortest = exact;
            for (int precision = 1; precision <= 17; precision++) {
                var candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
                if (candidate.doubleValue() == d) {
                    shortest = candidate;
                    break;
                }
            }
            shortest = shortest.stripTrailingZeros();
            var digits = shortest.unscaledValue().abs().toString();
            int exponent = digits.length() - 1 - shortest.scale();
            if (exponent >= -3 && exponent < 7) {
                var plain = shortest.toPlainString();
                out.append(plain);
                if (plain.indexOf('.') < 0) out.append(".0");
                return;
            }
            if (d < 0) out.append('-');
            out.append(digits.charAt(0)).append('.');
            out.append(digits.length() > 1 ? digits.substring(1) : "0");
            out.append('E').append(exponent);
        }

        static void writeString(StringBuilder out, String s) {
            out.append('"');
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\b' -> out.append("\\b");
                    case '\f' -> out.append("\\f");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    default -> {
                        if (c < 0x20) {
                            out.append("\\u");
                            String hex = Integer.toHexString(c);
                            for (int k = hex.length(); k < 4; k++) out.append('0');
                            out.append(hex);
                        } else {
                            out.append(c);
                        }
                    }
                }
            }
            out.append('"');
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    @Builder(toBuilder = true)
    public static final class Parser {

        static final Pattern NUMBER_LITERAL = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?[fF]?");

        private static final Set<String> VALUE_START =
                Set.of("string", "number", Token.Type.LBRACE.description(), Token.Type.LBRACKET.description());
        private static final Set<String> NODE_START = Set.of(Token.Type.IDENTIFIER.description());
        private static final Set<String> NODE_OR_CLOSE =
                Set.of(Token.Type.IDENTIFIER.description(), Token.Type.RBRACE.description());
        private static final Set<String> LIST_CONTINUATION =
                Set.of(Token.Type.COMMA.description(), Token.Type.RBRACKET.description());

        /**
         * Maximum nesting of lists and objects.
         */
        @Builder.Default
        private final int maxDepth = 512;

        /**
         * Maximum input length in characters.
         */
        @Builder.Default
        private final int maxInputLength = Integer.MAX_VALUE;

        public BonValue parse(String text) {
            var lexer = open(text);
            long started = System.nanoTime();
            try {
                var value = parseValue(lexer, 0);
                expectEnd(lexer);
                LOGGER.debug(
                        "Parsed {} from {} chars in {} ns", value.kind(), text.length(), System.nanoTime() - started);
                return value;
            } catch (ParseException e) {
                LOGGER.debug("Failed to parse BON input: {}", e.getMessage());
                throw e;
            }
        }

        public BonResult tryParse(String text) {
            try {
                return new BonResult.Success(parse(text));
            } catch (ParseException e) {
                return new BonResult.Failure(e.error());
            }
        }

        public BonNode parseNode(String text) {
            var lexer = open(text);
            try {
                var node = parseNode(lexer, 0, NODE_START);
                expectEnd(lexer);
                LOGGER.debug("Parsed node '{}' from {} chars", node.key(), text.length());
                return node;
            } catch (ParseException e) {
                LOGGER.debug("Failed to parse BON node: {}", e.getMessage());
                throw e;
            }
        }

        private Lexer open(String text) {
            Objects.requireNonNull(text, "text");
            if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
            if (text.length() > maxInputLength) {
                throw new ParseException(new ParseError(
                        ErrorKind.INPUT_TOO_LARGE,
                        Position.START,
                        "Input of " + text.length() + " characters exceeds the limit of " + maxInputLength,
                        Set.of(),
                        null));
            }
            var lexer = new Lexer(text);
            lexer.advance();
            return lexer;
        }

        BonValue parseValue(Lexer lexer, int depth) {
            var token = lexer.current();
            return switch (token.type()) {
                case LBRACE -> parseObject(lexer, depth + 1);
                case LBRACKET -> parseList(lexer, depth + 1);
                case STRING -> {
                    lexer.advance();
                    yield new BonString(token.text());
                }
                case NUMBER -> {
                    var number = classifyNumber(token);
                    lexer.advance();
                    yield number;
                }
                default -> throw unexpected(token, VALUE_START);
            };
        }

        BonObject parseObject(Lexer lexer, int depth) {
            checkDepth(lexer, depth);
            expect(lexer, Token.Type.LBRACE);
            var nodes = new ArrayList<BonNode>();
            while (lexer.current().type() != Token.Type.RBRACE) {
                nodes.add(parseNode(lexer, depth, NODE_OR_CLOSE));
            }
            lexer.advance();
            return new BonObject(nodes);
        }

        BonNode parseNode(Lexer lexer, int depth, Set<String> expected) {
            var key = lexer.current();
            switch (key.type()) {
                case IDENTIFIER -> lexer.advance();
                case NUMBER, STRING -> throw new ParseException(new ParseError(
                        ErrorKind.INVALID_KEY,
                        key.position(),
                        "Invalid node key " + key.describe() + ", keys must be identifiers",
                        expected,
                        key.describe()));
                default -> throw unexpected(key, expected);
            }
            expect(lexer, Token.Type.COLON);
            var value = parseValue(lexer, depth);
            expect(lexer, Token.Type.SEMICOLON);
            return new BonNode(key.text(), value);
        }

        BonList parseList(Lexer lexer, int depth) {
            checkDepth(lexer, depth);
            expect(lexer, Token.Type.LBRACKET);
            var values = new ArrayList<BonValue>();
            if (accept(lexer, Token.Type.RBRACKET)) return new BonList(values);
            while (true) {
                values.add(parseValue(lexer, depth));
                if (accept(lexer, Token.Type.COMMA)) continue;
                if (accept(lexer, Token.Type.RBRACKET)) break;
                throw unexpected(lexer.current(), LIST_CONTINUATION);
            }
            return new BonList(values);
        }

        private void checkDepth(Lexer lexer, int depth) {
            if (depth > maxDepth) {
                var token = lexer.current();
                throw new ParseException(new ParseError(
                        ErrorKind.NESTING_TOO_DEEP,
                        token.position(),
                        "Nesting exceeds the maximum depth of " + maxDepth,
                        Set.of(),
                        token.describe()));
            }
        }

        private static void expectEnd(Lexer lexer) {
            var token = lexer.current();
            if (token.type() != Token.Type.EOF) {
                throw new ParseException(new ParseError(
                        ErrorKind.TRAILING_CONTENT,
                        token.position(),
                        "Trailing content after top-level value: " + token.describe(),
                        Set.of(Token.Type.EOF.description()),
                        token.describe()));
            }
        }

        static void expect(Lexer lexer, Token.Type type) {
            if (lexer.current().type() != type) throw unexpected(lexer.current(), Set.of(type.description()));
            lexer.advance();
        }

        static boolean accept(Lexer lexer, Token.Type type) {
            if (lexer.current().type() == type) {
                lexer.advance();
                return true;
            }
            return false;
        }

        static ParseException unexpected(Token token, Set<String> expected) {
            var expecting = String.join(" or ", expected.stream().sorted().toList());
            if (token.type() == Token.Type.EOF) {
                return new ParseException(new ParseError(
                        ErrorKind.UNEXPECTED_END_OF_INPUT,
                        token.position(),
                        "Unexpected end of input, expected " + expecting,
                        expected,
                        token.describe()));
            }
            return new ParseException(new ParseError(
                    ErrorKind.UNEXPECTED_TOKEN,
                    token.position(),
                    "Unexpected " + token.describe() + ", expected " + expecting,
                    expected,
                    token.describe()));
        }

        private static BonValue classifyNumber(Token token) {
            try {
                return classifyNumber(token.text());
            } catch (ArithmeticException e) {
                throw new ParseException(new ParseError(
                        ErrorKind.INTEGER_OVERFLOW, token.position(), e.getMessage(), Set.of(), token.text()));
            } catch (NumberFormatException e) {
                throw new ParseException(new ParseError(
                        ErrorKind.INVALID_NUMBER_LITERAL, token.position(), e.getMessage(), Set.of(), token.text()));
            }
        }

        /**
         * Decide whether a raw number literal is an integer or a float.
         *
         * <p> A literal with a decimal point or an exponent is a float. Otherwise a trailing {@code f}/{@code F}
         * makes it a float and is dropped. Everything else is a signed 64-bit integer.
         *
         * @param literal raw literal text, e.g. {@code -3}, {@code 6.67e-11} or {@code 5f}
         * @return {@link BonInteger} or {@link BonFloat}
         * @throws NumberFormatException if the text is not a number literal, or combines a suffix with a decimal
         *                               point or exponent
         * @throws ArithmeticException   if an integer literal does not fit in a {@code long}
         */
        static BonValue classifyNumber(String literal) {
            if (!NUMBER_LITERAL.matcher(literal).matches()) {
                throw new NumberFormatException("Invalid number literal: '" + literal + "'");
            }
            char last = literal.charAt(literal.length() - 1);
            boolean suffixed = last == 'f' || last == 'F';
            boolean decimal = literal.indexOf('.') >= 0;
            boolean exponent = literal.indexOf('e') >= 0 || literal.indexOf('E') >= 0;
            if (decimal || exponent) {
                if (suffixed) {
                    throw new NumberFormatException(
                            "Float suffix cannot follow a decimal point or exponent: '" + literal + "'");
                }
                return new BonFloat(Double.parseDouble(literal));
            }
            if (suffixed) return new BonFloat(Double.parseDouble(literal.substring(0, literal.length() - 1)));
            try {
                return new BonInteger(Long.parseLong(literal));
            } catch (NumberFormatException e) {
                // the pattern already guarantees digits, so only the range can be wrong
                throw new ArithmeticException("Integer literal out of 64-bit range: " + literal);
            }
        }
    }
}
