package json.descent;

import java.util.Objects;
import java.util.logging.Logger;

/// Turns JSON text into tokens, one per call to {@link #next()}.
///
/// The tokenizer walks the input by code point with a single forward-only cursor and one
/// code point of lookahead. It never skips whitespace on its own: callers decide where
/// whitespace is allowed and call {@link #eatWhitespaces()} there.
///
/// Instances are not thread safe.
public final class Tokenizer {

    private static final Logger LOG = Logger.getLogger(Tokenizer.class.getName());

    private static final int END = -1;

    private final String input;
    private int pos;

    /// Creates a tokenizer positioned at the start of `input`.
    /// @throws NullPointerException if input is null
    public Tokenizer(String input) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.pos = 0;
    }

    /// Reads the next token.
    ///
    /// Consumes exactly the characters of the returned token and nothing after it.
    /// @return the token starting at the cursor, never null
    /// @throws JsonParseException with {@link JsonError#EOF} at end of input, or the lexical error found
    public Token next() {
        final int c = peek();
        if (c == END) {
            throw error(JsonError.EOF);
        }
        final Token token = switch (c) {
            case '{' -> structural(Token.LEFT_BRACE);
            case '}' -> structural(Token.RIGHT_BRACE);
            case '[' -> structural(Token.LEFT_BRACKET);
            case ']' -> structural(Token.RIGHT_BRACKET);
            case ',' -> structural(Token.COMMA);
            case ':' -> structural(Token.COLON);
            case '"' -> string();
            case '-', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> number();
            case 't', 'f' -> bool();
            case 'n' -> nullLiteral();
            default -> throw error(JsonError.INVALID_TOKEN);
        };
        LOG.finest(() -> "Token " + token + " ends at " + pos);
        return token;
    }

    /// Consumes a maximal run of space, line feed, carriage return and horizontal tab.
    /// @return true if at least one character was consumed
    public boolean eatWhitespaces() {
        if (!eatWhitespace()) {
            return false;
        }
        while (eatWhitespace()) {
            // keep eating
        }
        return true;
    }

    /// Consumes `expected` if it is a structural token and its character is next.
    /// Leaves the cursor untouched otherwise.
    /// @return true if the token was consumed
    public boolean eatToken(Token expected) {
        if (expected instanceof Token.Structural structural) {
            return eatc(structural.symbol());
        }
        return false;
    }

    /// Offset of the cursor in UTF-16 units.
    public int position() {
        return pos;
    }

    /// True when every character of the input has been consumed.
    public boolean atEnd() {
        return pos >= input.length();
    }

    JsonParseException error(JsonError error) {
        return new JsonParseException(error, input, pos);
    }

    int peek() {
        return pos < input.length() ? input.codePointAt(pos) : END;
    }

    int one() {
        final int c = peek();
        if (c != END) {
            pos += Character.charCount(c);
        }
        return c;
    }

    boolean eatc(int expected) {
        if (peek() == expected) {
            one();
            return true;
        }
        return false;
    }

    /// All-or-nothing match of a literal; the cursor does not move on mismatch.
    boolean eats(String literal) {
        if (input.startsWith(literal, pos)) {
            pos += literal.length();
            return true;
        }
        return false;
    }

    private boolean eatWhitespace() {
        return eatc(' ') || eatc('\n') || eatc('\r') || eatc('\t');
    }

    private Token structural(Token token) {
        one();
        return token;
    }

    /// Scans a string literal; the opening quote must be the next character.
    Token.StringToken string() {
        if (!eatc('"')) {
            throw error(JsonError.INVALID_STRING);
        }
        final var val = new StringBuilder();
        while (true) {
            final int c = peek();
            if (c == END) {
                throw error(JsonError.EOF);
            }
            if (c == '"') {
                one();
                return new Token.StringToken(val.toString());
            }
            one();
            if (c == '\\') {
                val.append(escape());
            } else {
                val.appendCodePoint(c);
            }
        }
    }

    private char escape() {
        final int c = peek();
        final char decoded = switch (c) {
            case '"' -> '"';
            case '\\' -> '\\';
            case '/' -> '/';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case END -> throw error(JsonError.EOF);
            // unicode escapes are not decoded
            default -> throw error(JsonError.INVALID_ESCAPE_CHAR);
        };
        one();
        return decoded;
    }

    /// Scans a number literal: integer part, then optional fraction and exponent.
    Token.NumberToken number() {
        final var val = new StringBuilder(integer().text());

        if (eatc('.')) {
            val.append('.').append(fraction().text());
        }

        final int c = peek();
        if (c == 'e' || c == 'E') {
            one();
            val.append((char) c).append(exponent().text());
        }

        return new Token.NumberToken(val.toString());
    }

    private IntegerPart integer() {
        final var val = new StringBuilder();

        if (eatc('-')) {
            val.append('-');
        }

        if (eatc('0')) {
            // JSON forbids leading zeros
            if (isDigit(peek())) {
                throw error(JsonError.INVALID_NUMBER);
            }
            return new IntegerPart(val.append('0').toString());
        }

        if (!isDigit(peek())) {
            throw error(JsonError.INVALID_NUMBER);
        }
        while (isDigit(peek())) {
            val.append((char) one());
        }
        return new IntegerPart(val.toString());
    }

    /// At least one digit, then as many as follow.
    private FractionPart fraction() {
        if (!isDigit(peek())) {
            throw error(JsonError.INVALID_NUMBER);
        }
        final var val = new StringBuilder();
        while (isDigit(peek())) {
            val.append((char) one());
        }
        return new FractionPart(val.toString());
    }

    private ExponentPart exponent() {
        final var val = new StringBuilder();
        final int c = peek();
        if (c == '+' || c == '-') {
            one();
            val.append((char) c);
        }
        return new ExponentPart(val.append(fraction().text()).toString());
    }

    private Token bool() {
        if (eats("true")) {
            return new Token.BoolToken(true);
        }
        if (eats("false")) {
            return new Token.BoolToken(false);
        }
        throw error(JsonError.INVALID_TOKEN);
    }

    private Token nullLiteral() {
        if (eats("null")) {
            return new Token.NullToken();
        }
        throw error(JsonError.INVALID_TOKEN);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    /// Pieces of a number literal, concatenated into a {@link Token.NumberToken}.
    private sealed interface NumberFragment permits IntegerPart, FractionPart, ExponentPart {
        String text();
    }

    private record IntegerPart(String text) implements NumberFragment {}

    private record FractionPart(String text) implements NumberFragment {}

    private record ExponentPart(String text) implements NumberFragment {}
}
