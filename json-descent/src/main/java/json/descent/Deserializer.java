package json.descent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Recursive descent parser that drives a {@link Tokenizer} to build a {@link Value} tree.
///
/// Grammar:
/// - value: object | array | string | number | true | false | null
/// - object: `{` `}` | `{` string `:` value (`,` string `:` value)* `}`
/// - array: `[` `]` | `[` value (`,` value)* `]`
///
/// Whitespace is allowed between any two tokens. Duplicate object keys keep the last value.
/// The first error aborts the parse.
///
/// Instances are single use and not thread safe.
public final class Deserializer {

    private static final Logger LOG = Logger.getLogger(Deserializer.class.getName());

    private final Tokenizer tokenizer;
    private final int maxDepth;
    private int depth;

    /// Creates a deserializer using the depth limit from {@link ParserConfig#defaults()}.
    /// @throws NullPointerException if input is null
    public Deserializer(String input) {
        this(input, ParserConfig.defaults().maxDepth());
    }

    /// Creates a deserializer with an explicit nesting depth limit.
    /// @throws NullPointerException if input is null
    /// @throws IllegalArgumentException if maxDepth is not positive
    public Deserializer(String input, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        this.tokenizer = new Tokenizer(input);
        this.maxDepth = maxDepth;
    }

    /// Parses one value starting at the current position.
    ///
    /// Input after the value is left unconsumed, so a caller can parse a prefix of a larger text.
    /// @return the parsed value, never null
    /// @throws JsonParseException on the first lexical or grammar error
    public Value parse() {
        LOG.fine(() -> "Parsing value at position " + tokenizer.position());
        final Value result = value();
        LOG.fine(() -> "Parsed " + result.getClass().getSimpleName() + " ending at " + tokenizer.position());
        return result;
    }

    /// Parses one value and requires that only whitespace follows it.
    /// @throws JsonParseException with {@link JsonError#INVALID_TOKEN} if anything else remains
    public Value parseDocument() {
        final Value result = parse();
        tokenizer.eatWhitespaces();
        if (!tokenizer.atEnd()) {
            throw tokenizer.error(JsonError.INVALID_TOKEN);
        }
        return result;
    }

    private Value value() {
        tokenizer.eatWhitespaces();

        final Token token = tokenizer.next();
        if (token instanceof Token.LeftBrace) {
            return object();
        }
        if (token instanceof Token.LeftBracket) {
            return array();
        }
        if (token instanceof Token.StringToken string) {
            return new Value.StringValue(string.text());
        }
        if (token instanceof Token.NumberToken number) {
            return new Value.NumberValue(number.text());
        }
        if (token instanceof Token.BoolToken bool) {
            return new Value.BoolValue(bool.value());
        }
        if (token instanceof Token.NullToken) {
            return new Value.NullValue();
        }
        // a structural token where a value must start
        throw tokenizer.error(JsonError.INVALID_TOKEN);
    }

    private Value.ObjectValue object() {
        enter();
        final Map<String, Value> members = new HashMap<>();

        tokenizer.eatWhitespaces();
        if (tokenizer.eatToken(Token.RIGHT_BRACE)) {
            return leave(new Value.ObjectValue(members));
        }

        while (true) {
            tokenizer.eatWhitespaces();

            if (!(tokenizer.next() instanceof Token.StringToken key)) {
                break;
            }

            tokenizer.eatWhitespaces();
            if (!tokenizer.eatToken(Token.COLON)) {
                break;
            }

            final Value member = value();
            members.put(key.text(), member);

            tokenizer.eatWhitespaces();
            if (tokenizer.eatToken(Token.RIGHT_BRACE)) {
                return leave(new Value.ObjectValue(members));
            }
            if (!tokenizer.eatToken(Token.COMMA)) {
                break;
            }
        }

        throw tokenizer.error(JsonError.INVALID_TOKEN);
    }

    private Value.ArrayValue array() {
        enter();
        final List<Value> elements = new ArrayList<>();

        tokenizer.eatWhitespaces();
        if (tokenizer.eatToken(Token.RIGHT_BRACKET)) {
            return leave(new Value.ArrayValue(elements));
        }

        while (true) {
            elements.add(value());

            tokenizer.eatWhitespaces();
            if (tokenizer.eatToken(Token.RIGHT_BRACKET)) {
                return leave(new Value.ArrayValue(elements));
            }
            if (!tokenizer.eatToken(Token.COMMA)) {
                throw tokenizer.error(JsonError.INVALID_TOKEN);
            }
        }
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw tokenizer.error(JsonError.DEPTH_EXCEEDED);
        }
        LOG.finer(() -> "Entering container at depth " + depth);
    }

    private <T extends Value> T leave(T container) {
        depth--;
        return container;
    }
}
