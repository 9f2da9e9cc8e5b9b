package json.descent;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Property-based tests for the deserializer.
/// Random documents are rendered compactly and with random whitespace between tokens;
/// both renderings must parse to the tree the document was generated from.
class DeserializerPropertyTest extends JsonDescentLoggingConfig {

    private static final Logger LOG = Logger.getLogger(DeserializerPropertyTest.class.getName());

    private static final List<String> NUMBERS = List.of("0", "-0", "7", "-42", "3.25", "-0.5e-3", "1E+9", "12345678901234567890");
    private static final List<String> STRINGS = List.of("", "a", "hello world", "quote\"d", "back\\slash", "tab\tline\nfeed", "{[:,]}");
    private static final String WHITESPACE = " \t\r\n";

    @Property(tries = 200)
    void whitespaceBetweenTokensDoesNotChangeTheTree(@ForAll long seed, @ForAll @IntRange(min = 0, max = 5) int depth) {
        final var random = new Random(seed);
        final Value expected = generate(random, depth);

        final String compact = render(expected, new Random(seed), false);
        final String spaced = render(expected, new Random(seed ^ 0x5DEECE66DL), true);
        LOG.finer(() -> "Compact: " + compact);

        assertThat(JsonDescent.parse(compact)).isEqualTo(expected);
        assertThat(JsonDescent.parse(spaced)).isEqualTo(expected);
    }

    @Property(tries = 100)
    void trailingCommaIsAlwaysRejected(@ForAll @IntRange(min = 1, max = 6) int size, @ForAll boolean object) {
        final var sb = new StringBuilder(object ? "{" : "[");
        for (int i = 0; i < size; i++) {
            if (object) {
                sb.append("\"k").append(i).append("\":");
            }
            sb.append(i).append(',');
        }
        sb.append(object ? "}" : "]");

        final var input = sb.toString();
        assertThatThrownBy(() -> new Deserializer(input).parse())
            .isInstanceOf(JsonParseException.class);
    }

    private static Value generate(Random random, int depth) {
        final int kind = random.nextInt(depth > 0 ? 6 : 4);
        return switch (kind) {
            case 0 -> new Value.NumberValue(NUMBERS.get(random.nextInt(NUMBERS.size())));
            case 1 -> new Value.StringValue(STRINGS.get(random.nextInt(STRINGS.size())));
            case 2 -> new Value.BoolValue(random.nextBoolean());
            case 3 -> new Value.NullValue();
            case 4 -> {
                final List<Value> elements = new ArrayList<>();
                final int size = random.nextInt(4);
                for (int i = 0; i < size; i++) {
                    elements.add(generate(random, depth - 1));
                }
                yield new Value.ArrayValue(elements);
            }
            default -> {
                final Map<String, Value> members = new LinkedHashMap<>();
                final int size = random.nextInt(4);
                for (int i = 0; i < size; i++) {
                    members.put("key" + i, generate(random, depth - 1));
                }
                yield new Value.ObjectValue(members);
            }
        };
    }

    private static String render(Value value, Random random, boolean spaced) {
        final var sb = new StringBuilder();
        render(value, sb, random, spaced);
        return sb.toString();
    }

    private static void render(Value value, StringBuilder sb, Random random, boolean spaced) {
        space(sb, random, spaced);
        if (value instanceof Value.ObjectValue object) {
            sb.append('{');
            var first = true;
            for (var entry : object.members().entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                space(sb, random, spaced);
                quote(entry.getKey(), sb);
                space(sb, random, spaced);
                sb.append(':');
                render(entry.getValue(), sb, random, spaced);
                space(sb, random, spaced);
            }
            space(sb, random, spaced);
            sb.append('}');
        } else if (value instanceof Value.ArrayValue array) {
            sb.append('[');
            var first = true;
            for (var element : array.elements()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                render(element, sb, random, spaced);
                space(sb, random, spaced);
            }
            space(sb, random, spaced);
            sb.append(']');
        } else if (value instanceof Value.StringValue string) {
            quote(string.text(), sb);
        } else if (value instanceof Value.NumberValue number) {
            sb.append(number.text());
        } else if (value instanceof Value.BoolValue bool) {
            sb.append(bool.value());
        } else {
            sb.append("null");
        }
        space(sb, random, spaced);
    }

    private static void quote(String text, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        sb.append('"');
    }

    private static void space(StringBuilder sb, Random random, boolean spaced) {
        if (!spaced) {
            return;
        }
        final int count = random.nextInt(3);
        for (int i = 0; i < count; i++) {
            sb.append(WHITESPACE.charAt(random.nextInt(WHITESPACE.length())));
        }
    }
}
