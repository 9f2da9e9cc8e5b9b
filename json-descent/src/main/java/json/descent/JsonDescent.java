package json.descent;

import java.util.Objects;

/// Entry point for parsing complete JSON documents.
///
/// ```java
/// Value value = JsonDescent.parse("{\"name\": \"json-descent\", \"tags\": [1, 2.5e3, true, null]}");
/// if (value instanceof Value.ObjectValue object) {
///     Value name = object.get("name");
/// }
/// ```
///
/// Use {@link Deserializer} directly to parse a value that is followed by other text.
public final class JsonDescent {

    private JsonDescent() {
        throw new AssertionError("JsonDescent cannot be instantiated");
    }

    /// Parses `text` as a single JSON document. Whitespace may surround the value; nothing else may.
    /// @throws NullPointerException if text is null
    /// @throws JsonParseException if the text is not a single valid JSON value
    public static Value parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new Deserializer(text).parseDocument();
    }

    /// Same as {@link #parse(String)} with an explicit nesting depth limit.
    public static Value parse(String text, int maxDepth) {
        Objects.requireNonNull(text, "text must not be null");
        return new Deserializer(text, maxDepth).parseDocument();
    }
}
