package json.descent;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A node in the parsed JSON tree.
///
/// Values are immutable once built. Containers copy their members on construction, so a
/// tree is never shared with the maps and lists used to build it.
/// Numbers are kept as their literal text; callers convert them when they need to.
public sealed interface Value {

    /// JSON object. Keys are unique and their order carries no meaning.
    record ObjectValue(Map<String, Value> members) implements Value {
        public ObjectValue {
            Objects.requireNonNull(members, "members must not be null");
            members = Map.copyOf(members);
        }

        /// Returns the member for `key`, or null when absent.
        public Value get(String key) {
            return members.get(key);
        }
    }

    /// JSON array in source order.
    record ArrayValue(List<Value> elements) implements Value {
        public ArrayValue {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }

        public Value get(int index) {
            return elements.get(index);
        }
    }

    record StringValue(String text) implements Value {
        public StringValue {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// JSON number as the literal text found in the input, e.g. `-100.001e10`.
    record NumberValue(String text) implements Value {
        public NumberValue {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record BoolValue(boolean value) implements Value {}

    record NullValue() implements Value {}
}
