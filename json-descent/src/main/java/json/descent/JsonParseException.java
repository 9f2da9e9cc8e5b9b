package json.descent;

import java.util.Objects;

/// Exception thrown when JSON text cannot be tokenized or parsed.
/// The first error found aborts the parse; no partial value is ever produced.
public class JsonParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final JsonError error;
    private final int position;

    /// Creates a new parse exception without position information.
    public JsonParseException(JsonError error) {
        super(Objects.requireNonNull(error, "error must not be null").description());
        this.error = error;
        this.position = -1;
    }

    /// Creates a new parse exception with the offset in `input` where the error occurred.
    public JsonParseException(JsonError error, CharSequence input, int position) {
        super(formatMessage(Objects.requireNonNull(error, "error must not be null"), input, position));
        this.error = error;
        this.position = position;
    }

    /// Returns the kind of failure.
    public JsonError error() {
        return error;
    }

    /// Returns the offset in the input where the error occurred, or -1 if unknown.
    public int position() {
        return position;
    }

    private static String formatMessage(JsonError error, CharSequence input, int position) {
        if (input == null || position < 0) {
            return error.description();
        }
        final var sb = new StringBuilder();
        sb.append(error.description());
        sb.append(" at position ").append(position);
        if (position < input.length()) {
            sb.append(" (near '").append(input.charAt(position)).append("')");
        }
        return sb.toString();
    }
}
