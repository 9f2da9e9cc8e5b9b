package json.descent;

/// The closed set of reasons a tokenize or parse can fail.
/// Shared by the tokenizer and the deserializer.
public enum JsonError {
    /// Input ended while a token or value was expected.
    EOF("Unexpected end of input"),
    /// A character or token matched none of the alternatives allowed at that position.
    INVALID_TOKEN("Invalid token"),
    /// String scanning was entered without an opening quote.
    INVALID_STRING("Invalid string"),
    /// Unrecognized or unsupported escape sequence, including unicode escapes.
    INVALID_ESCAPE_CHAR("Invalid escape character"),
    /// Malformed numeric literal.
    INVALID_NUMBER("Invalid number"),
    /// Objects or arrays nested deeper than the configured maximum.
    DEPTH_EXCEEDED("Maximum nesting depth exceeded");

    private final String description;

    JsonError(String description) {
        this.description = description;
    }

    /// Human readable description used as the start of exception messages.
    public String description() {
        return description;
    }
}
