package json.descent;

import java.util.Objects;

/// Lexical unit produced by {@link Tokenizer#next()}.
///
/// The set of tokens is closed:
/// - structural punctuation: `{ } [ ] , :` with no payload
/// - StringToken: unescaped string contents without the surrounding quotes
/// - NumberToken: the numeric literal exactly as written
/// - BoolToken and NullToken: the `true`, `false` and `null` literals
public sealed interface Token {

    Token LEFT_BRACE = new LeftBrace();
    Token RIGHT_BRACE = new RightBrace();
    Token LEFT_BRACKET = new LeftBracket();
    Token RIGHT_BRACKET = new RightBracket();
    Token COMMA = new Comma();
    Token COLON = new Colon();

    /// Single character punctuation, the only tokens {@link Tokenizer#eatToken(Token)} can consume.
    sealed interface Structural extends Token permits LeftBrace, RightBrace, LeftBracket, RightBracket, Comma, Colon {
        char symbol();
    }

    record LeftBrace() implements Structural {
        public char symbol() {
            return '{';
        }
    }

    record RightBrace() implements Structural {
        public char symbol() {
            return '}';
        }
    }

    record LeftBracket() implements Structural {
        public char symbol() {
            return '[';
        }
    }

    record RightBracket() implements Structural {
        public char symbol() {
            return ']';
        }
    }

    record Comma() implements Structural {
        public char symbol() {
            return ',';
        }
    }

    record Colon() implements Structural {
        public char symbol() {
            return ':';
        }
    }

    /// A string literal with escapes already resolved.
    record StringToken(String text) implements Token {
        public StringToken {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// A number literal, kept as text so no precision or formatting is lost.
    record NumberToken(String text) implements Token {
        public NumberToken {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record BoolToken(boolean value) implements Token {}

    record NullToken() implements Token {}
}
