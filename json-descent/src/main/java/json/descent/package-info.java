/// A small recursive descent JSON parser.
///
/// {@link json.descent.Tokenizer} scans text into {@link json.descent.Token}s and
/// {@link json.descent.Deserializer} builds an immutable {@link json.descent.Value} tree from them.
/// Numbers stay as their literal text. Every failure is reported as a
/// {@link json.descent.JsonParseException} carrying a {@link json.descent.JsonError}.
package json.descent;
