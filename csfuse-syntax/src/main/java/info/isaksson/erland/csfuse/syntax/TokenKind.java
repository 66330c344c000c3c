package info.isaksson.erland.csfuse.syntax;

public enum TokenKind {
    /** Identifiers and keywords (including {@code @verbatim} identifiers). */
    IDENTIFIER,
    NUMBER,
    /** Any string literal form: regular, verbatim, interpolated or raw. */
    STRING,
    CHAR,
    PUNCTUATION,
    EOF
}
