package info.isaksson.erland.csfuse.syntax;

/** Kinds of non-token source text attached to tokens. */
public enum TriviaKind {
    WHITESPACE,
    END_OF_LINE,
    SINGLE_LINE_COMMENT,
    /** {@code ///} documentation comment line. */
    DOC_COMMENT,
    MULTI_LINE_COMMENT,
    /** Preprocessor directive line ({@code #if}, {@code #region}, ...). */
    DIRECTIVE;

    public boolean isComment() {
        return this == SINGLE_LINE_COMMENT || this == DOC_COMMENT || this == MULTI_LINE_COMMENT;
    }
}
