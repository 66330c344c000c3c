package info.isaksson.erland.csfuse.syntax;

/**
 * Thrown when C# source text is not structurally valid.
 *
 * <p>Unchecked; a syntax error aborts the whole fusion run.</p>
 */
public final class SourceSyntaxException extends RuntimeException {

    private final String sourceName;
    private final int line;
    private final int column;
    private final String detail;

    public SourceSyntaxException(String sourceName, int line, int column, String detail) {
        super(format(sourceName, line, column, detail));
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    static SourceSyntaxException at(String sourceName, String text, int offset, String detail) {
        return new SourceSyntaxException(
                sourceName,
                SourceColumns.lineOf(text, offset),
                SourceColumns.columnOf(text, offset) + 1,
                detail);
    }

    public String getSourceName() {
        return sourceName;
    }

    /** 1-based. */
    public int getLine() {
        return line;
    }

    /** 1-based. */
    public int getColumn() {
        return column;
    }

    public String getDetail() {
        return detail;
    }

    private static String format(String sourceName, int line, int column, String detail) {
        String where = sourceName == null || sourceName.isBlank() ? "<source>" : sourceName;
        return where + "(" + line + "," + column + "): syntax error: " + detail;
    }
}
