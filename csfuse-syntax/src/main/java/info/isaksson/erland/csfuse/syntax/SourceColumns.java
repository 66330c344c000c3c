package info.isaksson.erland.csfuse.syntax;

/** Column and line arithmetic over source text. */
final class SourceColumns {

    static final int TAB_WIDTH = 4;

    private SourceColumns() {}

    /** Visual column of {@code offset}, tabs expanded. */
    static int columnOf(String text, int offset) {
        int lineStart = offset;
        while (lineStart > 0 && text.charAt(lineStart - 1) != '\n' && text.charAt(lineStart - 1) != '\r') {
            lineStart--;
        }
        int col = 0;
        for (int i = lineStart; i < offset; i++) {
            col = advance(col, text.charAt(i));
        }
        return col;
    }

    /** 1-based line number of {@code offset}. */
    static int lineOf(String text, int offset) {
        int line = 1;
        int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }

    static int advance(int column, char c) {
        if (c == '\t') {
            return (column / TAB_WIDTH + 1) * TAB_WIDTH;
        }
        return column + 1;
    }

    /**
     * Remove {@code columns} columns of leading whitespace from a line and re-express what
     * is left of the indentation as spaces. Lines indented less than that lose all of it.
     */
    static String stripIndent(String line, int columns) {
        int col = 0;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c != ' ' && c != '\t') break;
            col = advance(col, c);
            i++;
        }
        return " ".repeat(Math.max(0, col - columns)) + line.substring(i);
    }

    static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) end--;
        return line.substring(0, end);
    }
}
