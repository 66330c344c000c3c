package info.isaksson.erland.csfuse.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link CompilationUnit} as canonical C# text.
 *
 * <p>Layout rules: four-space indentation, {@code \n} line endings, directives in canonical
 * form, one blank line between members, block namespaces with the brace on its own line.
 * Comments and preprocessor directives in leading trivia are kept one per line; blank
 * lines in trivia are dropped. Member bodies keep their own line structure and are only
 * shifted to the new indentation; lines inside multi-line string literals are emitted
 * untouched.</p>
 *
 * <p>The output is a pure function of the tree, and formatting the parse of formatted text
 * reproduces it exactly.</p>
 */
public final class CSharpFormatter {

    static final String INDENT = "    ";

    public String format(CompilationUnit unit) {
        if (unit == null) throw new IllegalArgumentException("unit is null");
        List<String> lines = new ArrayList<>();

        for (ExternAliasDirective e : unit.externAliases) {
            lines.add(e.canonicalText());
        }
        for (UsingDirective u : unit.usings) {
            lines.add(u.canonicalText());
        }
        if (!unit.attributeLists.isEmpty()) {
            separate(lines);
            for (GlobalAttributeList a : unit.attributeLists) {
                lines.add(a.canonicalText());
            }
        }
        writeMembers(lines, unit.members, 0);
        if (hasVisibleTrivia(unit.endOfFileTrivia)) {
            separate(lines);
            writeTrivia(lines, unit.endOfFileTrivia, 0);
        }

        if (lines.isEmpty()) return "";
        return String.join("\n", lines) + "\n";
    }

    private void writeMembers(List<String> lines, List<MemberNode> members, int depth) {
        for (MemberNode m : members) {
            separate(lines);
            if (m instanceof NamespaceDeclaration) {
                writeNamespace(lines, (NamespaceDeclaration) m, depth);
            } else {
                writeDeclaration(lines, (MemberDeclaration) m, depth);
            }
        }
    }

    private void writeNamespace(List<String> lines, NamespaceDeclaration ns, int depth) {
        String indent = indent(depth);
        writeTrivia(lines, ns.leadingTrivia, depth);

        if (ns.fileScoped) {
            lines.add(indent + "namespace " + ns.name + ";");
            if (!ns.externAliases.isEmpty() || !ns.usings.isEmpty()) {
                separate(lines);
                writeDirectives(lines, ns, depth);
            }
            writeMembers(lines, ns.members, depth);
            return;
        }

        lines.add(indent + "namespace " + ns.name);
        lines.add(indent + "{");
        writeDirectives(lines, ns, depth + 1);
        writeMembers(lines, ns.members, depth + 1);
        if (hasVisibleTrivia(ns.closingTrivia)) {
            separate(lines);
            writeTrivia(lines, ns.closingTrivia, depth + 1);
        }
        lines.add(indent + "}");
    }

    private void writeDirectives(List<String> lines, NamespaceDeclaration ns, int depth) {
        String indent = indent(depth);
        for (ExternAliasDirective e : ns.externAliases) {
            lines.add(indent + e.canonicalText());
        }
        for (UsingDirective u : ns.usings) {
            lines.add(indent + u.canonicalText());
        }
    }

    private void writeDeclaration(List<String> lines, MemberDeclaration m, int depth) {
        String indent = indent(depth);
        writeTrivia(lines, m.leadingTrivia, depth);

        List<String> body = m.lines();
        for (int i = 0; i < body.size(); i++) {
            String line = body.get(i);
            if (i == 0) {
                lines.add(indent + SourceColumns.stripTrailing(line));
            } else if (m.verbatimLines.contains(i)) {
                lines.add(line);
            } else {
                lines.add(indented(indent, SourceColumns.stripIndent(line, m.column)));
            }
        }
        writeTrivia(lines, m.trailingTrivia, depth);
    }

    private void writeTrivia(List<String> lines, List<Trivia> trivia, int depth) {
        String indent = indent(depth);
        for (Trivia t : trivia) {
            switch (t.kind) {
                case SINGLE_LINE_COMMENT:
                case DOC_COMMENT:
                    lines.add(indent + SourceColumns.stripTrailing(t.text));
                    break;
                case MULTI_LINE_COMMENT: {
                    String[] parts = t.text.replace("\r\n", "\n").split("\n", -1);
                    lines.add(indent + SourceColumns.stripTrailing(parts[0]));
                    for (int i = 1; i < parts.length; i++) {
                        lines.add(indented(indent, SourceColumns.stripIndent(parts[i], t.column)));
                    }
                    break;
                }
                case DIRECTIVE: {
                    String directive = SourceColumns.stripTrailing(t.text);
                    lines.add(isIndentedDirective(directive) ? indent + directive : directive);
                    break;
                }
                default:
                    break;
            }
        }
    }

    /** {@code #region}/{@code #endregion}/{@code #pragma} follow the code; conditionals stay in column 0. */
    private static boolean isIndentedDirective(String directive) {
        String word = directive.substring(1).trim();
        return word.startsWith("region") || word.startsWith("endregion") || word.startsWith("pragma");
    }

    private static boolean hasVisibleTrivia(List<Trivia> trivia) {
        for (Trivia t : trivia) {
            if (t.kind.isComment() || t.kind == TriviaKind.DIRECTIVE) return true;
        }
        return false;
    }

    private static void separate(List<String> lines) {
        if (lines.isEmpty()) return;
        String last = lines.get(lines.size() - 1);
        if (last.isEmpty() || last.trim().equals("{")) return;
        lines.add("");
    }

    private static String indented(String indent, String content) {
        String trimmed = SourceColumns.stripTrailing(content);
        return trimmed.isEmpty() ? "" : indent + trimmed;
    }

    private static String indent(int depth) {
        return INDENT.repeat(depth);
    }
}
