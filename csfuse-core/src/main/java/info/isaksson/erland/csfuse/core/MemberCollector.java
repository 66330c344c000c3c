package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.syntax.CompilationUnit;
import info.isaksson.erland.csfuse.syntax.DirectiveSyntax;
import info.isaksson.erland.csfuse.syntax.MemberDeclaration;
import info.isaksson.erland.csfuse.syntax.MemberNode;
import info.isaksson.erland.csfuse.syntax.NamespaceDeclaration;
import info.isaksson.erland.csfuse.syntax.Trivia;
import info.isaksson.erland.csfuse.syntax.TriviaKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks parsed units and flattens every namespace into a single declaration list.
 *
 * <p>Namespaces (block or file-scoped, at any depth) are dissolved in place: their names go
 * to the namespace pool, their usings to the using pool, and their members are visited in
 * document order. Every other member is appended to the declaration list, optionally with
 * a provenance comment naming its file.</p>
 *
 * <p>Preprocessor directives sitting on syntax that does not survive flattening (namespace
 * headers and closing braces, usings, the end of the file) are moved onto the nearest
 * declaration of the same file, keeping their source order. A file that contributes no
 * declaration contributes none of those directives either. {@code #define} and
 * {@code #undef} are dropped everywhere since they are only legal at the top of a file.</p>
 */
public final class MemberCollector {

    private final boolean annotate;

    /** @param annotate whether to prefix each declaration with a {@code // ===== From: File.cs =====} line */
    public MemberCollector(boolean annotate) {
        this.annotate = annotate;
    }

    public CollectedMembers collect(List<ParsedUnit> units) {
        CollectedMembers out = new CollectedMembers();
        for (ParsedUnit unit : units) {
            collect(unit, out);
        }
        return out;
    }

    /** Append the contribution of one unit to {@code out}. */
    public void collect(ParsedUnit unit, CollectedMembers out) {
        CompilationUnit root = unit.root;
        FileScope file = new FileScope(unit.sourceFile.fileName(), out);

        out.externAliases.addAll(root.externAliases);
        out.usings.addAll(root.usings);
        out.attributeLists.addAll(root.attributeLists);
        file.holdAll(root.externAliases);
        file.holdAll(root.usings);
        file.holdAll(root.attributeLists);

        collectMembers(root.members, file, out);
        file.close(root.endOfFileTrivia);
        file.finish();
    }

    private void collectMembers(List<MemberNode> members, FileScope file, CollectedMembers out) {
        for (MemberNode member : members) {
            if (member instanceof NamespaceDeclaration) {
                NamespaceDeclaration ns = (NamespaceDeclaration) member;
                out.namespaceNames.add(ns.name);
                out.externAliases.addAll(ns.externAliases);
                out.usings.addAll(ns.usings);
                file.hold(ns.leadingTrivia);
                file.holdAll(ns.externAliases);
                file.holdAll(ns.usings);
                collectMembers(ns.members, file, out);
                file.close(ns.closingTrivia);
            } else {
                file.add((MemberDeclaration) member);
            }
        }
    }

    static String fileHeader(String fileName) {
        return "// ===== From: " + fileName + " =====";
    }

    static boolean isFileOnlyDirective(Trivia trivia) {
        if (trivia.kind != TriviaKind.DIRECTIVE) return false;
        String word = trivia.text.trim().substring(1).trim();
        return word.startsWith("define") || word.startsWith("undef");
    }

    private static List<Trivia> directives(List<Trivia> trivia) {
        List<Trivia> out = new ArrayList<>();
        for (Trivia t : trivia) {
            if (t.kind == TriviaKind.DIRECTIVE && !isFileOnlyDirective(t)) out.add(t);
        }
        return out;
    }

    /** Directives of one file still waiting for a declaration to ride on. */
    private final class FileScope {
        private final String fileName;
        private final CollectedMembers out;
        private final List<Trivia> pending = new ArrayList<>();
        private int last = -1;

        FileScope(String fileName, CollectedMembers out) {
            this.fileName = fileName;
            this.out = out;
        }

        void hold(List<Trivia> trivia) {
            pending.addAll(directives(trivia));
        }

        void holdAll(List<? extends DirectiveSyntax> nodes) {
            for (DirectiveSyntax node : nodes) {
                hold(node.preprocessorDirectives());
            }
        }

        void add(MemberDeclaration declaration) {
            List<Trivia> leading = new ArrayList<>(pending);
            pending.clear();
            for (Trivia t : declaration.leadingTrivia) {
                if (!isFileOnlyDirective(t)) leading.add(t);
            }
            MemberDeclaration moved = declaration.withTrivia(leading, declaration.trailingTrivia);
            out.declarations.add(annotate ? moved.withLeadingComment(fileHeader(fileName)) : moved);
            last = out.declarations.size() - 1;
        }

        /** Trivia that closes a scope goes after the last declaration unless earlier directives are still pending. */
        void close(List<Trivia> trivia) {
            List<Trivia> found = directives(trivia);
            if (found.isEmpty()) return;
            if (last < 0 || !pending.isEmpty()) {
                pending.addAll(found);
            } else {
                appendToLast(found);
            }
        }

        void finish() {
            if (last >= 0 && !pending.isEmpty()) appendToLast(pending);
            pending.clear();
        }

        private void appendToLast(List<Trivia> trivia) {
            MemberDeclaration target = out.declarations.get(last);
            List<Trivia> trailing = new ArrayList<>(target.trailingTrivia);
            trailing.addAll(trivia);
            out.declarations.set(last, target.withTrivia(target.leadingTrivia, trailing));
        }
    }
}
