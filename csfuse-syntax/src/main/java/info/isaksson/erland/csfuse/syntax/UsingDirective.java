package info.isaksson.erland.csfuse.syntax;

import java.util.List;

/**
 * A using directive: {@code using X;}, {@code using static X;}, {@code using A = X;}, with
 * optional {@code global} and {@code unsafe} modifiers.
 */
public final class UsingDirective extends DirectiveSyntax {

    public final boolean global;
    public final boolean isStatic;
    /** Alias name, or null when the directive is not an alias. */
    public final String alias;
    /** Canonical text of the imported namespace or type. */
    public final String name;

    UsingDirective(List<Token> tokens, boolean global, boolean isStatic, String alias, String name) {
        super(tokens);
        this.global = global;
        this.isStatic = isStatic;
        this.alias = alias;
        this.name = name;
    }

    /**
     * First segment of {@link #name}, ignoring a {@code global::} qualifier:
     * {@code System} for {@code System.Collections.Generic}.
     */
    public String rootSegment() {
        String n = name.startsWith("global::") ? name.substring("global::".length()) : name;
        int end = n.length();
        for (int i = 0; i < n.length(); i++) {
            char c = n.charAt(i);
            if (c == '.' || c == '<' || c == ':') {
                end = i;
                break;
            }
        }
        return n.substring(0, end);
    }
}
