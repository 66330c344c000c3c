package info.isaksson.erland.csfuse.syntax;

import java.util.List;

/** {@code [assembly: ...]} or {@code [module: ...]} at compilation-unit level. */
public final class GlobalAttributeList extends DirectiveSyntax {

    /** {@code assembly} or {@code module}. */
    public final String target;

    GlobalAttributeList(List<Token> tokens, String target) {
        super(tokens);
        this.target = target;
    }
}
