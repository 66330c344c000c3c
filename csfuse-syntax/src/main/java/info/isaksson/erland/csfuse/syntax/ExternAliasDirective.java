package info.isaksson.erland.csfuse.syntax;

import java.util.List;

/** {@code extern alias Name;} */
public final class ExternAliasDirective extends DirectiveSyntax {

    public final String alias;

    ExternAliasDirective(List<Token> tokens, String alias) {
        super(tokens);
        this.alias = alias;
    }
}
