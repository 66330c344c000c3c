package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.syntax.ExternAliasDirective;
import info.isaksson.erland.csfuse.syntax.GlobalAttributeList;
import info.isaksson.erland.csfuse.syntax.MemberDeclaration;
import info.isaksson.erland.csfuse.syntax.UsingDirective;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulators filled by {@link MemberCollector} during one fusion run.
 *
 * <p>All lists are in collection order: file order first, then document order.</p>
 */
public final class CollectedMembers {
    /** Flattened declarations, never deduplicated. */
    public final List<MemberDeclaration> declarations = new ArrayList<>();
    /** Raw using directives, duplicates included. */
    public final List<UsingDirective> usings = new ArrayList<>();
    /** Name of every namespace seen, at any depth, duplicates included. */
    public final List<String> namespaceNames = new ArrayList<>();
    public final List<ExternAliasDirective> externAliases = new ArrayList<>();
    public final List<GlobalAttributeList> attributeLists = new ArrayList<>();
}
