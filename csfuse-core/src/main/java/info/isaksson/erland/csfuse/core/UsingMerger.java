package info.isaksson.erland.csfuse.core;

import info.isaksson.erland.csfuse.syntax.DirectiveSyntax;
import info.isaksson.erland.csfuse.syntax.UsingDirective;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicates and orders using directives.
 *
 * <p>Directives are equal when their canonical text is equal; the first occurrence is
 * kept. Directives importing from the standard library root ({@code System}) sort first,
 * then each group is ordered by ordinal comparison of the canonical text.</p>
 */
public final class UsingMerger {

    public static final String STANDARD_LIBRARY_ROOT = "System";

    private final String standardLibraryRoot;

    public UsingMerger() {
        this(STANDARD_LIBRARY_ROOT);
    }

    public UsingMerger(String standardLibraryRoot) {
        if (standardLibraryRoot == null || standardLibraryRoot.isBlank()) {
            throw new IllegalArgumentException("standardLibraryRoot must not be blank");
        }
        this.standardLibraryRoot = standardLibraryRoot;
    }

    public List<UsingDirective> merge(List<UsingDirective> usings) {
        List<UsingDirective> unique = firstOccurrences(usings);
        unique.sort(Comparator
                .comparing((UsingDirective u) -> !isStandardLibrary(u))
                .thenComparing(UsingDirective::canonicalText));
        return unique;
    }

    public boolean isStandardLibrary(UsingDirective using) {
        return standardLibraryRoot.equals(using.rootSegment());
    }

    /** Keep the first directive of each canonical text, in encounter order. */
    public static <T extends DirectiveSyntax> List<T> firstOccurrences(List<T> directives) {
        Map<String, T> seen = new LinkedHashMap<>();
        for (T d : directives) {
            seen.putIfAbsent(d.canonicalText(), d);
        }
        return new ArrayList<>(seen.values());
    }
}
