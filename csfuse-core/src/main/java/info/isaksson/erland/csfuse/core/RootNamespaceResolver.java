package info.isaksson.erland.csfuse.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the namespace that wraps the fused output.
 *
 * <p>A forced name wins unconditionally. Otherwise the most frequent first segment of the
 * observed namespace names is used ({@code Foo} for {@code Foo.Sub}); ties go to the
 * ordinally smallest segment.</p>
 */
public final class RootNamespaceResolver {

    public static final String DEFAULT_ROOT_NAMESPACE = "Merged";

    public String resolve(List<String> namespaceNames, String forcedName) {
        if (forcedName != null && !forcedName.isBlank()) {
            return forcedName.trim();
        }
        if (namespaceNames == null || namespaceNames.isEmpty()) {
            return DEFAULT_ROOT_NAMESPACE;
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String name : namespaceNames) {
            if (name == null) continue;
            String segment = firstSegment(name);
            if (segment.isBlank()) continue;
            counts.merge(segment, 1, Integer::sum);
        }

        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            int count = e.getValue();
            if (best == null || count > bestCount || (count == bestCount && e.getKey().compareTo(best) < 0)) {
                best = e.getKey();
                bestCount = count;
            }
        }
        return best == null ? DEFAULT_ROOT_NAMESPACE : best;
    }

    static String firstSegment(String name) {
        int dot = name.indexOf('.');
        return (dot < 0 ? name : name.substring(0, dot)).trim();
    }
}
