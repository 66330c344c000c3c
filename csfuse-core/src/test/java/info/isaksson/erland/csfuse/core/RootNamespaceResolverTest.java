package info.isaksson.erland.csfuse.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RootNamespaceResolverTest {

    private final RootNamespaceResolver resolver = new RootNamespaceResolver();

    @Test
    void mostFrequentFirstSegmentWins() {
        List<String> names = List.of("Foo", "Bar.Core", "Foo.Sub", "Bar", "Foo.Sub.Deep");

        assertEquals("Foo", resolver.resolve(names, null));
    }

    @Test
    void tiesGoToTheOrdinallySmallestSegment() {
        assertEquals("Bar", resolver.resolve(List.of("Foo", "Foo.X", "Bar.Y", "Bar"), null));
        // ordinal: upper case sorts before lower case
        assertEquals("Zed", resolver.resolve(List.of("alpha", "Zed"), null));
    }

    @Test
    void forcedNameWinsAndIsTrimmed() {
        assertEquals("My.App", resolver.resolve(List.of("Foo", "Foo"), "  My.App "));
    }

    @Test
    void blankForcedNameIsIgnored() {
        assertEquals("Foo", resolver.resolve(List.of("Foo"), "   "));
    }

    @Test
    void fallsBackToDefaultWithoutNamespaces() {
        assertEquals(RootNamespaceResolver.DEFAULT_ROOT_NAMESPACE, resolver.resolve(List.of(), null));
        assertEquals("Merged", resolver.resolve(null, ""));
    }

    @Test
    void returnsOnlyTheSegment() {
        assertEquals("Acme", resolver.resolve(List.of("Acme.Shop.Cart"), null));
        assertEquals("Acme", RootNamespaceResolver.firstSegment("Acme.Shop"));
    }
}
