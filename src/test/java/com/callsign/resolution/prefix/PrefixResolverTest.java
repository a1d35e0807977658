package com.callsign.resolution.prefix;

import com.callsign.resolution.fixtures.ReferenceTableFixtures;
import com.callsign.resolution.table.IndexedReferenceData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.callsign.resolution.fixtures.ReferenceTableFixtures.Y2005;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PrefixResolver Tests")
class PrefixResolverTest {

    private PrefixResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PrefixResolver(new IndexedReferenceData(ReferenceTableFixtures.standard()));
    }

    @ParameterizedTest
    @CsvSource({
            "AB1CD, AB, 3",
            "AB9CD, AB9, 2",
            "AB, AB, 0",
            "SV9XYZ, SV9, 3",
            "W1AW, W, 3",
            "3D2AB, 3D2, 2"
    })
    @DisplayName("Should match the longest prefix")
    void longestPrefix(String candidate, String expectedPrefix, int expectedRemoved) {
        PrefixMatch match = resolver.resolve(candidate, Y2005).orElseThrow();

        assertEquals(expectedPrefix, match.prefix().call());
        assertEquals(expectedRemoved, match.charsRemoved());
    }

    @Test
    @DisplayName("Should prefer compound prefix formed with a single letter appendix")
    void compoundPrefix() {
        PrefixMatch match = resolver.resolve("CC1AB", Y2005, List.of("A")).orElseThrow();

        assertEquals("CC/A", match.prefix().call());
        assertEquals(3, match.charsRemoved());
    }

    @Test
    @DisplayName("Should ignore appendices longer than one letter")
    void ignoresLongAppendices() {
        PrefixMatch match = resolver.resolve("CC1AB", Y2005, List.of("AM", "1", "QRP")).orElseThrow();

        assertEquals("CC", match.prefix().call());
    }

    @Test
    @DisplayName("Should return empty when not even the first character is a prefix")
    void noMatch() {
        assertTrue(resolver.resolve("QQ1AB", Y2005).isEmpty());
    }

    @Test
    @DisplayName("Should reject empty candidate")
    void emptyCandidate() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve("", Y2005));
    }

    @ParameterizedTest
    @ValueSource(strings = {"AB1CD", "AB9", "SV9XYZ", "W", "3D2AB", "TT1ABCDEFG", "F5XYZ"})
    @DisplayName("Removed characters should stay below the candidate length")
    void charsRemovedBounded(String candidate) {
        PrefixMatch match = resolver.resolve(candidate, Y2005, List.of("A", "R")).orElseThrow();

        assertTrue(match.charsRemoved() <= candidate.length() - 1);
        assertTrue(match.charsRemoved() >= 0);
    }

    @Test
    @DisplayName("Single letter check should accept letters only")
    void singleLetter() {
        assertTrue(PrefixResolver.isSingleLetter("A"));
        assertFalse(PrefixResolver.isSingleLetter("9"));
        assertFalse(PrefixResolver.isSingleLetter("AB"));
        assertFalse(PrefixResolver.isSingleLetter(null));
    }

    @Test
    @DisplayName("Fewer removed characters should be more specific")
    void specificity() {
        PrefixMatch exact = resolver.resolve("SV9", Y2005).orElseThrow();
        PrefixMatch loose = resolver.resolve("SV1ABC", Y2005).orElseThrow();

        assertTrue(exact.isAtLeastAsSpecificAs(loose));
        assertFalse(loose.isAtLeastAsSpecificAs(exact));
        assertTrue(exact.isAtLeastAsSpecificAs(exact));
    }
}
