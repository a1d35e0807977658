package com.callsign.resolution.table;

import com.callsign.resolution.core.model.Prefix;
import com.callsign.resolution.fixtures.ReferenceTableFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;

import static com.callsign.resolution.fixtures.ReferenceTableFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReferenceData Tests")
class ReferenceDataTest {

    private static final List<Instant> INSTANTS = List.of(
            Y1999, Y2001, Y2005, Y2015, TT_SPLIT_END, TT_SPLIT_START, WHITELIST_START, WHITELIST_END);

    private static final List<String> KEYS = List.of(
            "AB", "AB9", "SV", "SV9", "CC", "CC/A", "MM", "XM", "TT", "F", "W", "3D2", "3D2/R", "R",
            "AB1ZZ", "AB3BAD", "AB1YY", "AB2WW", "AB1CD", "", "ZZ");

    @ParameterizedTest
    @EnumSource(ReferenceDataBackend.class)
    @DisplayName("Should find prefixes valid at the instant")
    void findsPrefix(ReferenceDataBackend backend) {
        ReferenceData data = backend.create(ReferenceTableFixtures.standard());

        assertEquals(ALPHA, data.getPrefix("AB", Y2005).orElseThrow().adif());
        assertTrue(data.getPrefix("A", Y2005).isEmpty());
        assertTrue(data.getPrefix("ab", Y2005).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(ReferenceDataBackend.class)
    @DisplayName("Should pick the record whose window contains the instant")
    void timeWindowedPrefix(ReferenceDataBackend backend) {
        ReferenceData data = backend.create(ReferenceTableFixtures.standard());

        assertEquals(TANGO_OLD, data.getPrefix("TT", Y2005).orElseThrow().adif());
        assertEquals(TANGO_OLD, data.getPrefix("TT", TT_SPLIT_END).orElseThrow().adif());
        assertEquals(TANGO_NEW, data.getPrefix("TT", TT_SPLIT_START).orElseThrow().adif());
        assertEquals(TANGO_NEW, data.getPrefix("TT", Y2015).orElseThrow().adif());
    }

    @ParameterizedTest
    @EnumSource(ReferenceDataBackend.class)
    @DisplayName("Should honour exception windows")
    void callsignExceptionWindow(ReferenceDataBackend backend) {
        ReferenceData data = backend.create(ReferenceTableFixtures.standard());

        assertEquals(SIERRA, data.getCallsignException("AB1YY", Y2001).orElseThrow().adif());
        assertTrue(data.getCallsignException("AB1YY", Y2005).isEmpty());
        assertTrue(data.getCallsignException("AB1YY", Y1999).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(ReferenceDataBackend.class)
    @DisplayName("Should answer invalid operation and zone queries")
    void invalidOperationAndZone(ReferenceDataBackend backend) {
        ReferenceData data = backend.create(ReferenceTableFixtures.standard());

        assertTrue(data.isInvalidOperation("AB3BAD", Y2005));
        assertFalse(data.isInvalidOperation("AB3BA", Y2005));
        assertEquals(99, data.getZoneOverride("AB2WW", Y2005).getAsInt());
        assertTrue(data.getZoneOverride("AB2W", Y2005).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(ReferenceDataBackend.class)
    @DisplayName("Should find entities by ADIF identifier")
    void findsEntity(ReferenceDataBackend backend) {
        ReferenceData data = backend.create(ReferenceTableFixtures.standard());

        assertEquals("BRAVO", data.getEntity(BRAVO, Y2005).orElseThrow().getName());
        assertTrue(data.getEntity(12345, Y2005).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(ReferenceDataBackend.class)
    @DisplayName("First record in table order should win on overlapping windows")
    void firstRecordWins(ReferenceDataBackend backend) {
        ReferenceData data = backend.create(ReferenceTableFixtures.overlapping());

        Prefix prefix = data.getPrefix("OV", Y2005).orElseThrow();

        assertEquals(90, prefix.record());
    }

    @Test
    @DisplayName("Scanning and indexed backends should give identical answers")
    void backendsEquivalent() {
        ReferenceTable table = ReferenceTableFixtures.standard();
        ReferenceData scanning = new ScanningReferenceData(table);
        ReferenceData indexed = new IndexedReferenceData(table);

        for (Instant t : INSTANTS) {
            for (String key : KEYS) {
                assertEquals(scanning.getPrefix(key, t), indexed.getPrefix(key, t), key + " at " + t);
                assertEquals(scanning.getCallsignException(key, t), indexed.getCallsignException(key, t));
                assertEquals(scanning.getZoneException(key, t), indexed.getZoneException(key, t));
                assertEquals(scanning.isInvalidOperation(key, t), indexed.isInvalidOperation(key, t));
            }
            for (int adif : List.of(0, ALPHA, BRAVO, SIERRA, MIKE, 12345)) {
                assertEquals(scanning.getEntity(adif, t), indexed.getEntity(adif, t));
            }
        }
    }

    @Test
    @DisplayName("Query results should be the table's own records")
    void returnsTableRecords() {
        ReferenceTable table = ReferenceTableFixtures.standard();
        ReferenceData data = new IndexedReferenceData(table);

        assertSame(table.getPrefixes().get(0), data.getPrefix("AB", Y2005).orElseThrow());
    }
}
