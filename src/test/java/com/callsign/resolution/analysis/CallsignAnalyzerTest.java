package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Adif;
import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.core.model.CallsignError;
import com.callsign.resolution.core.model.ResolutionSource;
import com.callsign.resolution.core.model.SpecialEntity;
import com.callsign.resolution.fixtures.ReferenceTableFixtures;
import com.callsign.resolution.table.ReferenceDataBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static com.callsign.resolution.fixtures.ReferenceTableFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CallsignAnalyzer Tests")
class CallsignAnalyzerTest {

    private CallsignAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new CallsignAnalyzer(ReferenceDataBackend.INDEXED.create(ReferenceTableFixtures.standard()));
    }

    private Callsign resolved(String call, Instant timestamp) {
        AnalysisResult result = analyzer.analyze(call, timestamp);
        assertTrue(result.isSuccess(), () -> call + " failed with " + result.getError().orElse(null));
        return result.getCallsign().orElseThrow();
    }

    private CallsignError failed(String call, Instant timestamp) {
        AnalysisResult result = analyzer.analyze(call, timestamp);
        assertFalse(result.isSuccess(), () -> call + " resolved to " + result.getCallsign().orElse(null));
        return result.getError().orElseThrow();
    }

    @Nested
    @DisplayName("Format check")
    class FormatCheck {

        @ParameterizedTest
        @ValueSource(strings = {"", "A", "/AB1CD", "AB1CD/", "ab1cd", "AB 1CD", "AB1CD-P", "AB1ÄD", "AB//CD", "AB1CD//P"})
        @DisplayName("Should reject calls with a basic format error")
        void basicFormat(String call) {
            assertEquals(CallsignError.BASIC_FORMAT, failed(call, Y2005));
        }

        @Test
        @DisplayName("Should reject null arguments")
        void nullArguments() {
            assertThrows(NullPointerException.class, () -> analyzer.analyze(null, Y2005));
            assertThrows(NullPointerException.class, () -> analyzer.analyze("AB1CD", null));
        }
    }

    @Nested
    @DisplayName("Plain prefixes")
    class PlainPrefixes {

        @ParameterizedTest
        @CsvSource({
                "AB1CD, 100, 10",
                "AB9CD, 200, 20",
                "SV1ABC, 300, 30",
                "CC1AB, 401, 41",
                "MM, 500, 14",
                "3D2AB, 700, 32"
        })
        @DisplayName("Should resolve the most specific prefix")
        void mostSpecific(String call, int adif, int cqZone) {
            Callsign callsign = resolved(call, Y2005);

            assertEquals(adif, callsign.getAdif());
            assertEquals(cqZone, callsign.getCqZone().orElseThrow());
            assertEquals(ResolutionSource.PREFIX, callsign.getSource());
            assertEquals(call, callsign.getCall());
        }

        @Test
        @DisplayName("Should pick the prefix valid at the instant")
        void timeWindowed() {
            assertEquals(TANGO_OLD, resolved("TT1AB", Y2005).getAdif());
            assertEquals(TANGO_OLD, resolved("TT1AB", TT_SPLIT_END).getAdif());
            assertEquals(TANGO_NEW, resolved("TT1AB", TT_SPLIT_START).getAdif());
        }

        @Test
        @DisplayName("Should fail when the call begins without a prefix")
        void beginWithoutPrefix() {
            assertEquals(CallsignError.BEGIN_WITHOUT_PREFIX, failed("QQ1AB", Y2005));
        }

        @Test
        @DisplayName("Ordinary appendices should keep the homecall prefix")
        void ordinaryAppendix() {
            Callsign callsign = resolved("AB1CD/P", Y2005);

            assertEquals(ALPHA, callsign.getAdif());
            assertEquals(ResolutionSource.PREFIX, callsign.getSource());
        }
    }

    @Nested
    @DisplayName("Invalid operations and callsign exceptions")
    class Exceptions {

        @Test
        @DisplayName("Exception should override the prefix")
        void exceptionOverridesPrefix() {
            Callsign callsign = resolved("AB1ZZ", Y2005);

            assertEquals(BRAVO, callsign.getAdif());
            assertEquals(ResolutionSource.CALLSIGN_EXCEPTION, callsign.getSource());
            assertEquals("OC", callsign.getContinent().orElseThrow());
        }

        @Test
        @DisplayName("Invalid operation should be checked before exceptions")
        void invalidOperationFirst() {
            assertEquals(CallsignError.INVALID_OPERATION, failed("AB3BAD", Y2005));
        }

        @Test
        @DisplayName("Exception should only apply within its window")
        void exceptionWindow() {
            assertEquals(SIERRA, resolved("AB1YY", Y2001).getAdif());
            assertEquals(ALPHA, resolved("AB1YY", Y2005).getAdif());
        }

        @Test
        @DisplayName("Exception should match the exact call only")
        void exactCallOnly() {
            Callsign callsign = resolved("AB1ZZ/P", Y2005);

            assertEquals(ALPHA, callsign.getAdif());
            assertEquals(ResolutionSource.PREFIX, callsign.getSource());
        }
    }

    @Nested
    @DisplayName("Special appendices")
    class SpecialAppendices {

        @ParameterizedTest
        @CsvSource({
                "AB1CD/MM, MARITIME_MOBILE",
                "AB1CD/AM, AERONAUTICAL_MOBILE",
                "AB1CD/SAT, SATELLITE",
                "SV1ABC/P/MM, MARITIME_MOBILE"
        })
        @DisplayName("Should resolve to no DXCC entity")
        void noEntity(String call, SpecialEntity expected) {
            Callsign callsign = resolved(call, Y2005);

            assertEquals(Adif.NO_DXCC, callsign.getAdif());
            assertTrue(callsign.isSpecialEntity());
            assertEquals(expected, callsign.getSpecialEntity().orElseThrow());
            assertEquals(ResolutionSource.SPECIAL_APPENDIX, callsign.getSource());
            assertTrue(callsign.getCqZone().isEmpty());
        }

        @Test
        @DisplayName("Should reject more than one special appendix")
        void multipleSpecial() {
            assertEquals(CallsignError.MULTIPLE_SPECIAL_APPENDICES, failed("AB1CD/MM/AM", Y2005));
        }

        @Test
        @DisplayName("Maritime mobile prefix should resolve to no DXCC entity")
        void maritimePrefix() {
            Callsign single = resolved("XM1AB", Y2005);
            Callsign withAppendix = resolved("XM1AB/P", Y2005);

            assertEquals(Adif.NO_DXCC, single.getAdif());
            assertEquals(ResolutionSource.MARITIME_PREFIX, single.getSource());
            assertEquals(SpecialEntity.MARITIME_MOBILE, withAppendix.getSpecialEntity().orElseThrow());
            assertEquals(ResolutionSource.MARITIME_PREFIX, withAppendix.getSource());
        }
    }

    @Nested
    @DisplayName("Single digit appendices")
    class DigitAppendices {

        @Test
        @DisplayName("Digit appendix should select a different prefix")
        void selectsDifferentPrefix() {
            Callsign callsign = resolved("SV1CD/9", Y2005);

            assertEquals(SIERRA_NINE, callsign.getAdif());
            assertEquals(31, callsign.getCqZone().orElseThrow());
            assertEquals("SV1CD/9", callsign.getCall());
        }

        @Test
        @DisplayName("Digit appendix without a different prefix should keep the homecall prefix")
        void samePrefix() {
            assertEquals(SIERRA, resolved("SV1CD/2", Y2005).getAdif());
        }

        @Test
        @DisplayName("Less specific prefix after substitution should keep the homecall prefix")
        void lessSpecificSubstitution() {
            // AB1CD only reaches AB, the homecall AB9CD matches the longer AB9
            Callsign callsign = resolved("AB9CD/1", Y2005);

            assertEquals(BRAVO, callsign.getAdif());
            assertEquals(20, callsign.getCqZone().orElseThrow());
        }

        @Test
        @DisplayName("Should reject more than one single digit appendix")
        void multipleDigits() {
            assertEquals(CallsignError.MULTIPLE_SINGLE_DIGIT_APPENDICES, failed("AB1CD/1/2", Y2005));
        }

        @Test
        @DisplayName("Special appendix should take precedence over digit appendices")
        void specialBeforeDigit() {
            assertEquals(Adif.NO_DXCC, resolved("SV1CD/9/MM", Y2005).getAdif());
        }
    }

    @Nested
    @DisplayName("Compound prefixes and two prefixes")
    class TwoPrefixes {

        @Test
        @DisplayName("Single letter appendix should form a compound prefix")
        void compoundWithAppendix() {
            assertEquals(CHARLIE_ALPHA, resolved("CC1AB/A", Y2005).getAdif());
            assertEquals(CHARLIE, resolved("CC1AB", Y2005).getAdif());
        }

        @ParameterizedTest
        @CsvSource({
                "F/W1ABC, 227",
                "W1ABC/F, 227",
                "W1ABC/F/P, 227",
                "SV/AB9CD, 300",
                "3D2AB/R, 701"
        })
        @DisplayName("Should pick the more specific of two prefixes")
        void moreSpecific(String call, int adif) {
            assertEquals(adif, resolved(call, Y2005).getAdif());
        }

        @Test
        @DisplayName("Should reject a third prefix")
        void thirdPrefix() {
            assertEquals(CallsignError.THIRD_PREFIX, failed("AB1CD/SV1AB/F1AB", Y2005));
        }
    }

    @Nested
    @DisplayName("Zone exceptions")
    class ZoneExceptions {

        @Test
        @DisplayName("Should override the zone of prefix results")
        void overridesZone() {
            Callsign callsign = resolved("AB2WW", Y2005);

            assertEquals(ALPHA, callsign.getAdif());
            assertEquals(99, callsign.getCqZone().orElseThrow());
            assertTrue(callsign.isZoneOverridden());
        }

        @Test
        @DisplayName("Should not override the zone of exception results")
        void notOnExceptions() {
            Callsign callsign = resolved("AB1ZZ", Y2005);

            assertEquals(21, callsign.getCqZone().orElseThrow());
            assertFalse(callsign.isZoneOverridden());
        }

        @Test
        @DisplayName("Should match the exact call only")
        void exactCall() {
            assertEquals(10, resolved("AB2WW/P", Y2005).getCqZone().orElseThrow());
        }
    }

    @Test
    @DisplayName("Repeated analysis should give equal results")
    void idempotent() {
        for (String call : new String[]{"AB1CD", "AB1ZZ", "AB3BAD", "SV1CD/9", "AB1CD/MM", "QQ1AB", "3D2AB/R"}) {
            assertEquals(analyzer.analyze(call, Y2005), analyzer.analyze(call, Y2005), call);
        }
    }

    @Test
    @DisplayName("Both backends should give the same results")
    void backendsAgree() {
        CallsignAnalyzer scanning = new CallsignAnalyzer(
                ReferenceDataBackend.SCAN.create(ReferenceTableFixtures.standard()));
        for (String call : new String[]{"AB1CD", "AB9CD", "AB1ZZ", "AB3BAD", "AB2WW", "SV1CD/9", "CC1AB/A",
                "XM1AB", "TT1AB", "F/W1ABC", "3D2AB/R", "AB1CD/1/2", "QQ1AB", "AB1YY"}) {
            for (Instant t : new Instant[]{Y1999, Y2001, Y2005, Y2015}) {
                assertEquals(scanning.analyze(call, t), analyzer.analyze(call, t), call + " at " + t);
            }
        }
    }
}
