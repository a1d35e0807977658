package com.callsign.resolution.segment;

import com.callsign.resolution.core.model.CallsignError;
import com.callsign.resolution.fixtures.ReferenceTableFixtures;
import com.callsign.resolution.prefix.PrefixResolver;
import com.callsign.resolution.table.ScanningReferenceData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.callsign.resolution.fixtures.ReferenceTableFixtures.Y2005;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CallsignSegmenter Tests")
class CallsignSegmenterTest {

    private CallsignSegmenter segmenter;

    @BeforeEach
    void setUp() {
        segmenter = new CallsignSegmenter(
                new PrefixResolver(new ScanningReferenceData(ReferenceTableFixtures.standard())));
    }

    @ParameterizedTest
    @CsvSource({
            "AB1CD, SINGLE_PREFIX",
            "MM, SINGLE_PREFIX",
            "AB1CD/P, ONE_PREFIX_WITH_APPENDICES",
            "AB1CD/MM, ONE_PREFIX_WITH_APPENDICES",
            "SV1CD/9, ONE_PREFIX_WITH_APPENDICES",
            "CC1AB/A, ONE_PREFIX_WITH_APPENDICES",
            "F/W1ABC, TWO_PREFIXES",
            "W1ABC/F/P, TWO_PREFIXES",
            "3D2AB/R, TWO_PREFIXES"
    })
    @DisplayName("Should classify the shape of valid calls")
    void shapes(String call, CallsignShape expected) {
        Segmentation segmentation = segmenter.segment(call, Y2005);

        assertTrue(segmentation.isValid());
        assertEquals(expected, segmentation.getShape().orElseThrow());
        assertTrue(segmentation.getError().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "QQ1AB, BEGIN_WITHOUT_PREFIX",
            "P/AB1CD, BEGIN_WITHOUT_PREFIX",
            "AB1CD/SV1AB/F1AB, THIRD_PREFIX",
            "AB1CD/P/SV1AB, THIRD_PREFIX",
            "AB//CD, BASIC_FORMAT",
            "AB1CD//P, BASIC_FORMAT"
    })
    @DisplayName("Should reject calls with an invalid shape")
    void invalidShapes(String call, CallsignError expected) {
        Segmentation segmentation = segmenter.segment(call, Y2005);

        assertFalse(segmentation.isValid());
        assertEquals(expected, segmentation.getError().orElseThrow());
        assertTrue(segmentation.getShape().isEmpty());
    }

    @Test
    @DisplayName("Reserved appendices should not be prefixes after the first part")
    void reservedAppendices() {
        Segmentation segmentation = segmenter.segment("AB1CD/MM", Y2005);

        List<CallsignPart> parts = segmentation.getParts();
        assertEquals(2, parts.size());
        assertTrue(parts.get(0).isPrefix());
        assertFalse(parts.get(1).isPrefix());
        assertEquals(PartType.OTHER, parts.get(1).type());
    }

    @Test
    @DisplayName("Reserved appendix in first position should be a prefix")
    void reservedFirst() {
        Segmentation segmentation = segmenter.segment("MM/AB1CD", Y2005);

        assertEquals(CallsignShape.TWO_PREFIXES, segmentation.getShape().orElseThrow());
        assertTrue(segmentation.getParts().get(0).isPrefix());
    }

    @Test
    @DisplayName("Should expose parts by position")
    void partsByPosition() {
        Segmentation segmentation = segmenter.segment("SV1CD/9/P", Y2005);

        assertEquals("SV1CD", segmentation.part(0));
        assertEquals(List.of("9", "P"), segmentation.partsFrom(1));
        assertTrue(segmentation.getParts().get(1).isSingleDigit());
    }
}
