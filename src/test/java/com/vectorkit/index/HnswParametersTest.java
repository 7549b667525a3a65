package com.vectorkit.index;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HnswParametersTest {

    @Test
    void shouldExposeDefaults() {
        HnswParameters defaults = HnswParameters.defaults();

        assertEquals(16, defaults.maxLevel());
        assertEquals(16, defaults.m());
        assertEquals(32, defaults.mMax());
        assertEquals(200, defaults.efConstruction());
        assertEquals(100, defaults.efSearch());
        assertEquals(DistanceMetric.SQUARED_EUCLIDEAN, defaults.metric());
    }

    @Test
    void shouldRejectOutOfRangeValues() {
        assertThrows(InvalidParameterException.class, () -> new HnswParameters(-1, 16, 32, 200, 100, DistanceMetric.SQUARED_EUCLIDEAN));
        assertThrows(InvalidParameterException.class, () -> new HnswParameters(16, 0, 32, 200, 100, DistanceMetric.SQUARED_EUCLIDEAN));
        assertThrows(InvalidParameterException.class, () -> new HnswParameters(16, 16, 8, 200, 100, DistanceMetric.SQUARED_EUCLIDEAN));
        assertThrows(InvalidParameterException.class, () -> new HnswParameters(16, 16, 32, 0, 100, DistanceMetric.SQUARED_EUCLIDEAN));
        assertThrows(InvalidParameterException.class, () -> new HnswParameters(16, 16, 32, 200, -5, DistanceMetric.SQUARED_EUCLIDEAN));
        assertThrows(InvalidParameterException.class, () -> new HnswParameters(16, 16, 32, 200, 100, null));
    }

    @Test
    void shouldNameOffendingValueInMessage() {
        InvalidParameterException ex = assertThrows(InvalidParameterException.class,
                () -> new HnswParameters(16, 16, 32, 200, -5, DistanceMetric.SQUARED_EUCLIDEAN));

        assertTrue(ex.getMessage().contains("efSearch"));
        assertTrue(ex.getMessage().contains("-5"));
    }

    @Test
    void shouldSwapMetric() {
        HnswParameters cosine = HnswParameters.defaults().withMetric(DistanceMetric.COSINE);

        assertEquals(DistanceMetric.COSINE, cosine.metric());
        assertEquals(HnswParameters.DEFAULT_EF_SEARCH, cosine.efSearch());
    }
}
