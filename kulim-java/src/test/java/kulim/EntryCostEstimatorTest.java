package kulim;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EntryCostEstimatorTest {

    private final EntryCostEstimator estimator = new EntryCostEstimator();

    @Test
    void testLengthPriors() {
        assertEquals(-5, estimator.estimate("을", "JKO"));
        assertEquals(-30, estimator.estimate("에서", "JKB"));
        assertEquals(-40, estimator.estimate("아름답", "VA"));
    }

    @Test
    void testTagAdjustments() {
        assertEquals(15, estimator.estimate("먹", "VV"));
        assertEquals(15, estimator.estimate("네", "IC"));
        assertEquals(-35, estimator.estimate("친구", "NNG"));
        assertEquals(-45, estimator.estimate("선생님", "NNG"));
        assertEquals(-40, estimator.estimate("정말", "MAG"));
        assertEquals(-5, estimator.estimate("책", "NNG"));
        // NA is not a noun
        assertEquals(-30, estimator.estimate("ㅋㅋ", "NA"));
    }

    @Test
    void testLengthCountsCodePoints() {
        assertEquals(-30, estimator.estimate("😀😀", "SW"));
    }

    @Test
    void testFromFrequency() {
        assertEquals(0, estimator.fromFrequency(100, 100));
        assertEquals(10, estimator.fromFrequency(10, 100));
        assertEquals(20, estimator.fromFrequency(10, 1000));
        assertEquals(23, estimator.fromFrequency(1, 1000));
        assertEquals(estimator.fromFrequency(0, 1000), estimator.fromFrequency(5, 1000));
        assertThrows(IllegalArgumentException.class, () -> estimator.fromFrequency(1, 0));
    }
}
