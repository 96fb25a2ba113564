package RPT.Model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ModelTest {
  // m = k = 1, eps = 0.75, errorProba = 0.75: every intermediate value is exact in binary
  private static final SamplingParameters EXACT = SamplingParameters.derive(1, 1, 0.75, 0.75);

  @Test
  void testDerivedParameters() {
    Assertions.assertEquals(0.125, EXACT.beta());
    Assertions.assertEquals(16, EXACT.gamma());
    Assertions.assertEquals(3, EXACT.logGamma()); // ceil(ln 16)
    Assertions.assertEquals(4, EXACT.levels()); // log2 16
    Assertions.assertEquals(Math.log(16), EXACT.logConfidence(), 1e-12); // ln(6 * 1 * 2 / 0.75)

    Assertions.assertEquals(45, EXACT.lambda());
    Assertions.assertEquals(400, EXACT.alpha(0));
    Assertions.assertEquals(200, EXACT.alpha(1));
    Assertions.assertEquals(100, EXACT.alpha(2));
    Assertions.assertEquals(50, EXACT.alpha(3));
    Assertions.assertEquals(795, EXACT.totalFragments());
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> EXACT.alpha(4));

    Assertions.assertEquals(2, SamplingParameters.fragmentLength(0));
    Assertions.assertEquals(16, SamplingParameters.fragmentLength(3));
  }

  @Test
  void testLevelsRoundUp() {
    // gamma = 12 * 3 / 1 = 36, log2 36 = 5.17
    SamplingParameters p = SamplingParameters.derive(2, 3, 1.0, 0.5);
    Assertions.assertEquals(36, p.gamma());
    Assertions.assertEquals(6, p.levels());
    Assertions.assertEquals(4, p.logGamma());
  }

  @Test
  void testManyComponentsDoNotOverflow() {
    SamplingParameters p = SamplingParameters.derive(2000, 2000, 1.0, 0.1);
    Assertions.assertTrue(Double.isFinite(p.logConfidence()));
    Assertions.assertTrue(p.logConfidence() > 2000 * Math.log(2));
    Assertions.assertTrue(p.lambda() > 0);
  }

  @Test
  void testSaturation() {
    Assertions.assertEquals(1L << 62, SamplingParameters.fragmentLength(61));
    Assertions.assertEquals(Long.MAX_VALUE, SamplingParameters.fragmentLength(62));
    Assertions.assertEquals(Long.MAX_VALUE, SamplingParameters.fragmentLength(63));
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> SamplingParameters.fragmentLength(-1));

    SamplingParameters p = SamplingParameters.derive(1, 2, 1e-300, 0.3);
    Assertions.assertEquals(Long.MAX_VALUE, p.gamma());
    Assertions.assertEquals(63, p.levels());
    Assertions.assertEquals(Long.MAX_VALUE, p.alpha(0));
    Assertions.assertEquals(Long.MAX_VALUE, p.totalFragments());
  }

  @Test
  void testInvalidShapes() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> SamplingParameters.derive(1, 0, 0.5, 0.5));
    Assertions.assertThrows(IllegalArgumentException.class, () -> SamplingParameters.derive(3, 2, 0.5, 0.5));
    Assertions.assertThrows(IllegalArgumentException.class, () -> SamplingParameters.derive(1, 1, 0, 0.5));
    Assertions.assertThrows(IllegalArgumentException.class, () -> SamplingParameters.derive(1, 1, 0.5, 1.5));
  }

  @Test
  void testThresholds() {
    ExactThreshold t = ExactThreshold.standard();
    Assertions.assertEquals("scaled", t.getName());
    Assertions.assertEquals("12.0", t.getParam());
    Assertions.assertEquals(576, t.threshold(EXACT)); // 12 * 16 * 3
    Assertions.assertTrue(t.isShortInput(575, EXACT));
    Assertions.assertFalse(t.isShortInput(576, EXACT));

    t = ExactThreshold.scaled(ExactThreshold.SINGLE_LETTER_CONSTANT);
    Assertions.assertEquals("3.0", t.getParam());
    Assertions.assertEquals(144, t.threshold(EXACT));

    // k / beta = 8 dominates a tiny constant
    t = ExactThreshold.scaled(0.01);
    Assertions.assertEquals(8, t.threshold(EXACT));

    t = ExactThreshold.alwaysExact();
    Assertions.assertEquals("exact", t.getName());
    Assertions.assertEquals("", t.getParam());
    Assertions.assertTrue(t.isShortInput(Integer.MAX_VALUE, EXACT));

    t = ExactThreshold.neverExact();
    Assertions.assertEquals("sampled", t.getName());
    Assertions.assertTrue(t.isShortInput(0, EXACT));
    Assertions.assertFalse(t.isShortInput(1, EXACT));

    Assertions.assertThrows(IllegalArgumentException.class, () -> ExactThreshold.scaled(0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> ExactThreshold.scaled(Double.NaN));
  }
}
