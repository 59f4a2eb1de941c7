package net.larse.seasonal.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PeriodicSplineTest {
  private static final double PERIOD = 100.0;

  private static PeriodicSpline sine(int n, PeriodicSpline.Type type) {
    double[] knots = new double[n];
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      knots[i] = PERIOD * (i + 0.5) / n;
      values[i] = Math.sin(2.0 * Math.PI * knots[i] / PERIOD);
    }
    PeriodicSpline spline = new PeriodicSpline(PERIOD, type);
    spline.fit(knots, values, type);
    return spline;
  }

  @Test
  public void testInterpolatesKnots() {
    double[] knots = {0.0, 25.0, 50.0, 75.0};
    double[] values = {1.0, 2.0, 0.0, -1.0};
    for (PeriodicSpline.Type type : PeriodicSpline.Type.values()) {
      PeriodicSpline spline = new PeriodicSpline(PERIOD, type);
      spline.fit(knots, values, type);
      for (int i = 0; i < knots.length; i++) {
        assertEquals(values[i], spline.value(knots[i]), 1e-12);
      }
    }
  }

  @Test
  public void testPeriodic() {
    PeriodicSpline spline = sine(7, PeriodicSpline.Type.CUBIC);
    for (double x = 0.0; x < PERIOD; x += 3.3) {
      assertEquals(spline.value(x), spline.value(x + PERIOD), 1e-9);
      assertEquals(spline.value(x), spline.value(x - 2 * PERIOD), 1e-9);
    }
  }

  @Test
  public void testCubicRecoversSine() {
    PeriodicSpline spline = sine(24, PeriodicSpline.Type.CUBIC);
    assertEquals(PeriodicSpline.Type.CUBIC, spline.type());
    for (double x = 0.0; x < PERIOD; x += 0.7) {
      assertEquals(Math.sin(2.0 * Math.PI * x / PERIOD), spline.value(x), 1e-3);
    }
    assertEquals(0.0, spline.mean(), 1e-9);
  }

  @Test
  public void testLinearWrapsAround() {
    PeriodicSpline spline = new PeriodicSpline(PERIOD, PeriodicSpline.Type.LINEAR);
    spline.fit(new double[] {10.0, 60.0}, new double[] {0.0, 2.0}, PeriodicSpline.Type.LINEAR);
    assertEquals(1.0, spline.value(35.0), 1e-12);
    // Halfway from the knot at 60 to the knot at 110.
    assertEquals(1.0, spline.value(85.0), 1e-12);
    assertEquals(0.4, spline.value(0.0), 1e-12);
    assertEquals(1.0, spline.mean(), 1e-12);
  }

  @Test
  public void testDegenerate() {
    PeriodicSpline spline = new PeriodicSpline(PERIOD, PeriodicSpline.Type.CUBIC);
    assertTrue(spline.isEmpty());
    assertEquals(0.0, spline.value(12.0), 0.0);
    assertEquals(0.0, spline.mean(), 0.0);

    spline.fit(new double[] {40.0}, new double[] {3.0}, PeriodicSpline.Type.CUBIC);
    assertFalse(spline.isEmpty());
    assertEquals(3.0, spline.value(12.0), 0.0);
    assertEquals(3.0, spline.mean(), 0.0);

    spline.clear();
    assertTrue(spline.isEmpty());
  }

  @Test
  public void testConstantMean() {
    PeriodicSpline spline = new PeriodicSpline(PERIOD, PeriodicSpline.Type.CUBIC);
    spline.fit(
        new double[] {5.0, 20.0, 33.0, 90.0}, new double[] {4.0, 4.0, 4.0, 4.0},
        PeriodicSpline.Type.CUBIC);
    assertEquals(4.0, spline.mean(), 1e-12);
    assertEquals(4.0, spline.value(60.0), 1e-12);
  }

  @Test
  public void testRejectsBadKnots() {
    PeriodicSpline spline = new PeriodicSpline(PERIOD, PeriodicSpline.Type.CUBIC);
    assertFalse(spline.validKnots(new double[] {10.0, 10.0}));
    assertFalse(spline.validKnots(new double[] {10.0, PERIOD}));
    assertFalse(spline.validKnots(new double[] {-1.0}));
    assertTrue(spline.validKnots(new double[0]));
    try {
      spline.fit(new double[] {20.0, 10.0}, new double[] {1.0, 2.0}, PeriodicSpline.Type.CUBIC);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException expected) {
    }
  }
}
