package net.larse.seasonal.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class XoroShiro128PlusTest {
  @Test
  public void testReproducible() {
    XoroShiro128Plus a = new XoroShiro128Plus(42);
    XoroShiro128Plus b = new XoroShiro128Plus(42);
    XoroShiro128Plus c = new XoroShiro128Plus(43);
    boolean differs = false;
    for (int i = 0; i < 100; i++) {
      long x = a.nextLong();
      assertEquals(x, b.nextLong());
      differs |= x != c.nextLong();
    }
    assertTrue(differs);
  }

  @Test
  public void testUnitInterval() {
    XoroShiro128Plus rng = new XoroShiro128Plus(0);
    double sum = 0.0;
    for (int i = 0; i < 10000; i++) {
      double u = rng.nextDouble();
      assertTrue(u >= 0.0 && u < 1.0);
      sum += u;
    }
    assertEquals(0.5, sum / 10000, 0.02);
  }

  @Test
  public void testDelimitedRoundTrip() {
    XoroShiro128Plus rng = new XoroShiro128Plus(5);
    rng.nextLong();
    XoroShiro128Plus restored = new XoroShiro128Plus(6);
    assertNotEquals(rng.toDelimited(), restored.toDelimited());
    assertTrue(restored.fromDelimited(rng.toDelimited()));
    assertEquals(rng.nextLong(), restored.nextLong());

    assertFalse(restored.fromDelimited("0:0"));
    assertFalse(restored.fromDelimited("12"));
    assertFalse(restored.fromDelimited("a:b"));
  }
}
