package net.larse.seasonal.timeseries;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FixedPeriodTimeTest {
  @Test
  public void testPeriodic() {
    FixedPeriodTime time = new FixedPeriodTime(FixedPeriodTime.DAY);
    assertEquals(FixedPeriodTime.DAY, time.period());
    assertEquals(0.0, time.periodic(0), 0.0);
    assertEquals(3600.0, time.periodic(3 * FixedPeriodTime.DAY + 3600), 0.0);
    assertEquals(FixedPeriodTime.DAY - 1.0, time.periodic(-1), 0.0);
  }

  @Test
  public void testStartOfPeriod() {
    FixedPeriodTime week = new FixedPeriodTime(FixedPeriodTime.WEEK, 4 * FixedPeriodTime.DAY);
    assertEquals(0.0, week.periodic(4 * FixedPeriodTime.DAY), 0.0);
    assertEquals(3.0 * FixedPeriodTime.DAY, week.periodic(FixedPeriodTime.WEEK), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsEmptyPeriod() {
    new FixedPeriodTime(0);
  }
}
