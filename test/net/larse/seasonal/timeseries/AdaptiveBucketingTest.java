package net.larse.seasonal.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.larse.seasonal.state.StateDocument;
import org.apache.commons.math.random.JDKRandomGenerator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AdaptiveBucketingTest {
  private static final long DAY = FixedPeriodTime.DAY;
  private static final SeasonalTime TIME = new FixedPeriodTime(DAY);

  private static final List<WindowSummary> EMPTY_DAY =
      ImmutableList.of(new WindowSummary(0, DAY, 0.0, 0.0, 0.0));

  private static HashCode hash(AdaptiveBucketing bucketing) {
    Hasher hasher = Hashing.murmur3_128().newHasher();
    bucketing.hash(hasher);
    return hasher.hash();
  }

  private static AdaptiveBucketing initialized(int maxSize, double decayRate, double minLength) {
    AdaptiveBucketing bucketing = new AdaptiveBucketing(TIME, maxSize, decayRate, minLength);
    assertTrue(bucketing.initialize(0, DAY, EMPTY_DAY));
    return bucketing;
  }

  private static void add(AdaptiveBucketing bucketing, long time, double value) {
    bucketing.add(time, TIME.periodic(time), value, 1.0);
  }

  private static void assertCoversPeriod(AdaptiveBucketing bucketing) {
    double[] endpoints = bucketing.endpoints();
    double[] centres = bucketing.centres();
    assertTrue(bucketing.size() <= bucketing.maxSize());
    assertEquals(0.0, endpoints[0], 0.0);
    assertEquals(DAY, endpoints[endpoints.length - 1], 0.0);
    double total = 0.0;
    for (int i = 0; i + 1 < endpoints.length; i++) {
      double length = endpoints[i + 1] - endpoints[i];
      assertTrue(length > 0.0);
      assertTrue(length >= bucketing.minimumBucketLength() - 1e-6);
      assertTrue(centres[i] >= endpoints[i] && centres[i] < endpoints[i + 1]);
      total += length;
    }
    assertEquals(DAY, total, 1e-6);
  }

  @Test
  public void testInvalidConfiguration() {
    double[][] configurations = {
      {0, 0.0, 0.0}, {24, -1.0, 0.0}, {24, Double.POSITIVE_INFINITY, 0.0}, {24, 0.0, -1.0},
      {24, 0.0, DAY}
    };
    for (double[] c : configurations) {
      try {
        new AdaptiveBucketing(TIME, (int) c[0], c[1], c[2]);
        fail("Expected IllegalArgumentException for " + c[0] + ", " + c[1] + ", " + c[2]);
      } catch (IllegalArgumentException expected) {
      }
    }
  }

  @Test
  public void testInitialize() {
    AdaptiveBucketing bucketing = new AdaptiveBucketing(TIME, 24, 0.0, 0.0);
    assertFalse(bucketing.initialize(0, DAY, Collections.<WindowSummary>emptyList()));
    assertFalse(bucketing.initialize(DAY, DAY, EMPTY_DAY));
    assertFalse(bucketing.initialized());

    assertTrue(bucketing.initialize(0, DAY, EMPTY_DAY));
    assertEquals(24, bucketing.size());
    double[] endpoints = bucketing.endpoints();
    for (int i = 0; i < endpoints.length; i++) {
      assertEquals(3600.0 * i, endpoints[i], 0.0);
    }
    assertEquals(0.0, bucketing.count(1000.0), 0.0);

    // The minimum bucket length caps the number of buckets.
    assertTrue(initialized(24, 0.0, 7200.0).size() == 12);
  }

  @Test
  public void testInitialValuesAreSpreadOverBuckets() {
    AdaptiveBucketing bucketing = new AdaptiveBucketing(TIME, 24, 0.0, 0.0);
    bucketing.initialize(0, 2 * DAY, ImmutableList.of(new WindowSummary(0, DAY, 24.0, 3.0, 1.0)));
    for (int i = 0; i < 24; i++) {
      assertEquals(1.0, bucketing.count(3600.0 * i + 1.0), 1e-12);
    }

    // Windows wrap around the end of the period.
    bucketing.initialize(
        0, 2 * DAY, ImmutableList.of(new WindowSummary(DAY - 3600, DAY + 3600, 2.0, 3.0, 1.0)));
    assertEquals(1.0, bucketing.count(100.0), 1e-12);
    assertEquals(1.0, bucketing.count(DAY - 100.0), 1e-12);
    assertEquals(0.0, bucketing.count(DAY / 2.0), 0.0);

    // Windows longer than the period visit every bucket more than once.
    bucketing.initialize(0, 2 * DAY, ImmutableList.of(new WindowSummary(0, 2 * DAY, 48, 3, 1)));
    for (int i = 0; i < 24; i++) {
      assertEquals(2.0, bucketing.count(3600.0 * i + 1.0), 1e-12);
    }

    DoubleArrayList centres = new DoubleArrayList();
    DoubleArrayList values = new DoubleArrayList();
    DoubleArrayList variances = new DoubleArrayList();
    bucketing.knots(DAY, centres, values, variances);
    assertEquals(24, centres.size());
    for (int i = 0; i < 24; i++) {
      assertEquals(3.0, values.getDouble(i), 1e-9);
      assertEquals(1.0, variances.getDouble(i), 1e-9);
    }
  }

  @Test
  public void testAdd() {
    AdaptiveBucketing bucketing = new AdaptiveBucketing(TIME, 24, 0.0, 0.0);
    add(bucketing, 100, 1.0);
    assertFalse(bucketing.initialized());
    assertEquals(0.0, bucketing.count(100.0), 0.0);

    bucketing.initialize(0, DAY, EMPTY_DAY);
    add(bucketing, 100, 1.0);
    add(bucketing, DAY + 200, 3.0);
    bucketing.add(300, 300.0, Double.NaN, 1.0);
    bucketing.add(300, 300.0, 1.0, 0.0);
    bucketing.add(300, 300.0, 1.0, -1.0);
    assertEquals(2.0, bucketing.count(0.0), 0.0);
    assertEquals(0.0, bucketing.count(3600.0), 0.0);
    assertFalse(bucketing.sufficientHistoryToPredict(0.0));
    add(bucketing, 2 * DAY + 300, 2.0);
    assertEquals(3.0, bucketing.count(0.0), 0.0);
    assertFalse(bucketing.sufficientHistoryToPredict(0.0));
    add(bucketing, 3 * DAY + 400, 2.0);
    assertTrue(bucketing.sufficientHistoryToPredict(0.0));

    DoubleArrayList centres = new DoubleArrayList();
    DoubleArrayList values = new DoubleArrayList();
    DoubleArrayList variances = new DoubleArrayList();
    bucketing.knots(2 * DAY, centres, values, variances);
    assertEquals(1, centres.size());
    assertEquals(200.0, centres.getDouble(0), 1e-9);
  }

  @Test
  public void testCoverageIsMaintained() {
    JDKRandomGenerator rng = new JDKRandomGenerator();
    rng.setSeed(1);
    AdaptiveBucketing bucketing = initialized(24, 1e-5, 1800.0);
    long time = 0;
    for (int round = 0; round < 30; round++) {
      for (int i = 0; i < 500; i++) {
        time += 1 + rng.nextInt(600);
        double phase = TIME.periodic(time);
        double noise = phase < 20000.0 || (round % 3 == 0 && phase > 60000.0) ? 2.0 : 0.1;
        add(bucketing, time, 5.0 + Math.signum(phase - 40000.0) + noise * rng.nextGaussian());
      }
      bucketing.refine(time);
      assertCoversPeriod(bucketing);
      if (round % 4 == 3) {
        bucketing.propagateForwardsByTime(1.0 + rng.nextInt(100000), true);
        assertCoversPeriod(bucketing);
      }
    }
  }

  @Test
  public void testRefineIsIdempotent() {
    JDKRandomGenerator rng = new JDKRandomGenerator();
    rng.setSeed(2);
    AdaptiveBucketing bucketing = initialized(24, 0.0, 0.0);
    for (int i = 0; i < 2000; i++) {
      long time = rng.nextInt((int) DAY);
      double noise = time < 10800 ? 1.0 : 0.01;
      add(bucketing, time, noise * rng.nextGaussian());
    }
    bucketing.refine(DAY);
    HashCode refined = hash(bucketing);
    bucketing.refine(DAY);
    assertEquals(refined, hash(bucketing));
  }

  @Test
  public void testRefineConcentratesBucketsWhereErrorIsHigh() {
    JDKRandomGenerator rng = new JDKRandomGenerator();
    rng.setSeed(3);
    AdaptiveBucketing bucketing = initialized(24, 0.0, 0.0);
    for (int i = 0; i < 2000; i++) {
      long time = rng.nextInt((int) DAY);
      double noise = time < 10800 ? 1.0 : 0.01;
      add(bucketing, time, noise * rng.nextGaussian());
    }
    bucketing.refine(DAY);
    assertCoversPeriod(bucketing);
    int noisy = 0;
    for (BucketModel bucket : bucketing.buckets()) {
      if (bucket.end() <= 10800.0) {
        noisy++;
      }
    }
    assertTrue("buckets in noisy region: " + noisy, noisy >= 4);
  }

  @Test
  public void testForgetting() {
    JDKRandomGenerator rng = new JDKRandomGenerator();
    rng.setSeed(4);
    AdaptiveBucketing bucketing = initialized(24, 0.001, 0.0);
    long time = 0;
    for (int day = 0; day < 5; day++) {
      for (int i = 0; i < 1000; i++) {
        time = day * DAY + rng.nextInt((int) DAY);
        double phase = TIME.periodic(time);
        add(bucketing, time, phase * 1e-4 + (phase < 30000.0 ? 3.0 : 0.3) * rng.nextGaussian());
      }
      bucketing.refine(time);
    }
    assertTrue(bucketing.maxVariance() / bucketing.meanVariance() > 2.0);

    bucketing.propagateForwardsByTime(-1.0, true);
    bucketing.propagateForwardsByTime(100000.0, true);
    assertCoversPeriod(bucketing);
    assertEquals(1.0, bucketing.maxVariance() / bucketing.meanVariance(), 1e-9);
    double[] endpoints = bucketing.endpoints();
    int n = bucketing.size();
    for (int i = 0; i <= n; i++) {
      assertEquals(DAY * (double) i / n, endpoints[i], 1e-6);
    }
  }

  @Test
  public void testAgingReducesWeight() {
    AdaptiveBucketing bucketing = initialized(24, 0.001, 0.0);
    for (int i = 0; i < 10; i++) {
      add(bucketing, i * DAY + 10, 1.0);
    }
    bucketing.propagateForwardsByTime(1000.0, false);
    assertEquals(10.0 * Math.exp(-1.0), bucketing.count(10.0), 1e-9);
    bucketing.decayRate(0.0);
    bucketing.propagateForwardsByTime(1000.0, false);
    assertEquals(10.0 * Math.exp(-1.0), bucketing.count(10.0), 1e-9);
  }

  @Test
  public void testShifts() {
    JDKRandomGenerator rng = new JDKRandomGenerator();
    rng.setSeed(5);
    AdaptiveBucketing bucketing = initialized(24, 0.0, 0.0);
    for (long time = 0; time < 10 * DAY; time += 600) {
      add(bucketing, time, 10.0 + rng.nextGaussian());
    }
    long now = 10 * DAY;
    DoubleArrayList before = values(bucketing, now);

    bucketing.shiftOrigin(now);
    assertEquals(now, bucketing.regressionOrigin());
    assertEquals(0.0, bucketing.regressionTime(now), 0.0);
    DoubleArrayList after = values(bucketing, now);
    for (int i = 0; i < before.size(); i++) {
      assertEquals(before.getDouble(i), after.getDouble(i), 1e-6);
    }

    bucketing.shiftLevel(2.0);
    after = values(bucketing, now);
    for (int i = 0; i < before.size(); i++) {
      assertEquals(before.getDouble(i) + 2.0, after.getDouble(i), 1e-6);
    }

    double slope = bucketing.slope();
    bucketing.shiftSlope(1e-5);
    assertEquals(slope + 1e-5, bucketing.slope(), 1e-10);
  }

  private static DoubleArrayList values(AdaptiveBucketing bucketing, long time) {
    DoubleArrayList values = new DoubleArrayList();
    bucketing.knots(time, new DoubleArrayList(), values, new DoubleArrayList());
    return values;
  }

  @Test
  public void testPersistRoundTrip() {
    JDKRandomGenerator rng = new JDKRandomGenerator();
    rng.setSeed(6);
    AdaptiveBucketing bucketing = initialized(12, 0.002, 600.0);
    for (int i = 0; i < 3000; i++) {
      long time = i * 97L;
      add(bucketing, time, Math.sin(time / 5000.0) + 0.1 * rng.nextGaussian());
      if (i % 1000 == 999) {
        bucketing.refine(time);
      }
    }
    StateDocument document = StateDocument.write(bucketing::persist);

    AdaptiveBucketing restored = new AdaptiveBucketing(TIME, 1, 0.0, 0.0);
    assertNotEquals(hash(bucketing), hash(restored));
    assertTrue(restored.restore(document.traverser()));
    assertEquals(hash(bucketing), hash(restored));
    assertEquals(12, restored.maxSize());
    assertEquals(600.0, restored.minimumBucketLength(), 0.0);

    List<StateDocument> elements = new ArrayList<>(document.elements());
    elements.add(0, StateDocument.leaf("unknown", "x"));
    restored = new AdaptiveBucketing(TIME, 1, 0.0, 0.0);
    assertTrue(restored.restore(StateDocument.of(elements).traverser()));
    assertEquals(hash(bucketing), hash(restored));
  }

  @Test
  public void testRestoreRejectsBadState() {
    AdaptiveBucketing bucketing = initialized(6, 0.0, 0.0);
    StateDocument document = StateDocument.write(bucketing::persist);

    AdaptiveBucketing otherPeriod = new AdaptiveBucketing(new FixedPeriodTime(DAY / 2), 6, 0, 0);
    assertFalse(otherPeriod.restore(document.traverser()));
    assertFalse(otherPeriod.initialized());

    List<StateDocument> gap = new ArrayList<>(document.elements());
    int firstBucket = -1;
    for (int i = 0; i < gap.size() && firstBucket < 0; i++) {
      if (gap.get(i).tag().equals("bucket")) {
        firstBucket = i;
      }
    }
    gap.remove(firstBucket + 1);
    AdaptiveBucketing restored = new AdaptiveBucketing(TIME, 6, 0, 0);
    assertFalse(restored.restore(StateDocument.of(gap).traverser()));
    assertFalse(restored.initialized());

    List<StateDocument> noOrigin = new ArrayList<>();
    for (StateDocument element : document.elements()) {
      if (!element.tag().equals("origin")) {
        noOrigin.add(element);
      }
    }
    assertFalse(restored.restore(StateDocument.of(noOrigin).traverser()));

    List<StateDocument> badBucket = new ArrayList<>(document.elements());
    badBucket.set(firstBucket, StateDocument.level("bucket", ImmutableList.of()));
    assertFalse(restored.restore(StateDocument.of(badBucket).traverser()));
  }
}
