/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.seasonal.timeseries;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.List;
import net.larse.seasonal.helper.PeriodicSpline;
import net.larse.seasonal.helper.SizeOf;
import net.larse.seasonal.helper.XoroShiro128Plus;
import net.larse.seasonal.state.StatePersistInserter;
import net.larse.seasonal.state.StateRestoreTraverser;
import org.apache.commons.math.MathException;
import org.apache.commons.math.distribution.ChiSquaredDistributionImpl;
import org.apache.commons.math.distribution.NormalDistributionImpl;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates a seasonal component of a time series, that is a function of the phase within a
 * fixed period, from a stream of values.
 *
 * <p>The values are averaged into the buckets of an {@link AdaptiveBucketing}, each of which fits
 * a linear trend, and the bucket values are interpolated by a periodic cubic spline. A second,
 * linear, spline interpolates the bucket residual variances. Predictions come from the splines,
 * which are only brought up to date by {@link #interpolate}.
 *
 * <p>Value phases are randomly jittered by up to half the minimum bucket length, which stops
 * values that always arrive at the same offsets in the period from aliasing with the bucket end
 * points.
 */
public class SeasonalComponent implements SizeOf.Measurable {
  private static final Logger LOG = LoggerFactory.getLogger(SeasonalComponent.class);

  private static final long OBJ_SIZE = SizeOf.object(6 * SizeOf.PTR)
      + SizeOf.object(2 * SizeOf.LONG);

  private static final String RNG_TAG = "rng";
  private static final String BUCKETING_TAG = "bucketing";
  private static final String VALUE_SPLINE_TAG = "value_spline";
  private static final String VARIANCE_SPLINE_TAG = "variance_spline";
  private static final String TYPE_TAG = "type";
  private static final String KNOTS_TAG = "knots";
  private static final String VALUES_TAG = "values";

  /** The parameters of a seasonal component. */
  public static class Args {
    /** The maximum number of buckets used to model one period. */
    public int maxSize = 24;

    /** The rate per second at which the component forgets old values. */
    public double decayRate = 0.0;

    /** The shortest bucket, in seconds. Values are jittered by up to half this. */
    public double minimumBucketLength = 0.0;

    /** Seeds the jitter. */
    public long seed = 0;

    public Args() {}

    public Args(int maxSize, double decayRate, double minimumBucketLength) {
      this.maxSize = maxSize;
      this.decayRate = decayRate;
      this.minimumBucketLength = minimumBucketLength;
    }
  }

  /** A prediction and the half-width of its symmetric confidence interval. */
  public static final class Estimate {
    private final double mean;
    private final double halfWidth;

    public Estimate(double mean, double halfWidth) {
      this.mean = mean;
      this.halfWidth = halfWidth;
    }

    public double mean() {
      return mean;
    }

    public double halfWidth() {
      return halfWidth;
    }

    public double lower() {
      return mean - halfWidth;
    }

    public double upper() {
      return mean + halfWidth;
    }

    @Override
    public String toString() {
      return mean + " +/- " + halfWidth;
    }
  }

  private final SeasonalTime time;
  // A copy of the construction arguments, which a failed restore returns to.
  private final Args args;
  private XoroShiro128Plus rng;
  private AdaptiveBucketing bucketing;
  private PeriodicSpline valueSpline;
  private PeriodicSpline varianceSpline;

  public SeasonalComponent(SeasonalTime time, Args args) {
    Preconditions.checkNotNull(args);
    this.time = Preconditions.checkNotNull(time);
    this.args = new Args(args.maxSize, args.decayRate, args.minimumBucketLength);
    this.args.seed = args.seed;
    this.rng = new XoroShiro128Plus(args.seed);
    this.bucketing = newBucketing();
    this.valueSpline = new PeriodicSpline(time.period(), PeriodicSpline.Type.CUBIC);
    this.varianceSpline = new PeriodicSpline(time.period(), PeriodicSpline.Type.LINEAR);
  }

  public SeasonalTime time() {
    return time;
  }

  public boolean initialized() {
    return bucketing.initialized();
  }

  /**
   * Initializes the bucketing from summaries of the values in windows of [startTime, endTime)
   * and interpolates it. Returns false, leaving the component uninitialized, if there is nothing
   * to initialize from.
   */
  public boolean initialize(long startTime, long endTime, List<WindowSummary> values) {
    clear();
    if (!bucketing.initialize(startTime, endTime, values)) {
      return false;
    }
    interpolate(endTime, false);
    return true;
  }

  /** The number of buckets. */
  public int size() {
    return bucketing.size();
  }

  public void clear() {
    bucketing.clear();
    valueSpline.clear();
    varianceSpline.clear();
  }

  public void add(long time, double value) {
    add(time, value, 1.0);
  }

  /** Adds {@code value} at {@code time} with weight {@code weight}. */
  public void add(long time, double value, double weight) {
    if (!initialized()) {
      return;
    }
    bucketing.add(time, jitter(this.time.periodic(time)), value, weight);
  }

  /** Refits the splines to the current bucket values at {@code time}, refining first if asked. */
  public void interpolate(long time, boolean refine) {
    if (!initialized()) {
      return;
    }
    if (refine) {
      bucketing.refine(time);
    }
    DoubleArrayList knots = new DoubleArrayList(bucketing.size());
    DoubleArrayList values = new DoubleArrayList(bucketing.size());
    DoubleArrayList variances = new DoubleArrayList(bucketing.size());
    bucketing.knots(time, knots, values, variances);
    valueSpline.fit(knots.toDoubleArray(), values.toDoubleArray(), PeriodicSpline.Type.CUBIC);
    varianceSpline.fit(
        knots.toDoubleArray(), variances.toDoubleArray(), PeriodicSpline.Type.LINEAR);
  }

  public void interpolate(long time) {
    interpolate(time, true);
  }

  public double decayRate() {
    return bucketing.decayRate();
  }

  public void decayRate(double decayRate) {
    bucketing.decayRate(decayRate);
  }

  /** See {@link AdaptiveBucketing#propagateForwardsByTime}. */
  public void propagateForwardsByTime(double elapsed, boolean meanRevert) {
    bucketing.propagateForwardsByTime(elapsed, meanRevert);
  }

  public void shiftOrigin(long time) {
    bucketing.shiftOrigin(time);
  }

  public void shiftLevel(double shift) {
    bucketing.shiftLevel(shift);
  }

  /** Adds {@code shift}, in value units per second, to the trend of every bucket. */
  public void shiftSlope(double shift) {
    bucketing.shiftSlope(shift);
  }

  /** The mean trend of the buckets in value units per second. */
  public double slope() {
    return bucketing.slope();
  }

  /**
   * The predicted value at {@code time} with the half-width of its {@code confidence} percent
   * confidence interval.
   */
  public Estimate value(long time, double confidence) {
    double phase = this.time.periodic(time);
    double mean = valueSpline.value(phase);
    if (confidence <= 0.0) {
      return new Estimate(mean, 0.0);
    }
    double n = Math.max(bucketing.count(phase), 1.0);
    double sd = Math.sqrt(
        Math.max(varianceSpline.value(phase), 0.0) / n
            + bucketing.varianceDueToParameterDrift(time, phase));
    if (sd == 0.0) {
      return new Estimate(mean, 0.0);
    }
    try {
      double z = new NormalDistributionImpl()
          .inverseCumulativeProbability((100.0 + confidence) / 200.0);
      return new Estimate(mean, z * sd);
    } catch (MathException e) {
      LOG.error("Failed to compute the {}% confidence interval: {}", confidence, e.getMessage());
      return new Estimate(mean, 0.0);
    }
  }

  /** The mean of the component's value over one period. */
  public double meanValue() {
    return valueSpline.mean();
  }

  /**
   * The residual variance at {@code time} with the half-width of its {@code confidence} percent
   * confidence interval.
   */
  public Estimate variance(long time, double confidence) {
    double phase = this.time.periodic(time);
    double variance = Math.max(varianceSpline.value(phase), 0.0);
    if (confidence <= 0.0 || variance == 0.0) {
      return new Estimate(variance, 0.0);
    }
    double df = Math.max(bucketing.count(phase), 2.0) - 1.0;
    try {
      ChiSquaredDistributionImpl chi = new ChiSquaredDistributionImpl(df);
      double lower = chi.inverseCumulativeProbability((100.0 - confidence) / 200.0);
      double upper = chi.inverseCumulativeProbability((100.0 + confidence) / 200.0);
      return new Estimate(variance, (upper - lower) * variance / df / 2.0);
    } catch (MathException e) {
      LOG.error("Failed to compute the {}% confidence interval: {}", confidence, e.getMessage());
      return new Estimate(variance, 0.0);
    }
  }

  /** The length weighted mean of the bucket residual variances. */
  public double meanVariance() {
    return bucketing.meanVariance();
  }

  /**
   * The difference between the value at {@code time} and the mean of the values at the times
   * {@code period} apart in one period of this component. Zero unless {@code period} is shorter
   * than this component's period and divides it.
   */
  public double differenceFromMean(long time, long period) {
    long p = this.time.period();
    if (period <= 0 || period >= p || p % period != 0) {
      return 0.0;
    }
    long n = p / period;
    double mean = 0.0;
    for (long k = 0; k < n; k++) {
      mean += valueSpline.value(this.time.periodic(time + k * period));
    }
    return valueSpline.value(this.time.periodic(time)) - mean / n;
  }

  /** The ratio of the largest bucket residual variance to their mean. */
  public double heteroscedasticity() {
    if (bucketing.nonEmptySize() <= 1) {
      return 1.0;
    }
    double mean = bucketing.meanVariance();
    return mean > 0.0 ? bucketing.maxVariance() / mean : 1.0;
  }

  /** The variance of the prediction at {@code time} due to uncertainty in the bucket trend. */
  public double varianceDueToParameterDrift(long time) {
    return bucketing.varianceDueToParameterDrift(time, this.time.periodic(time));
  }

  /**
   * Fills in the covariance of the intercept and slope of the bucket owning {@code time}.
   * Returns false if the bucket has too few values.
   */
  public boolean covariances(long time, DenseMatrix64F result) {
    return bucketing.covariances(this.time.periodic(time), result);
  }

  public boolean sufficientHistoryToPredict(long time) {
    return bucketing.sufficientHistoryToPredict(this.time.periodic(time));
  }

  public PeriodicSpline valueSpline() {
    return valueSpline;
  }

  /** A hash of the complete state of this component, mixed with {@code seed}. */
  public long checksum(long seed) {
    Hasher hasher = Hashing.murmur3_128().newHasher();
    hasher.putLong(seed);
    rng.hash(hasher);
    bucketing.hash(hasher);
    valueSpline.hash(hasher);
    varianceSpline.hash(hasher);
    return hasher.hash().asLong();
  }

  @Override
  public long heapSize() {
    return OBJ_SIZE + bucketing.heapSize() + valueSpline.heapSize() + varianceSpline.heapSize();
  }

  public void persist(StatePersistInserter inserter) {
    inserter.insertValue(RNG_TAG, rng.toDelimited());
    inserter.insertLevel(BUCKETING_TAG, bucketing::persist);
    inserter.insertLevel(VALUE_SPLINE_TAG, level -> persist(valueSpline, level));
    inserter.insertLevel(VARIANCE_SPLINE_TAG, level -> persist(varianceSpline, level));
  }

  /**
   * Restores state written by {@link #persist}. Returns false if the state is malformed or
   * incomplete, in which case the component is reset to its state on construction.
   */
  public boolean restore(StateRestoreTraverser traverser) {
    XoroShiro128Plus restoredRng = new XoroShiro128Plus(args.seed);
    AdaptiveBucketing restoredBucketing = newBucketing();
    PeriodicSpline restoredValues = new PeriodicSpline(time.period(), PeriodicSpline.Type.CUBIC);
    PeriodicSpline restoredVariances =
        new PeriodicSpline(time.period(), PeriodicSpline.Type.LINEAR);
    boolean haveRng = false;
    boolean haveBucketing = false;
    boolean haveValueSpline = false;
    boolean haveVarianceSpline = false;
    while (traverser.next()) {
      String name = traverser.name();
      boolean ok = true;
      switch (name) {
        case RNG_TAG:
          ok = haveRng =
              traverser.value() != null && restoredRng.fromDelimited(traverser.value());
          break;
        case BUCKETING_TAG:
          ok = haveBucketing = traverser.traverseSubLevel(restoredBucketing::restore);
          break;
        case VALUE_SPLINE_TAG:
          ok = haveValueSpline =
              traverser.traverseSubLevel(level -> restore(restoredValues, level));
          break;
        case VARIANCE_SPLINE_TAG:
          ok = haveVarianceSpline =
              traverser.traverseSubLevel(level -> restore(restoredVariances, level));
          break;
        default:
          LOG.debug("Skipping unknown tag {}", name);
          break;
      }
      if (!ok) {
        LOG.warn("Failed to restore {}", name);
        reset();
        return false;
      }
    }
    if (!(haveRng && haveBucketing && haveValueSpline && haveVarianceSpline)) {
      LOG.warn("Incomplete seasonal component state");
      reset();
      return false;
    }
    rng = restoredRng;
    bucketing = restoredBucketing;
    valueSpline = restoredValues;
    varianceSpline = restoredVariances;
    return true;
  }

  private AdaptiveBucketing newBucketing() {
    return new AdaptiveBucketing(
        time, args.maxSize, args.decayRate, args.minimumBucketLength);
  }

  // Returns to the state on construction.
  private void reset() {
    rng = new XoroShiro128Plus(args.seed);
    bucketing = newBucketing();
    valueSpline = new PeriodicSpline(time.period(), PeriodicSpline.Type.CUBIC);
    varianceSpline = new PeriodicSpline(time.period(), PeriodicSpline.Type.LINEAR);
  }

  // Triangular jitter of up to half the minimum bucket length either side of phase.
  double jitter(double phase) {
    double minimumLength = bucketing.minimumBucketLength();
    if (minimumLength <= 0.0) {
      return phase;
    }
    double u = rng.nextDouble();
    double offset = u <= 0.5 ? Math.sqrt(2.0 * u) - 1.0 : Math.sqrt(2.0 * (u - 0.5));
    double period = bucketing.period();
    double result = (phase + 0.5 * minimumLength * offset) % period;
    if (result < 0.0) {
      result += period;
    }
    return result < period ? result : 0.0;
  }

  private static void persist(PeriodicSpline spline, StatePersistInserter inserter) {
    inserter.insertValue(TYPE_TAG, spline.type().name());
    inserter.insertValues(KNOTS_TAG, spline.knots());
    inserter.insertValues(VALUES_TAG, spline.values());
  }

  private static boolean restore(PeriodicSpline spline, StateRestoreTraverser traverser) {
    PeriodicSpline.Type type = null;
    double[] knots = null;
    double[] values = null;
    while (traverser.next()) {
      switch (traverser.name()) {
        case TYPE_TAG:
          Optional<PeriodicSpline.Type> parsed = traverser.value() == null
              ? Optional.<PeriodicSpline.Type>absent()
              : Enums.getIfPresent(PeriodicSpline.Type.class, traverser.value());
          type = parsed.orNull();
          break;
        case KNOTS_TAG:
          knots = traverser.doubleValues();
          break;
        case VALUES_TAG:
          values = traverser.doubleValues();
          break;
        default:
          break;
      }
    }
    if (type == null || knots == null || values == null || knots.length != values.length
        || !spline.validKnots(knots)) {
      return false;
    }
    spline.fit(knots, values, type);
    return true;
  }
}
