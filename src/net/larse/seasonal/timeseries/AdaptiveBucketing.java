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

import com.google.common.base.Preconditions;
import com.google.common.hash.Hasher;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.larse.seasonal.helper.SizeOf;
import net.larse.seasonal.state.StatePersistInserter;
import net.larse.seasonal.state.StateRestoreTraverser;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions one period into at most {@code maxSize} buckets, each with its own regression and
 * residual variance, and adapts the partition so that no bucket's averaging error dominates.
 *
 * <p>Refinement works from the mean squared error of the predictions made for the values added
 * since the previous refinement. Boundaries move toward the bucket with the higher error, buckets
 * whose error is well above average are split, and neighbouring buckets whose errors are both
 * well below average are merged. The raw values are never kept, so splits share the statistics
 * of the bucket being split between its halves.
 *
 * <p>Regressions are in "regression time", the time since the regression origin in weeks, which
 * keeps the sums of the normal equations well scaled.
 */
public class AdaptiveBucketing implements SizeOf.Measurable {
  private static final Logger LOG = LoggerFactory.getLogger(AdaptiveBucketing.class);

  /** The length of one unit of regression time in seconds. */
  public static final double REGRESSION_TIME_SCALE = 604800.0;

  // The largest boundary move, as a fraction of the shorter adjacent bucket.
  private static final double MAX_BOUNDARY_SHIFT = 0.1;
  // Buckets with error below this multiple of the mean are merge candidates.
  private static final double MERGE_ERROR_FRACTION = 0.25;
  // Buckets with error above this multiple of the mean are split.
  private static final double SPLIT_ERROR_MULTIPLE = 4.0;
  // A slope is only fitted once the regression times spread over this fraction of a period.
  private static final double MINIMUM_SPREAD_FRACTION = 0.25;

  private static final long OBJ_SIZE =
      SizeOf.object(3 * SizeOf.DOUBLE + SizeOf.LONG + SizeOf.INT + 2 * SizeOf.PTR);

  private static final String PERIOD_TAG = "period";
  private static final String MAX_SIZE_TAG = "max_size";
  private static final String DECAY_RATE_TAG = "decay_rate";
  private static final String MIN_BUCKET_LENGTH_TAG = "min_bucket_length";
  private static final String ORIGIN_TAG = "origin";
  private static final String BUCKET_TAG = "bucket";

  private final SeasonalTime time;
  private final double period;
  private int maxSize;
  private double decayRate;
  private double minimumBucketLength;
  private long regressionOrigin;
  private List<BucketModel> buckets = new ArrayList<>();

  /**
   * @param time maps times to phases
   * @param maxSize the maximum number of buckets
   * @param decayRate the rate per second at which bucket statistics are forgotten
   * @param minimumBucketLength the shortest bucket allowed, in seconds
   */
  public AdaptiveBucketing(
      SeasonalTime time, int maxSize, double decayRate, double minimumBucketLength) {
    this.time = Preconditions.checkNotNull(time);
    this.period = time.period();
    Preconditions.checkArgument(period > 0.0, "period must be positive: %s", period);
    Preconditions.checkArgument(maxSize >= 1, "maxSize must be at least one: %s", maxSize);
    checkDecayRate(decayRate);
    Preconditions.checkArgument(
        minimumBucketLength >= 0.0 && minimumBucketLength < period,
        "minimumBucketLength must be in [0, %s): %s", period, minimumBucketLength);
    this.maxSize = maxSize;
    this.decayRate = decayRate;
    this.minimumBucketLength = minimumBucketLength;
  }

  public boolean initialized() {
    return !buckets.isEmpty();
  }

  /**
   * Creates a uniform partition of the period and seeds it from {@code values}, summaries of the
   * values in windows of [startTime, endTime). Returns false if there are no summaries or the
   * time range is empty.
   */
  public boolean initialize(long startTime, long endTime, List<WindowSummary> values) {
    if (values.isEmpty() || endTime <= startTime) {
      LOG.debug("Nothing to initialize from: {} windows in [{}, {})",
          values.size(), startTime, endTime);
      return false;
    }
    int n = maxSize;
    if (minimumBucketLength > 0.0) {
      n = (int) Math.max(1, Math.min(maxSize, Math.floor(period / minimumBucketLength)));
    }
    buckets = new ArrayList<>(n);
    regressionOrigin = startTime;
    for (int i = 0; i < n; i++) {
      double a = period * i / n;
      double b = i + 1 == n ? period : period * (i + 1) / n;
      buckets.add(new BucketModel(a, b, startTime));
    }
    for (WindowSummary window : values) {
      seed(window);
    }
    return true;
  }

  // Spreads a window's count over the buckets it overlaps in proportion to the overlap.
  private void seed(WindowSummary window) {
    double length = window.end() - window.start();
    if (window.count() <= 0.0 || length <= 0.0) {
      return;
    }
    long mid = window.start() + (window.end() - window.start()) / 2;
    double t = regressionTime(mid);
    double offset = time.periodic(window.start());
    double remaining = length;
    while (remaining > 0.0) {
      double phase = offset % period;
      BucketModel bucket = buckets.get(bucketIndex(phase));
      double segment = Math.min(remaining, bucket.end() - phase);
      bucket.addSummary(
          window.mean(), window.variance(), window.count() * segment / length, t, mid,
          phase + segment / 2.0);
      offset = phase + segment;
      remaining -= segment;
    }
  }

  /** Adds {@code value} at {@code time} to the bucket containing {@code phase}. */
  public void add(long time, double phase, double value, double weight) {
    if (buckets.isEmpty()) {
      LOG.debug("Ignoring value at {} before initialization", time);
      return;
    }
    if (!Double.isFinite(value) || !(weight > 0.0) || Double.isInfinite(weight)) {
      LOG.warn("Ignoring bad value {} with weight {} at {}", value, weight, time);
      return;
    }
    buckets.get(bucketIndex(phase))
        .update(value, weight, regressionTime(time), time, phase, minimumSpread());
  }

  /**
   * Adjusts the bucketing to equalize the prediction errors of the buckets. Does nothing if no
   * values have been added since the last refinement.
   */
  public void refine(long time) {
    int n = buckets.size();
    double[] errors = new double[n];
    double sum = 0.0;
    int known = 0;
    for (int i = 0; i < n; i++) {
      errors[i] = buckets.get(i).refinementError();
      if (!Double.isNaN(errors[i])) {
        sum += errors[i];
        known++;
      }
    }
    if (known == 0) {
      return;
    }
    double meanError = sum / known;
    if (meanError > 0.0) {
      moveBoundaries(errors);
      DoubleArrayList mergedErrors = new DoubleArrayList(n);
      int merges = merge(errors, meanError, mergedErrors);
      int splits = split(mergedErrors.toDoubleArray(), meanError, time);
      LOG.debug("Refined to {} buckets: {} merges, {} splits", buckets.size(), merges, splits);
    }
    for (BucketModel bucket : buckets) {
      bucket.resetRefinementError();
    }
  }

  private void moveBoundaries(double[] errors) {
    int n = buckets.size();
    double[] lengths = new double[n];
    for (int i = 0; i < n; i++) {
      lengths[i] = buckets.get(i).length();
    }
    for (int i = 0; i + 1 < n; i++) {
      double el = errors[i];
      double er = errors[i + 1];
      if (Double.isNaN(el) || Double.isNaN(er) || el + er <= 0.0) {
        continue;
      }
      BucketModel left = buckets.get(i);
      BucketModel right = buckets.get(i + 1);
      double shift =
          MAX_BOUNDARY_SHIFT * Math.min(lengths[i], lengths[i + 1]) * (el - er) / (el + er);
      double boundary = left.end() - shift;
      if (boundary - left.start() < minimumBucketLength
          || right.end() - boundary < minimumBucketLength) {
        continue;
      }
      left.setInterval(left.start(), boundary);
      right.setInterval(boundary, right.end());
    }
  }

  private int merge(double[] errors, double meanError, DoubleArrayList mergedErrors) {
    double threshold = MERGE_ERROR_FRACTION * meanError;
    double maxLength = 2.0 * period / maxSize * (1.0 + 1e-9);
    List<BucketModel> result = new ArrayList<>(buckets.size());
    int merges = 0;
    for (int i = 0; i < buckets.size(); i++) {
      BucketModel bucket = buckets.get(i);
      if (i + 1 < buckets.size()
          && errors[i] < threshold
          && errors[i + 1] < threshold
          && bucket.length() + buckets.get(i + 1).length() <= maxLength) {
        result.add(bucket.merge(buckets.get(i + 1)));
        mergedErrors.add((errors[i] + errors[i + 1]) / 2.0);
        merges++;
        i++;
      } else {
        result.add(bucket);
        mergedErrors.add(errors[i]);
      }
    }
    buckets = result;
    return merges;
  }

  private int split(double[] errors, double meanError, long time) {
    int n = buckets.size();
    int headroom = maxSize - n;
    if (headroom <= 0) {
      return 0;
    }
    IntArrayList candidates = new IntArrayList();
    for (int i = 0; i < n; i++) {
      if (errors[i] > SPLIT_ERROR_MULTIPLE * meanError
          && buckets.get(i).length() >= 2.0 * minimumBucketLength) {
        candidates.add(i);
      }
    }
    if (candidates.isEmpty()) {
      return 0;
    }
    int[] order = candidates.toIntArray();
    IntArrays.quickSort(order, (a, b) -> Double.compare(errors[b], errors[a]));
    boolean[] chosen = new boolean[n];
    for (int k = 0; k < Math.min(headroom, order.length); k++) {
      chosen[order[k]] = true;
    }
    double t = regressionTime(time);
    double spread = minimumSpread();
    List<BucketModel> result = new ArrayList<>(n + headroom);
    int splits = 0;
    for (int i = 0; i < n; i++) {
      BucketModel bucket = buckets.get(i);
      double at = chosen[i] ? splitPoint(i, errors, meanError) : Double.NaN;
      if (Double.isNaN(at)) {
        result.add(bucket);
        continue;
      }
      Collections.addAll(result, bucket.split(at, gradient(i, t, spread)));
      splits++;
    }
    buckets = result;
    return splits;
  }

  // Places the split nearer the side whose neighbour has the higher error, since that is where
  // the bucket's error most likely comes from. Returns NaN if no valid split point exists.
  private double splitPoint(int i, double[] errors, double meanError) {
    int n = buckets.size();
    double el = errors[(i + n - 1) % n];
    double er = errors[(i + 1) % n];
    el = Double.isNaN(el) ? meanError : el;
    er = Double.isNaN(er) ? meanError : er;
    double fraction = el + er > 0.0 ? er / (el + er) : 0.5;
    fraction = Math.min(Math.max(fraction, 0.25), 0.75);
    BucketModel bucket = buckets.get(i);
    for (double f : new double[] {fraction, 0.5}) {
      double at = bucket.start() + f * bucket.length();
      if (at - bucket.start() >= minimumBucketLength && bucket.end() - at >= minimumBucketLength) {
        return at;
      }
    }
    return Double.NaN;
  }

  // Estimates the rate of change of the bucket values with phase at bucket i from the values of
  // its neighbours.
  private double gradient(int i, double t, double spread) {
    int n = buckets.size();
    if (n < 3) {
      return 0.0;
    }
    BucketModel prev = buckets.get((i + n - 1) % n);
    BucketModel next = buckets.get((i + 1) % n);
    double cp = prev.centre() - (i == 0 ? period : 0.0);
    double cn = next.centre() + (i + 1 == n ? period : 0.0);
    if (prev.weight() <= 0.0 || next.weight() <= 0.0 || cn <= cp) {
      return 0.0;
    }
    return (next.predict(t, spread) - prev.predict(t, spread)) / (cn - cp);
  }

  /**
   * Ages the bucket statistics to account for {@code elapsed} seconds passing. If
   * {@code meanRevert} is set, the bucket levels and variances also relax toward their means and
   * the boundaries relax toward the uniform partition, by the fraction of information lost.
   */
  public void propagateForwardsByTime(double elapsed, boolean meanRevert) {
    if (elapsed < 0.0) {
      LOG.error("Can't propagate bucketing backwards in time: {}", elapsed);
      return;
    }
    if (buckets.isEmpty()) {
      return;
    }
    double factor = Math.exp(-decayRate * elapsed);
    for (BucketModel bucket : buckets) {
      bucket.age(factor);
    }
    if (!meanRevert || factor >= 1.0) {
      return;
    }
    double alpha = 1.0 - factor;
    double spread = minimumSpread();
    int n = buckets.size();
    double[] levels = new double[n];
    double meanLevel = 0.0;
    double totalLength = 0.0;
    for (int i = 0; i < n; i++) {
      BucketModel bucket = buckets.get(i);
      if (bucket.weight() > 0.0) {
        levels[i] = bucket.predict(regressionTime(bucket.lastUpdate()), spread);
        meanLevel += bucket.length() * levels[i];
        totalLength += bucket.length();
      }
    }
    if (totalLength > 0.0) {
      meanLevel /= totalLength;
      double meanVariance = meanVariance();
      for (int i = 0; i < n; i++) {
        BucketModel bucket = buckets.get(i);
        if (bucket.weight() > 0.0) {
          bucket.shiftLevel(alpha * (meanLevel - levels[i]));
          bucket.relaxVariance(meanVariance, alpha);
        }
      }
    }
    double[] starts = new double[n + 1];
    for (int i = 0; i < n; i++) {
      starts[i] = factor * buckets.get(i).start() + alpha * period * i / n;
    }
    starts[0] = 0.0;
    starts[n] = period;
    for (int i = 0; i < n; i++) {
      buckets.get(i).setInterval(starts[i], starts[i + 1]);
    }
  }

  /** Moves the regression origin to {@code time} without changing any prediction. */
  public void shiftOrigin(long time) {
    double shift = regressionTime(time);
    for (BucketModel bucket : buckets) {
      bucket.shiftAbscissa(-shift);
    }
    regressionOrigin = time;
  }

  /** Adds {@code shift} to every bucket's level. */
  public void shiftLevel(double shift) {
    for (BucketModel bucket : buckets) {
      bucket.shiftLevel(shift);
    }
  }

  /** Adds {@code shift}, in value units per second, to every bucket's slope. */
  public void shiftSlope(double shift) {
    for (BucketModel bucket : buckets) {
      bucket.shiftSlope(shift * REGRESSION_TIME_SCALE);
    }
  }

  /** The weighted mean slope of the buckets which fit one, in value units per second. */
  public double slope() {
    double spread = minimumSpread();
    double total = 0.0;
    double weight = 0.0;
    for (BucketModel bucket : buckets) {
      if (bucket.weight() > 0.0) {
        total += bucket.weight() * bucket.slope(spread);
        weight += bucket.weight();
      }
    }
    return weight > 0.0 ? total / weight / REGRESSION_TIME_SCALE : 0.0;
  }

  /**
   * Appends the centre, value at {@code time} and variance of every non-empty bucket, in phase
   * order.
   */
  public void knots(
      long time, DoubleArrayList centres, DoubleArrayList values, DoubleArrayList variances) {
    double t = regressionTime(time);
    double spread = minimumSpread();
    for (BucketModel bucket : buckets) {
      if (bucket.weight() > 0.0) {
        centres.add(bucket.centre());
        values.add(bucket.predict(t, spread));
        variances.add(bucket.variance());
      }
    }
  }

  /** The length weighted mean of the non-empty buckets' residual variances. */
  public double meanVariance() {
    double total = 0.0;
    double length = 0.0;
    for (BucketModel bucket : buckets) {
      if (bucket.weight() > 0.0) {
        total += bucket.length() * bucket.variance();
        length += bucket.length();
      }
    }
    return length > 0.0 ? total / length : 0.0;
  }

  /** The largest residual variance of any non-empty bucket. */
  public double maxVariance() {
    double result = 0.0;
    for (BucketModel bucket : buckets) {
      if (bucket.weight() > 0.0) {
        result = Math.max(result, bucket.variance());
      }
    }
    return result;
  }

  /** The number of buckets holding values. */
  public int nonEmptySize() {
    int result = 0;
    for (BucketModel bucket : buckets) {
      if (bucket.weight() > 0.0) {
        result++;
      }
    }
    return result;
  }

  /** The effective number of values in the bucket containing {@code phase}. */
  public double count(double phase) {
    return buckets.isEmpty() ? 0.0 : bucket(phase).weight();
  }

  /** See {@link BucketModel#varianceDueToParameterDrift}. */
  public double varianceDueToParameterDrift(long time, double phase) {
    if (buckets.isEmpty()) {
      return 0.0;
    }
    BucketModel bucket = bucket(phase);
    return bucket.varianceDueToParameterDrift(
        regressionTime(time), regressionTime(bucket.lastUpdate()), minimumSpread());
  }

  /** See {@link BucketModel#covariance}. */
  public boolean covariances(double phase, DenseMatrix64F result) {
    return !buckets.isEmpty() && bucket(phase).covariance(minimumSpread(), result);
  }

  /** True if the bucket containing {@code phase} holds more than the minimum samples. */
  public boolean sufficientHistoryToPredict(double phase) {
    return count(phase) > BucketModel.MINIMUM_SAMPLES;
  }

  /** The time in weeks since the regression origin. */
  public double regressionTime(long time) {
    return (time - regressionOrigin) / REGRESSION_TIME_SCALE;
  }

  public int size() {
    return buckets.size();
  }

  public List<BucketModel> buckets() {
    return Collections.unmodifiableList(buckets);
  }

  /** The bucket end points: the starts of every bucket followed by the period. */
  public double[] endpoints() {
    double[] result = new double[buckets.size() + 1];
    for (int i = 0; i < buckets.size(); i++) {
      result[i] = buckets.get(i).start();
    }
    result[buckets.size()] = period;
    return result;
  }

  /** The bucket centres in phase order. */
  public double[] centres() {
    double[] result = new double[buckets.size()];
    for (int i = 0; i < buckets.size(); i++) {
      result[i] = buckets.get(i).centre();
    }
    return result;
  }

  public double period() {
    return period;
  }

  public int maxSize() {
    return maxSize;
  }

  public double minimumBucketLength() {
    return minimumBucketLength;
  }

  public double decayRate() {
    return decayRate;
  }

  public void decayRate(double decayRate) {
    checkDecayRate(decayRate);
    this.decayRate = decayRate;
  }

  public long regressionOrigin() {
    return regressionOrigin;
  }

  public void clear() {
    buckets = new ArrayList<>();
  }

  public void hash(Hasher hasher) {
    hasher.putDouble(period).putInt(maxSize).putDouble(decayRate).putDouble(minimumBucketLength);
    hasher.putLong(regressionOrigin).putInt(buckets.size());
    for (BucketModel bucket : buckets) {
      bucket.hash(hasher);
    }
  }

  @Override
  public long heapSize() {
    long result = OBJ_SIZE + SizeOf.arrayList(buckets.size());
    for (BucketModel bucket : buckets) {
      result += bucket.heapSize();
    }
    return result;
  }

  public void persist(StatePersistInserter inserter) {
    inserter.insertValue(PERIOD_TAG, period);
    inserter.insertValue(MAX_SIZE_TAG, maxSize);
    inserter.insertValue(DECAY_RATE_TAG, decayRate);
    inserter.insertValue(MIN_BUCKET_LENGTH_TAG, minimumBucketLength);
    inserter.insertValue(ORIGIN_TAG, regressionOrigin);
    for (BucketModel bucket : buckets) {
      inserter.insertLevel(BUCKET_TAG, bucket::persist);
    }
  }

  /**
   * Restores state written by {@link #persist}. Returns false, leaving this unchanged, if the
   * state is malformed, incomplete, or does not tile this bucketing's period.
   */
  public boolean restore(StateRestoreTraverser traverser) {
    Double restoredPeriod = null;
    Long restoredMaxSize = null;
    Double restoredDecayRate = null;
    Double restoredMinimumLength = null;
    Long restoredOrigin = null;
    List<BucketModel> restored = new ArrayList<>();
    while (traverser.next()) {
      switch (traverser.name()) {
        case PERIOD_TAG:
          restoredPeriod = traverser.doubleValue();
          break;
        case MAX_SIZE_TAG:
          restoredMaxSize = traverser.longValue();
          break;
        case DECAY_RATE_TAG:
          restoredDecayRate = traverser.doubleValue();
          break;
        case MIN_BUCKET_LENGTH_TAG:
          restoredMinimumLength = traverser.doubleValue();
          break;
        case ORIGIN_TAG:
          restoredOrigin = traverser.longValue();
          break;
        case BUCKET_TAG:
          BucketModel[] bucket = new BucketModel[1];
          if (!traverser.traverseSubLevel(
              level -> (bucket[0] = BucketModel.restore(level)) != null)) {
            LOG.warn("Invalid bucket in state document");
            return false;
          }
          restored.add(bucket[0]);
          break;
        default:
          LOG.debug("Skipping unknown tag {}", traverser.name());
          break;
      }
    }
    if (restoredPeriod == null || restoredPeriod != period) {
      LOG.warn("Restored period {} does not match {}", restoredPeriod, period);
      return false;
    }
    if (restoredMaxSize == null || restoredMaxSize < 1 || restoredMaxSize > Integer.MAX_VALUE
        || restoredDecayRate == null || !(restoredDecayRate >= 0.0)
        || Double.isInfinite(restoredDecayRate)
        || restoredMinimumLength == null
        || !(restoredMinimumLength >= 0.0 && restoredMinimumLength < period)
        || restoredOrigin == null) {
      LOG.warn("Missing or invalid bucketing parameters in state document");
      return false;
    }
    if (!tiles(restored, restoredMaxSize)) {
      LOG.warn("Restored buckets do not tile the period");
      return false;
    }
    maxSize = restoredMaxSize.intValue();
    decayRate = restoredDecayRate;
    minimumBucketLength = restoredMinimumLength;
    regressionOrigin = restoredOrigin;
    buckets = restored;
    return true;
  }

  private boolean tiles(List<BucketModel> candidate, long size) {
    if (candidate.isEmpty()) {
      return true;
    }
    if (candidate.size() > size || candidate.get(0).start() != 0.0
        || candidate.get(candidate.size() - 1).end() != period) {
      return false;
    }
    for (int i = 1; i < candidate.size(); i++) {
      if (candidate.get(i).start() != candidate.get(i - 1).end()) {
        return false;
      }
    }
    return true;
  }

  private BucketModel bucket(double phase) {
    return buckets.get(bucketIndex(phase));
  }

  // The index of the bucket containing phase, which is clamped into [0, period).
  private int bucketIndex(double phase) {
    int lo = 0;
    int hi = buckets.size() - 1;
    while (lo < hi) {
      int mid = (lo + hi + 1) >>> 1;
      if (buckets.get(mid).start() <= phase) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    return lo;
  }

  private double minimumSpread() {
    return MINIMUM_SPREAD_FRACTION * period / REGRESSION_TIME_SCALE;
  }

  private static void checkDecayRate(double decayRate) {
    Preconditions.checkArgument(
        decayRate >= 0.0 && !Double.isInfinite(decayRate),
        "decayRate must be non-negative and finite: %s", decayRate);
  }
}
