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
import net.larse.seasonal.helper.LeastSquaresOnline;
import net.larse.seasonal.helper.MeanVarAccumulator;
import net.larse.seasonal.helper.SizeOf;
import net.larse.seasonal.state.StatePersistInserter;
import net.larse.seasonal.state.StateRestoreTraverser;
import org.ejml.data.DenseMatrix64F;

/**
 * The model of one bucket of the adaptive bucketing: a weighted linear regression of the values
 * which fell in a phase interval against (regression) time, plus the variance of the residuals
 * about that regression.
 *
 * <p>The bucket also tracks the weighted mean phase of its values, its centre, which is where its
 * value is placed when the bucket values are interpolated, and the mean squared prediction error
 * since the bucketing was last refined.
 */
public class BucketModel implements SizeOf.Measurable {
  /** The weight a regression needs before its covariance is available. */
  public static final double MINIMUM_SAMPLES = 3.0;

  // The weight the regression needs before residuals are meaningful.
  private static final double MINIMUM_RESIDUAL_WEIGHT = 1.0;

  // Centres are kept this fraction of the bucket length inside its end points.
  private static final double CENTRE_MARGIN = 0.01;

  private static final long OBJ_SIZE =
      SizeOf.object(5 * SizeOf.DOUBLE + SizeOf.LONG + 3 * SizeOf.PTR);

  private static final String START_TAG = "start";
  private static final String END_TAG = "end";
  private static final String CENTRE_TAG = "centre";
  private static final String LAST_UPDATE_TAG = "last_update";
  private static final String REGRESSION_TAG = "regression";
  private static final String VARIANCE_TAG = "variance";
  private static final String ERROR_TAG = "error";

  private double start;
  private double end;
  private double centre;
  private double centreWeight;
  private long lastUpdate;
  private final LeastSquaresOnline regression;
  private final MeanVarAccumulator variance;
  private final MeanVarAccumulator error;

  public BucketModel(double start, double end, long lastUpdate) {
    this(start, end, lastUpdate, new LeastSquaresOnline(), new MeanVarAccumulator());
  }

  private BucketModel(
      double start,
      double end,
      long lastUpdate,
      LeastSquaresOnline regression,
      MeanVarAccumulator variance) {
    Preconditions.checkArgument(start < end, "empty bucket [%s, %s)", start, end);
    this.start = start;
    this.end = end;
    this.centre = (start + end) / 2.0;
    this.lastUpdate = lastUpdate;
    this.regression = regression;
    this.variance = variance;
    this.error = new MeanVarAccumulator();
  }

  public double start() {
    return start;
  }

  public double end() {
    return end;
  }

  public double length() {
    return end - start;
  }

  public double centre() {
    return centre;
  }

  public long lastUpdate() {
    return lastUpdate;
  }

  /** The effective number of values in the bucket. */
  public double weight() {
    return regression.weight();
  }

  public boolean contains(double phase) {
    return phase >= start && phase < end;
  }

  /**
   * Folds a value into the regression and residual variance.
   *
   * @param value the value
   * @param weight the value's weight
   * @param regressionTime the value's time as a regression abscissa
   * @param time the value's time
   * @param phase the value's (jittered) phase
   * @param minimumSpread the minimum abscissa spread for which a slope is fitted
   */
  public void update(
      double value, double weight, double regressionTime, long time, double phase,
      double minimumSpread) {
    if (regression.weight() >= MINIMUM_RESIDUAL_WEIGHT) {
      double residual = value - regression.predict(regressionTime, minimumSpread);
      variance.add(residual, weight);
      error.add(residual * residual, weight);
    }
    regression.add(regressionTime, value, weight);
    updateCentre(phase, weight);
    lastUpdate = Math.max(lastUpdate, time);
  }

  /** Adds {@code weight} values, summarized by their mean and variance, at {@code phase}. */
  public void addSummary(
      double mean, double var, double weight, double regressionTime, long time, double phase) {
    regression.addSummary(regressionTime, mean, var, weight);
    variance.add(0.0, var, weight);
    updateCentre(phase, weight);
    lastUpdate = Math.max(lastUpdate, time);
  }

  /** Scales down the weight of everything seen so far by {@code factor}. */
  public void age(double factor) {
    regression.age(factor);
    variance.age(factor);
    centreWeight *= factor;
  }

  public double predict(double regressionTime, double minimumSpread) {
    return regression.predict(regressionTime, minimumSpread);
  }

  /** The slope of the regression, per unit regression time. */
  public double slope(double minimumSpread) {
    return regression.parameters(minimumSpread)[1];
  }

  /** The variance of the residuals about the regression. */
  public double variance() {
    return variance.variance();
  }

  /**
   * Fills in the covariance of the regression's intercept and slope. Returns false if the bucket
   * has too little weight.
   */
  public boolean covariance(double minimumSpread, DenseMatrix64F result) {
    return regression.covariance(minimumSpread, MINIMUM_SAMPLES, result);
  }

  /**
   * The variance of the prediction at {@code regressionTime} due to uncertainty in the
   * regression parameters, propagated forward from the last update at {@code lastUpdateTime}.
   * Zero if the covariance is unavailable. Non-decreasing in {@code regressionTime}.
   */
  public double varianceDueToParameterDrift(
      double regressionTime, double lastUpdateTime, double minimumSpread) {
    DenseMatrix64F c = new DenseMatrix64F(2, 2);
    if (!covariance(minimumSpread, c)) {
      return 0.0;
    }
    double t0 = lastUpdateTime;
    double varIntercept = c.get(0, 0) + 2.0 * t0 * c.get(0, 1) + t0 * t0 * c.get(1, 1);
    double covInterceptSlope = c.get(0, 1) + t0 * c.get(1, 1);
    double dt = Math.max(regressionTime - t0, 0.0);
    return Math.max(varIntercept, 0.0)
        + 2.0 * dt * Math.abs(covInterceptSlope)
        + dt * dt * c.get(1, 1);
  }

  /** The mean squared prediction error since the last reset, or NaN if there were no values. */
  public double refinementError() {
    return error.weight() > 0.0 ? error.mean() : Double.NaN;
  }

  public void resetRefinementError() {
    error.reset();
  }

  /** Moves the bucket's end points, keeping its centre inside them. */
  public void setInterval(double start, double end) {
    Preconditions.checkArgument(start < end, "empty bucket [%s, %s)", start, end);
    this.start = start;
    this.end = end;
    clampCentre();
  }

  public void shiftAbscissa(double dt) {
    regression.shiftAbscissa(dt);
  }

  public void shiftLevel(double shift) {
    regression.shiftOrdinate(shift);
  }

  public void shiftSlope(double shift) {
    regression.shiftGradient(shift);
  }

  /** Moves the residual variance a fraction {@code alpha} of the way to {@code target}. */
  public void relaxVariance(double target, double alpha) {
    variance.relaxVariance(target, alpha);
  }

  /** Creates the bucket covering this and its right neighbour {@code next}. */
  public BucketModel merge(BucketModel next) {
    Preconditions.checkArgument(end == next.start, "buckets are not adjacent");
    LeastSquaresOnline r = regression.copy();
    r.addInputsOf(next.regression);
    MeanVarAccumulator v = variance.copy();
    v.add(next.variance);
    BucketModel result =
        new BucketModel(start, next.end, Math.max(lastUpdate, next.lastUpdate), r, v);
    double w = centreWeight + next.centreWeight;
    result.centreWeight = w;
    result.centre = w > 0.0
        ? (centreWeight * centre + next.centreWeight * next.centre) / w
        : (length() * centre + next.length() * next.centre) / result.length();
    result.clampCentre();
    return result;
  }

  /**
   * Splits this bucket at {@code at}. Each half gets a share of the statistics in proportion to
   * its length and has its level corrected by {@code gradient}, the estimated rate of change of
   * the value with phase.
   */
  public BucketModel[] split(double at, double gradient) {
    Preconditions.checkArgument(at > start && at < end, "split point %s outside bucket", at);
    double[] bounds = {start, at, end};
    BucketModel[] result = new BucketModel[2];
    for (int i = 0; i < 2; i++) {
      double fraction = (bounds[i + 1] - bounds[i]) / length();
      LeastSquaresOnline r = regression.copy();
      r.age(fraction);
      MeanVarAccumulator v = variance.copy();
      v.age(fraction);
      BucketModel half = new BucketModel(bounds[i], bounds[i + 1], lastUpdate, r, v);
      half.centreWeight = centreWeight * fraction;
      half.shiftLevel(gradient * (half.centre - centre));
      result[i] = half;
    }
    return result;
  }

  public void hash(Hasher hasher) {
    hasher.putDouble(start).putDouble(end).putDouble(centre).putDouble(centreWeight);
    hasher.putLong(lastUpdate);
    regression.hash(hasher);
    variance.hash(hasher);
    error.hash(hasher);
  }

  @Override
  public long heapSize() {
    return OBJ_SIZE
        + regression.heapSize()
        + 2 * SizeOf.object(3 * SizeOf.DOUBLE);
  }

  public void persist(StatePersistInserter inserter) {
    inserter.insertValue(START_TAG, start);
    inserter.insertValue(END_TAG, end);
    inserter.insertValues(CENTRE_TAG, centre, centreWeight);
    inserter.insertValue(LAST_UPDATE_TAG, lastUpdate);
    inserter.insertValues(REGRESSION_TAG, regression.toArray());
    inserter.insertValues(VARIANCE_TAG, variance.toArray());
    inserter.insertValues(ERROR_TAG, error.toArray());
  }

  /** Reads a bucket written by {@link #persist}; null if it is malformed or incomplete. */
  public static BucketModel restore(StateRestoreTraverser traverser) {
    Double start = null;
    Double end = null;
    double[] centre = null;
    Long lastUpdate = null;
    LeastSquaresOnline regression = new LeastSquaresOnline();
    MeanVarAccumulator variance = new MeanVarAccumulator();
    MeanVarAccumulator error = new MeanVarAccumulator();
    boolean haveRegression = false;
    boolean haveVariance = false;
    boolean haveError = false;
    while (traverser.next()) {
      switch (traverser.name()) {
        case START_TAG:
          start = traverser.doubleValue();
          break;
        case END_TAG:
          end = traverser.doubleValue();
          break;
        case CENTRE_TAG:
          centre = traverser.doubleValues();
          break;
        case LAST_UPDATE_TAG:
          lastUpdate = traverser.longValue();
          break;
        case REGRESSION_TAG:
          haveRegression = regression.fromArray(traverser.doubleValues());
          break;
        case VARIANCE_TAG:
          haveVariance = variance.fromArray(traverser.doubleValues());
          break;
        case ERROR_TAG:
          haveError = error.fromArray(traverser.doubleValues());
          break;
        default:
          break;
      }
    }
    if (start == null || end == null || !(start < end) || centre == null || centre.length != 2
        || lastUpdate == null || !haveRegression || !haveVariance || !haveError) {
      return null;
    }
    BucketModel result = new BucketModel(start, end, lastUpdate, regression, variance);
    result.centre = centre[0];
    result.centreWeight = centre[1];
    result.error.fromArray(error.toArray());
    if (!result.contains(result.centre)) {
      return null;
    }
    return result;
  }

  private void updateCentre(double phase, double weight) {
    double w = centreWeight + weight;
    if (w > 0.0) {
      centre += weight * (phase - centre) / w;
      centreWeight = w;
      clampCentre();
    }
  }

  private void clampCentre() {
    double margin = CENTRE_MARGIN * length();
    centre = Math.min(Math.max(centre, start + margin), end - margin);
  }
}
