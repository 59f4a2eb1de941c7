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
package net.larse.seasonal.helper;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hasher;
import java.util.Arrays;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

/**
 * Computes a weighted least squares line y = a + b * t from a stream of observations, without
 * storing them.
 *
 * <p>Only the weighted sums of the normal equations are kept, so the state can be aged (every
 * sum scaled by the same factor), merged with another solver, split by scaling, and have its
 * abscissa or ordinate shifted, all exactly.
 */
public class LeastSquaresOnline implements SizeOf.Measurable {
  private static final long OBJ_SIZE =
      SizeOf.object(SizeOf.BOOLEAN + 5 * SizeOf.PTR + SizeOf.DOUBLE);

  // The following values were based on cursory examination of the EJML source.
  private static final long SOLVER_SIZE =
      SizeOf.object(3 * SizeOf.INT + 4 * SizeOf.PTR) + SizeOf.array(4 * SizeOf.DOUBLE);
  private static final long MATRIX_SIZE =
      SizeOf.object(2 * SizeOf.INT + SizeOf.PTR) + SizeOf.array(4 * SizeOf.DOUBLE);

  // Below this the normal equations are treated as singular.
  private static final double MIN_QUALITY = 1e-10;

  // [ sum(w), sum(w*t), sum(w*t^2) ]
  private final double[] xSums = new double[3];
  // [ sum(w*y), sum(w*t*y) ]
  private final double[] ySums = new double[2];
  // sum(w*y^2)
  private double y2Sum;

  // true if parameters holds the solution of the current sums
  private boolean solved;
  private double solvedSpread = Double.NaN;
  private final double[] parameters = new double[2];

  // created on first solve
  private DenseMatrix64F xMat;
  private DenseMatrix64F yMat;
  private DenseMatrix64F result;
  private LinearSolver<DenseMatrix64F> solver;

  @Override
  public long heapSize() {
    return OBJ_SIZE
        + SizeOf.array(xSums) + SizeOf.array(ySums) + SizeOf.array(parameters)
        + (xMat == null ? 0 : 3 * MATRIX_SIZE + SOLVER_SIZE);
  }

  // Writing the weighted observations as
  //   X = [ 1 t0 ]     Y = [ y0 ]     W = diag(w0, w1, ...)
  //       [ 1 t1 ]         [ y1 ]
  //        ...              ...
  // the normal equations are (X' W X) p = X' W Y with
  //   X' W X = [ sum(w)    sum(w*t)   ]     X' W Y = [ sum(w*y)   ]
  //            [ sum(w*t)  sum(w*t^2) ]              [ sum(w*t*y) ]
  // and the weighted residual sum of squares is sum(w*y^2) - p . (X' W Y).

  /** Adds one observation {@code y} at {@code t} with weight {@code w}. */
  public void add(double t, double y, double w) {
    addSummary(t, y, 0.0, w);
  }

  /** Adds {@code w} observations at {@code t} with the given mean and variance. */
  public void addSummary(double t, double mean, double variance, double w) {
    xSums[0] += w;
    xSums[1] += w * t;
    xSums[2] += w * t * t;
    ySums[0] += w * mean;
    ySums[1] += w * t * mean;
    y2Sum += w * (mean * mean + variance);
    solved = false;
  }

  /** The total weight of the observations. */
  public double weight() {
    return xSums[0];
  }

  /** The weighted mean of the abscissa, or 0 if empty. */
  public double meanAbscissa() {
    return xSums[0] > 0.0 ? xSums[1] / xSums[0] : 0.0;
  }

  /**
   * Returns the intercept and slope. The slope is only fitted if the weighted standard deviation
   * of the abscissa is at least {@code minimumSpread}; otherwise, or if the normal equations are
   * singular, the result is the weighted mean with zero slope. Empty solvers give zeros.
   */
  public double[] parameters(double minimumSpread) {
    if (!solved || solvedSpread != minimumSpread) {
      solve(minimumSpread);
    }
    return new double[] {parameters[0], parameters[1]};
  }

  public double predict(double t, double minimumSpread) {
    double[] p = parameters(minimumSpread);
    return p[0] + p[1] * t;
  }

  /** True if a slope is being fitted, rather than just the mean. */
  public boolean fitsSlope(double minimumSpread) {
    double w = xSums[0];
    if (w <= 0.0) {
      return false;
    }
    double m = xSums[1] / w;
    double spread = xSums[2] / w - m * m;
    return spread >= minimumSpread * minimumSpread;
  }

  /**
   * Computes the covariance matrix of the intercept and slope, scaled by the estimated residual
   * variance. Returns false if the total weight is below {@code minimumWeight} or the normal
   * equations are singular.
   */
  public boolean covariance(double minimumSpread, double minimumWeight, DenseMatrix64F out) {
    double w = xSums[0];
    if (w < minimumWeight || w <= 2.0) {
      return false;
    }
    double[] p = parameters(minimumSpread);
    double sumSq = y2Sum - p[0] * ySums[0] - p[1] * ySums[1];
    out.reshape(2, 2, false);
    if (!fitsSlope(minimumSpread)) {
      // due to roundoff, sumSq could end up slightly negative
      double sigma2 = Math.max(sumSq, 0.0) / (w - 1.0);
      out.zero();
      out.unsafe_set(0, 0, sigma2 / w);
      return true;
    }
    if (!setUpSolver()) {
      return false;
    }
    double sigma2 = Math.max(sumSq, 0.0) / (w - 2.0);
    solver.invert(out);
    for (int i = 0; i < 4; ++i) {
      out.data[i] *= sigma2;
    }
    return true;
  }

  /** Scales every sum by {@code factor}; the fitted line is unchanged. */
  public void age(double factor) {
    Preconditions.checkArgument(factor >= 0.0, "factor must be non-negative: %s", factor);
    for (int i = 0; i < xSums.length; ++i) {
      xSums[i] *= factor;
    }
    for (int i = 0; i < ySums.length; ++i) {
      ySums[i] *= factor;
    }
    y2Sum *= factor;
    solved = false;
  }

  /** Replaces every abscissa t with t + dt. */
  public void shiftAbscissa(double dt) {
    xSums[2] += 2.0 * dt * xSums[1] + dt * dt * xSums[0];
    xSums[1] += dt * xSums[0];
    ySums[1] += dt * ySums[0];
    solved = false;
  }

  /** Replaces every ordinate y with y + dy. */
  public void shiftOrdinate(double dy) {
    y2Sum += 2.0 * dy * ySums[0] + dy * dy * xSums[0];
    ySums[1] += dy * xSums[1];
    ySums[0] += dy * xSums[0];
    solved = false;
  }

  /** Replaces every ordinate y with y + g * t. */
  public void shiftGradient(double g) {
    y2Sum += 2.0 * g * ySums[1] + g * g * xSums[2];
    ySums[0] += g * xSums[1];
    ySums[1] += g * xSums[2];
    solved = false;
  }

  /**
   * Add all the inputs of another solver to this solver. Does not change the state of the other
   * solver.
   */
  public void addInputsOf(LeastSquaresOnline other) {
    add(xSums, other.xSums);
    add(ySums, other.ySums);
    y2Sum += other.y2Sum;
    solved = false;
  }

  public LeastSquaresOnline copy() {
    LeastSquaresOnline result = new LeastSquaresOnline();
    result.addInputsOf(this);
    return result;
  }

  /** Reset the solver to its no-inputs state. */
  public void reset() {
    Arrays.fill(xSums, 0);
    Arrays.fill(ySums, 0);
    y2Sum = 0;
    solved = false;
  }

  public double[] toArray() {
    return new double[] {xSums[0], xSums[1], xSums[2], ySums[0], ySums[1], y2Sum};
  }

  /** Restores from {@link #toArray()} output; false if it is malformed. */
  public boolean fromArray(double[] values) {
    if (values == null || values.length != 6 || values[0] < 0.0) {
      return false;
    }
    System.arraycopy(values, 0, xSums, 0, 3);
    System.arraycopy(values, 3, ySums, 0, 2);
    y2Sum = values[5];
    solved = false;
    return true;
  }

  public void hash(Hasher hasher) {
    for (double x : toArray()) {
      hasher.putDouble(x);
    }
  }

  private void solve(double minimumSpread) {
    double w = xSums[0];
    parameters[0] = 0.0;
    parameters[1] = 0.0;
    if (w > 0.0) {
      parameters[0] = ySums[0] / w;
      if (fitsSlope(minimumSpread) && setUpSolver()) {
        solver.solve(yMat, result);
        parameters[0] = result.unsafe_get(0, 0);
        parameters[1] = result.unsafe_get(1, 0);
      }
    }
    solved = true;
    solvedSpread = minimumSpread;
  }

  // populate xMat and yMat from the sums and make sure the system is invertible
  private boolean setUpSolver() {
    if (xMat == null) {
      xMat = new DenseMatrix64F(2, 2);
      yMat = new DenseMatrix64F(2, 1);
      result = new DenseMatrix64F(2, 1);
      solver = LinearSolverFactory.symmPosDef(2);
    }
    xMat.unsafe_set(0, 0, xSums[0]);
    xMat.unsafe_set(0, 1, xSums[1]);
    xMat.unsafe_set(1, 0, xSums[1]);
    xMat.unsafe_set(1, 1, xSums[2]);
    yMat.unsafe_set(0, 0, ySums[0]);
    yMat.unsafe_set(1, 0, ySums[1]);
    return solver.setA(xMat) && solver.quality() > MIN_QUALITY;
  }

  /** Add each element of src to the corresponding element of dest. */
  private static void add(double[] dest, double[] src) {
    for (int i = 0; i < src.length; ++i) {
      dest[i] += src[i];
    }
  }
}
