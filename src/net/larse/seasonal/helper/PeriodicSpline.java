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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interpolates values known at a set of knots in [0, period) by a spline which wraps around the
 * period, so that the value at phase 0 joins the value at phase period.
 *
 * <p>The cubic spline has continuous first and second derivatives everywhere including across
 * the wrap. The linear spline just joins the knots with straight lines.
 */
public class PeriodicSpline implements SizeOf.Measurable {
  private static final Logger LOG = LoggerFactory.getLogger(PeriodicSpline.class);

  private static final long OBJ_SIZE = SizeOf.object(SizeOf.DOUBLE + 4 * SizeOf.PTR);

  public enum Type {
    LINEAR,
    CUBIC
  }

  private final double period;
  private Type type;
  private double[] knots = new double[0];
  private double[] values = new double[0];
  // second derivatives at the knots, all zero for the linear spline
  private double[] curvatures = new double[0];

  public PeriodicSpline(double period, Type type) {
    Preconditions.checkArgument(period > 0.0, "period must be positive: %s", period);
    this.period = period;
    this.type = Preconditions.checkNotNull(type);
  }

  public double period() {
    return period;
  }

  public Type type() {
    return type;
  }

  public boolean isEmpty() {
    return knots.length == 0;
  }

  public double[] knots() {
    return knots.clone();
  }

  public double[] values() {
    return values.clone();
  }

  public void clear() {
    knots = new double[0];
    values = new double[0];
    curvatures = new double[0];
  }

  /**
   * Refits the spline to {@code values} at {@code knots}, which must be strictly increasing and
   * lie in [0, period).
   */
  public void fit(double[] knots, double[] values, Type type) {
    Preconditions.checkArgument(knots.length == values.length, "knots and values differ in length");
    Preconditions.checkArgument(
        validKnots(knots), "knots must be increasing in [0, %s): %s", period,
        Arrays.toString(knots));
    this.type = type;
    this.knots = knots.clone();
    this.values = values.clone();
    this.curvatures = new double[knots.length];
    if (type == Type.CUBIC && knots.length > 1 && !solveCurvatures()) {
      LOG.warn("Unable to fit cubic spline to {} knots, falling back to linear", knots.length);
      Arrays.fill(curvatures, 0.0);
      this.type = Type.LINEAR;
    }
  }

  /** True if {@code knots} are strictly increasing and lie in [0, period). */
  public boolean validKnots(double[] knots) {
    for (int i = 0; i < knots.length; i++) {
      if (!(knots[i] >= 0.0 && knots[i] < period) || (i > 0 && !(knots[i] > knots[i - 1]))) {
        return false;
      }
    }
    return true;
  }

  /** Evaluates the spline at {@code phase}, which is first reduced modulo the period. */
  public double value(double phase) {
    int n = knots.length;
    if (n == 0) {
      return 0.0;
    }
    if (n == 1) {
      return values[0];
    }
    double x = reduce(phase);
    int i = Arrays.binarySearch(knots, x);
    if (i < 0) {
      i = -i - 2;
    }
    // x >= knots[0] after reduction, so i is in [0, n)
    int j = i + 1 == n ? 0 : i + 1;
    double xl = knots[i];
    double xr = j == 0 ? knots[0] + period : knots[j];
    double h = xr - xl;
    double b = (x - xl) / h;
    double a = 1.0 - b;
    double result = a * values[i] + b * values[j];
    if (type == Type.CUBIC) {
      result += ((a * a * a - a) * curvatures[i] + (b * b * b - b) * curvatures[j]) * h * h / 6.0;
    }
    return result;
  }

  /** The mean of the spline over one period, i.e. its integral divided by the period. */
  public double mean() {
    int n = knots.length;
    if (n == 0) {
      return 0.0;
    }
    if (n == 1) {
      return values[0];
    }
    double integral = 0.0;
    for (int i = 0; i < n; i++) {
      int j = i + 1 == n ? 0 : i + 1;
      double h = (j == 0 ? knots[0] + period : knots[j]) - knots[i];
      integral += h * (values[i] + values[j]) / 2.0;
      integral -= h * h * h * (curvatures[i] + curvatures[j]) / 24.0;
    }
    return integral / period;
  }

  public void hash(Hasher hasher) {
    hasher.putInt(type.ordinal());
    for (int i = 0; i < knots.length; i++) {
      hasher.putDouble(knots[i]).putDouble(values[i]);
    }
  }

  @Override
  public long heapSize() {
    return OBJ_SIZE + SizeOf.array(knots) + SizeOf.array(values) + SizeOf.array(curvatures);
  }

  // Maps x into [knots[0], knots[0] + period).
  private double reduce(double x) {
    double offset = (x - knots[0]) % period;
    if (offset < 0.0) {
      offset += period;
    }
    if (offset >= period) {
      offset = 0.0;
    }
    return knots[0] + offset;
  }

  // The periodic cubic spline's second derivatives M satisfy, for every knot i,
  //   h[i-1] M[i-1] + 2 (h[i-1] + h[i]) M[i] + h[i] M[i+1]
  //       = 6 ((y[i+1] - y[i]) / h[i] - (y[i] - y[i-1]) / h[i-1])
  // with indices taken modulo n. The matrix is cyclic tridiagonal and strictly diagonally
  // dominant; n is the bucket count, so we just hand it to a dense solver.
  private boolean solveCurvatures() {
    int n = knots.length;
    double[] h = new double[n];
    for (int i = 0; i < n; i++) {
      h[i] = (i + 1 == n ? knots[0] + period : knots[i + 1]) - knots[i];
    }
    DenseMatrix64F a = new DenseMatrix64F(n, n);
    DenseMatrix64F b = new DenseMatrix64F(n, 1);
    for (int i = 0; i < n; i++) {
      int prev = (i + n - 1) % n;
      int next = (i + 1) % n;
      a.add(i, prev, h[prev]);
      a.add(i, i, 2.0 * (h[prev] + h[i]));
      a.add(i, next, h[i]);
      b.set(i, 0, 6.0 * ((values[next] - values[i]) / h[i] - (values[i] - values[prev]) / h[prev]));
    }
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.linear(n);
    if (!solver.setA(a)) {
      return false;
    }
    DenseMatrix64F m = new DenseMatrix64F(n, 1);
    solver.solve(b, m);
    for (int i = 0; i < n; i++) {
      double curvature = m.get(i, 0);
      if (!Double.isFinite(curvature)) {
        return false;
      }
      curvatures[i] = curvature;
    }
    return true;
  }
}
