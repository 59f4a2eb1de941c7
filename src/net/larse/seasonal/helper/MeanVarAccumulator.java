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

import com.google.common.hash.Hasher;

/**
 * Weighted running mean and (population) variance. Aging scales the weight only, so old samples
 * lose influence without moving the current estimates.
 */
public class MeanVarAccumulator {
  private double weight;
  private double mean;
  private double variance;

  public MeanVarAccumulator() {}

  public MeanVarAccumulator(double weight, double mean, double variance) {
    this.weight = weight;
    this.mean = mean;
    this.variance = variance;
  }

  public MeanVarAccumulator copy() {
    return new MeanVarAccumulator(weight, mean, variance);
  }

  public double weight() {
    return weight;
  }

  public double mean() {
    return mean;
  }

  public double variance() {
    return variance;
  }

  public void add(double x, double w) {
    add(x, 0.0, w);
  }

  /** Adds {@code w} samples with the given mean and variance. */
  public void add(double m, double v, double w) {
    if (w <= 0.0) {
      return;
    }
    double total = weight + w;
    double delta = m - mean;
    mean += w * delta / total;
    variance = (weight * variance + w * v + weight * w * delta * delta / total) / total;
    weight = total;
  }

  public void add(MeanVarAccumulator other) {
    add(other.mean, other.variance, other.weight);
  }

  public void age(double factor) {
    weight *= factor;
  }

  /** Moves the variance a fraction {@code alpha} of the way toward {@code target}. */
  public void relaxVariance(double target, double alpha) {
    variance += alpha * (target - variance);
  }

  public void reset() {
    weight = 0.0;
    mean = 0.0;
    variance = 0.0;
  }

  public double[] toArray() {
    return new double[] {weight, mean, variance};
  }

  /** Restores from {@link #toArray()} output; false if it is malformed. */
  public boolean fromArray(double[] values) {
    if (values == null || values.length != 3 || values[0] < 0.0 || values[2] < 0.0) {
      return false;
    }
    weight = values[0];
    mean = values[1];
    variance = values[2];
    return true;
  }

  public void hash(Hasher hasher) {
    hasher.putDouble(weight).putDouble(mean).putDouble(variance);
  }
}
