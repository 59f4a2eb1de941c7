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

/**
 * A summary of the values seen in the time window [start, end): their count, mean and variance.
 * These seed a seasonal component's buckets when it is initialized.
 */
public final class WindowSummary {
  private final long start;
  private final long end;
  private final double count;
  private final double mean;
  private final double variance;

  public WindowSummary(long start, long end, double count, double mean, double variance) {
    Preconditions.checkArgument(start <= end, "window ends before it starts: [%s, %s)", start, end);
    Preconditions.checkArgument(count >= 0.0, "negative count: %s", count);
    Preconditions.checkArgument(variance >= 0.0, "negative variance: %s", variance);
    this.start = start;
    this.end = end;
    this.count = count;
    this.mean = mean;
    this.variance = variance;
  }

  public long start() {
    return start;
  }

  public long end() {
    return end;
  }

  public double count() {
    return count;
  }

  public double mean() {
    return mean;
  }

  public double variance() {
    return variance;
  }

  @Override
  public String toString() {
    return String.format("[%d, %d) n=%s mean=%s var=%s", start, end, count, mean, variance);
  }
}
