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

/** A period of fixed length whose repeats start at {@code startOfPeriod + k * period}. */
public final class FixedPeriodTime implements SeasonalTime {
  public static final long DAY = 86400;
  public static final long WEEK = 7 * DAY;

  private final long period;
  private final long startOfPeriod;

  public FixedPeriodTime(long period) {
    this(period, 0);
  }

  public FixedPeriodTime(long period, long startOfPeriod) {
    Preconditions.checkArgument(period > 0, "period must be positive: %s", period);
    this.period = period;
    this.startOfPeriod = startOfPeriod;
  }

  @Override
  public long period() {
    return period;
  }

  @Override
  public double periodic(long time) {
    return Math.floorMod(time - startOfPeriod, period);
  }

  @Override
  public String toString() {
    return "FixedPeriodTime{period=" + period + ", startOfPeriod=" + startOfPeriod + "}";
  }
}
