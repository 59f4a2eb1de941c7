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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.hash.Hasher;
import com.google.common.primitives.Longs;
import java.util.List;

/**
 * The xoroshiro128+ generator of Blackman and Vigna.
 *
 * <p>The whole state is two longs, so it can be persisted and restored exactly. The state is
 * expanded from a single seed with splitmix64, which guarantees it is never all zero.
 */
public class XoroShiro128Plus {
  private static final double DOUBLE_UNIT = 0x1.0p-53;

  private long s0;
  private long s1;

  public XoroShiro128Plus(long seed) {
    seed(seed);
  }

  public void seed(long seed) {
    long x = seed;
    x += 0x9e3779b97f4a7c15L;
    s0 = mix(x);
    x += 0x9e3779b97f4a7c15L;
    s1 = mix(x);
  }

  public long nextLong() {
    long a = s0;
    long b = s1;
    long result = a + b;
    b ^= a;
    s0 = Long.rotateLeft(a, 24) ^ b ^ (b << 16);
    s1 = Long.rotateLeft(b, 37);
    return result;
  }

  /** A uniform sample from [0, 1). */
  public double nextDouble() {
    return (nextLong() >>> 11) * DOUBLE_UNIT;
  }

  public void hash(Hasher hasher) {
    hasher.putLong(s0).putLong(s1);
  }

  /** Encodes the state as text suitable for a state document. */
  public String toDelimited() {
    return Joiner.on(':').join(s0, s1);
  }

  /** Restores a state written by {@link #toDelimited()}; returns false if it is malformed. */
  public boolean fromDelimited(String state) {
    List<String> parts = Splitter.on(':').splitToList(state);
    if (parts.size() != 2) {
      return false;
    }
    Long a = Longs.tryParse(parts.get(0));
    Long b = Longs.tryParse(parts.get(1));
    if (a == null || b == null || (a == 0 && b == 0)) {
      return false;
    }
    s0 = a;
    s1 = b;
    return true;
  }

  private static long mix(long z) {
    z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
    z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
    return z ^ (z >>> 31);
  }
}
