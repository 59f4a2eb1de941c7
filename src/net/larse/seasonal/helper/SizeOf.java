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

/**
 * Approximate heap size arithmetic, used by models that report their memory footprint to the
 * process holding them.
 *
 * <p>The sizes assume a 64 bit JVM with compressed oops. They are estimates, good enough for
 * budgeting many models at once, not exact accounting.
 */
public final class SizeOf {
  public static final int BOOLEAN = 1;
  public static final int INT = 4;
  public static final int LONG = 8;
  public static final int DOUBLE = 8;
  public static final int PTR = 4;

  private static final int OBJECT_HEADER = 12;
  private static final int ARRAY_HEADER = 16;
  private static final int ALIGNMENT = 8;

  /** Something that can estimate the number of bytes it holds on the heap. */
  public interface Measurable {
    long heapSize();
  }

  private SizeOf() {}

  /** Size of an object whose fields occupy {@code fieldBytes}. */
  public static long object(long fieldBytes) {
    return align(OBJECT_HEADER + fieldBytes);
  }

  /** Size of an array whose elements occupy {@code elementBytes}. */
  public static long array(long elementBytes) {
    return align(ARRAY_HEADER + elementBytes);
  }

  public static long array(double[] array) {
    return array == null ? 0 : array((long) array.length * DOUBLE);
  }

  /** Size of an ArrayList holding {@code capacity} references, excluding the referents. */
  public static long arrayList(int capacity) {
    return object(INT + PTR) + array((long) capacity * PTR);
  }

  private static long align(long bytes) {
    return (bytes + ALIGNMENT - 1) / ALIGNMENT * ALIGNMENT;
  }
}
