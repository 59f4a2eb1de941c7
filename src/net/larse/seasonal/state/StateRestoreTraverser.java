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
package net.larse.seasonal.state;

import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;
import java.util.List;
import java.util.function.Predicate;

/**
 * Walks the elements of one level of a state document in the order they were written.
 *
 * <p>Typical use:
 *
 * <pre>
 *   while (traverser.next()) {
 *     switch (traverser.name()) {
 *       case "a": ...
 *       default: // unknown tags are skipped
 *     }
 *   }
 * </pre>
 */
public interface StateRestoreTraverser {
  char DELIMITER = ',';

  /** Moves to the next element of this level; false once the level is exhausted. */
  boolean next();

  /** The tag of the current element. */
  String name();

  /** The value of the current element, or null if it is a nested level. */
  String value();

  boolean hasSubLevel();

  /**
   * Runs {@code level} over the nested level of the current element and returns its result.
   * Returns false if the current element has no nested level.
   */
  boolean traverseSubLevel(Predicate<StateRestoreTraverser> level);

  /** The current value as a double, or null if it is missing or malformed. */
  default Double doubleValue() {
    String value = value();
    return value == null ? null : Doubles.tryParse(value);
  }

  /** The current value as a long, or null if it is missing or malformed. */
  default Long longValue() {
    String value = value();
    return value == null ? null : Longs.tryParse(value);
  }

  /** The current value as a list of doubles, or null if any entry is malformed. */
  default double[] doubleValues() {
    String value = value();
    if (value == null) {
      return null;
    }
    if (value.isEmpty()) {
      return new double[0];
    }
    List<String> parts = Splitter.on(DELIMITER).splitToList(value);
    double[] result = new double[parts.size()];
    for (int i = 0; i < result.length; i++) {
      Double parsed = Doubles.tryParse(parts.get(i));
      if (parsed == null) {
        return null;
      }
      result[i] = parsed;
    }
    return result;
  }
}
