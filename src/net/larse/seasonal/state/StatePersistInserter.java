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

import com.google.common.base.Joiner;
import com.google.common.primitives.Doubles;
import java.util.function.Consumer;

/**
 * Writes tagged values and nested levels of a state document.
 *
 * <p>Doubles are written with {@link Double#toString(double)}, which parses back to the identical
 * value, so a restored model reproduces the persisted one bit for bit.
 */
public interface StatePersistInserter {
  void insertValue(String tag, String value);

  /** Adds a nested level named {@code tag} whose contents are written by {@code level}. */
  void insertLevel(String tag, Consumer<StatePersistInserter> level);

  default void insertValue(String tag, double value) {
    insertValue(tag, Double.toString(value));
  }

  default void insertValue(String tag, long value) {
    insertValue(tag, Long.toString(value));
  }

  default void insertValues(String tag, double... values) {
    insertValue(tag, Joiner.on(StateRestoreTraverser.DELIMITER).join(Doubles.asList(values)));
  }
}
