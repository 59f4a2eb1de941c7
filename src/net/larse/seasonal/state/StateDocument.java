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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * An in-memory tree of tagged values. Each element is either a leaf with a string value or a
 * named level holding further elements.
 */
public final class StateDocument {
  private final String tag;
  private final String value;
  private final List<StateDocument> children;

  private StateDocument(String tag, String value, List<StateDocument> children) {
    this.tag = tag;
    this.value = value;
    this.children = children;
  }

  /** Builds a document from whatever {@code writer} inserts at the top level. */
  public static StateDocument write(Consumer<StatePersistInserter> writer) {
    List<StateDocument> children = new ArrayList<>();
    writer.accept(new Inserter(children));
    return new StateDocument("", null, ImmutableList.copyOf(children));
  }

  /** Builds a document from explicit elements, mainly to create edited or broken documents. */
  public static StateDocument of(List<StateDocument> elements) {
    return new StateDocument("", null, ImmutableList.copyOf(elements));
  }

  public static StateDocument leaf(String tag, String value) {
    return new StateDocument(tag, Preconditions.checkNotNull(value), ImmutableList.of());
  }

  public static StateDocument level(String tag, List<StateDocument> elements) {
    return new StateDocument(tag, null, ImmutableList.copyOf(elements));
  }

  public String tag() {
    return tag;
  }

  public String value() {
    return value;
  }

  public List<StateDocument> elements() {
    return children;
  }

  /** A traverser positioned before the first top-level element. */
  public StateRestoreTraverser traverser() {
    return new Traverser(children);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (StateDocument child : children) {
      child.append(sb, 0);
    }
    return sb.toString();
  }

  private void append(StringBuilder sb, int depth) {
    sb.append(Strings.repeat("  ", depth)).append(tag);
    if (value != null) {
      sb.append(" = ").append(value).append('\n');
    } else {
      sb.append('\n');
      for (StateDocument child : children) {
        child.append(sb, depth + 1);
      }
    }
  }

  private static final class Inserter implements StatePersistInserter {
    private final List<StateDocument> elements;

    Inserter(List<StateDocument> elements) {
      this.elements = elements;
    }

    @Override
    public void insertValue(String tag, String value) {
      elements.add(leaf(tag, value));
    }

    @Override
    public void insertLevel(String tag, Consumer<StatePersistInserter> level) {
      List<StateDocument> nested = new ArrayList<>();
      level.accept(new Inserter(nested));
      elements.add(level(tag, nested));
    }
  }

  private static final class Traverser implements StateRestoreTraverser {
    private final List<StateDocument> elements;
    private int position = -1;

    Traverser(List<StateDocument> elements) {
      this.elements = elements;
    }

    @Override
    public boolean next() {
      if (position < elements.size()) {
        position++;
      }
      return position < elements.size();
    }

    @Override
    public String name() {
      return current().tag;
    }

    @Override
    public String value() {
      return current().value;
    }

    @Override
    public boolean hasSubLevel() {
      return current().value == null;
    }

    @Override
    public boolean traverseSubLevel(Predicate<StateRestoreTraverser> level) {
      return hasSubLevel() && level.test(new Traverser(current().children));
    }

    private StateDocument current() {
      Preconditions.checkState(
          position >= 0 && position < elements.size(), "traverser is not on an element");
      return elements.get(position);
    }
  }
}
