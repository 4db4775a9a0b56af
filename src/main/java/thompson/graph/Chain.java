package thompson.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable sequence which can be appended to another in constant time.
 *
 * <p>A chain is either a leaf holding a list of items or the join of two
 * chains. Iteration walks the joins with an explicit stack, so long chains
 * built from many small appends are fine.
 *
 * @param <T> items in the sequence
 *
 * @author regex-thompson authors
 */
final class Chain<T> implements Iterable<T> {

  private static final Chain<?> EMPTY = new Chain<>(List.of(), null, null);

  // Items of a leaf (empty for joins)
  private final List<T> items;

  private final Chain<T> left;
  private final Chain<T> right;
  private final int size;

  private Chain(List<T> items, Chain<T> left, Chain<T> right) {
    this.items = items;
    this.left = left;
    this.right = right;
    this.size = left == null ? items.size() : left.size + right.size;
  }

  @SuppressWarnings("unchecked")
  static <T> Chain<T> empty() {
    return (Chain<T>) EMPTY;
  }

  @SafeVarargs
  static <T> Chain<T> of(T... items) {
    return new Chain<>(List.of(items), null, null);
  }

  static <T> Chain<T> copyOf(List<T> items) {
    return new Chain<>(List.copyOf(items), null, null);
  }

  Chain<T> append(Chain<T> other) {
    if (other.size == 0) {
      return this;
    } else if (size == 0) {
      return other;
    }
    return new Chain<>(List.of(), this, other);
  }

  int size() {
    return size;
  }

  List<T> toList() {
    final var list = new ArrayList<T>(size);
    for (T item : this) {
      list.add(item);
    }
    return list;
  }

  @Override
  public Iterator<T> iterator() {
    final Deque<Chain<T>> pending = new ArrayDeque<>();
    pending.push(this);

    return new Iterator<T>() {
      private Iterator<T> current = Collections.emptyIterator();

      @Override
      public boolean hasNext() {
        while (!current.hasNext()) {
          if (pending.isEmpty()) {
            return false;
          }
          final Chain<T> next = pending.pop();
          if (next.left == null) {
            current = next.items.iterator();
          } else {
            pending.push(next.right);
            pending.push(next.left);
          }
        }
        return true;
      }

      @Override
      public T next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return current.next();
      }
    };
  }
}
