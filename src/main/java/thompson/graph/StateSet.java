package thompson.graph;

import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable set of NFA states.
 *
 * <p>This is both the configuration of a running NFA and the state of a DFA
 * obtained by subset construction. Two state sets with the same members are
 * equal (and have the same hash code), which is what lets subset construction
 * recognize an already discovered DFA state.
 *
 * @author regex-thompson authors
 */
public final class StateSet extends AbstractSet<NfaState> {

  public static final StateSet EMPTY = new StateSet(new int[0]);

  // Sorted and distinct state IDs
  private final int[] ids;

  private StateSet(int[] ids) {
    this.ids = ids;
  }

  public static StateSet of(int... ids) {
    return new StateSet(Arrays.stream(ids).sorted().distinct().toArray());
  }

  public static StateSet copyOf(Collection<NfaState> states) {
    if (states instanceof StateSet stateSet) {
      return stateSet;
    }
    return new StateSet(
      new TreeSet<NfaState>(states).stream().mapToInt(NfaState::id).toArray()
    );
  }

  @Override
  public int size() {
    return ids.length;
  }

  @Override
  public boolean contains(Object obj) {
    return obj instanceof NfaState state && Arrays.binarySearch(ids, state.id()) >= 0;
  }

  /**
   * Check whether any state is in both this set and another collection.
   *
   * @param states states to check against
   * @return whether the intersection is non-empty
   */
  public boolean intersects(Collection<NfaState> states) {
    for (int id : ids) {
      if (states.contains(new NfaState(id))) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Iterator<NfaState> iterator() {
    return new Iterator<NfaState>() {
      private int index = 0;

      @Override
      public boolean hasNext() {
        return index < ids.length;
      }

      @Override
      public NfaState next() {
        if (index >= ids.length) {
          throw new NoSuchElementException();
        }
        return new NfaState(ids[index++]);
      }
    };
  }

  @Override
  public int hashCode() {
    // Must agree with `AbstractSet.hashCode`, which sums the element hashes
    int hash = 0;
    for (int id : ids) {
      hash += Integer.hashCode(id);
    }
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof StateSet other) {
      return Arrays.equals(ids, other.ids);
    } else {
      return super.equals(obj);
    }
  }

  @Override
  public String toString() {
    return Arrays
      .stream(ids)
      .mapToObj(Integer::toString)
      .collect(Collectors.joining(",", "{", "}"));
  }
}
