package thompson.graph;

/**
 * State of a non-deterministic automaton.
 *
 * <p>Identifiers are only meaningful relative to the builder which allocated
 * them: states from two different compilations may share an ID.
 *
 * @param id unique identifier of the state within its automaton
 *
 * @author regex-thompson authors
 */
public record NfaState(int id) implements Comparable<NfaState> {

  @Override
  public int compareTo(NfaState other) {
    return Integer.compare(id, other.id);
  }

  // Spelled out since `StateSet` hashes its members by their IDs
  @Override
  public int hashCode() {
    return Integer.hashCode(id);
  }

  @Override
  public String toString() {
    return Integer.toString(id);
  }
}
