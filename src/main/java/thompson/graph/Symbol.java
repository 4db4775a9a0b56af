package thompson.graph;

/**
 * Label on a rule of a finite automaton.
 *
 * <p>A symbol is either a {@link CodeUnit} from the matchable alphabet or the
 * reserved {@link Epsilon#EPSILON}, which is never part of the alphabet and
 * denotes a move that consumes no input.
 *
 * @author regex-thompson authors
 */
public interface Symbol {

  /**
   * Whether this symbol is the free move.
   *
   * @return {@code true} only for {@link Epsilon#EPSILON}
   */
  default boolean isEpsilon() {
    return false;
  }

  /**
   * Label for edges in the DOT graph rendering.
   *
   * @return HTML label string
   */
  String dotLabel();
}
