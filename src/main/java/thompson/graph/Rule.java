package thompson.graph;

import java.util.Objects;

/**
 * Transition rule of a finite automaton.
 *
 * @param <Q> states in the automaton
 * @param state state in which the rule applies
 * @param symbol symbol read by the rule (or {@link Epsilon#EPSILON} for a free move)
 * @param nextState state entered after following the rule
 *
 * @author regex-thompson authors
 */
public record Rule<Q>(Q state, Symbol symbol, Q nextState) {

  public Rule {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(symbol, "symbol");
    Objects.requireNonNull(nextState, "nextState");
  }

  public static <Q> Rule<Q> epsilon(Q state, Q nextState) {
    return new Rule<>(state, Epsilon.EPSILON, nextState);
  }

  public static <Q> Rule<Q> onChar(Q state, char c, Q nextState) {
    return new Rule<>(state, CodeUnit.of(c), nextState);
  }

  /**
   * Check if the rule applies in a given state when reading a given symbol.
   *
   * @param fromState current state
   * @param read symbol read (compared for exact equality)
   */
  public boolean appliesTo(Q fromState, Symbol read) {
    return state.equals(fromState) && symbol.equals(read);
  }

  public Q follow() {
    return nextState;
  }

  public boolean isEpsilon() {
    return symbol.isEpsilon();
  }

  @Override
  public String toString() {
    return "#<Rule " + state + " --" + symbol + "--> " + nextState + ">";
  }
}
