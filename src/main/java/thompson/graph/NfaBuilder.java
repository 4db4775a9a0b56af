package thompson.graph;

import java.util.ArrayList;
import java.util.List;
import thompson.parser.PatternVisitor;

/**
 * Regex AST visitor which builds up the corresponding NFA using Thompson's
 * construction.
 *
 * <p>Every visit returns a self-contained {@link Fragment}: a start state, some
 * accepting states and the rules between them. Combining fragments only ever
 * adds new epsilon rules (and possibly a fresh start state) around them, so a
 * sub-fragment is never modified once built. The rules and accepting states of
 * the operands are shared rather than copied, which keeps the whole
 * construction linear in the size of the pattern. Use {@link #build} on the
 * final fragment to get the NFA.
 *
 * <p>States are drawn from a counter owned by the builder, so all fragments
 * built by one builder have pairwise disjoint states. Fragments from different
 * builders must not be combined.
 *
 * @author regex-thompson authors
 */
public final class NfaBuilder implements PatternVisitor<NfaBuilder.Fragment> {

  private int lastState = 0;

  /**
   * Partially built NFA.
   *
   * <p>All of the states of the fragment have IDs in the range from
   * {@code firstState} (inclusive) to {@code endState} (exclusive). Operands
   * of one combinator must have ranges which don't overlap.
   */
  public static final class Fragment {
    final NfaState startState;
    final Chain<NfaState> acceptStates;
    final Chain<Rule<NfaState>> rules;
    final int firstState;
    final int endState;

    private Fragment(
      NfaState startState,
      Chain<NfaState> acceptStates,
      Chain<Rule<NfaState>> rules,
      int firstState,
      int endState
    ) {
      this.startState = startState;
      this.acceptStates = acceptStates;
      this.rules = rules;
      this.firstState = firstState;
      this.endState = endState;
    }

    public NfaState startState() {
      return startState;
    }

    boolean disjoint(Fragment other) {
      return endState <= other.firstState || other.endState <= firstState;
    }

    @Override
    public String toString() {
      return "Fragment(start = " + startState + ", states " + firstState + " to " + (endState - 1)
        + ", " + rules.size() + " rules)";
    }
  }

  /**
   * Summon a fresh state identifier.
   *
   * @return state never returned before by this builder
   */
  public NfaState freshState() {
    return new NfaState(lastState++);
  }

  /**
   * Number of states allocated so far.
   *
   * @return count of fresh states handed out
   */
  public int stateCount() {
    return lastState;
  }

  /**
   * Turn a fragment into a standalone NFA.
   *
   * @param fragment fragment built by this builder
   * @return NFA with the same start state, accepting states and rules
   */
  public Nfa build(Fragment fragment) {
    return new Nfa(
      fragment.startState,
      fragment.acceptStates.toList(),
      new Rulebook<>(fragment.rules.toList())
    );
  }

  @Override
  public Fragment visitEmpty() {
    final NfaState state = freshState();
    return new Fragment(state, Chain.of(state), Chain.empty(), state.id(), lastState);
  }

  @Override
  public Fragment visitLiteral(char character) {
    final NfaState start = freshState();
    final NfaState accept = freshState();
    return new Fragment(
      start,
      Chain.of(accept),
      Chain.of(Rule.onChar(start, character, accept)),
      start.id(),
      lastState
    );
  }

  @Override
  public Fragment visitConcatenation(Fragment first, Fragment second) {
    assert first.disjoint(second) : "fragments share states";

    final List<Rule<NfaState>> links = new ArrayList<>(first.acceptStates.size());
    for (NfaState accept : first.acceptStates) {
      links.add(Rule.epsilon(accept, second.startState));
    }
    return new Fragment(
      first.startState,
      second.acceptStates,
      first.rules.append(second.rules).append(Chain.copyOf(links)),
      Math.min(first.firstState, second.firstState),
      Math.max(first.endState, second.endState)
    );
  }

  @Override
  public Fragment visitChoice(Fragment first, Fragment second) {
    assert first.disjoint(second) : "fragments share states";

    final NfaState start = freshState();
    final Chain<Rule<NfaState>> dispatch = Chain.of(
      Rule.epsilon(start, first.startState),
      Rule.epsilon(start, second.startState)
    );
    return new Fragment(
      start,
      first.acceptStates.append(second.acceptStates),
      first.rules.append(second.rules).append(dispatch),
      Math.min(first.firstState, second.firstState),
      lastState
    );
  }

  @Override
  public Fragment visitRepeat(Fragment pattern) {
    // The new start state also accepts, to permit zero repetitions
    final NfaState start = freshState();
    final List<Rule<NfaState>> loops = new ArrayList<>(pattern.acceptStates.size() + 1);
    loops.add(Rule.epsilon(start, pattern.startState));
    for (NfaState accept : pattern.acceptStates) {
      loops.add(Rule.epsilon(accept, pattern.startState));
    }

    return new Fragment(
      start,
      pattern.acceptStates.append(Chain.of(start)),
      pattern.rules.append(Chain.copyOf(loops)),
      pattern.firstState,
      lastState
    );
  }
}
