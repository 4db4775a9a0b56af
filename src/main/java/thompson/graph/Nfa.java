package thompson.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;
import thompson.parser.PatternParseException;
import thompson.parser.PatternParser;

/**
 * Non-deterministic finite automaton with epsilon rules.
 *
 * <p>The automaton itself is immutable and can be shared freely. Matching
 * happens on a configuration (the set of states the automaton could currently
 * be in) which belongs to a single match.
 *
 * @author regex-thompson authors
 */
public final class Nfa implements DotGraph<NfaState> {

  private final NfaState startState;

  private final SortedSet<NfaState> acceptStates;

  private final Rulebook<NfaState> rulebook;

  public Nfa(
    NfaState startState,
    Collection<NfaState> acceptStates,
    Rulebook<NfaState> rulebook
  ) {
    this.startState = Objects.requireNonNull(startState, "startState");
    this.acceptStates = Collections.unmodifiableSortedSet(new TreeSet<>(acceptStates));
    this.rulebook = Objects.requireNonNull(rulebook, "rulebook");
  }

  /**
   * Compile a regular expression straight into an NFA, without an intermediate
   * AST.
   *
   * @param pattern regular expression to parse
   * @return NFA accepting the same strings as the pattern
   * @throws PatternParseException if the pattern is malformed
   */
  public static Nfa parse(String pattern) throws PatternParseException {
    final var builder = new NfaBuilder();
    return builder.build(PatternParser.parse(builder, pattern));
  }

  public NfaState startState() {
    return startState;
  }

  public SortedSet<NfaState> acceptStates() {
    return acceptStates;
  }

  public Rulebook<NfaState> rulebook() {
    return rulebook;
  }

  /**
   * All states
   *
   * @return start, accepting and rule states, in ascending order
   */
  public SortedSet<NfaState> allStates() {
    final var states = new TreeSet<NfaState>(rulebook.states());
    states.add(startState);
    states.addAll(acceptStates);
    return Collections.unmodifiableSortedSet(states);
  }

  /**
   * Configuration before reading any input.
   *
   * @return states reachable from the start state using only free moves
   */
  public StateSet initialConfiguration() {
    return StateSet.copyOf(rulebook.epsilonClosure(Set.of(startState)));
  }

  /**
   * Advance a configuration by reading one character.
   *
   * @param configuration current states
   * @param character character read
   * @return next configuration, closed under free moves
   */
  public StateSet step(Set<NfaState> configuration, char character) {
    final Set<NfaState> next = rulebook.nextStates(configuration, CodeUnit.of(character));
    return StateSet.copyOf(rulebook.epsilonClosure(next));
  }

  /**
   * Check whether a configuration accepts.
   *
   * <p>The configuration gets closed first, since free moves may lead to an
   * accepting state without consuming any input.
   *
   * @param configuration current states
   * @return whether some accepting state is reachable
   */
  public boolean accepting(Set<NfaState> configuration) {
    return StateSet.copyOf(rulebook.epsilonClosure(configuration)).intersects(acceptStates);
  }

  /**
   * Run the NFA over a whole input.
   *
   * @param input characters to read
   * @return whether the input is accepted
   */
  public boolean matches(CharSequence input) {
    StateSet configuration = initialConfiguration();
    for (int i = 0; i < input.length(); i++) {
      if (configuration.isEmpty()) {
        return false;
      }
      configuration = step(configuration, input.charAt(i));
    }
    return accepting(configuration);
  }

  /**
   * Start a fresh match.
   *
   * @return simulation positioned before the first character
   */
  public Simulation simulation() {
    return new Simulation();
  }

  /**
   * Mutable configuration of one run of the NFA.
   *
   * <p>Not thread-safe, but each run gets its own.
   */
  public final class Simulation {

    private StateSet currentStates = initialConfiguration();

    private Simulation() { }

    public void readCharacter(char character) {
      currentStates = step(currentStates, character);
    }

    public void readString(CharSequence input) {
      for (int i = 0; i < input.length(); i++) {
        readCharacter(input.charAt(i));
      }
    }

    public boolean accepting() {
      return Nfa.this.accepting(currentStates);
    }

    public StateSet currentStates() {
      return currentStates;
    }
  }

  @Override
  public Stream<DotGraph.Vertex<NfaState>> vertices() {
    return allStates()
      .stream()
      .map(state -> new DotGraph.Vertex<>(
        state,
        state.equals(startState),
        acceptStates.contains(state)
      ));
  }

  @Override
  public Stream<Rule<NfaState>> edges() {
    return rulebook.rules().stream();
  }

  @Override
  public String toString() {
    return "Nfa(start = " + startState + ", accept = " + acceptStates + ", "
      + rulebook.rules().size() + " rules)";
  }
}
