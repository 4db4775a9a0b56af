package thompson.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deterministic finite automaton whose states are sets of NFA states.
 *
 * <p>A DFA has no epsilon rules and at most one rule for every state and
 * symbol. Transitions which aren't in the rulebook lead to a "stuck"
 * configuration that rejects the rest of the input.
 *
 * @author regex-thompson authors
 */
public final class Dfa implements DotGraph<StateSet> {

  private static final Logger logger = Logger.getLogger("thompson");

  private final StateSet startState;

  private final Set<StateSet> acceptStates;

  private final Rulebook<StateSet> rulebook;

  /**
   * Transitions indexed along their starting state, in rulebook order.
   *
   * <p>Every state of the DFA is a key, even if it has no outgoing rules. The
   * inner maps are sorted by code unit.
   */
  private final Map<StateSet, Map<CodeUnit, StateSet>> transitions;

  /**
   * @param startState state before reading any input
   * @param acceptStates accepting states
   * @param rulebook deterministic rules
   * @throws IllegalStateException if the rulebook has an epsilon rule or more
   *   than one rule for some state and symbol
   */
  public Dfa(
    StateSet startState,
    Collection<StateSet> acceptStates,
    Rulebook<StateSet> rulebook
  ) {
    this.startState = Objects.requireNonNull(startState, "startState");
    this.acceptStates = Collections.unmodifiableSet(new LinkedHashSet<>(acceptStates));
    this.rulebook = Objects.requireNonNull(rulebook, "rulebook");

    final var index = new LinkedHashMap<StateSet, Map<CodeUnit, StateSet>>();
    index.put(startState, new TreeMap<>());
    for (Rule<StateSet> rule : rulebook.rules()) {
      if (!(rule.symbol() instanceof CodeUnit codeUnit)) {
        throw new IllegalStateException("Epsilon rule in a DFA: " + rule);
      }
      final StateSet previous = index
        .computeIfAbsent(rule.state(), k -> new TreeMap<>())
        .putIfAbsent(codeUnit, rule.nextState());
      if (previous != null) {
        throw new IllegalStateException(
          "Non-deterministic rules in a DFA: " + rule + " conflicts with the rule to " + previous
        );
      }
      index.computeIfAbsent(rule.nextState(), k -> new TreeMap<>());
    }
    for (StateSet accept : this.acceptStates) {
      index.computeIfAbsent(accept, k -> new TreeMap<>());
    }

    // Prevent updates to the state maps
    index.replaceAll((state, stateTransitions) -> Collections.unmodifiableMap(stateTransitions));
    this.transitions = Collections.unmodifiableMap(index);
  }

  /**
   * Determinize an NFA using the subset construction.
   *
   * <p>The only cap on the number of states is {@link #subsetCount}, which
   * the construction can't exceed unless it fails to recognize a state it has
   * already discovered.
   *
   * @param nfa automaton to determinize
   * @return DFA accepting the same strings as the NFA
   * @throws IllegalStateException if the construction discovers more states than there are subsets
   */
  public static Dfa fromNfa(Nfa nfa) {
    return fromNfa(nfa, subsetCount(nfa));
  }

  /**
   * Number of distinct sets of NFA states.
   *
   * @param nfa automaton to determinize
   * @return {@code 2^n} for an NFA with {@code n} states, saturated at {@link Integer#MAX_VALUE}
   */
  public static int subsetCount(Nfa nfa) {
    final int states = nfa.allStates().size();
    return states >= Integer.SIZE - 1 ? Integer.MAX_VALUE : 1 << states;
  }

  /**
   * Determinize an NFA using the subset construction.
   *
   * <p>Each DFA state is the set of NFA states the NFA could be in, closed
   * under free moves. Starting from the closure of the NFA start state, every
   * newly discovered set is expanded along every symbol in the alphabet of the
   * NFA. Sets are compared by value, so this stops once no expansion produces
   * an undiscovered set. The empty set shows up as a state when some input
   * leaves the NFA with no states.
   *
   * @param nfa automaton to determinize
   * @param stateLimit maximum number of DFA states to discover
   * @return DFA accepting the same strings as the NFA
   * @throws IllegalStateException if more than {@code stateLimit} states are discovered
   */
  public static Dfa fromNfa(Nfa nfa, int stateLimit) {
    if (stateLimit < 1) {
      throw new IllegalArgumentException("State limit must be positive: " + stateLimit);
    }

    final Rulebook<NfaState> nfaRulebook = nfa.rulebook();
    final SortedSet<CodeUnit> alphabet = nfaRulebook.alphabet();
    final StateSet start = nfa.initialConfiguration();

    final var discovered = new LinkedHashSet<StateSet>();
    final var toVisit = new LinkedList<StateSet>();
    final var rules = new ArrayList<Rule<StateSet>>();
    discovered.add(start);
    toVisit.addLast(start);

    while (!toVisit.isEmpty()) {
      final StateSet from = toVisit.removeFirst();
      for (CodeUnit symbol : alphabet) {
        final StateSet to = StateSet.copyOf(
          nfaRulebook.epsilonClosure(nfaRulebook.nextStates(from, symbol))
        );
        rules.add(new Rule<>(from, symbol, to));

        if (discovered.add(to)) {
          logger.finest(() -> "Discovered DFA state " + to + " from " + from + " on " + symbol);
          if (discovered.size() > stateLimit) {
            throw new IllegalStateException(
              "Subset construction exceeded the limit of " + stateLimit + " states"
            );
          }
          toVisit.addLast(to);
        }
      }
    }

    final List<StateSet> accepting = discovered
      .stream()
      .filter(states -> states.intersects(nfa.acceptStates()))
      .collect(Collectors.toList());

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
        "Subset construction: " + nfa.allStates().size() + " NFA states, "
        + alphabet.size() + " symbols, " + discovered.size() + " DFA states ("
        + accepting.size() + " accepting)"
      );
    }

    return new Dfa(start, accepting, new Rulebook<>(rules));
  }

  public StateSet startState() {
    return startState;
  }

  public Set<StateSet> acceptStates() {
    return acceptStates;
  }

  public Rulebook<StateSet> rulebook() {
    return rulebook;
  }

  /**
   * All states, starting with the initial one.
   *
   * @return every state mentioned by the start state, the accepting states, or a rule
   */
  public Set<StateSet> states() {
    return transitions.keySet();
  }

  /**
   * Look up the transitions out of a state.
   *
   * @param state state inside the DFA
   * @return map of code units to next states (empty for unknown states)
   */
  public Map<CodeUnit, StateSet> transitions(StateSet state) {
    return transitions.getOrDefault(state, Map.of());
  }

  /**
   * Follow the rule for a state and a character.
   *
   * @param state current state
   * @param character character read
   * @return next state, or nothing if there is no rule (the DFA is stuck)
   */
  public Optional<StateSet> nextState(StateSet state, char character) {
    return Optional.ofNullable(transitions(state).get(CodeUnit.of(character)));
  }

  /**
   * Run the DFA over a whole input.
   *
   * @param input characters to read
   * @return whether the input is accepted
   */
  public boolean matches(CharSequence input) {
    StateSet currentState = startState;
    for (int i = 0; i < input.length(); i++) {
      currentState = transitions(currentState).get(CodeUnit.of(input.charAt(i)));
      if (currentState == null) {
        return false;
      }
    }
    return acceptStates.contains(currentState);
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
   * Reinterpret the DFA as an NFA without epsilon rules.
   *
   * <p>Each DFA state gets a fresh NFA state, numbered in the order of
   * {@link #states()}.
   *
   * @return equivalent NFA
   */
  public Nfa toNfa() {
    final var builder = new NfaBuilder();
    final var renamed = new HashMap<StateSet, NfaState>();
    for (StateSet state : states()) {
      renamed.put(state, builder.freshState());
    }

    final List<Rule<NfaState>> rules = rulebook
      .rules()
      .stream()
      .map(rule -> new Rule<>(renamed.get(rule.state()), rule.symbol(), renamed.get(rule.nextState())))
      .collect(Collectors.toList());
    final List<NfaState> accepting = acceptStates
      .stream()
      .map(renamed::get)
      .collect(Collectors.toList());
    return new Nfa(renamed.get(startState), accepting, new Rulebook<>(rules));
  }

  /**
   * Mutable configuration of one run of the DFA.
   *
   * <p>Once stuck, the simulation stays stuck and rejects.
   */
  public final class Simulation {

    private Optional<StateSet> currentState = Optional.of(startState);

    private Simulation() { }

    public void readCharacter(char character) {
      currentState = currentState.flatMap(state -> nextState(state, character));
    }

    public void readString(CharSequence input) {
      for (int i = 0; i < input.length(); i++) {
        readCharacter(input.charAt(i));
      }
    }

    public boolean accepting() {
      return currentState.map(acceptStates::contains).orElse(false);
    }

    /**
     * Current state.
     *
     * @return current state, or nothing if stuck
     */
    public Optional<StateSet> currentState() {
      return currentState;
    }
  }

  @Override
  public Stream<DotGraph.Vertex<StateSet>> vertices() {
    return states()
      .stream()
      .map(state -> new DotGraph.Vertex<>(
        state,
        state.equals(startState),
        acceptStates.contains(state)
      ));
  }

  @Override
  public Stream<Rule<StateSet>> edges() {
    return rulebook.rules().stream();
  }

  @Override
  public String toString() {
    return "Dfa(start = " + startState + ", " + states().size() + " states, "
      + acceptStates.size() + " accepting)";
  }
}
