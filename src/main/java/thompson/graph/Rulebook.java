package thompson.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable collection of transition rules.
 *
 * <p>The order of the rules carries no meaning. Rules are indexed by the state
 * they start from, so looking up the rules applicable in one state doesn't
 * require a scan of the whole rulebook.
 *
 * @param <Q> states in the automaton
 *
 * @author regex-thompson authors
 */
public final class Rulebook<Q> {

  private final List<Rule<Q>> rules;

  // Rules grouped along their starting state
  private final Map<Q, List<Rule<Q>>> rulesByState;

  public Rulebook(Collection<Rule<Q>> rules) {
    this.rules = List.copyOf(rules);
    final var byState = new HashMap<Q, List<Rule<Q>>>();
    for (Rule<Q> rule : this.rules) {
      byState.computeIfAbsent(rule.state(), k -> new ArrayList<>()).add(rule);
    }
    byState.replaceAll((state, stateRules) -> Collections.unmodifiableList(stateRules));
    this.rulesByState = Collections.unmodifiableMap(byState);
  }

  @SafeVarargs
  public static <Q> Rulebook<Q> of(Rule<Q>... rules) {
    return new Rulebook<>(List.of(rules));
  }

  /**
   * All of the rules.
   *
   * @return unmodifiable list of rules
   */
  public List<Rule<Q>> rules() {
    return rules;
  }

  /**
   * Rules starting from a state.
   *
   * @param state starting state
   * @return unmodifiable list of rules out of that state
   */
  public List<Rule<Q>> rulesFrom(Q state) {
    return rulesByState.getOrDefault(state, List.of());
  }

  /**
   * Rules which apply in a state when reading a symbol.
   *
   * @param state current state
   * @param symbol symbol read
   * @return matching rules
   */
  public List<Rule<Q>> rulesFor(Q state, Symbol symbol) {
    return rulesFrom(state)
      .stream()
      .filter(rule -> rule.appliesTo(state, symbol))
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * States reached by following every rule which applies in a state when
   * reading a symbol.
   *
   * @param state current state
   * @param symbol symbol read
   * @return next states (possibly with repeats)
   */
  public List<Q> followRulesFor(Q state, Symbol symbol) {
    return rulesFor(state, symbol)
      .stream()
      .map(Rule::follow)
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * States reached from any of the input states by reading exactly one symbol.
   *
   * <p>Free moves are not followed here, neither before nor after reading the
   * symbol: that is the job of {@link #epsilonClosure}.
   *
   * @param states current states
   * @param symbol code unit read
   * @return union of the next states
   */
  public Set<Q> nextStates(Set<Q> states, CodeUnit symbol) {
    final var next = new HashSet<Q>();
    for (Q state : states) {
      next.addAll(followRulesFor(state, symbol));
    }
    return next;
  }

  /**
   * Smallest superset of the input states closed under free moves.
   *
   * <p>Each state is pushed onto the work stack at most once, so the search
   * ends after visiting every epsilon rule reachable from the input states at
   * most once.
   *
   * @param states starting states
   * @return states reachable using only epsilon rules (including the inputs)
   */
  public Set<Q> epsilonClosure(Set<Q> states) {
    final var closure = new HashSet<Q>(states);
    final var toVisit = new Stack<Q>();
    toVisit.addAll(states);

    while (!toVisit.empty()) {
      for (Rule<Q> rule : rulesFrom(toVisit.pop())) {
        if (rule.isEpsilon() && closure.add(rule.follow())) {
          toVisit.push(rule.follow());
        }
      }
    }

    return closure;
  }

  /**
   * Symbols consumed by some rule.
   *
   * @return sorted code units appearing on non-epsilon rules
   */
  public SortedSet<CodeUnit> alphabet() {
    final var alphabet = new TreeSet<CodeUnit>();
    for (Rule<Q> rule : rules) {
      if (rule.symbol() instanceof CodeUnit codeUnit) {
        alphabet.add(codeUnit);
      }
    }
    return Collections.unmodifiableSortedSet(alphabet);
  }

  /**
   * States mentioned by some rule.
   *
   * @return states at either end of a rule, in rule order
   */
  public Set<Q> states() {
    final var states = new LinkedHashSet<Q>();
    for (Rule<Q> rule : rules) {
      states.add(rule.state());
      states.add(rule.nextState());
    }
    return Collections.unmodifiableSet(states);
  }

  public boolean hasEpsilonRules() {
    return rules.stream().anyMatch(Rule::isEpsilon);
  }

  @Override
  public String toString() {
    return rules
      .stream()
      .map(Rule::toString)
      .collect(Collectors.joining("\n"));
  }
}
