package thompson.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import junit.framework.TestCase;

public class DfaTestCase extends TestCase {

  private static NfaState s(int id) {
    return new NfaState(id);
  }

  private static final List<String> SOURCES = List.of(
    "a", "a|b", "(ab|a)*", "a(b|)*", "(a|b)*abb", "", "()*", "(a*b*)*", "a(a|b)(a|b)"
  );

  // Every string over {a, b, c} of length at most 5
  private static final List<String> INPUTS = new ArrayList<>();
  static {
    INPUTS.add("");
    for (int i = 0; i < INPUTS.size(); i++) {
      final String input = INPUTS.get(i);
      if (input.length() < 5) {
        for (char c : "abc".toCharArray()) {
          INPUTS.add(input + c);
        }
      }
    }
  }

  // NFA with a free move, a non-deterministic choice and a dead end
  private final Nfa nfa = new Nfa(
    s(1),
    Set.of(s(3)),
    Rulebook.of(
      Rule.onChar(s(1), 'a', s(1)),
      Rule.onChar(s(1), 'a', s(2)),
      Rule.epsilon(s(1), s(2)),
      Rule.onChar(s(2), 'b', s(3)),
      Rule.onChar(s(3), 'b', s(1)),
      Rule.epsilon(s(3), s(2))
    )
  );

  public void testSubsetConstruction() {
    final Dfa dfa = Dfa.fromNfa(nfa);
    assertEquals(StateSet.of(1, 2), dfa.startState());
    assertEquals(
      Set.of(StateSet.of(1, 2), StateSet.of(2, 3), StateSet.EMPTY, StateSet.of(1, 2, 3)),
      dfa.states()
    );
    assertEquals(Set.of(StateSet.of(2, 3), StateSet.of(1, 2, 3)), dfa.acceptStates());

    assertEquals(
      Map.of(CodeUnit.of('a'), StateSet.of(1, 2), CodeUnit.of('b'), StateSet.of(2, 3)),
      dfa.transitions(StateSet.of(1, 2))
    );
    assertEquals(
      Map.of(CodeUnit.of('a'), StateSet.EMPTY, CodeUnit.of('b'), StateSet.of(1, 2, 3)),
      dfa.transitions(StateSet.of(2, 3))
    );
    assertEquals(
      Map.of(CodeUnit.of('a'), StateSet.EMPTY, CodeUnit.of('b'), StateSet.EMPTY),
      dfa.transitions(StateSet.EMPTY)
    );
  }

  public void testStartStateComesFirst() {
    final Dfa dfa = Dfa.fromNfa(Nfa.parse("(a|b)*abb"));
    assertEquals(dfa.startState(), dfa.states().iterator().next());
  }

  public void testAgreesWithNfa() {
    for (String source : SOURCES) {
      final Nfa parsed = Nfa.parse(source);
      final Dfa dfa = Dfa.fromNfa(parsed);
      for (String input : INPUTS) {
        assertEquals("/" + source + "/ on \"" + input + "\"", parsed.matches(input), dfa.matches(input));
      }
    }
  }

  public void testDeterminizationIsIdempotent() {
    for (String source : SOURCES) {
      final Dfa dfa = Dfa.fromNfa(Nfa.parse(source));
      final Dfa again = Dfa.fromNfa(dfa.toNfa());
      assertEquals(source, dfa.states().size(), again.states().size());
      assertEquals(source, dfa.acceptStates().size(), again.acceptStates().size());
      assertEquals(source, dfa.rulebook().rules().size(), again.rulebook().rules().size());

      // Renumbered states are singletons, which are a fixed point
      final Dfa thrice = Dfa.fromNfa(again.toNfa());
      assertEquals(source, again.states(), thrice.states());
      assertEquals(source, again.acceptStates(), thrice.acceptStates());
      assertEquals(source, Set.copyOf(again.rulebook().rules()), Set.copyOf(thrice.rulebook().rules()));

      for (String input : INPUTS) {
        assertEquals(source + " on \"" + input + "\"", dfa.matches(input), again.matches(input));
      }
    }
  }

  public void testToNfaHasNoFreeMoves() {
    final Nfa reinterpreted = Dfa.fromNfa(nfa).toNfa();
    assertFalse(reinterpreted.rulebook().hasEpsilonRules());
    assertEquals(s(0), reinterpreted.startState());
    assertEquals(4, reinterpreted.allStates().size());
  }

  public void testStuckOnUnknownCharacter() {
    final Dfa dfa = Dfa.fromNfa(Nfa.parse("ab"));
    assertFalse(dfa.matches("ac"));
    assertFalse(dfa.matches("abc"));
    assertEquals(Optional.empty(), dfa.nextState(dfa.startState(), 'z'));

    final Dfa.Simulation simulation = dfa.simulation();
    simulation.readCharacter('a');
    assertTrue(simulation.currentState().isPresent());
    simulation.readCharacter('c');
    assertEquals(Optional.empty(), simulation.currentState());
    simulation.readCharacter('b');
    assertFalse(simulation.accepting());
  }

  public void testSimulation() {
    final Dfa dfa = Dfa.fromNfa(nfa);
    final Dfa.Simulation simulation = dfa.simulation();
    assertFalse(simulation.accepting());
    simulation.readString("aab");
    assertTrue(simulation.accepting());
    assertEquals(Optional.of(StateSet.of(2, 3)), simulation.currentState());
    simulation.readCharacter('a');
    assertEquals(Optional.of(StateSet.EMPTY), simulation.currentState());
    assertFalse(simulation.accepting());
  }

  public void testRejectsFreeMoves() {
    try {
      new Dfa(
        StateSet.of(0),
        Set.of(StateSet.of(1)),
        Rulebook.of(Rule.epsilon(StateSet.of(0), StateSet.of(1)))
      );
      fail("should throw");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testRejectsNonDeterminism() {
    try {
      new Dfa(
        StateSet.of(0),
        Set.of(StateSet.of(1)),
        Rulebook.of(
          Rule.onChar(StateSet.of(0), 'a', StateSet.of(1)),
          Rule.onChar(StateSet.of(0), 'a', StateSet.of(2))
        )
      );
      fail("should throw");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testStateLimit() {
    final Nfa blowup = Nfa.parse("(a|b)*a(a|b)(a|b)(a|b)(a|b)");
    try {
      Dfa.fromNfa(blowup, 10);
      fail("should throw");
    } catch (IllegalStateException e) {
      // expected
    }
    assertTrue(Dfa.fromNfa(blowup).matches("abbbb"));

    try {
      Dfa.fromNfa(blowup, 0);
      fail("should throw");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testDotGraph() {
    final String dot = Dfa.fromNfa(nfa).dotGraph("dfa");
    assertTrue(dot.contains("\"{1,2}\" [shape = circle, label = <{1,2}>];"));
    assertTrue(dot.contains("\"{2,3}\" [shape = doublecircle, label = <{2,3}>];"));
    assertTrue(dot.contains("\"_gen1\" -> \"{1,2}\";"));
    assertFalse(dot.contains("_gen2"));
    assertFalse(dot.contains("&epsilon;"));
  }

  public void testSubsetCount() {
    assertEquals(4, Dfa.subsetCount(Nfa.parse("a")));
    assertEquals(1 << 30, Dfa.subsetCount(Nfa.parse("abcdefghijklmno")));
    assertEquals(Integer.MAX_VALUE, Dfa.subsetCount(Nfa.parse("abcdefghijklmnop")));
  }

  public void testDefaultLimitAllowsLargeDfas() {
    // Remembers which of the last 14 characters were 'a'
    final Nfa blowup = Nfa.parse("(a|b)*a" + "(a|b)".repeat(13));
    final Dfa dfa = Dfa.fromNfa(blowup);
    assertTrue(dfa.states().size() > 10_000);

    for (String input : List.of("a" + "b".repeat(13), "ab" + "b".repeat(13), "b".repeat(14), "ba" + "a".repeat(13))) {
      assertEquals(input, blowup.matches(input), dfa.matches(input));
    }
    assertTrue(dfa.matches("a" + "b".repeat(13)));
    assertFalse(dfa.matches("b".repeat(14)));
  }
}
