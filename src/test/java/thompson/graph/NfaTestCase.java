package thompson.graph;

import java.util.List;
import java.util.Set;
import junit.framework.TestCase;

public class NfaTestCase extends TestCase {

  private static NfaState s(int id) {
    return new NfaState(id);
  }

  // Accepts strings whose third to last character is 'b'
  private final Nfa thirdLastB = new Nfa(
    s(1),
    Set.of(s(4)),
    Rulebook.of(
      Rule.onChar(s(1), 'a', s(1)),
      Rule.onChar(s(1), 'b', s(1)),
      Rule.onChar(s(1), 'b', s(2)),
      Rule.onChar(s(2), 'a', s(3)),
      Rule.onChar(s(2), 'b', s(3)),
      Rule.onChar(s(3), 'a', s(4)),
      Rule.onChar(s(3), 'b', s(4))
    )
  );

  // Accepts strings of a's whose length is a multiple of 2 or 3
  private final Nfa multiples = new Nfa(
    s(1),
    Set.of(s(2), s(4)),
    Rulebook.of(
      Rule.epsilon(s(1), s(2)),
      Rule.epsilon(s(1), s(4)),
      Rule.onChar(s(2), 'a', s(3)),
      Rule.onChar(s(3), 'a', s(2)),
      Rule.onChar(s(4), 'a', s(5)),
      Rule.onChar(s(5), 'a', s(6)),
      Rule.onChar(s(6), 'a', s(4))
    )
  );

  public void testMatches() {
    for (String input : List.of("bab", "bbbbb", "bbabb", "abaa")) {
      assertTrue(input, thirdLastB.matches(input));
    }
    for (String input : List.of("", "b", "bbbbbbbaaa", "aaa", "bbc")) {
      assertFalse(input, thirdLastB.matches(input));
    }
  }

  public void testFreeMoves() {
    for (String input : List.of("", "aa", "aaa", "aaaa", "aaaaaa", "aaaaaaaa")) {
      assertTrue(input, multiples.matches(input));
    }
    for (String input : List.of("a", "aaaaa", "aaaaaaa", "b")) {
      assertFalse(input, multiples.matches(input));
    }
  }

  public void testSimulation() {
    final Nfa.Simulation simulation = thirdLastB.simulation();
    assertFalse(simulation.accepting());
    simulation.readCharacter('b');
    assertFalse(simulation.accepting());
    simulation.readCharacter('a');
    assertFalse(simulation.accepting());
    simulation.readCharacter('b');
    assertTrue(simulation.accepting());
    assertEquals(StateSet.of(1, 2, 4), simulation.currentStates());

    // Simulations don't share their configuration
    final Nfa.Simulation other = thirdLastB.simulation();
    other.readString("bbbaaa");
    assertFalse(other.accepting());
    assertTrue(simulation.accepting());
  }

  public void testConfigurations() {
    assertEquals(StateSet.of(1, 2, 4), multiples.initialConfiguration());
    assertEquals(StateSet.of(3, 5), multiples.step(multiples.initialConfiguration(), 'a'));
    assertEquals(StateSet.EMPTY, multiples.step(StateSet.of(3, 5), 'b'));
    assertTrue(multiples.accepting(StateSet.of(1)));
    assertFalse(multiples.accepting(StateSet.of(3, 5)));
    assertFalse(multiples.accepting(StateSet.EMPTY));
  }

  public void testStuckConfigurationRejects() {
    final Nfa.Simulation simulation = multiples.simulation();
    simulation.readString("ab");
    assertTrue(simulation.currentStates().isEmpty());
    simulation.readString("aaaaaa");
    assertFalse(simulation.accepting());
  }

  public void testAllStates() {
    final Nfa lonely = new Nfa(s(7), Set.of(s(9)), Rulebook.of(Rule.onChar(s(3), 'x', s(4))));
    assertEquals(StateSet.of(3, 4, 7, 9), lonely.allStates());
    assertFalse(lonely.matches(""));
  }

  public void testParse() {
    final Nfa nfa = Nfa.parse("(a|b)*b");
    assertTrue(nfa.matches("ab"));
    assertTrue(nfa.matches("b"));
    assertFalse(nfa.matches("ba"));
  }

  public void testDotGraph() {
    final String dot = multiples.dotGraph("multiples");
    assertTrue(dot.startsWith("digraph \"multiples\" {"));
    assertTrue(dot.contains("\"1\" [shape = circle, label = <1>];"));
    assertTrue(dot.contains("\"2\" [shape = doublecircle, label = <2>];"));
    assertTrue(dot.contains("\"_gen1\" -> \"1\";"));
    assertTrue(dot.contains("\"1\" -> \"2\" [label = <&epsilon;>];"));
    assertTrue(dot.contains("\"2\" -> \"3\" [label = <<font face=\"courier\">a</font>>];"));
    assertTrue(dot.endsWith("}"));
  }
}
