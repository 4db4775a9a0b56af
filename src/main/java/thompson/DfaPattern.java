package thompson;

import thompson.codegen.CompiledDfa;
import thompson.codegen.CompiledMatcher;
import thompson.graph.Dfa;
import thompson.graph.Nfa;
import thompson.parser.PatternParseException;

/**
 * DFA-backed regular expression pattern.
 *
 * <p>The regular expression is parsed, turned into an NFA using Thompson's
 * construction and then determinized once, up front. Matching is then linear
 * in the length of the input with no backtracking. On the flip side, the
 * determinization may take exponential time and memory in the size of the
 * pattern. The overloads taking a state limit put a cap on that.
 *
 * @author regex-thompson authors
 */
abstract public class DfaPattern {

  private final String pattern;
  private final Dfa dfa;

  protected DfaPattern(String pattern, Dfa dfa) {
    this.pattern = pattern;
    this.dfa = dfa;
  }

  private static Nfa toNfa(String regex) throws PatternParseException {
    return Pattern.compile(regex).toNfa();
  }

  /**
   * Compiles the given regular expression into an efficient pattern.
   *
   * <p>The output will generate a fresh hidden class where the matching method
   * encodes DFA state transitions directly with {@code GOTO}.
   *
   * @param regex source of the pattern
   * @return compiled DFA pattern
   * @throws PatternParseException if the regular expression is malformed
   * @throws IllegalStateException if the DFA is too large
   */
  public static DfaPattern compile(String regex) throws PatternParseException {
    return new CompiledDfaPattern(regex, Dfa.fromNfa(toNfa(regex)));
  }

  /**
   * Like {@link #compile(String)}, with a custom cap on the number of DFA states.
   *
   * @param regex source of the pattern
   * @param stateLimit maximum number of DFA states
   * @return compiled DFA pattern
   * @throws PatternParseException if the regular expression is malformed
   * @throws IllegalStateException if the DFA is too large
   */
  public static DfaPattern compile(String regex, int stateLimit) throws PatternParseException {
    return new CompiledDfaPattern(regex, Dfa.fromNfa(toNfa(regex), stateLimit));
  }

  /**
   * Compiles the given regular expression into an interpreted pattern.
   *
   * <p>This functions like {@link #compile(String)}, but the DFA is walked
   * inside an interpreter. No bytecode is generated.
   *
   * @param regex source of the pattern
   * @return interpreted DFA pattern
   * @throws PatternParseException if the regular expression is malformed
   * @throws IllegalStateException if the DFA is too large
   */
  public static DfaPattern interpreted(String regex) throws PatternParseException {
    return new InterpretedDfaPattern(regex, Dfa.fromNfa(toNfa(regex)));
  }

  public static DfaPattern interpreted(String regex, int stateLimit) throws PatternParseException {
    return new InterpretedDfaPattern(regex, Dfa.fromNfa(toNfa(regex), stateLimit));
  }

  /**
   * Returns initial regular expression from which the pattern was derived.
   *
   * @return source of the pattern
   */
  public String pattern() {
    return pattern;
  }

  /**
   * Deterministic automaton behind the pattern.
   *
   * @return DFA accepting exactly the strings matching the pattern
   */
  public Dfa dfa() {
    return dfa;
  }

  /**
   * Check whether the whole input matches the pattern.
   *
   * @param input string against which to match
   * @return whether the input matched
   */
  public abstract boolean matches(CharSequence input);

  final static public class CompiledDfaPattern extends DfaPattern {

    private final CompiledMatcher matcher;

    private CompiledDfaPattern(String pattern, Dfa dfa) {
      super(pattern, dfa);
      this.matcher = CompiledDfa.load(dfa());
    }

    @Override
    public boolean matches(CharSequence input) {
      return matcher.matches(input);
    }

    @Override
    public String toString() {
      return "DfaPattern.CompiledDfaPattern(" + pattern() + ")";
    }
  }

  final static public class InterpretedDfaPattern extends DfaPattern {

    private InterpretedDfaPattern(String pattern, Dfa dfa) {
      super(pattern, dfa);
    }

    @Override
    public boolean matches(CharSequence input) {
      return dfa().matches(input);
    }

    @Override
    public String toString() {
      return "DfaPattern.InterpretedDfaPattern(" + pattern() + ")";
    }
  }
}
