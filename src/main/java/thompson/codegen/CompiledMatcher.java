package thompson.codegen;

/**
 * Interface implemented by the classes generated from a DFA.
 *
 * <p>Generated matchers have no state, so one instance can be shared between
 * any number of threads.
 *
 * @author regex-thompson authors
 */
public interface CompiledMatcher {

  /**
   * Run the DFA over a whole input.
   *
   * @param input characters to read
   * @return whether the input is accepted
   */
  boolean matches(CharSequence input);
}
