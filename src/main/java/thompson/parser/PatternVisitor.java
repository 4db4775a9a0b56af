package thompson.parser;

/**
 * Bottom-up traversal of the regular expression pattern AST.
 *
 * <p>Children are always visited before their parent, so a visitor sees the
 * results of visiting the sub-patterns and never the sub-patterns themselves.
 *
 * @param <R> output from traversing the regex pattern AST
 *
 * @author regex-thompson authors
 */
public interface PatternVisitor<R> {

  /**
   * Empty expression, matching only the empty string.
   */
  R visitEmpty();

  /**
   * Matches exactly one character.
   *
   * @param character character to match
   */
  R visitLiteral(char character);

  /**
   * Matches a concatenation of two patterns.
   *
   * @param first first pattern to match
   * @param second second pattern to match
   */
  R visitConcatenation(R first, R second);

  /**
   * Matches a union of two patterns.
   *
   * @param first one alternative
   * @param second other alternative
   */
  R visitChoice(R first, R second);

  /**
   * Matches a pattern zero or more times.
   *
   * @param pattern pattern to match
   */
  R visitRepeat(R pattern);
}
