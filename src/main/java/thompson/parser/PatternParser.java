package thompson.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Parser for the regular expressions built from literals, {@code |},
 * {@code *} and parentheses.
 *
 * <p>This is a predictive parser deciding on the next production by looking at
 * a single character. Groups which are still open are kept on an explicit
 * stack rather than the call stack, so arbitrarily deep nesting is fine. The
 * results are made available through a visitor instead of as an explicit AST
 * type.
 *
 * <p>Supported syntax (loosest binding first):
 *
 * <pre>
 *   alternation   := concatenation ( '|' alternation )?
 *   concatenation := ( repeat concatenation )?
 *   repeat        := atom '*'?
 *   atom          := '(' alternation ')' | literal
 *   literal       := any character other than '*', '|', '(' and ')'
 * </pre>
 *
 * <p>Either side of a {@code |} may be empty, as may the inside of a pair of
 * parentheses or the whole pattern. Those parse as the empty pattern.
 * Alternations and concatenations of several operands lean to the right:
 * {@code a|b|c} is {@code a|(b|c)}.
 *
 * @author regex-thompson authors
 */
public final class PatternParser<A> {

  // Used when "visiting" the AST bottom up
  private final PatternVisitor<A> visitor;

  // Bookkeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  /**
   * Alternation being parsed at one level of parenthesis nesting.
   *
   * <p>Finished alternatives are already folded into single results, while
   * the alternative currently being read is still a list of repeats.
   */
  private final class Group {

    // Index of the opening paren, or -1 for the whole pattern
    final int openParen;

    final List<A> alternatives = new ArrayList<>();
    List<A> parts = new ArrayList<>();

    Group(int openParen) {
      this.openParen = openParen;
    }

    void endAlternative() {
      alternatives.add(concatenation(parts));
      parts = new ArrayList<>();
    }

    A finish() {
      endAlternative();
      A choice = alternatives.get(alternatives.size() - 1);
      for (int i = alternatives.size() - 2; i >= 0; i--) {
        choice = visitor.visitChoice(alternatives.get(i), choice);
      }
      return choice;
    }
  }

  /**
   * Parse a regular expression pattern from an input string.
   *
   * @param visitor visitor used to accept bottom-up parsing progress
   * @param input regular expression pattern
   * @return parsed regular expression
   * @throws PatternParseException if the input is not a valid pattern
   */
  public static <B> B parse(
    PatternVisitor<B> visitor,
    String input
  ) throws PatternParseException {
    Objects.requireNonNull(visitor, "visitor");
    Objects.requireNonNull(input, "input");

    return new PatternParser<B>(visitor, input).parsePattern();
  }

  /**
   * Characters which can't be used as literals.
   *
   * @param c character to check
   * @return whether the character has a special meaning in patterns
   */
  public static boolean isReserved(char c) {
    return c == '*' || c == '|' || c == '(' || c == ')';
  }

  private PatternParser(PatternVisitor<A> visitor, String input) {
    this.visitor = visitor;
    this.input = input;
    this.length = input.length();
  }

  private PatternParseException error(String description, String expected) {
    return new PatternParseException(description, expected, input, position);
  }

  /**
   * Parse the whole input.
   *
   * <p>The innermost open group is at the top of the stack. Closing a group
   * folds it into one result which becomes the next atom of the enclosing
   * group.
   */
  private A parsePattern() {
    final Deque<Group> groups = new ArrayDeque<>();
    groups.push(new Group(-1));

    while (position < length) {
      final char c = input.charAt(position);
      switch (c) {
        case '(':
          groups.push(new Group(position));
          position++;
          break;

        case ')':
          if (groups.size() == 1) {
            throw error("Unbalanced ')'", "'|' or the end of the pattern");
          }
          position++;
          final A group = groups.pop().finish();
          groups.peek().parts.add(optionalRepeat(group));
          break;

        case '|':
          groups.peek().endAlternative();
          position++;
          break;

        case '*':
          throw error("Dangling '*' with nothing to repeat", "a literal or '('");

        default:
          position++;
          groups.peek().parts.add(optionalRepeat(visitor.visitLiteral(c)));
      }
    }

    if (groups.size() > 1) {
      throw error(
        "Unexpected end of pattern in group opened at index " + groups.peek().openParen,
        "')'"
      );
    }
    return groups.pop().finish();
  }

  /**
   * Wrap an atom which was just parsed if it is followed by one {@code *}.
   */
  private A optionalRepeat(A atom) {
    if (position < length && input.charAt(position) == '*') {
      position++;
      return visitor.visitRepeat(atom);
    }
    return atom;
  }

  /**
   * Fold a concatenation, which may have no parts at all.
   */
  private A concatenation(List<A> parts) {
    if (parts.isEmpty()) {
      return visitor.visitEmpty();
    }
    A concatenation = parts.get(parts.size() - 1);
    for (int i = parts.size() - 2; i >= 0; i--) {
      concatenation = visitor.visitConcatenation(parts.get(i), concatenation);
    }
    return concatenation;
  }
}
