package thompson;

import java.util.Objects;
import thompson.graph.Nfa;
import thompson.graph.NfaBuilder;
import thompson.parser.PatternParseException;
import thompson.parser.PatternParser;
import thompson.parser.PatternVisitor;

/**
 * Regular expression syntax tree.
 *
 * <p>Patterns are immutable trees: {@link Empty} and {@link Literal} are
 * leaves, {@link Concatenate} and {@link Choose} have two children and
 * {@link Repeat} has one. Equality is structural.
 *
 * @author regex-thompson authors
 */
public interface Pattern {

  /**
   * Parse a regular expression into its syntax tree.
   *
   * @param source regular expression
   * @return parsed pattern
   * @throws PatternParseException if the source is malformed
   */
  static Pattern compile(String source) throws PatternParseException {
    return PatternParser.parse(AstBuilder.INSTANCE, source);
  }

  /**
   * Traverse the pattern bottom-up.
   *
   * <p>The traversal doesn't recurse, so patterns of any depth are fine.
   *
   * @param visitor visitor receiving every node after its children
   * @return output of visiting the root
   */
  default <R> R accept(PatternVisitor<R> visitor) {
    return PostOrder.fold(this, visitor);
  }

  /**
   * How tightly the pattern binds when printed.
   *
   * <p>Higher binds tighter: choice is {@code 0}, concatenation {@code 1},
   * repetition {@code 2} and the leaves {@code 3}.
   */
  int precedence();

  /**
   * Compile the pattern into an NFA using Thompson's construction.
   *
   * @return fresh NFA accepting exactly the strings matching the pattern
   */
  default Nfa toNfa() {
    final var builder = new NfaBuilder();
    return builder.build(accept(builder));
  }

  /**
   * Check whether the whole input matches the pattern, by simulating its NFA.
   *
   * @param input string to match
   * @return whether the pattern matched
   */
  default boolean matches(CharSequence input) {
    return toNfa().matches(input);
  }

  /**
   * Matches only the empty string.
   */
  record Empty() implements Pattern {


    @Override
    public int precedence() {
      return 3;
    }

    @Override
    public String toString() {
      return PatternPrinter.print(this);
    }
  }

  /**
   * Matches exactly one character.
   *
   * @param character character matched, which can't be one of {@code *|()}
   */
  record Literal(char character) implements Pattern {

    public Literal {
      if (PatternParser.isReserved(character)) {
        throw new IllegalArgumentException("Reserved character can't be a literal: " + character);
      }
    }


    @Override
    public int precedence() {
      return 3;
    }

    @Override
    public String toString() {
      return PatternPrinter.print(this);
    }
  }

  /**
   * Matches the first pattern followed by the second.
   */
  record Concatenate(Pattern first, Pattern second) implements Pattern {

    public Concatenate {
      Objects.requireNonNull(first, "first");
      Objects.requireNonNull(second, "second");
    }


    @Override
    public int precedence() {
      return 1;
    }

    @Override
    public String toString() {
      return PatternPrinter.print(this);
    }
  }

  /**
   * Matches either pattern.
   */
  record Choose(Pattern first, Pattern second) implements Pattern {

    public Choose {
      Objects.requireNonNull(first, "first");
      Objects.requireNonNull(second, "second");
    }


    @Override
    public int precedence() {
      return 0;
    }

    @Override
    public String toString() {
      return PatternPrinter.print(this);
    }
  }

  /**
   * Matches the pattern zero or more times.
   */
  record Repeat(Pattern pattern) implements Pattern {

    public Repeat {
      Objects.requireNonNull(pattern, "pattern");
    }


    @Override
    public int precedence() {
      return 2;
    }

    @Override
    public String toString() {
      return PatternPrinter.print(this);
    }
  }
}
