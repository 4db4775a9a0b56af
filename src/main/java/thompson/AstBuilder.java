package thompson;

import thompson.parser.PatternVisitor;

/**
 * Visitor which materializes the explicit syntax tree.
 *
 * @author regex-thompson authors
 */
final class AstBuilder implements PatternVisitor<Pattern> {

  static final AstBuilder INSTANCE = new AstBuilder();

  private static final Pattern EMPTY = new Pattern.Empty();

  private AstBuilder() { }

  @Override
  public Pattern visitEmpty() {
    return EMPTY;
  }

  @Override
  public Pattern visitLiteral(char character) {
    return new Pattern.Literal(character);
  }

  @Override
  public Pattern visitConcatenation(Pattern first, Pattern second) {
    return new Pattern.Concatenate(first, second);
  }

  @Override
  public Pattern visitChoice(Pattern first, Pattern second) {
    return new Pattern.Choose(first, second);
  }

  @Override
  public Pattern visitRepeat(Pattern pattern) {
    return new Pattern.Repeat(pattern);
  }
}
