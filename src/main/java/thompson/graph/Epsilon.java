package thompson.graph;

/**
 * Symbol for transitions which don't consume any input.
 *
 * @author regex-thompson authors
 */
public enum Epsilon implements Symbol {
  EPSILON;

  @Override
  public boolean isEpsilon() {
    return true;
  }

  @Override
  public String dotLabel() {
    return "&epsilon;";
  }

  @Override
  public String toString() {
    return "ε";
  }
}
