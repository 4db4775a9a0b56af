package thompson.graph;

/**
 * Symbol matching exactly one UTF-16 code unit of the input.
 *
 * @param value code unit matched
 *
 * @author regex-thompson authors
 */
public record CodeUnit(char value) implements Symbol, Comparable<CodeUnit> {

  public static CodeUnit of(char c) {
    return new CodeUnit(c);
  }

  @Override
  public int compareTo(CodeUnit other) {
    return Character.compare(value, other.value);
  }

  /**
   * Prints alphanumeric ascii characters as themselves and everything else
   * escaped.
   */
  @Override
  public String dotLabel() {
    /* Note: "courier" is a monospaced font. Using just "monospace" leads to
     * alignment issues: https://gitlab.com/graphviz/graphviz/-/issues/1426
     */
    if (value <= 127 && Character.isLetterOrDigit(value)) {
      return String.format("<font face=\"courier\">%c</font>", value);
    } else {
      return String.format("<font face=\"courier\">\\\\u%04X</font>", (int) value);
    }
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
