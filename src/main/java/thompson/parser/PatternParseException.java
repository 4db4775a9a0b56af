package thompson.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Malformed regular expression source.
 *
 * <p>This is the only failure surfaced when compiling a pattern. Matching a
 * compiled pattern never fails.
 *
 * @author regex-thompson authors
 */
public class PatternParseException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 3187446226531270529L;

  /**
   * Construct which the parser expected to find at the error index.
   */
  private final String expected;

  public PatternParseException(
    String description,
    String expected,
    String regex,
    int index
  ) {
    super(description + " (expected " + expected + ")", regex, index);
    this.expected = expected;
  }

  /**
   * Describe what would have been valid at the error index.
   *
   * @return human readable name of the expected construct
   */
  public String expected() {
    return expected;
  }
}
