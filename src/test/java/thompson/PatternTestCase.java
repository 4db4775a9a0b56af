package thompson;

import java.util.List;
import junit.framework.TestCase;
import thompson.Pattern.Choose;
import thompson.Pattern.Concatenate;
import thompson.Pattern.Empty;
import thompson.Pattern.Literal;
import thompson.Pattern.Repeat;
import thompson.parser.PatternParseException;

public class PatternTestCase extends TestCase {

  private static final List<String> INPUTS = List.of(
    "", "a", "b", "c", "aa", "ab", "ba", "bb", "abc", "aba", "abb", "bab",
    "abab", "abba", "aabb", "abcabc", "cccc", "abababa"
  );

  private static Pattern lit(char c) {
    return new Literal(c);
  }

  private static void assertMatches(Pattern pattern, String... inputs) {
    for (String input : inputs) {
      assertTrue(pattern + " should match \"" + input + "\"", pattern.matches(input));
    }
  }

  private static void assertRejects(Pattern pattern, String... inputs) {
    for (String input : inputs) {
      assertFalse(pattern + " should reject \"" + input + "\"", pattern.matches(input));
    }
  }

  public void testSingleLiteral() {
    final Pattern pattern = Pattern.compile("a");
    assertEquals(lit('a'), pattern);
    assertMatches(pattern, "a");
    assertRejects(pattern, "", "aa");
  }

  public void testChoice() {
    final Pattern pattern = Pattern.compile("a|b");
    assertEquals(new Choose(lit('a'), lit('b')), pattern);
    assertMatches(pattern, "a", "b");
    assertRejects(pattern, "c", "ab");
  }

  public void testRepeatedChoice() {
    final Pattern pattern = Pattern.compile("(ab|a)*");
    assertMatches(pattern, "", "a", "ab", "aba", "abab");
    assertRejects(pattern, "b", "ba");
  }

  public void testRepeatedEmptyAlternative() {
    final Pattern pattern = Pattern.compile("a(b|)*");
    assertEquals(new Concatenate(lit('a'), new Repeat(new Choose(lit('b'), new Empty()))), pattern);
    assertMatches(pattern, "a", "ab", "abb");
    assertRejects(pattern, "", "b", "abab");

    final Pattern wider = Pattern.compile("a(a|b|)*");
    assertMatches(wider, "a", "ab", "abab", "abba");
    assertRejects(wider, "", "ba");
  }

  public void testMalformedPattern() {
    try {
      Pattern.compile("(a");
      fail("should throw");
    } catch (PatternParseException e) {
      assertEquals("(a", e.getPattern());
    }
  }

  public void testManualConstruction() {
    // Same as (a(|b))*
    final Pattern pattern = new Repeat(
      new Concatenate(lit('a'), new Choose(new Empty(), lit('b')))
    );
    assertEquals("(a(|b))*", pattern.toString());
    assertMatches(pattern, "", "a", "ab", "aba", "abab", "abaab");
    assertRejects(pattern, "b", "abba");
  }

  public void testReservedLiteral() {
    for (char reserved : "*|()".toCharArray()) {
      try {
        new Literal(reserved);
        fail("should throw");
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
  }

  public void testPrecedence() {
    assertEquals(3, new Empty().precedence());
    assertEquals(3, lit('a').precedence());
    assertEquals(2, new Repeat(lit('a')).precedence());
    assertEquals(1, new Concatenate(lit('a'), lit('b')).precedence());
    assertEquals(0, new Choose(lit('a'), lit('b')).precedence());
  }

  public void testPrinting() {
    assertEquals("", new Empty().toString());
    assertEquals("a", lit('a').toString());
    assertEquals("ab", new Concatenate(lit('a'), lit('b')).toString());
    assertEquals("a|b", new Choose(lit('a'), lit('b')).toString());
    assertEquals("a*", new Repeat(lit('a')).toString());

    // Brackets only where needed
    assertEquals("(ab)*", new Repeat(new Concatenate(lit('a'), lit('b'))).toString());
    assertEquals("(a|b)*", new Repeat(new Choose(lit('a'), lit('b'))).toString());
    assertEquals("(a*)*", new Repeat(new Repeat(lit('a'))).toString());
    assertEquals("a(b|c)", new Concatenate(lit('a'), new Choose(lit('b'), lit('c'))).toString());
    assertEquals("ab|c", new Choose(new Concatenate(lit('a'), lit('b')), lit('c')).toString());
    assertEquals("a*b", new Concatenate(new Repeat(lit('a')), lit('b')).toString());
    assertEquals("a|b|c", new Choose(lit('a'), new Choose(lit('b'), lit('c'))).toString());
    assertEquals("a|b|c", new Choose(new Choose(lit('a'), lit('b')), lit('c')).toString());

    // Empty sub-patterns
    assertEquals("a|", new Choose(lit('a'), new Empty()).toString());
    assertEquals("a()", new Concatenate(lit('a'), new Empty()).toString());
    assertEquals("()*", new Repeat(new Empty()).toString());
  }

  public void testParsingIsRightLeaning() {
    assertEquals(
      new Concatenate(lit('a'), new Concatenate(lit('b'), lit('c'))),
      Pattern.compile("abc")
    );
    assertEquals(
      new Choose(lit('a'), new Choose(lit('b'), lit('c'))),
      Pattern.compile("a|b|c")
    );
  }

  public void testRoundTrip() {
    final List<Pattern> patterns = List.of(
      new Empty(),
      lit('a'),
      new Concatenate(new Concatenate(lit('a'), lit('b')), lit('c')),
      new Choose(new Choose(lit('a'), new Empty()), lit('b')),
      new Repeat(new Concatenate(lit('a'), lit('b'))),
      new Repeat(new Repeat(new Choose(lit('a'), lit('c')))),
      new Concatenate(new Empty(), new Repeat(new Empty())),
      new Concatenate(new Choose(lit('a'), lit('b')), new Repeat(lit('c'))),
      new Choose(new Empty(), new Choose(new Empty(), new Empty()))
    );

    for (Pattern pattern : patterns) {
      final Pattern reparsed = Pattern.compile(pattern.toString());
      assertEquals("printing is stable for " + pattern, pattern.toString(), reparsed.toString());
      for (String input : INPUTS) {
        assertEquals(
          pattern + " on \"" + input + "\"",
          pattern.matches(input),
          reparsed.matches(input)
        );
      }
    }
  }

  public void testParsedPatternsPrintBack() {
    for (String source : List.of("a", "ab|c", "(ab)*", "a(b|)*", "(a|b)*abb", "(|a)*b")) {
      assertEquals(source, Pattern.compile(source).toString());
    }
  }

  public void testToNfaIsFresh() {
    final Pattern pattern = Pattern.compile("(a|b)*");
    assertNotSame(pattern.toNfa(), pattern.toNfa());
    assertEquals(pattern.toNfa().allStates(), pattern.toNfa().allStates());
  }

  public void testLongConcatenation() {
    final String source = "ab".repeat(25_000);
    final Pattern pattern = Pattern.compile(source);
    assertEquals(source, pattern.toString());
    assertTrue(pattern.matches(source));
    assertFalse(pattern.matches(source + "a"));
    assertFalse(pattern.matches(source.substring(2)));
  }

  public void testDeeplyNestedGroups() {
    final int depth = 5_000;
    final Pattern groups = Pattern.compile("(".repeat(depth) + "a" + ")".repeat(depth));
    assertEquals(lit('a'), groups);
    assertTrue(groups.matches("a"));

    // Each level of repetition loops back from every accepting state below it
    final int repeatDepth = 300;
    final Pattern repeats = Pattern.compile("(".repeat(repeatDepth) + "a" + ")*".repeat(repeatDepth));
    assertEquals("(".repeat(repeatDepth - 1) + "a*" + ")*".repeat(repeatDepth - 1), repeats.toString());
    assertTrue(repeats.matches(""));
    assertTrue(repeats.matches("aaa"));
    assertFalse(repeats.matches("ab"));
  }

  public void testDeeplyNestedChoices() {
    final int depth = 5_000;
    final Pattern pattern = Pattern.compile("(a|".repeat(depth) + "b" + ")".repeat(depth));
    assertTrue(pattern.matches("a"));
    assertTrue(pattern.matches("b"));
    assertFalse(pattern.matches("ab"));
    assertEquals("a|".repeat(depth) + "b", pattern.toString());
  }
}
