package thompson;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders patterns back into source, adding only the parentheses needed.
 *
 * <p>Reparsing the output gives a pattern matching the same strings, though
 * not necessarily the same tree ({@code (ab)c} prints as {@code abc}, which
 * parses as {@code a(bc)}).
 *
 * <p>The source is written left to right into one buffer. Nodes still to be
 * printed sit on an explicit stack along with the minimum precedence their
 * parent accepts without brackets, interleaved with the operator text which
 * comes after them.
 *
 * @author regex-thompson authors
 */
final class PatternPrinter {

  // Minimum precedence of operands
  private static final int CHOICE_OPERAND = 0;
  private static final int CONCATENATION_OPERAND = 1;
  private static final int REPEAT_OPERAND = 3;

  /**
   * Pending output: either a node or some fixed text.
   *
   * @param pattern node to print, or {@code null} for text
   * @param minimum minimum precedence accepted without brackets
   * @param text text to print if this isn't a node
   */
  private record Item(Pattern pattern, int minimum, String text) {

    static Item node(Pattern pattern, int minimum) {
      return new Item(pattern, minimum, null);
    }

    static Item text(String text) {
      return new Item(null, 0, text);
    }
  }

  private PatternPrinter() { }

  static String print(Pattern pattern) {
    final var source = new StringBuilder();
    final Deque<Item> items = new ArrayDeque<>();
    items.push(Item.node(pattern, CHOICE_OPERAND));

    while (!items.isEmpty()) {
      final Item item = items.pop();
      final Pattern node = item.pattern();

      if (node == null) {
        source.append(item.text());
      } else if (node instanceof Pattern.Empty) {
        // Empty only prints as nothing where an alternative may be missing
        source.append(item.minimum() > CHOICE_OPERAND ? "()" : "");
      } else if (node.precedence() < item.minimum()) {
        source.append('(');
        items.push(Item.text(")"));
        items.push(Item.node(node, CHOICE_OPERAND));
      } else if (node instanceof Pattern.Literal literal) {
        source.append(literal.character());
      } else if (node instanceof Pattern.Concatenate concatenate) {
        items.push(Item.node(concatenate.second(), CONCATENATION_OPERAND));
        items.push(Item.node(concatenate.first(), CONCATENATION_OPERAND));
      } else if (node instanceof Pattern.Choose choose) {
        items.push(Item.node(choose.second(), CHOICE_OPERAND));
        items.push(Item.text("|"));
        items.push(Item.node(choose.first(), CHOICE_OPERAND));
      } else if (node instanceof Pattern.Repeat repeat) {
        items.push(Item.text("*"));
        items.push(Item.node(repeat.pattern(), REPEAT_OPERAND));
      } else {
        throw new IllegalArgumentException("Unknown pattern node " + node.getClass());
      }
    }

    return source.toString();
  }
}
