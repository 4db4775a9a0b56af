package thompson;

import java.util.ArrayDeque;
import java.util.Deque;
import thompson.parser.PatternVisitor;

/**
 * Bottom-up traversal of a pattern, using explicit stacks instead of
 * recursion so that very deep patterns can be traversed.
 *
 * <p>Children are visited before their parent, first operand before second,
 * which is the same order in which the parser drives a visitor.
 *
 * @author regex-thompson authors
 */
final class PostOrder {

  /**
   * Pending work: a node to expand, or one whose children have been visited.
   */
  private record Step(Pattern pattern, boolean childrenVisited) { }

  private PostOrder() { }

  /**
   * Fold a pattern through a visitor.
   *
   * @param root pattern to traverse
   * @param visitor visitor, which must not produce {@code null}
   * @return output of visiting the root
   */
  static <R> R fold(Pattern root, PatternVisitor<R> visitor) {
    final Deque<Step> steps = new ArrayDeque<>();
    final Deque<R> results = new ArrayDeque<>();
    steps.push(new Step(root, false));

    while (!steps.isEmpty()) {
      final Step step = steps.pop();
      final Pattern pattern = step.pattern();

      if (pattern instanceof Pattern.Empty) {
        results.push(visitor.visitEmpty());
      } else if (pattern instanceof Pattern.Literal literal) {
        results.push(visitor.visitLiteral(literal.character()));
      } else if (!step.childrenVisited()) {
        steps.push(new Step(pattern, true));

        // Second operand goes on the stack first, so it gets visited last
        if (pattern instanceof Pattern.Concatenate concatenate) {
          steps.push(new Step(concatenate.second(), false));
          steps.push(new Step(concatenate.first(), false));
        } else if (pattern instanceof Pattern.Choose choose) {
          steps.push(new Step(choose.second(), false));
          steps.push(new Step(choose.first(), false));
        } else if (pattern instanceof Pattern.Repeat repeat) {
          steps.push(new Step(repeat.pattern(), false));
        } else {
          throw new IllegalArgumentException("Unknown pattern node " + pattern.getClass());
        }
      } else if (pattern instanceof Pattern.Repeat) {
        results.push(visitor.visitRepeat(results.pop()));
      } else {
        final R second = results.pop();
        final R first = results.pop();
        results.push(
          pattern instanceof Pattern.Concatenate
            ? visitor.visitConcatenation(first, second)
            : visitor.visitChoice(first, second)
        );
      }
    }

    return results.pop();
  }
}
