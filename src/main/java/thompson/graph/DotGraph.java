package thompson.graph;

import java.util.stream.Stream;

/**
 * Automata which can be rendered using the DOT language.
 *
 * <p>Compile the output using {@code dot -Tsvg fsm.dot > fsm.svg}.
 *
 * @param <V> vertex in the graph
 *
 * @author regex-thompson authors
 */
public interface DotGraph<V> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param initial is this the starting state?
   * @param accepting is this an accepting state?
   */
  record Vertex<V>(V id, boolean initial, boolean accepting) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all rules, as edges
   */
  Stream<Rule<V>> edges();

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    // Vertices, with a blank vertex pointing at each initial one
    int gen = 0;
    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.accepting() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + ", label = <" + vertex.id() + ">];\n");
      if (vertex.initial()) {
        final var genId = escapeId("_gen" + ++gen);
        builder.append("  " + genId + " [shape = none, label = <>];\n");
        builder.append("  " + genId + " -> " + id + ";\n");
      }
    }

    // Edges
    final Iterable<Rule<V>> es = () -> edges().iterator();
    for (Rule<V> edge : es) {
      final var from = escapeId(edge.state().toString());
      final var to = escapeId(edge.nextState().toString());
      builder.append("  " + from + " -> " + to + " [label = <" + edge.symbol().dotLabel() + ">];\n");
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
