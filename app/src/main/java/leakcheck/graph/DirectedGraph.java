package leakcheck.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Mutable directed graph with integer-keyed vertices and at most one edge per ordered vertex pair.
 *
 * <p>Edges may reference indices that have no vertex; such dangling edges are kept so that a
 * validator can report them instead of the graph silently dropping them.
 */
public class DirectedGraph<V, E extends Arc> {
  private final SortedMap<Integer, V> vertices = new TreeMap<>();
  private final Map<Edge, E> edges = new LinkedHashMap<>();
  private final Map<Integer, Map<Integer, E>> outgoing = new TreeMap<>();
  private final Map<Integer, Map<Integer, E>> incoming = new TreeMap<>();

  public void addVertex(int index, V vertex) {
    Objects.requireNonNull(vertex, "vertex");
    if (vertices.containsKey(index)) {
      throw new IllegalArgumentException("vertex " + index + " already exists");
    }
    vertices.put(index, vertex);
  }

  /** Replaces the payload of an existing vertex, keeping its edges. */
  public void replaceVertex(int index, V vertex) {
    Objects.requireNonNull(vertex, "vertex");
    if (!vertices.containsKey(index)) {
      throw new IllegalArgumentException("vertex " + index + " does not exist");
    }
    vertices.put(index, vertex);
  }

  /** Removes a vertex together with every edge touching it. */
  public Optional<V> removeVertex(int index) {
    V removed = vertices.remove(index);
    if (removed == null) {
      return Optional.empty();
    }
    for (E edge : edgesOut(index)) {
      removeEdge(edge.head(), edge.tail());
    }
    for (E edge : edgesIn(index)) {
      removeEdge(edge.head(), edge.tail());
    }
    return Optional.of(removed);
  }

  public boolean containsVertex(int index) {
    return vertices.containsKey(index);
  }

  public Optional<V> vertex(int index) {
    return Optional.ofNullable(vertices.get(index));
  }

  /** Vertices in index order; read-only view. */
  public SortedMap<Integer, V> vertices() {
    return Collections.unmodifiableSortedMap(vertices);
  }

  public int vertexCount() {
    return vertices.size();
  }

  public void addEdge(E edge) {
    Objects.requireNonNull(edge, "edge");
    Edge key = edge.edge();
    if (edges.containsKey(key)) {
      throw new IllegalArgumentException("edge " + key + " already exists");
    }
    putEdge(edge);
  }

  /** Inserts or replaces the edge between the same pair of vertices. */
  public void putEdge(E edge) {
    Edge key = edge.edge();
    edges.put(key, edge);
    outgoing.computeIfAbsent(key.head(), k -> new LinkedHashMap<>()).put(key.tail(), edge);
    incoming.computeIfAbsent(key.tail(), k -> new LinkedHashMap<>()).put(key.head(), edge);
  }

  public Optional<E> removeEdge(int head, int tail) {
    E removed = edges.remove(new Edge(head, tail));
    if (removed == null) {
      return Optional.empty();
    }
    detach(outgoing, head, tail);
    detach(incoming, tail, head);
    return Optional.of(removed);
  }

  private void detach(Map<Integer, Map<Integer, E>> adjacency, int from, int to) {
    Map<Integer, E> row = adjacency.get(from);
    if (row != null) {
      row.remove(to);
      if (row.isEmpty()) {
        adjacency.remove(from);
      }
    }
  }

  public Optional<E> edge(int head, int tail) {
    return Optional.ofNullable(edges.get(new Edge(head, tail)));
  }

  public boolean containsEdge(int head, int tail) {
    return edges.containsKey(new Edge(head, tail));
  }

  /** Edges in insertion order. */
  public List<E> edges() {
    return List.copyOf(edges.values());
  }

  public int edgeCount() {
    return edges.size();
  }

  public List<E> edgesOut(int index) {
    return List.copyOf(outgoing.getOrDefault(index, Map.of()).values());
  }

  public List<E> edgesIn(int index) {
    return List.copyOf(incoming.getOrDefault(index, Map.of()).values());
  }

  public List<Integer> successors(int index) {
    return List.copyOf(outgoing.getOrDefault(index, Map.of()).keySet());
  }

  public List<Integer> predecessors(int index) {
    return List.copyOf(incoming.getOrDefault(index, Map.of()).keySet());
  }

  /** Vertices reachable from {@code start} along edges between existing vertices. */
  public Set<Integer> reachableFrom(int start) {
    Set<Integer> visited = new LinkedHashSet<>();
    if (!vertices.containsKey(start)) {
      return visited;
    }
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(start);
    while (!stack.isEmpty()) {
      int current = stack.pop();
      if (!visited.add(current)) {
        continue;
      }
      List<Integer> next = new ArrayList<>(successors(current));
      Collections.reverse(next);
      for (int neighbor : next) {
        if (vertices.containsKey(neighbor) && !visited.contains(neighbor)) {
          stack.push(neighbor);
        }
      }
    }
    return visited;
  }

  /** Copies vertices and edges through the given copiers into {@code target}. */
  protected <G extends DirectedGraph<V, E>> G copyInto(
      G target, UnaryOperator<V> vertexCopier, UnaryOperator<E> edgeCopier) {
    vertices.forEach((index, vertex) -> target.addVertex(index, vertexCopier.apply(vertex)));
    for (E edge : edges.values()) {
      target.putEdge(edgeCopier.apply(edge));
    }
    return target;
  }

  public DirectedGraph<V, E> copy(UnaryOperator<V> vertexCopier, UnaryOperator<E> edgeCopier) {
    return copyInto(new DirectedGraph<>(), vertexCopier, edgeCopier);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    vertices.forEach((index, vertex) -> sb.append(vertex).append('\n'));
    for (E edge : edges.values()) {
      sb.append(edge).append('\n');
    }
    return sb.toString();
  }
}
