package leakcheck.report;

import java.util.LinkedHashMap;
import java.util.Map;

/** Minimal builder for Graphviz {@code digraph} documents. */
public final class DotWriter {
  private final StringBuilder body = new StringBuilder();
  private final String name;

  public DotWriter(String name) {
    this.name = name;
  }

  public static Map<String, String> attributes(String... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("attributes come in key/value pairs");
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      attributes.put(keyValues[i], keyValues[i + 1]);
    }
    return attributes;
  }

  public DotWriter graphAttributes(Map<String, String> attributes) {
    body.append("  graph").append(render(attributes)).append(";\n");
    return this;
  }

  public DotWriter nodeDefaults(Map<String, String> attributes) {
    body.append("  node").append(render(attributes)).append(";\n");
    return this;
  }

  public DotWriter node(String id, Map<String, String> attributes) {
    body.append("  ").append(quote(id)).append(render(attributes)).append(";\n");
    return this;
  }

  public DotWriter edge(String head, String tail, Map<String, String> attributes) {
    body.append("  ")
        .append(quote(head))
        .append(" -> ")
        .append(quote(tail))
        .append(render(attributes))
        .append(";\n");
    return this;
  }

  private static String render(Map<String, String> attributes) {
    if (attributes.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(" [");
    boolean first = true;
    for (Map.Entry<String, String> entry : attributes.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(entry.getKey()).append('=').append(quote(entry.getValue()));
    }
    return sb.append(']').toString();
  }

  /** Quotes a DOT identifier; newlines become left-justified line breaks. */
  public static String quote(String text) {
    String escaped = text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\l");
    return "\"" + escaped + "\"";
  }

  public String render() {
    return "digraph " + quote(name) + " {\n" + body + "}\n";
  }

  @Override
  public String toString() {
    return render();
  }
}
