package leakcheck.report;

import java.io.IOException;
import java.nio.file.Path;

/** Something that can be drawn as a Graphviz DOT graph. */
public interface RenderGraph {

  String renderToString();

  default void renderToFile(Path path) throws IOException {
    DumpToFile.dump(renderToString(), path);
  }
}
