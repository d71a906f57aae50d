package leakcheck.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Writes the text rendering of any value to a file, replacing its previous contents. */
public final class DumpToFile {
  private DumpToFile() {}

  public static void dump(Object value, Path path) throws IOException {
    Objects.requireNonNull(value, "value");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, value.toString(), StandardCharsets.UTF_8);
  }
}
