package nl.adgroot.submittals.tags;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** An input document as discovered on disk. */
public record RawFile(String filename, Path path, long size) {

  public static RawFile of(Path path) throws IOException {
    Path absolute = path.toAbsolutePath().normalize();
    return new RawFile(absolute.getFileName().toString(), absolute, Files.size(absolute));
  }

  /** Filename without its last extension. */
  public String baseName() {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  public String extension() {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(dot).toLowerCase(java.util.Locale.ROOT) : "";
  }
}
