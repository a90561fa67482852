package nl.adgroot.submittals.tags;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Lists the supported input documents of a directory (not recursive), sorted by filename. */
public class RawFileScanner {

  private static final Logger log = LoggerFactory.getLogger(RawFileScanner.class);

  private final Set<String> extensions;

  public RawFileScanner(List<String> supportedExtensions) {
    this.extensions = supportedExtensions.stream()
        .map(e -> e.toLowerCase(Locale.ROOT))
        .map(e -> e.startsWith(".") ? e : "." + e)
        .collect(Collectors.toSet());
  }

  public List<RawFile> scan(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      throw new IOException("Not a directory: " + directory);
    }

    List<Path> candidates;
    try (Stream<Path> s = Files.list(directory)) {
      candidates = s.filter(Files::isRegularFile)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .toList();
    }

    List<RawFile> files = new ArrayList<>(candidates.size());
    for (Path p : candidates) {
      RawFile file = RawFile.of(p);
      if (file.filename().startsWith(".") || file.filename().startsWith("~$")) {
        continue; // hidden files and office lock files
      }
      if (!extensions.contains(file.extension())) {
        log.debug("Skipping unsupported file: {}", file.filename());
        continue;
      }
      files.add(file);
    }

    log.info("Found {} input documents in {}", files.size(), directory);
    return files;
  }
}
