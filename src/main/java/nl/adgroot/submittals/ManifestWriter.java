package nl.adgroot.submittals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ManifestWriter {

  private static final Logger log = LoggerFactory.getLogger(ManifestWriter.class);

  public static final String SUFFIX = ".manifest.json";

  private final ObjectMapper mapper = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  /** {@code submittal.pdf} -> {@code submittal.pdf.manifest.json} next to it. */
  public static Path manifestPath(Path output) {
    return output.resolveSibling(output.getFileName().toString() + SUFFIX);
  }

  public Path write(SubmittalManifest manifest, Path output) throws IOException {
    Path target = manifestPath(output);
    Files.writeString(target, mapper.writeValueAsString(manifest));
    log.info("Manifest written to {} ({} skipped, {} warnings)",
        target, manifest.skippedCount(), manifest.warnings().size());
    return target;
  }
}
