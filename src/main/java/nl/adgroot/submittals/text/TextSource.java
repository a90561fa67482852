package nl.adgroot.submittals.text;

import java.io.IOException;
import java.nio.file.Path;

/** Plain-text view of an input document. */
@FunctionalInterface
public interface TextSource {

  String extractText(Path path) throws IOException;
}
