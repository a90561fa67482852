package nl.adgroot.submittals.convert;

import java.nio.file.Path;

/** Renders one input document to a PDF inside {@code targetDir}. */
@FunctionalInterface
public interface DocumentConverter {

  Path convert(Path source, Path targetDir) throws DocumentConversionException;

  /** Whether the converter can take work right now; checked once before a batch. */
  default boolean isAvailable() {
    return true;
  }
}
