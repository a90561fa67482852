package nl.adgroot.submittals.convert;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import nl.adgroot.submittals.tags.RawFile;

/** Rendered PDF per input file, plus the files that could not be rendered. */
public record ConversionResult(Map<RawFile, Path> rendered, List<ConversionFailure> failures) {

  public ConversionResult {
    rendered = Map.copyOf(rendered);
    failures = List.copyOf(failures);
  }
}
