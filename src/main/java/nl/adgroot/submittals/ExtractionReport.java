package nl.adgroot.submittals;

import java.util.List;

import nl.adgroot.submittals.structure.Structure;
import nl.adgroot.submittals.tags.ExtractionFailure;

/** Structure of a batch plus the files that could not be placed in it. */
public record ExtractionReport(Structure structure, List<ExtractionFailure> failures) {

  public ExtractionReport {
    failures = List.copyOf(failures);
  }
}
