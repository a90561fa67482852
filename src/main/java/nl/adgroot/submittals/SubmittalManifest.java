package nl.adgroot.submittals;

import java.util.List;
import java.util.Map;

import nl.adgroot.submittals.convert.ConversionFailure;
import nl.adgroot.submittals.pdf.AssemblyResult;
import nl.adgroot.submittals.pdf.AssemblyWarning;
import nl.adgroot.submittals.tags.ExtractionFailure;

/**
 * Everything a person needs to finish a submittal by hand: what went in, and what was left out
 * with the reason.
 */
public record SubmittalManifest(
    String output,
    int totalPages,
    int removedPricingPages,
    Map<String, List<String>> includedFiles,
    List<ExtractionFailure> extractionFailures,
    List<ConversionFailure> conversionFailures,
    List<AssemblyWarning> warnings
) {

  public static SubmittalManifest of(
      AssemblyResult result,
      List<ExtractionFailure> extractionFailures,
      List<ConversionFailure> conversionFailures
  ) {
    return new SubmittalManifest(
        result.output().toString(),
        result.totalPages(),
        result.removedPricingPages(),
        result.includedFiles(),
        List.copyOf(extractionFailures),
        List.copyOf(conversionFailures),
        result.warnings()
    );
  }

  public int skippedCount() {
    return extractionFailures.size() + conversionFailures.size();
  }
}
