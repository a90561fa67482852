package nl.adgroot.submittals.pdf;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * @param includedFiles filenames that contributed pages, per group tag, in output order
 * @param removedPricingPages pages dropped by the pricing filter across all documents
 */
public record AssemblyResult(
    Path output,
    int totalPages,
    int removedPricingPages,
    List<OutlineEntry> outline,
    Map<String, List<String>> includedFiles,
    List<AssemblyWarning> warnings
) {}
