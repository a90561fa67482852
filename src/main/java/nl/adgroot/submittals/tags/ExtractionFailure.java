package nl.adgroot.submittals.tags;

/** A file for which no tag could be found. Kept for the manifest, never thrown. */
public record ExtractionFailure(String filename, String reason) {}
