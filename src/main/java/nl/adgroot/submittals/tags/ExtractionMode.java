package nl.adgroot.submittals.tags;

public enum ExtractionMode {
  /** Filename patterns only; no file is opened. */
  FILENAME,
  /** Filename patterns first, then a scan of the document text when they find nothing. */
  CONTENT_FALLBACK
}
