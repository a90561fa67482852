package nl.adgroot.submittals.pdf;

/** Something the assembler skipped; the rest of the submittal is still produced. */
public record AssemblyWarning(Kind kind, String tag, String filename, String message) {

  public enum Kind {
    MISSING_TITLE_PAGE,
    MISSING_RENDERED_PDF,
    UNREADABLE_PDF,
    EMPTY_DOCUMENT,
    EMPTY_GROUP
  }
}
