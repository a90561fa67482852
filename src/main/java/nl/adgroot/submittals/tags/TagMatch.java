package nl.adgroot.submittals.tags;

/**
 * @param tag normalized tag, or {@link EquipmentTag#CUTSHEET}
 * @param documentType raw document-type text, classified later
 * @param confidence 0.0 - 1.0, fixed per matching rule
 * @param source whether the filename or the document text produced the tag
 */
public record TagMatch(String tag, String documentType, double confidence, MatchSource source) {

  public static final double EXPLICIT_FILENAME = 1.0;
  public static final double LABELED_CONTENT = 0.9;
  public static final double NUMERIC_PREFIX = 0.8;
  public static final double BARE_CONTENT = 0.6;

  public boolean isCutSheet() {
    return EquipmentTag.CUTSHEET.equals(tag);
  }
}
