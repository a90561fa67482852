package nl.adgroot.submittals.classify;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Semantic role of a document inside an equipment section. Declaration order of the equipment
 * roles is their order in the submittal.
 */
public enum DocumentRole {
  @JsonProperty("technical_data") TECHNICAL_DATA("Technical Data", 0),
  @JsonProperty("fan_curve") FAN_CURVE("Fan Curve", 1),
  @JsonProperty("drawing") DRAWING("Drawing", 2),
  @JsonProperty("item_summary") ITEM_SUMMARY("Item Summary", 3),
  @JsonProperty("specification") SPECIFICATION("Specification", 4),
  @JsonProperty("unknown") UNKNOWN("Document", 5),
  // cut sheets live in their own section and have no precedence among equipment documents
  @JsonProperty("cutsheet") CUTSHEET("Cut Sheet", Integer.MAX_VALUE);

  private final String label;
  private final int precedence;

  DocumentRole(String label, int precedence) {
    this.label = label;
    this.precedence = precedence;
  }

  /** Human readable label used for bookmarks. */
  public String label() {
    return label;
  }

  public int precedence() {
    return precedence;
  }
}
