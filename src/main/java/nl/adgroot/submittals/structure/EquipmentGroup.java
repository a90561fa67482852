package nl.adgroot.submittals.structure;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import nl.adgroot.submittals.tags.EquipmentTag;

/**
 * All documents of one tag, in submittal order.
 *
 * @param tag normalized tag, {@link EquipmentTag#CUTSHEET} for the cut sheets section
 * @param title heading for the title page and bookmark; the tag unless edited
 * @param order zero-based position of the group in the structure
 */
public record EquipmentGroup(String tag, String title, int order, List<DocumentEntry> documents) {

  public static final String CUT_SHEETS_TITLE = "Cut Sheets";

  public EquipmentGroup {
    if (tag == null || tag.isBlank()) {
      throw new IllegalArgumentException("Group tag must not be blank");
    }
    title = (title == null || title.isBlank()) ? tag : title;
    documents = documents == null ? List.of() : List.copyOf(documents);
  }

  @JsonIgnore
  public boolean isCutSheets() {
    return EquipmentTag.CUTSHEET.equals(tag);
  }
}
