package nl.adgroot.submittals.structure;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import nl.adgroot.submittals.classify.DocumentRole;
import nl.adgroot.submittals.tags.EquipmentTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups classified documents by tag and puts groups and documents in submittal order.
 *
 * <p>Needs the complete batch: tier and position of a group depend on every other tag.
 */
public class StructureBuilder {

  private static final Logger log = LoggerFactory.getLogger(StructureBuilder.class);

  static final Comparator<DocumentEntry> DOCUMENT_ORDER = Comparator
      .comparingInt((DocumentEntry d) -> d.role().precedence())
      .thenComparing(DocumentEntry::filename);

  static final Comparator<DocumentEntry> CUT_SHEET_ORDER = Comparator.comparing(DocumentEntry::filename);

  public Structure build(List<ClassifiedDocument> documents) {
    Map<String, List<DocumentEntry>> byTag = new HashMap<>();
    List<DocumentEntry> cutSheets = new ArrayList<>();

    for (ClassifiedDocument doc : documents) {
      DocumentEntry entry = DocumentEntry.of(doc);
      if (doc.role() == DocumentRole.CUTSHEET) {
        cutSheets.add(entry);
      } else {
        byTag.computeIfAbsent(doc.match().tag(), t -> new ArrayList<>()).add(entry);
      }
    }

    List<String> tags = byTag.keySet().stream().sorted(GroupOrder.TAGS).toList();

    List<EquipmentGroup> groups = new ArrayList<>(tags.size() + 1);
    for (String tag : tags) {
      List<DocumentEntry> entries = byTag.get(tag).stream().sorted(DOCUMENT_ORDER).toList();
      groups.add(new EquipmentGroup(tag, tag, groups.size(), entries));
    }

    if (!cutSheets.isEmpty()) {
      List<DocumentEntry> entries = cutSheets.stream().sorted(CUT_SHEET_ORDER).toList();
      groups.add(new EquipmentGroup(EquipmentTag.CUTSHEET, EquipmentGroup.CUT_SHEETS_TITLE, groups.size(), entries));
    }

    log.info("Built structure: {} equipment groups, {} cut sheets", tags.size(), cutSheets.size());
    log.info("Processing order: {}", groups.stream().map(EquipmentGroup::tag).toList());
    return Structure.of(groups);
  }
}
