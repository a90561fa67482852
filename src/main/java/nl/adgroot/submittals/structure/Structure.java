package nl.adgroot.submittals.structure;

import java.util.List;
import java.util.Optional;

/**
 * The ordered plan of one submittal: equipment groups, then the cut sheets section if there are
 * any cut sheets. Immutable; an edited plan is a new instance.
 */
public record Structure(int version, List<EquipmentGroup> groups) {

  public static final int CURRENT_VERSION = 1;

  public Structure {
    groups = groups == null ? List.of() : List.copyOf(groups);
  }

  public static Structure of(List<EquipmentGroup> groups) {
    return new Structure(CURRENT_VERSION, groups);
  }

  public List<EquipmentGroup> equipmentGroups() {
    return groups.stream().filter(g -> !g.isCutSheets()).toList();
  }

  public Optional<EquipmentGroup> cutSheets() {
    return groups.stream().filter(EquipmentGroup::isCutSheets).findFirst();
  }

  public Optional<EquipmentGroup> group(String tag) {
    return groups.stream().filter(g -> g.tag().equals(tag)).findFirst();
  }

  public int documentCount() {
    return groups.stream().mapToInt(g -> g.documents().size()).sum();
  }
}
