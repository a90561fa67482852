package nl.adgroot.submittals.structure;

import static nl.adgroot.submittals.structure.StructureFixtures.cutSheet;
import static nl.adgroot.submittals.structure.StructureFixtures.doc;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import nl.adgroot.submittals.classify.DocumentRole;
import nl.adgroot.submittals.tags.EquipmentTag;
import org.junit.jupiter.api.Test;

class StructureBuilderTest {

  private final StructureBuilder builder = new StructureBuilder();

  private static List<String> tags(Structure s) {
    return s.groups().stream().map(EquipmentGroup::tag).toList();
  }

  @Test
  void mauGroupsFirstThenOthersThenCutSheets() {
    // GIVEN
    List<ClassifiedDocument> docs = List.of(
        doc("AHU-10", "Technical Data Sheet", "AHU-10 - Technical Data Sheet.pdf"),
        doc("MAU-5", "Drawing", "MAU-5_Drawing.pdf"),
        cutSheet("CS_Filter.pdf"),
        doc("AHU-10", "Item Summary", "10_Item Summary.docx")
    );

    // WHEN
    Structure s = builder.build(docs);

    // THEN
    assertEquals(List.of("MAU-5", "AHU-10", EquipmentTag.CUTSHEET), tags(s));
    assertEquals(
        List.of(DocumentRole.TECHNICAL_DATA, DocumentRole.ITEM_SUMMARY),
        s.group("AHU-10").orElseThrow().documents().stream().map(DocumentEntry::role).toList());
    assertEquals(EquipmentGroup.CUT_SHEETS_TITLE, s.cutSheets().orElseThrow().title());
    assertEquals(4, s.documentCount());
  }

  @Test
  void otherPrefixesShareOneTierOrderedByNumber() {
    Structure s = builder.build(List.of(
        doc("RTU-3", "Drawing", "RTU-3 Drawing.pdf"),
        doc("AHU-10", "Drawing", "AHU-10 Drawing.pdf"),
        doc("MAU-12", "Drawing", "MAU-12 Drawing.pdf"),
        doc("EF-1", "Drawing", "EF-1 Drawing.pdf"),
        doc("AHU-1", "Drawing", "AHU-1 Drawing.pdf"),
        doc("MAU-2", "Drawing", "MAU-2 Drawing.pdf")
    ));

    assertEquals(List.of("MAU-2", "MAU-12", "AHU-1", "EF-1", "RTU-3", "AHU-10"), tags(s));
  }

  @Test
  void documentsFollowRolePrecedenceThenFilename() {
    Structure s = builder.build(List.of(
        doc("AHU-1", "Specification", "AHU-1 Specification.pdf"),
        doc("AHU-1", "Notes", "AHU-1 Notes.pdf"),
        doc("AHU-1", "Drawing", "AHU-1 Drawing B.pdf"),
        doc("AHU-1", "Fan Curve", "AHU-1 Fan Curve.pdf"),
        doc("AHU-1", "Drawing", "AHU-1 Drawing A.pdf"),
        doc("AHU-1", "Technical Data", "AHU-1 Technical Data.pdf")
    ));

    assertEquals(
        List.of(
            "AHU-1 Technical Data.pdf",
            "AHU-1 Fan Curve.pdf",
            "AHU-1 Drawing A.pdf",
            "AHU-1 Drawing B.pdf",
            "AHU-1 Specification.pdf",
            "AHU-1 Notes.pdf"),
        s.groups().get(0).documents().stream().map(DocumentEntry::filename).toList());
  }

  @Test
  void noCutSheetsMeansNoCutSheetsGroup() {
    Structure s = builder.build(List.of(doc("AHU-1", "Drawing", "AHU-1 Drawing.pdf")));

    assertTrue(s.cutSheets().isEmpty());
    assertEquals(1, s.groups().size());
  }

  @Test
  void cutSheetsSortedByFilename() {
    Structure s = builder.build(List.of(cutSheet("CS_Louver.pdf"), cutSheet("CS_Damper.pdf")));

    assertEquals(
        List.of("CS_Damper.pdf", "CS_Louver.pdf"),
        s.cutSheets().orElseThrow().documents().stream().map(DocumentEntry::filename).toList());
  }

  @Test
  void groupOrderFieldMatchesPosition() {
    Structure s = builder.build(List.of(
        doc("AHU-2", "Drawing", "AHU-2 Drawing.pdf"),
        doc("MAU-1", "Drawing", "MAU-1 Drawing.pdf"),
        cutSheet("CS_X.pdf")
    ));

    for (int i = 0; i < s.groups().size(); i++) {
      assertEquals(i, s.groups().get(i).order());
    }
  }

  @Test
  void inputOrderDoesNotMatter() {
    List<ClassifiedDocument> docs = new ArrayList<>(List.of(
        doc("AHU-10", "Technical Data Sheet", "AHU-10 - Technical Data Sheet.pdf"),
        doc("MAU-5", "Drawing", "MAU-5_Drawing.pdf"),
        cutSheet("CS_Filter.pdf"),
        doc("AHU-10", "Item Summary", "10_Item Summary.docx")
    ));
    Structure first = builder.build(docs);

    Collections.reverse(docs);
    Structure second = builder.build(docs);

    assertEquals(first, second);
  }

  @Test
  void emptyBatchGivesEmptyStructure() {
    Structure s = builder.build(List.of());

    assertTrue(s.groups().isEmpty());
    assertEquals(Structure.CURRENT_VERSION, s.version());
  }
}
