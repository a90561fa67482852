package nl.adgroot.submittals.tags;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class FilenameTagExtractorTest {

  private final FilenameTagExtractor extractor = new FilenameTagExtractor();
  private final ExtractionContext emptyContext = new ExtractionContext().freeze();

  static RawFile file(String name) {
    return new RawFile(name, Path.of("/submittals", name), 0);
  }

  @Test
  void explicitTagWithDashSeparator() {
    TagMatch m = extractor.extract(file("AHU-10 - Technical Data Sheet.pdf"), emptyContext).orElseThrow();

    assertEquals("AHU-10", m.tag());
    assertEquals("Technical Data Sheet", m.documentType());
    assertEquals(TagMatch.EXPLICIT_FILENAME, m.confidence());
    assertEquals(MatchSource.FILENAME, m.source());
  }

  @Test
  void explicitTagWithUnderscores() {
    TagMatch m = extractor.extract(file("mau_05_Fan_Curve.docx"), emptyContext).orElseThrow();

    assertEquals("MAU-5", m.tag());
    assertEquals("Fan Curve", m.documentType());
  }

  @Test
  void explicitTagWithoutType() {
    TagMatch m = extractor.extract(file("EF-3.pdf"), emptyContext).orElseThrow();

    assertEquals("EF-3", m.tag());
    assertEquals("", m.documentType());
  }

  @Test
  void cutSheetPrefixVariants() {
    for (String name : new String[] {"CS_Filter.pdf", "CS - Damper.pdf", "cs-Louver.pdf", "CS.pdf"}) {
      TagMatch m = extractor.extract(file(name), emptyContext).orElseThrow(() -> new AssertionError(name));
      assertEquals(EquipmentTag.CUTSHEET, m.tag(), name);
      assertTrue(m.isCutSheet());
    }
  }

  @Test
  void csIsNeverAnEquipmentPrefix() {
    TagMatch m = extractor.extract(file("CS_1_Louver.pdf"), emptyContext).orElseThrow();

    assertEquals(EquipmentTag.CUTSHEET, m.tag());
  }

  @Test
  void numericPrefixResolvesThroughContext() {
    ExtractionContext context = new ExtractionContext();
    context.register(10, "AHU-10");
    context.freeze();

    TagMatch m = extractor.extract(file("10_Item Summary.docx"), context).orElseThrow();

    assertEquals("AHU-10", m.tag());
    assertEquals("Item Summary", m.documentType());
    assertEquals(TagMatch.NUMERIC_PREFIX, m.confidence());
  }

  @Test
  void unknownNumericPrefixDoesNotMatch() {
    Optional<TagMatch> m = extractor.extract(file("99_Unknown.docx"), emptyContext);

    assertTrue(m.isEmpty());
  }

  @Test
  void plainNamesDoNotMatch() {
    assertTrue(extractor.extract(file("Cover Letter.pdf"), emptyContext).isEmpty());
    assertTrue(extractor.extract(file("AHU10 Drawing.pdf"), emptyContext).isEmpty());
  }

  @Test
  void embeddedTagAfterNumericPrefix() {
    assertEquals(Optional.of("AHU-10"), FilenameTagExtractor.embeddedTag("10_AHU-10_Drawing"));
    assertEquals(Optional.empty(), FilenameTagExtractor.embeddedTag("10_Item Summary"));
    assertEquals(Optional.empty(), FilenameTagExtractor.embeddedTag("AHU-10_Drawing"));
  }

  @Test
  void cleanTypeCollapsesSeparators() {
    assertEquals("Fan Curve", FilenameTagExtractor.cleanType("Fan__Curve"));
    assertEquals("Item Summary", FilenameTagExtractor.cleanType("Item_-_Summary"));
  }
}
