package nl.adgroot.submittals.text;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import nl.adgroot.submittals.pdf.PdfFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentTextSourceTest {

  @TempDir
  Path dir;

  @Test
  void routesByExtension() throws Exception {
    DocumentTextSource source = new DocumentTextSource(p -> "pdf", p -> "office");

    assertEquals("pdf", source.extractText(dir.resolve("a.PDF")));
    assertEquals("office", source.extractText(dir.resolve("a.docx")));
    assertEquals("", source.extractText(dir.resolve("a.jpg")));
  }

  @Test
  void readsPdfText() throws Exception {
    Path pdf = PdfFixtures.write(dir.resolve("sheet.pdf"), "Unit Tag: AHU-10");

    assertTrue(new DocumentTextSource().extractText(pdf).contains("AHU-10"));
  }

  @Test
  void tikaReadsPlainText() throws Exception {
    Path txt = Files.writeString(dir.resolve("notes.txt"), "Equipment ID: MAU-5\nSupply fan data");

    String text = new TikaTextExtractor().extractText(txt);

    assertTrue(text.contains("MAU-5"), text);
  }

  @Test
  void tikaStopsAtTheCharacterLimit() throws Exception {
    Path txt = Files.writeString(dir.resolve("long.txt"), "RTU-3 " + "x".repeat(5_000));

    String text = new TikaTextExtractor(100).extractText(txt);

    assertTrue(text.strip().startsWith("RTU-3"), text);
    assertTrue(text.length() <= 100, "length " + text.length());
  }
}
