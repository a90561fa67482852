package nl.adgroot.submittals.pdf;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import nl.adgroot.submittals.tags.EquipmentTag;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDPageContentStream.AppendMode;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * US-letter title page with the heading centred in large Helvetica Bold.
 * The cut sheets section is headed {@code CUT SHEETS}.
 */
public class PdfBoxTitlePageGenerator implements TitlePageGenerator {

  private static final Logger log = LoggerFactory.getLogger(PdfBoxTitlePageGenerator.class);

  static final String CUT_SHEETS_HEADING = "CUT SHEETS";

  private static final float MARGIN = 72f;

  private final Path outputDir;
  private final float fontSize;

  public PdfBoxTitlePageGenerator(Path outputDir, float fontSize) {
    this.outputDir = outputDir;
    this.fontSize = fontSize;
  }

  @Override
  public Path generateTitlePage(String tag, String heading) throws IOException {
    String text = EquipmentTag.CUTSHEET.equals(tag) ? CUT_SHEETS_HEADING : heading;
    Files.createDirectories(outputDir);
    Path target = outputDir.resolve(fileName(tag));

    try (PDDocument doc = new PDDocument()) {
      PDPage page = new PDPage(PDRectangle.LETTER);
      doc.addPage(page);
      writeCentered(doc, page, text);
      doc.save(target.toFile());
    }

    log.debug("Created title page {} for {}", target.getFileName(), tag);
    return target;
  }

  static String fileName(String tag) {
    if (EquipmentTag.CUTSHEET.equals(tag)) return "title_CUT_SHEETS.pdf";
    return "title_" + tag.replaceAll("[^A-Za-z0-9]+", "_") + ".pdf";
  }

  private void writeCentered(PDDocument doc, PDPage page, String text) throws IOException {
    PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    String safe = text == null ? "" : text.replaceAll("\\p{C}+", " ").trim();

    PDRectangle box = page.getMediaBox();
    float maxWidth = box.getWidth() - 2 * MARGIN;

    // shrink long headings until they fit between the margins
    float size = fontSize;
    float width = font.getStringWidth(safe) / 1000f * size;
    if (width > maxWidth && width > 0) {
      size = size * maxWidth / width;
      width = maxWidth;
    }

    float x = (box.getWidth() - width) / 2;
    float y = (box.getHeight() - size) / 2;

    try (PDPageContentStream cs = new PDPageContentStream(doc, page, AppendMode.OVERWRITE, true, true)) {
      cs.beginText();
      cs.setFont(font, size);
      cs.newLineAtOffset(x, y);
      cs.showText(safe);
      cs.endText();
    }
  }
}
