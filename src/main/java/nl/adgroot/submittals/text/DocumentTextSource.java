package nl.adgroot.submittals.text;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

import nl.adgroot.submittals.pdf.PdfBoxTextExtractor;

/**
 * Routes text extraction by extension: PDFs through PDFBox, office files through Tika.
 * Images yield no text (there is no OCR).
 */
public class DocumentTextSource implements TextSource {

  private static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".tif", ".tiff");

  private final TextSource pdf;
  private final TextSource office;

  public DocumentTextSource() {
    this(new PdfBoxTextExtractor(), new TikaTextExtractor());
  }

  public DocumentTextSource(TextSource pdf, TextSource office) {
    this.pdf = pdf;
    this.office = office;
  }

  @Override
  public String extractText(Path path) throws IOException {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    String ext = dot >= 0 ? name.substring(dot) : "";

    if (IMAGE_EXTENSIONS.contains(ext)) return "";
    if (ext.equals(".pdf")) return pdf.extractText(path);
    return office.extractText(path);
  }
}
