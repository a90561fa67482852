package nl.adgroot.submittals.pdf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.submittals.text.TextSource;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

public class PdfBoxTextExtractor implements TextSource, PageTextSource {

  @Override
  public String extractText(Path path) throws IOException {
    try (PDDocument document = Loader.loadPDF(path.toFile())) {
      return new PDFTextStripper().getText(document);
    }
  }

  /** One string per page, in page order. */
  public List<String> extractPages(Path pdfPath) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
      List<String> pages = new ArrayList<>(document.getNumberOfPages());
      for (int i = 0; i < document.getNumberOfPages(); i++) {
        pages.add(pageText(document, i));
      }
      return pages;
    }
  }

  @Override
  public String pageText(PDDocument document, int pageIndex) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setStartPage(pageIndex + 1);
    stripper.setEndPage(pageIndex + 1);
    return stripper.getText(document);
  }
}
