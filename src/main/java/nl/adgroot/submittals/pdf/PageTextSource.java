package nl.adgroot.submittals.pdf;

import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;

/** Text of a single page of an open document; {@code pageIndex} is zero based. */
@FunctionalInterface
public interface PageTextSource {

  String pageText(PDDocument document, int pageIndex) throws IOException;
}
