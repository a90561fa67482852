package nl.adgroot.submittals.pdf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects pricing pages: a page is pricing when at least one of its lines holds a dollar amount
 * such as {@code $1,250.00} or {@code $ 75}. A lone {@code $} does not count.
 */
public class PricingPageFilter {

  private static final Logger log = LoggerFactory.getLogger(PricingPageFilter.class);

  static final Pattern PRICE = Pattern.compile("\\$\\s?[0-9][0-9,]*(\\.[0-9]{2})?");

  private final PageTextSource pageText;

  public PricingPageFilter(PageTextSource pageText) {
    this.pageText = pageText;
  }

  public static boolean isPricingText(String text) {
    if (text == null || text.isEmpty()) return false;
    for (String line : text.split("\\R")) {
      if (PRICE.matcher(line).find()) {
        return true;
      }
    }
    return false;
  }

  /** Zero-based indexes of the pages to keep, in order. */
  public List<Integer> keptPages(PDDocument document) throws IOException {
    List<Integer> kept = new ArrayList<>(document.getNumberOfPages());
    for (int i = 0; i < document.getNumberOfPages(); i++) {
      if (isPricingText(pageText.pageText(document, i))) {
        log.debug("Dropping pricing page {}", i + 1);
      } else {
        kept.add(i);
      }
    }
    return kept;
  }
}
