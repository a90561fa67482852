package nl.adgroot.submittals.pdf;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import nl.adgroot.submittals.pdf.AssemblyWarning.Kind;
import nl.adgroot.submittals.structure.DocumentEntry;
import nl.adgroot.submittals.structure.EquipmentGroup;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDPageFitDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges title pages and rendered documents into one PDF in structure order and writes a
 * matching outline.
 *
 * <p>Every group that contributes document pages gets one top-level bookmark on its first page
 * (its title page when there is one) and one child bookmark per contributing document. Documents
 * that are missing, unreadable or empty after pricing removal are skipped with a warning; a group
 * left without document pages is dropped entirely, title page included. Only a submittal with no
 * pages at all is fatal.
 */
public class SubmittalAssembler {

  private static final Logger log = LoggerFactory.getLogger(SubmittalAssembler.class);

  private final PricingPageFilter pricingFilter;

  public SubmittalAssembler(PricingPageFilter pricingFilter) {
    this.pricingFilter = pricingFilter;
  }

  private record PendingDocument(String label, String filename, PDDocument source, List<Integer> pages) {}

  public AssemblyResult assemble(AssemblyPlan plan, Path output, boolean filterPricing) throws IOException {
    List<AssemblyWarning> warnings = new ArrayList<>();
    List<OutlineEntry> outlineEntries = new ArrayList<>();
    Map<String, List<String>> included = new LinkedHashMap<>();
    int removedPricing = 0;

    // imported pages reference their source documents, which therefore stay open until save
    List<PDDocument> sources = new ArrayList<>();

    try (PDDocument out = new PDDocument()) {
      PDDocumentOutline outline = new PDDocumentOutline();
      out.getDocumentCatalog().setDocumentOutline(outline);

      for (EquipmentGroup group : plan.structure().groups()) {
        List<PendingDocument> pending = new ArrayList<>();

        for (DocumentEntry doc : group.documents()) {
          Path pdf = plan.renderedPdfs().get(doc.file());
          if (pdf == null || !Files.isRegularFile(pdf)) {
            warn(warnings, Kind.MISSING_RENDERED_PDF, group, doc.filename(), "no rendered PDF available");
            continue;
          }

          PDDocument source;
          try {
            source = Loader.loadPDF(pdf.toFile());
          } catch (IOException e) {
            warn(warnings, Kind.UNREADABLE_PDF, group, doc.filename(), "could not open " + pdf.getFileName() + ": " + e.getMessage());
            continue;
          }
          sources.add(source);

          List<Integer> pages;
          try {
            pages = filterPricing
                ? pricingFilter.keptPages(source)
                : IntStream.range(0, source.getNumberOfPages()).boxed().toList();
          } catch (IOException | RuntimeException e) {
            warn(warnings, Kind.UNREADABLE_PDF, group, doc.filename(), "could not read page text: " + e.getMessage());
            continue;
          }
          removedPricing += source.getNumberOfPages() - pages.size();

          if (pages.isEmpty()) {
            warn(warnings, Kind.EMPTY_DOCUMENT, group, doc.filename(), "no pages left after pricing removal");
            continue;
          }
          pending.add(new PendingDocument(childLabel(group, doc), doc.filename(), source, pages));
        }

        if (pending.isEmpty()) {
          warn(warnings, Kind.EMPTY_GROUP, group, null, "no document contributed any page; section omitted");
          continue;
        }

        int groupStart = out.getNumberOfPages();
        PDPage groupFirstPage = null;

        Path titlePath = plan.titlePages().get(group.tag());
        if (titlePath == null || !Files.isRegularFile(titlePath)) {
          warn(warnings, Kind.MISSING_TITLE_PAGE, group, null, "no title page");
        } else {
          try {
            PDDocument title = Loader.loadPDF(titlePath.toFile());
            sources.add(title);
            for (PDPage page : title.getPages()) {
              PDPage imported = out.importPage(page);
              if (groupFirstPage == null) groupFirstPage = imported;
            }
          } catch (IOException e) {
            warn(warnings, Kind.MISSING_TITLE_PAGE, group, null, "could not open title page: " + e.getMessage());
          }
        }

        PDOutlineItem groupItem = new PDOutlineItem();
        groupItem.setTitle(group.title());
        List<OutlineEntry> children = new ArrayList<>();
        List<String> files = new ArrayList<>();

        for (PendingDocument doc : pending) {
          int docStart = out.getNumberOfPages();
          PDPage first;
          try {
            first = importPages(out, doc);
          } catch (IOException | RuntimeException e) {
            removePagesFrom(out, docStart);
            warn(warnings, Kind.UNREADABLE_PDF, group, doc.filename(), "could not copy pages: " + e.getMessage());
            continue;
          }
          if (groupFirstPage == null) groupFirstPage = first;

          PDOutlineItem child = new PDOutlineItem();
          child.setTitle(doc.label());
          child.setDestination(destination(first));
          groupItem.addLast(child);

          children.add(new OutlineEntry(doc.label(), docStart + 1, List.of()));
          files.add(doc.filename());
          log.debug("  {} -> pages {}-{}", doc.filename(), docStart + 1, out.getNumberOfPages());
        }

        if (children.isEmpty()) {
          removePagesFrom(out, groupStart);
          warn(warnings, Kind.EMPTY_GROUP, group, null, "no document pages could be copied; section omitted");
          continue;
        }

        groupItem.setDestination(destination(groupFirstPage));
        outline.addLast(groupItem);
        outlineEntries.add(new OutlineEntry(group.title(), groupStart + 1, children));
        included.put(group.tag(), files);

        log.info("Added {}: {} documents, pages {}-{}", group.tag(), files.size(), groupStart + 1, out.getNumberOfPages());
      }

      if (out.getNumberOfPages() == 0) {
        throw new AssemblyFatalException("No group contributed any page; nothing to assemble", warnings);
      }

      outline.openNode();
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      out.save(output.toFile());

      log.info("Wrote {} ({} pages, {} pricing pages removed, {} warnings)",
          output, out.getNumberOfPages(), removedPricing, warnings.size());
      return new AssemblyResult(output, out.getNumberOfPages(), removedPricing, outlineEntries, included, warnings);
    } finally {
      for (PDDocument d : sources) {
        try {
          d.close();
        } catch (IOException e) {
          log.debug("Could not close source document: {}", e.getMessage());
        }
      }
    }
  }

  private static PDPage importPages(PDDocument out, PendingDocument doc) throws IOException {
    PDPage first = null;
    for (int index : doc.pages()) {
      PDPage imported = out.importPage(doc.source().getPage(index));
      if (first == null) first = imported;
    }
    return first;
  }

  // drops pages appended after a failed copy so page numbers stay in step with the outline
  private static void removePagesFrom(PDDocument out, int firstIndex) {
    while (out.getNumberOfPages() > firstIndex) {
      out.removePage(out.getNumberOfPages() - 1);
    }
  }

  private static String childLabel(EquipmentGroup group, DocumentEntry doc) {
    if (group.isCutSheets()) {
      return doc.file().baseName();
    }
    return doc.role().label();
  }

  private static PDPageFitDestination destination(PDPage page) {
    PDPageFitDestination dest = new PDPageFitDestination();
    dest.setPage(page);
    return dest;
  }

  private static void warn(List<AssemblyWarning> warnings, Kind kind, EquipmentGroup group, String filename, String message) {
    AssemblyWarning warning = new AssemblyWarning(kind, group.tag(), filename, message);
    warnings.add(warning);
    log.warn("{} [{}{}]: {}", kind, group.tag(), filename == null ? "" : " / " + filename, message);
  }
}
