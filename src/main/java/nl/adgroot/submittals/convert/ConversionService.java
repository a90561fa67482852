package nl.adgroot.submittals.convert;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import nl.adgroot.submittals.structure.DocumentEntry;
import nl.adgroot.submittals.structure.Structure;
import nl.adgroot.submittals.tags.RawFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders every document of a structure to PDF.
 *
 * <p>Conversions run on the given executor, whose size bounds the parallelism. Input PDFs are used
 * as they are. A failed document is recorded and the batch carries on. {@link #convertAll}
 * returns only when every conversion has finished, so assembly sees a complete mapping.
 */
public class ConversionService {

  private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

  static final String SERVICE_UNAVAILABLE = "conversion service unavailable";

  private final DocumentConverter converter;
  private final ExecutorService conversionPool;

  public ConversionService(DocumentConverter converter, ExecutorService conversionPool) {
    this.converter = converter;
    this.conversionPool = conversionPool;
  }

  private record Converted(RawFile file, Path pdf, String error) {}

  public ConversionResult convertAll(Structure structure, Path targetDir) {
    return convertAll(structure, targetDir, new ConversionProgress(structure.documentCount()));
  }

  ConversionResult convertAll(Structure structure, Path targetDir, ConversionProgress progress) {
    List<RawFile> files = structure.groups().stream()
        .flatMap(g -> g.documents().stream())
        .map(DocumentEntry::file)
        .toList();

    boolean needsConverter = files.stream().anyMatch(f -> !f.extension().equals(".pdf"));
    boolean available = !needsConverter || converter.isAvailable();
    if (!available) {
      log.warn("Conversion service unavailable; only input PDFs will be assembled");
    }

    List<CompletableFuture<Converted>> futures = new ArrayList<>(files.size());

    for (RawFile file : files) {
      if (file.extension().equals(".pdf")) {
        progress.finishDocument(0, true);
        futures.add(CompletableFuture.completedFuture(new Converted(file, file.path(), null)));
        continue;
      }
      if (!available) {
        progress.finishDocument(0, false);
        futures.add(CompletableFuture.completedFuture(new Converted(file, null, SERVICE_UNAVAILABLE)));
        continue;
      }
      futures.add(CompletableFuture
          .supplyAsync(() -> convertOne(file, targetDir, progress), conversionPool)
          .exceptionally(ex -> new Converted(file, null, rootMessage(ex))));
    }

    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    Map<RawFile, Path> rendered = new LinkedHashMap<>();
    List<ConversionFailure> failures = new ArrayList<>();
    for (CompletableFuture<Converted> f : futures) {
      Converted c = f.join(); // safe after allOf
      if (c.pdf() != null) {
        rendered.put(c.file(), c.pdf());
      } else {
        failures.add(new ConversionFailure(c.file().filename(), c.error()));
      }
    }

    log.info("Conversion finished: {} rendered, {} failed", rendered.size(), failures.size());
    return new ConversionResult(rendered, failures);
  }

  private Converted convertOne(RawFile file, Path targetDir, ConversionProgress progress) {
    long startNs = System.nanoTime();
    try {
      Path pdf = converter.convert(file.path(), targetDir);
      long millis = (System.nanoTime() - startNs) / 1_000_000;
      progress.finishDocument(millis, true);
      log.info("{} <- {}", progress.formatStatus(millis), file.filename());
      return new Converted(file, pdf, null);
    } catch (DocumentConversionException | RuntimeException e) {
      long millis = (System.nanoTime() - startNs) / 1_000_000;
      progress.finishDocument(millis, false);
      log.warn("Conversion failed for '{}': {}", file.filename(), e.getMessage());
      throw new CompletionException(e);
    }
  }

  private static String rootMessage(Throwable ex) {
    Throwable t = ex;
    while ((t instanceof CompletionException) && t.getCause() != null) {
      t = t.getCause();
    }
    return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
  }
}
