package nl.adgroot.submittals;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import nl.adgroot.submittals.classify.DocumentClassifier;
import nl.adgroot.submittals.pdf.AssemblyPlan;
import nl.adgroot.submittals.pdf.AssemblyResult;
import nl.adgroot.submittals.pdf.SubmittalAssembler;
import nl.adgroot.submittals.structure.ClassifiedDocument;
import nl.adgroot.submittals.structure.Structure;
import nl.adgroot.submittals.structure.StructureBuilder;
import nl.adgroot.submittals.tags.ExtractionContext;
import nl.adgroot.submittals.tags.ExtractionFailure;
import nl.adgroot.submittals.tags.ExtractionMode;
import nl.adgroot.submittals.tags.ExtractionOutcome;
import nl.adgroot.submittals.tags.RawFile;
import nl.adgroot.submittals.tags.TagExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The two operations a caller needs: turn a batch of files into a {@link Structure}, and turn a
 * structure plus rendered PDFs into the final submittal.
 */
public class SubmittalEngine {

  private static final Logger log = LoggerFactory.getLogger(SubmittalEngine.class);

  private final TagExtractor tagExtractor;
  private final DocumentClassifier classifier;
  private final StructureBuilder structureBuilder;
  private final SubmittalAssembler assembler;
  private final ExecutorService cpuPool;

  public SubmittalEngine(
      TagExtractor tagExtractor,
      DocumentClassifier classifier,
      StructureBuilder structureBuilder,
      SubmittalAssembler assembler,
      ExecutorService cpuPool
  ) {
    this.tagExtractor = tagExtractor;
    this.classifier = classifier;
    this.structureBuilder = structureBuilder;
    this.assembler = assembler;
    this.cpuPool = cpuPool;
  }

  /**
   * Primes the numeric-prefix context sequentially, extracts and classifies every file in
   * parallel, then builds the structure from the complete batch.
   */
  public ExtractionReport extractStructure(List<RawFile> files, ExtractionMode mode) {
    ExtractionContext context = tagExtractor.primeContext(files, mode);

    List<CompletableFuture<ExtractionOutcome>> futures = new ArrayList<>(files.size());
    for (RawFile file : files) {
      futures.add(CompletableFuture.supplyAsync(() -> tagExtractor.extract(file, mode, context), cpuPool));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    List<ClassifiedDocument> documents = new ArrayList<>();
    List<ExtractionFailure> failures = new ArrayList<>();
    for (CompletableFuture<ExtractionOutcome> f : futures) {
      ExtractionOutcome outcome = f.join(); // safe after allOf, kept in input order
      if (outcome.isMatched()) {
        documents.add(new ClassifiedDocument(outcome.file(), outcome.match(), classifier.classify(outcome.match())));
      } else {
        failures.add(outcome.failure());
      }
    }

    log.info("Extracted tags for {}/{} files ({} unclassified)", documents.size(), files.size(), failures.size());
    return new ExtractionReport(structureBuilder.build(documents), failures);
  }

  public AssemblyResult assemble(
      Structure structure,
      Map<RawFile, Path> renderedPdfs,
      Map<String, Path> titlePages,
      boolean filterPricing,
      Path output
  ) throws IOException {
    return assembler.assemble(new AssemblyPlan(structure, renderedPdfs, titlePages), output, filterPricing);
  }
}
