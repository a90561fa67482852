package nl.adgroot.submittals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import nl.adgroot.submittals.convert.ConversionResult;
import nl.adgroot.submittals.convert.ConversionService;
import nl.adgroot.submittals.pdf.AssemblyResult;
import nl.adgroot.submittals.pdf.TitlePageGenerator;
import nl.adgroot.submittals.structure.DocumentEntry;
import nl.adgroot.submittals.structure.EquipmentGroup;
import nl.adgroot.submittals.structure.Structure;
import nl.adgroot.submittals.tags.ExtractionFailure;
import nl.adgroot.submittals.tags.ExtractionMode;
import nl.adgroot.submittals.tags.RawFile;
import nl.adgroot.submittals.tags.RawFileScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full batch around a {@link SubmittalEngine}: input discovery, conversion to PDF, title
 * pages, assembly and the manifest.
 */
public class SubmittalPipeline {

  private static final Logger log = LoggerFactory.getLogger(SubmittalPipeline.class);

  static final String REMOVED_FROM_STRUCTURE = "removed from the structure";

  private final RawFileScanner scanner;
  private final SubmittalEngine engine;
  private final ConversionService conversionService;
  private final TitlePageGenerator titlePages;
  private final ManifestWriter manifestWriter;
  private final Path conversionDir;
  private final boolean writeManifest;

  public SubmittalPipeline(
      RawFileScanner scanner,
      SubmittalEngine engine,
      ConversionService conversionService,
      TitlePageGenerator titlePages,
      ManifestWriter manifestWriter,
      Path conversionDir,
      boolean writeManifest
  ) {
    this.scanner = scanner;
    this.engine = engine;
    this.conversionService = conversionService;
    this.titlePages = titlePages;
    this.manifestWriter = manifestWriter;
    this.conversionDir = conversionDir;
    this.writeManifest = writeManifest;
  }

  public ExtractionReport extract(Path inputDir, ExtractionMode mode) throws IOException {
    List<RawFile> files = scanner.scan(inputDir);
    ExtractionReport report = engine.extractStructure(files, mode);
    for (ExtractionFailure f : report.failures()) {
      log.warn("Unclassified: {} ({})", f.filename(), f.reason());
    }
    return report;
  }

  public SubmittalManifest run(Path inputDir, Path output, ExtractionMode mode, boolean filterPricing)
      throws IOException {
    ExtractionReport report = extract(inputDir, mode);
    return assemble(report.structure(), output, filterPricing, report.failures());
  }

  public SubmittalManifest assemble(
      Structure structure,
      Path output,
      boolean filterPricing,
      List<ExtractionFailure> extractionFailures
  ) throws IOException {
    Path absoluteOutput = output.toAbsolutePath();
    if (absoluteOutput.getParent() != null) Files.createDirectories(absoluteOutput.getParent());

    ConversionResult conversion = conversionService.convertAll(structure, conversionDir);
    Map<String, Path> titles = generateTitlePages(structure);

    AssemblyResult result = engine.assemble(
        structure, conversion.rendered(), titles, filterPricing, absoluteOutput);

    SubmittalManifest manifest = SubmittalManifest.of(result, extractionFailures, conversion.failures());
    if (writeManifest) {
      manifestWriter.write(manifest, absoluteOutput);
    }
    return manifest;
  }

  /**
   * Input files of {@code inputDir} that a saved structure does not contain, with the reason. Files
   * that still get no tag keep their extraction reason; files that do were taken out by hand.
   */
  public List<ExtractionFailure> unplacedFiles(Structure structure, Path inputDir, ExtractionMode mode)
      throws IOException {
    Set<String> placed = structure.groups().stream()
        .flatMap(g -> g.documents().stream())
        .map(DocumentEntry::filename)
        .collect(Collectors.toSet());

    List<RawFile> missing = scanner.scan(inputDir).stream()
        .filter(f -> !placed.contains(f.filename()))
        .toList();
    if (missing.isEmpty()) {
      return List.of();
    }

    ExtractionReport report = engine.extractStructure(missing, mode);
    List<ExtractionFailure> unplaced = new ArrayList<>(report.failures());
    report.structure().groups().stream()
        .flatMap(g -> g.documents().stream())
        .map(d -> new ExtractionFailure(d.filename(), REMOVED_FROM_STRUCTURE))
        .forEach(unplaced::add);
    unplaced.sort(Comparator.comparing(ExtractionFailure::filename));

    log.info("{} input files are not in the structure", unplaced.size());
    return unplaced;
  }

  /** A failed title page is logged and left out; the assembler bookmarks the group's first page instead. */
  Map<String, Path> generateTitlePages(Structure structure) {
    Map<String, Path> titles = new LinkedHashMap<>();
    for (EquipmentGroup group : structure.groups()) {
      try {
        titles.put(group.tag(), titlePages.generateTitlePage(group.tag(), group.title()));
      } catch (IOException e) {
        log.warn("Title page for {} could not be created: {}", group.tag(), e.getMessage());
      }
    }
    return titles;
  }

  /**
   * Points documents whose recorded path no longer exists at the file of the same name in
   * {@code inputDir}. Used when a saved structure is assembled after the inputs moved.
   */
  public static Structure relocate(Structure structure, Path inputDir) throws IOException {
    List<EquipmentGroup> groups = new ArrayList<>(structure.groups().size());
    for (EquipmentGroup group : structure.groups()) {
      List<DocumentEntry> docs = new ArrayList<>(group.documents().size());
      for (DocumentEntry doc : group.documents()) {
        Path candidate = inputDir.resolve(doc.filename());
        if (!Files.exists(doc.file().path()) && Files.isRegularFile(candidate)) {
          RawFile moved = RawFile.of(candidate);
          docs.add(new DocumentEntry(moved, doc.role(), doc.documentType(), doc.confidence(), doc.source()));
        } else {
          docs.add(doc);
        }
      }
      groups.add(new EquipmentGroup(group.tag(), group.title(), group.order(), docs));
    }
    return new Structure(structure.version(), groups);
  }
}
