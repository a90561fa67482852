package nl.adgroot.submittals;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.adgroot.submittals.classify.DocumentClassifier;
import nl.adgroot.submittals.convert.ConversionService;
import nl.adgroot.submittals.convert.DocumentConversionException;
import nl.adgroot.submittals.convert.DocumentConverter;
import nl.adgroot.submittals.pdf.PdfBoxTextExtractor;
import nl.adgroot.submittals.pdf.PdfBoxTitlePageGenerator;
import nl.adgroot.submittals.pdf.PdfFixtures;
import nl.adgroot.submittals.pdf.PricingPageFilter;
import nl.adgroot.submittals.pdf.SubmittalAssembler;
import nl.adgroot.submittals.structure.EquipmentGroup;
import nl.adgroot.submittals.structure.Structure;
import nl.adgroot.submittals.structure.StructureBuilder;
import nl.adgroot.submittals.structure.StructureSerializer;
import nl.adgroot.submittals.tags.ContentTagExtractor;
import nl.adgroot.submittals.tags.ExtractionFailure;
import nl.adgroot.submittals.tags.ExtractionMode;
import nl.adgroot.submittals.tags.FilenameTagExtractor;
import nl.adgroot.submittals.tags.RawFileScanner;
import nl.adgroot.submittals.tags.TagExtractor;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SubmittalPipelineTest {

  @TempDir
  Path dir;

  private Path input;
  private Path work;
  private final ExecutorService pool = Executors.newFixedThreadPool(2);

  /** Fake conversion service: every office file becomes a one-page PDF naming the source. */
  private final DocumentConverter converter = (source, target) -> {
    String name = source.getFileName().toString();
    if (name.contains("Broken")) throw new DocumentConversionException("LibreOffice failed");
    try {
      Files.createDirectories(target);
      String text = name.contains("Quote") ? "Total $4,200.00" : "Converted " + name;
      return PdfFixtures.write(target.resolve(name + ".pdf"), text);
    } catch (java.io.IOException e) {
      throw new DocumentConversionException("fixture failed", e);
    }
  };

  @BeforeEach
  void createInputs() throws Exception {
    input = Files.createDirectories(dir.resolve("input"));
    work = Files.createDirectories(dir.resolve("work"));
    Files.writeString(input.resolve("AHU-10 - Technical Data Sheet.docx"), "docx");
    Files.writeString(input.resolve("AHU-10 - Quote.docx"), "docx");
    Files.writeString(input.resolve("MAU-5 - Drawing.docx"), "docx");
    Files.writeString(input.resolve("EF-1 - Broken Drawing.docx"), "docx");
    Files.writeString(input.resolve("99_Unknown.docx"), "docx");
    PdfFixtures.write(input.resolve("CS_Filter.pdf"), "Filter media", "Price: $1,250.00");
  }

  @AfterEach
  void shutdown() {
    pool.shutdownNow();
  }

  private SubmittalPipeline pipeline() {
    SubmittalEngine engine = new SubmittalEngine(
        new TagExtractor(new FilenameTagExtractor(), new ContentTagExtractor(), p -> ""),
        new DocumentClassifier(),
        new StructureBuilder(),
        new SubmittalAssembler(new PricingPageFilter(new PdfBoxTextExtractor())),
        pool
    );
    return new SubmittalPipeline(
        new RawFileScanner(List.of(".pdf", ".docx")),
        engine,
        new ConversionService(converter, pool),
        new PdfBoxTitlePageGenerator(work.resolve("titles"), 48f),
        new ManifestWriter(),
        work.resolve("converted"),
        true
    );
  }

  @Test
  void runProducesSubmittalAndManifest() throws Exception {
    Path output = dir.resolve("out/submittal.pdf");

    SubmittalManifest manifest = pipeline().run(input, output, ExtractionMode.FILENAME, true);

    // MAU-5: title + drawing, AHU-10: title + data sheet (quote removed), cut sheets: title + 1 page
    assertEquals(6, manifest.totalPages());
    assertEquals(2, manifest.removedPricingPages());
    assertEquals(List.of("MAU-5", "AHU-10", "CUTSHEET"), List.copyOf(manifest.includedFiles().keySet()));
    assertEquals(List.of("99_Unknown.docx"), manifest.extractionFailures().stream().map(ExtractionFailure::filename).toList());
    assertEquals("EF-1 - Broken Drawing.docx", manifest.conversionFailures().get(0).filename());

    try (PDDocument doc = Loader.loadPDF(output.toFile())) {
      assertEquals(6, doc.getNumberOfPages());
    }

    Path manifestFile = ManifestWriter.manifestPath(output);
    JsonNode json = new ObjectMapper().readTree(manifestFile.toFile());
    assertEquals(6, json.get("totalPages").asInt());
    assertEquals("99_Unknown.docx", json.get("extractionFailures").get(0).get("filename").asText());
  }

  @Test
  void savedStructureCanBeEditedAndAssembled() throws Exception {
    SubmittalPipeline pipeline = pipeline();
    StructureSerializer serializer = new StructureSerializer();
    Path structureFile = dir.resolve("structure.json");

    ExtractionReport report = pipeline.extract(input, ExtractionMode.FILENAME);
    serializer.write(report.structure(), structureFile);
    String edited = Files.readString(structureFile).replace("\"title\" : \"AHU-10\"", "\"title\" : \"Air Handler 10\"");
    Files.writeString(structureFile, edited);

    Structure structure = serializer.read(structureFile);
    SubmittalManifest manifest = pipeline.assemble(
        structure, dir.resolve("edited.pdf"), false, pipeline.unplacedFiles(structure, input, ExtractionMode.FILENAME));

    assertEquals(8, manifest.totalPages());
    assertEquals(0, manifest.removedPricingPages());
    assertEquals("Air Handler 10", structure.group("AHU-10").orElseThrow().title());
    assertEquals(List.of("99_Unknown.docx"), manifest.extractionFailures().stream().map(ExtractionFailure::filename).toList());
  }

  @Test
  void filesTakenOutOfTheStructureAreReported() throws Exception {
    SubmittalPipeline pipeline = pipeline();
    Structure full = pipeline.extract(input, ExtractionMode.FILENAME).structure();
    // drop the MAU-5 group, as someone editing the saved structure would
    List<EquipmentGroup> kept = full.groups().stream().filter(g -> !g.tag().equals("MAU-5")).toList();
    List<EquipmentGroup> renumbered = new ArrayList<>();
    for (EquipmentGroup g : kept) {
      renumbered.add(new EquipmentGroup(g.tag(), g.title(), renumbered.size(), g.documents()));
    }
    Structure edited = Structure.of(renumbered);

    List<ExtractionFailure> unplaced = pipeline.unplacedFiles(edited, input, ExtractionMode.FILENAME);

    assertEquals(
        List.of("99_Unknown.docx", "MAU-5 - Drawing.docx"),
        unplaced.stream().map(ExtractionFailure::filename).toList());
    assertNotEquals(SubmittalPipeline.REMOVED_FROM_STRUCTURE, unplaced.get(0).reason());
    assertEquals(SubmittalPipeline.REMOVED_FROM_STRUCTURE, unplaced.get(1).reason());
  }

  @Test
  void completeStructureHasNoUnplacedFiles() throws Exception {
    Files.delete(input.resolve("99_Unknown.docx"));
    SubmittalPipeline pipeline = pipeline();
    Structure structure = pipeline.extract(input, ExtractionMode.FILENAME).structure();

    assertTrue(pipeline.unplacedFiles(structure, input, ExtractionMode.FILENAME).isEmpty());
  }

  @Test
  void relocateFindsMovedInputs() throws Exception {
    SubmittalPipeline pipeline = pipeline();
    Structure structure = pipeline.extract(input, ExtractionMode.FILENAME).structure();

    Path moved = Files.createDirectories(dir.resolve("moved"));
    try (var files = Files.list(input)) {
      for (Path p : files.toList()) {
        Files.move(p, moved.resolve(p.getFileName()));
      }
    }

    Structure relocated = SubmittalPipeline.relocate(structure, moved);

    relocated.groups().stream()
        .flatMap(g -> g.documents().stream())
        .forEach(d -> assertEquals(moved.toAbsolutePath().normalize(), d.file().path().getParent()));
  }
}
