package nl.adgroot.submittals;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import nl.adgroot.submittals.classify.DocumentClassifier;
import nl.adgroot.submittals.config.AppConfig;
import nl.adgroot.submittals.config.ConfigLoader;
import nl.adgroot.submittals.convert.ConversionService;
import nl.adgroot.submittals.convert.GotenbergConverter;
import nl.adgroot.submittals.pdf.AssemblyFatalException;
import nl.adgroot.submittals.pdf.PdfBoxTextExtractor;
import nl.adgroot.submittals.pdf.PdfBoxTitlePageGenerator;
import nl.adgroot.submittals.pdf.PricingPageFilter;
import nl.adgroot.submittals.pdf.SubmittalAssembler;
import nl.adgroot.submittals.structure.Structure;
import nl.adgroot.submittals.structure.StructureBuilder;
import nl.adgroot.submittals.structure.StructureSerializer;
import nl.adgroot.submittals.tags.ContentTagExtractor;
import nl.adgroot.submittals.tags.ExtractionFailure;
import nl.adgroot.submittals.tags.ExtractionMode;
import nl.adgroot.submittals.tags.FilenameTagExtractor;
import nl.adgroot.submittals.tags.RawFileScanner;
import nl.adgroot.submittals.tags.TagExtractor;
import nl.adgroot.submittals.text.DocumentTextSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 *   extract  &lt;inputDir&gt; &lt;structure.json&gt;
 *   assemble &lt;inputDir&gt; &lt;structure.json&gt; &lt;output.pdf&gt;
 *   run      &lt;inputDir&gt; &lt;output.pdf&gt;
 *
 *   --content-fallback   look for tags in document text when the filename has none
 *   --keep-pricing       do not remove pricing pages
 *   --config &lt;file&gt;      configuration file instead of the bundled config.json
 * </pre>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 2;
  static final int EXIT_FAILED = 1;

  record Arguments(String command, List<String> positional, boolean contentFallback, boolean keepPricing, Path config) {}

  public static void main(String[] args) throws Exception {
    System.exit(run(args));
  }

  static int run(String[] args) throws Exception {
    Arguments a;
    try {
      a = parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(usage());
      return EXIT_USAGE;
    }

    AppConfig cfg = a.config() == null ? ConfigLoader.loadDefault() : ConfigLoader.load(a.config());
    ExtractionMode mode = a.contentFallback() ? ExtractionMode.CONTENT_FALLBACK : cfg.extraction.mode;
    boolean filterPricing = cfg.assembly.filterPricing && !a.keepPricing();

    try (AppExecutors exec = AppExecutors.create(cfg)) {
      StructureSerializer serializer = new StructureSerializer();
      Path inputDir = Path.of(a.positional().get(0)).toAbsolutePath();

      switch (a.command()) {
        case "extract" -> {
          Path structureFile = Path.of(a.positional().get(1));
          ExtractionReport report = pipeline(cfg, exec, workDir(inputDir)).extract(inputDir, mode);
          serializer.write(report.structure(), structureFile);
          log.info("{} groups, {} documents, {} unclassified",
              report.structure().groups().size(), report.structure().documentCount(), report.failures().size());
        }
        case "assemble" -> {
          Path structureFile = Path.of(a.positional().get(1));
          Path output = Path.of(a.positional().get(2)).toAbsolutePath();
          Structure structure = SubmittalPipeline.relocate(serializer.read(structureFile), inputDir);
          SubmittalPipeline pipeline = pipeline(cfg, exec, workDir(output));
          List<ExtractionFailure> unplaced = pipeline.unplacedFiles(structure, inputDir, mode);
          report(pipeline.assemble(structure, output, filterPricing, unplaced));
        }
        case "run" -> {
          Path output = Path.of(a.positional().get(1)).toAbsolutePath();
          report(pipeline(cfg, exec, workDir(output)).run(inputDir, output, mode, filterPricing));
        }
        default -> throw new IllegalStateException("Unhandled command " + a.command());
      }
      return EXIT_OK;
    } catch (AssemblyFatalException e) {
      log.error("{} ({} warnings)", e.getMessage(), e.getWarnings().size());
      e.getWarnings().forEach(w -> log.error("  {} {}: {}", w.kind(), w.filename(), w.message()));
      return EXIT_FAILED;
    }
  }

  static SubmittalPipeline pipeline(AppConfig cfg, AppExecutors exec, Path workDir) {
    PdfBoxTextExtractor pdfText = new PdfBoxTextExtractor();

    TagExtractor tagExtractor = new TagExtractor(
        new FilenameTagExtractor(),
        new ContentTagExtractor(cfg.extraction.equipmentPrefixes),
        new DocumentTextSource()
    );
    SubmittalEngine engine = new SubmittalEngine(
        tagExtractor,
        new DocumentClassifier(),
        new StructureBuilder(),
        new SubmittalAssembler(new PricingPageFilter(pdfText)),
        exec.cpuPool()
    );

    GotenbergConverter converter = new GotenbergConverter(cfg.conversion);
    log.info("Conversion service: {}", converter.getUrl());

    return new SubmittalPipeline(
        new RawFileScanner(cfg.extraction.supportedExtensions),
        engine,
        new ConversionService(converter, exec.conversionPool()),
        new PdfBoxTitlePageGenerator(workDir.resolve(cfg.titlePages.outputDir), cfg.titlePages.fontSize),
        new ManifestWriter(),
        workDir.resolve(cfg.conversion.outputDir),
        cfg.assembly.writeManifest
    );
  }

  private static Path workDir(Path anchor) {
    Path parent = anchor.getParent();
    return parent == null ? Path.of("").toAbsolutePath() : parent;
  }

  private static void report(SubmittalManifest manifest) {
    log.info("Wrote {} ({} pages, {} pricing pages removed)",
        manifest.output(), manifest.totalPages(), manifest.removedPricingPages());
    manifest.extractionFailures().forEach(f -> log.warn("Skipped {}: {}", f.filename(), f.reason()));
    manifest.conversionFailures().forEach(f -> log.warn("Not converted {}: {}", f.filename(), f.reason()));
    manifest.warnings().forEach(w -> log.warn("{} {} {}: {}", w.kind(), w.tag(), w.filename(), w.message()));
  }

  static Arguments parse(String[] args) {
    boolean contentFallback = false;
    boolean keepPricing = false;
    Path config = null;
    List<String> rest = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
        case "--content-fallback" -> contentFallback = true;
        case "--keep-pricing" -> keepPricing = true;
        case "--config" -> {
          if (i + 1 >= args.length) throw new IllegalArgumentException("--config needs a file");
          config = Path.of(args[++i]);
        }
        default -> {
          if (arg.startsWith("--")) throw new IllegalArgumentException("Unknown option " + arg);
          rest.add(arg);
        }
      }
    }

    if (rest.isEmpty()) throw new IllegalArgumentException("Missing command");
    String command = rest.get(0);
    List<String> positional = rest.subList(1, rest.size());

    int expected = switch (command) {
      case "extract", "run" -> 2;
      case "assemble" -> 3;
      default -> throw new IllegalArgumentException("Unknown command " + command);
    };
    if (positional.size() != expected) {
      throw new IllegalArgumentException(command + " expects " + expected + " arguments, got " + positional.size());
    }
    return new Arguments(command, List.copyOf(positional), contentFallback, keepPricing, config);
  }

  static String usage() {
    return String.join(System.lineSeparator(),
        "usage:",
        "  extract  <inputDir> <structure.json>",
        "  assemble <inputDir> <structure.json> <output.pdf>",
        "  run      <inputDir> <output.pdf>",
        "options: --content-fallback --keep-pricing --config <file>");
  }
}
