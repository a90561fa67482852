package nl.adgroot.submittals.tags;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import nl.adgroot.submittals.text.TextSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces zero or one {@link TagMatch} per input file.
 *
 * <p>Filename rules always run first. In {@link ExtractionMode#CONTENT_FALLBACK} a file the
 * filename rules cannot place is opened and its text scanned. A file that yields nothing becomes
 * an {@link ExtractionFailure}; {@link #extract} never throws for a single file.
 */
public class TagExtractor {

  private static final Logger log = LoggerFactory.getLogger(TagExtractor.class);

  private final FilenameTagExtractor filenames;
  private final ContentTagExtractor content;
  private final TextSource textSource;

  public TagExtractor(FilenameTagExtractor filenames, ContentTagExtractor content, TextSource textSource) {
    this.filenames = filenames;
    this.content = content;
    this.textSource = textSource;
  }

  /**
   * Builds the numeric-prefix mapping in one sequential pass over the batch. Must run before
   * any parallel call to {@link #extract}.
   */
  public ExtractionContext primeContext(List<RawFile> files, ExtractionMode mode) {
    ExtractionContext context = new ExtractionContext();

    for (RawFile file : files) {
      String baseName = file.baseName().trim();
      OptionalInt number = FilenameTagExtractor.numericPrefix(baseName);
      if (number.isEmpty() || context.resolve(number.getAsInt()).isPresent()) continue;

      Optional<String> tag = FilenameTagExtractor.embeddedTag(baseName);
      if (tag.isEmpty() && mode == ExtractionMode.CONTENT_FALLBACK && textSource != null) {
        tag = readTag(file).map(TagMatch::tag);
      }

      tag.ifPresent(t -> {
        context.register(number.getAsInt(), t);
        log.debug("Numeric prefix {} -> {} (from '{}')", number.getAsInt(), t, file.filename());
      });
    }

    if (!context.mappings().isEmpty()) {
      log.info("Resolved {} numeric filename prefixes: {}", context.mappings().size(), context.mappings());
    }
    return context.freeze();
  }

  public ExtractionOutcome extract(RawFile file, ExtractionMode mode, ExtractionContext context) {
    try {
      Optional<TagMatch> match = filenames.extract(file, context);
      if (match.isPresent()) {
        return ExtractionOutcome.matched(file, match.get());
      }

      if (mode == ExtractionMode.CONTENT_FALLBACK && textSource != null) {
        match = readTag(file);
        if (match.isPresent()) {
          log.debug("'{}' tagged from content -> {} ({})", file.filename(), match.get().tag(), match.get().confidence());
          return ExtractionOutcome.matched(file, match.get());
        }
        return fail(file, "no tag in filename or document text");
      }

      OptionalInt number = FilenameTagExtractor.numericPrefix(file.baseName().trim());
      if (number.isPresent()) {
        return fail(file, "numeric prefix " + number.getAsInt() + " is not linked to any equipment tag");
      }
      return fail(file, "no tag pattern matched the filename");
    } catch (RuntimeException e) {
      return fail(file, "tag extraction failed: " + e.getMessage());
    }
  }

  private Optional<TagMatch> readTag(RawFile file) {
    String text;
    try {
      text = textSource.extractText(file.path());
    } catch (IOException | RuntimeException e) {
      log.warn("Could not read text of '{}': {}", file.filename(), e.getMessage());
      return Optional.empty();
    }
    return content.extract(text, contentDocumentType(file), file.filename());
  }

  /** Content has no type text of its own; the filename minus any numeric prefix stands in. */
  static String contentDocumentType(RawFile file) {
    String baseName = file.baseName().trim();
    return FilenameTagExtractor.cleanType(baseName.replaceFirst("^\\d{1,9}_", ""));
  }

  private static ExtractionOutcome fail(RawFile file, String reason) {
    log.warn("No tag for '{}': {}", file.filename(), reason);
    return ExtractionOutcome.failed(file, reason);
  }
}
