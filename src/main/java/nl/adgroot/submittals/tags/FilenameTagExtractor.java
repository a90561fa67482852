package nl.adgroot.submittals.tags;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a tag and document type in a filename.
 *
 * <p>Rules are tried in order and the first one that matches wins:
 * <ol>
 *   <li>explicit tag, separator, type: {@code AHU-10 - Technical Data Sheet}, {@code AHU_10_Fan_Curve}</li>
 *   <li>numeric prefix resolved through the {@link ExtractionContext}: {@code 10_Item Summary}</li>
 *   <li>cut-sheet prefix: {@code CS_Filter}, {@code CS - Damper}</li>
 * </ol>
 */
public class FilenameTagExtractor {

  private static final Logger log = LoggerFactory.getLogger(FilenameTagExtractor.class);

  // CS is never an equipment prefix: "CS_1_Louver" is a cut sheet, not tag CS-1
  static final Pattern EXPLICIT_TAG = Pattern.compile(
      "^(?!CS[-_\\s])([A-Za-z]{1,8})[-_](\\d{1,9})(?:(?:\\s*-\\s*|_-_|[_\\s]+)(.*))?$",
      Pattern.CASE_INSENSITIVE
  );

  static final Pattern NUMERIC_PREFIX = Pattern.compile("^(\\d{1,9})_(.*)$");

  static final Pattern CUT_SHEET = Pattern.compile("^CS(?:[-_\\s.].*)?$", Pattern.CASE_INSENSITIVE);

  // tag embedded anywhere, used while priming numeric prefixes: "10_AHU-10_Drawing"
  private static final Pattern EMBEDDED_TAG = Pattern.compile(
      "(?<![A-Za-z])([A-Za-z]{2,8})[-_](\\d{1,9})(?!\\d)"
  );

  /** One ordered filename rule. */
  interface FilenameRule {
    String name();

    Optional<TagMatch> apply(String baseName, ExtractionContext context);
  }

  private static final List<FilenameRule> RULES = List.of(
      new ExplicitTagRule(),
      new NumericPrefixRule(),
      new CutSheetRule()
  );

  public Optional<TagMatch> extract(RawFile file, ExtractionContext context) {
    String baseName = file.baseName().trim();
    for (FilenameRule rule : RULES) {
      Optional<TagMatch> match = rule.apply(baseName, context);
      if (match.isPresent()) {
        log.debug("'{}' matched rule {} -> {}", file.filename(), rule.name(), match.get().tag());
        return match;
      }
    }
    return Optional.empty();
  }

  /** The legacy numeric prefix of a filename, if it has one. */
  public static OptionalInt numericPrefix(String baseName) {
    Matcher m = NUMERIC_PREFIX.matcher(baseName);
    return m.matches() ? OptionalInt.of(Integer.parseInt(m.group(1))) : OptionalInt.empty();
  }

  /** Tag written after a numeric prefix, e.g. {@code 10_AHU-10_Drawing} gives {@code AHU-10}. */
  public static Optional<String> embeddedTag(String baseName) {
    Matcher prefix = NUMERIC_PREFIX.matcher(baseName);
    if (!prefix.matches()) return Optional.empty();
    Matcher m = EMBEDDED_TAG.matcher(prefix.group(2));
    if (!m.find() || m.group(1).equalsIgnoreCase("CS")) return Optional.empty();
    return Optional.of(EquipmentTag.of(m.group(1), m.group(2)).toString());
  }

  static String cleanType(String raw) {
    if (raw == null) return "";
    return raw.replace("_-_", " ").replace('_', ' ').replaceAll("\\s+", " ").trim();
  }

  private record ExplicitTagRule() implements FilenameRule {
    @Override
    public String name() {
      return "explicit-tag";
    }

    @Override
    public Optional<TagMatch> apply(String baseName, ExtractionContext context) {
      Matcher m = EXPLICIT_TAG.matcher(baseName);
      if (!m.matches()) return Optional.empty();
      String tag = EquipmentTag.of(m.group(1), m.group(2)).toString();
      return Optional.of(new TagMatch(tag, cleanType(m.group(3)), TagMatch.EXPLICIT_FILENAME, MatchSource.FILENAME));
    }
  }

  private record NumericPrefixRule() implements FilenameRule {
    @Override
    public String name() {
      return "numeric-prefix";
    }

    @Override
    public Optional<TagMatch> apply(String baseName, ExtractionContext context) {
      Matcher m = NUMERIC_PREFIX.matcher(baseName);
      if (!m.matches()) return Optional.empty();
      return context.resolve(Integer.parseInt(m.group(1)))
          .map(tag -> new TagMatch(tag, cleanType(m.group(2)), TagMatch.NUMERIC_PREFIX, MatchSource.FILENAME));
    }
  }

  private record CutSheetRule() implements FilenameRule {
    @Override
    public String name() {
      return "cut-sheet";
    }

    @Override
    public Optional<TagMatch> apply(String baseName, ExtractionContext context) {
      if (!CUT_SHEET.matcher(baseName).matches()) return Optional.empty();
      return Optional.of(new TagMatch(EquipmentTag.CUTSHEET, "cutsheet", TagMatch.EXPLICIT_FILENAME, MatchSource.FILENAME));
    }
  }
}
