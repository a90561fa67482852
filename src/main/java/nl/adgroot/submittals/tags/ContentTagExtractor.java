package nl.adgroot.submittals.tags;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a tag in the plain text of a document.
 *
 * <p>Labeled tags ({@code Unit Tag: AHU-10}, {@code Equipment ID: MAU-5}) take precedence over
 * bare tokens such as {@code RTU-3}. Bare tokens only count when their prefix is in the configured
 * equipment vocabulary. With several distinct tags the earliest one in the text is used.
 */
public class ContentTagExtractor {

  private static final Logger log = LoggerFactory.getLogger(ContentTagExtractor.class);

  public static final List<String> DEFAULT_PREFIXES = List.of(
      "AHU", "MAU", "EF", "RTU", "FCU", "VAV", "CAV", "OAHU", "WSHP", "DOAS", "BCU", "HP", "FC", "BC", "CH"
  );

  private static final Pattern LABELED = Pattern.compile(
      "(?:Unit\\s+Tag|Equipment\\s+ID)\\s*:\\s*([A-Za-z]{1,8})\\s*[-_]\\s*(\\d{1,9})(?!\\d)",
      Pattern.CASE_INSENSITIVE
  );

  private final Pattern bare;

  public ContentTagExtractor() {
    this(DEFAULT_PREFIXES);
  }

  public ContentTagExtractor(List<String> equipmentPrefixes) {
    if (equipmentPrefixes == null || equipmentPrefixes.isEmpty()) {
      throw new IllegalArgumentException("At least one equipment prefix is required");
    }
    // longest first so OAHU is tried before AHU
    String alternation = equipmentPrefixes.stream()
        .map(p -> p.trim().toUpperCase(Locale.ROOT))
        .filter(p -> !p.isEmpty())
        .distinct()
        .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
        .map(Pattern::quote)
        .collect(Collectors.joining("|"));
    this.bare = Pattern.compile("(?<![A-Za-z0-9])(" + alternation + ")[-_](\\d{1,9})(?!\\d)", Pattern.CASE_INSENSITIVE);
  }

  /**
   * @param text plain text of the document
   * @param documentType raw type to carry on the match (content has no type of its own)
   */
  public Optional<TagMatch> extract(String text, String documentType, String filename) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }

    List<String> labeled = findAll(LABELED, text);
    if (!labeled.isEmpty()) {
      warnIfAmbiguous(filename, labeled);
      return Optional.of(new TagMatch(labeled.get(0), documentType, TagMatch.LABELED_CONTENT, MatchSource.CONTENT));
    }

    List<String> tokens = findAll(bare, text);
    if (!tokens.isEmpty()) {
      warnIfAmbiguous(filename, tokens);
      return Optional.of(new TagMatch(tokens.get(0), documentType, TagMatch.BARE_CONTENT, MatchSource.CONTENT));
    }
    return Optional.empty();
  }

  /** All distinct tags in order of first appearance. */
  private static List<String> findAll(Pattern pattern, String text) {
    Set<String> tags = new LinkedHashSet<>();
    Matcher m = pattern.matcher(text);
    while (m.find()) {
      tags.add(EquipmentTag.of(m.group(1), m.group(2)).toString());
    }
    return new ArrayList<>(tags);
  }

  private static void warnIfAmbiguous(String filename, List<String> tags) {
    if (tags.size() > 1) {
      log.warn("'{}' mentions {} different tags {}; using the first one, {}", filename, tags.size(), tags, tags.get(0));
    }
  }
}
