package nl.adgroot.submittals.classify;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import nl.adgroot.submittals.tags.EquipmentTag;
import nl.adgroot.submittals.tags.TagMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a raw document type to a {@link DocumentRole}.
 *
 * <p>The rule table is checked top to bottom and the first hit wins, so a type that mentions both
 * "drawing" and "specification" is a {@link DocumentRole#DRAWING}. The {@code CUTSHEET} tag
 * forces {@link DocumentRole#CUTSHEET} whatever the type says.
 */
public class DocumentClassifier {

  private static final Logger log = LoggerFactory.getLogger(DocumentClassifier.class);

  public static final List<ClassificationRule> DEFAULT_RULES = List.of(
      new ClassificationRule("technical data", DocumentRole.TECHNICAL_DATA),
      new ClassificationRule("fan curve", DocumentRole.FAN_CURVE),
      new ClassificationRule("drawing", DocumentRole.DRAWING),
      new ClassificationRule("item summary", DocumentRole.ITEM_SUMMARY),
      new ClassificationRule("specification", DocumentRole.SPECIFICATION),
      // synonyms seen in supplier file names
      new ClassificationRule("tech data", DocumentRole.TECHNICAL_DATA),
      new ClassificationRule("data sheet", DocumentRole.TECHNICAL_DATA),
      new ClassificationRule("curve", DocumentRole.FAN_CURVE),
      new ClassificationRule("dwg", DocumentRole.DRAWING)
  );

  private final List<ClassificationRule> rules;

  public DocumentClassifier() {
    this(DEFAULT_RULES);
  }

  public DocumentClassifier(List<ClassificationRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public DocumentRole classify(TagMatch match) {
    if (EquipmentTag.CUTSHEET.equals(match.tag())) {
      return DocumentRole.CUTSHEET;
    }
    return classify(match.documentType());
  }

  public DocumentRole classify(String documentType) {
    if (documentType == null || documentType.isBlank()) {
      return DocumentRole.UNKNOWN;
    }
    String normalized = documentType.toLowerCase(Locale.ROOT).replace('_', ' ').replaceAll("\\s+", " ");

    DocumentRole first = null;
    Set<DocumentRole> hits = new LinkedHashSet<>();
    for (ClassificationRule rule : rules) {
      if (rule.matches(normalized)) {
        if (first == null) first = rule.role();
        hits.add(rule.role());
      }
    }

    if (first == null) {
      return DocumentRole.UNKNOWN;
    }
    if (hits.size() > 1) {
      log.warn("Type '{}' matches roles {}; first rule wins -> {}", documentType, hits, first);
    }
    return first;
  }

  public List<ClassificationRule> rules() {
    return rules;
  }
}
