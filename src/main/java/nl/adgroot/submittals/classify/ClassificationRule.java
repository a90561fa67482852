package nl.adgroot.submittals.classify;

import java.util.Locale;

/** Case-insensitive substring rule: a type containing {@code keyword} gets {@code role}. */
public record ClassificationRule(String keyword, DocumentRole role) {

  public ClassificationRule {
    keyword = keyword.toLowerCase(Locale.ROOT);
  }

  public boolean matches(String normalizedType) {
    return normalizedType.contains(keyword);
  }
}
