package nl.adgroot.submittals.tags;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Numeric-prefix to tag mapping for one run (legacy names like {@code 10_Item Summary.docx}).
 *
 * <p>Filled by a single sequential pass, then frozen before extraction fans out over threads.
 * The first registration of a number wins.
 */
public final class ExtractionContext {

  private final Map<Integer, String> tagsByNumber = new LinkedHashMap<>();
  private volatile boolean frozen;

  public boolean register(int number, String tag) {
    if (frozen) {
      throw new IllegalStateException("Extraction context is frozen");
    }
    return tagsByNumber.putIfAbsent(number, tag) == null;
  }

  public Optional<String> resolve(int number) {
    return Optional.ofNullable(tagsByNumber.get(number));
  }

  public ExtractionContext freeze() {
    frozen = true;
    return this;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public Map<Integer, String> mappings() {
    return Collections.unmodifiableMap(tagsByNumber);
  }
}
