package nl.adgroot.submittals.tags;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

/**
 * Normalized equipment identifier in {@code PREFIX-NUMBER} form.
 *
 * <p>The prefix is upper-cased and the number is re-rendered without leading zeros, so
 * {@code ahu-01}, {@code AHU_1} and {@code AHU-1} all become {@code AHU-1}.
 */
public record EquipmentTag(String prefix, int number) {

  /** Pseudo-tag carried by every cut-sheet file. */
  public static final String CUTSHEET = "CUTSHEET";

  private static final Pattern TAG = Pattern.compile("^\\s*([A-Za-z]{1,8})\\s*[-_]\\s*(\\d{1,9})\\s*$");

  public EquipmentTag {
    prefix = prefix.toUpperCase(Locale.ROOT);
    if (number < 0) {
      throw new IllegalArgumentException("Tag number must not be negative: " + number);
    }
  }

  public static EquipmentTag of(String prefix, String digits) {
    return new EquipmentTag(prefix, Integer.parseInt(digits));
  }

  /** Parses a raw tag such as {@code "mau_05"}; empty when the text is not a tag. */
  public static Optional<EquipmentTag> parse(String raw) {
    if (raw == null) return Optional.empty();
    Matcher m = TAG.matcher(raw);
    if (!m.matches()) return Optional.empty();
    return Optional.of(of(m.group(1), m.group(2)));
  }

  public static String normalize(String raw) {
    return parse(raw).map(EquipmentTag::toString).orElse(raw == null ? null : raw.trim().toUpperCase(Locale.ROOT));
  }

  @NotNull
  @Override
  public String toString() {
    return prefix + "-" + number;
  }
}
