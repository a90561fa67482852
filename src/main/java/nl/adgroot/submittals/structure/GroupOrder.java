package nl.adgroot.submittals.structure;

import java.util.Comparator;
import java.util.Optional;

import nl.adgroot.submittals.tags.EquipmentTag;

/**
 * Order of equipment groups: every MAU group comes first, then all other prefixes together.
 * Inside a tier groups go by number; equal numbers (AHU-1, EF-1) fall back to the prefix.
 */
public final class GroupOrder {

  public static final String FIRST_TIER_PREFIX = "MAU";

  public static final Comparator<String> TAGS = Comparator
      .comparingInt(GroupOrder::tier)
      .thenComparingLong(GroupOrder::number)
      .thenComparing(GroupOrder::prefix)
      .thenComparing(Comparator.naturalOrder());

  private GroupOrder() {
    // utility class
  }

  public static int tier(String tag) {
    return parse(tag).map(t -> t.prefix().equals(FIRST_TIER_PREFIX) ? 0 : 1).orElse(1);
  }

  // unparseable tags sort after every numbered tag of their tier
  private static long number(String tag) {
    return parse(tag).map(t -> (long) t.number()).orElse(Long.MAX_VALUE);
  }

  private static String prefix(String tag) {
    return parse(tag).map(EquipmentTag::prefix).orElse(tag);
  }

  private static Optional<EquipmentTag> parse(String tag) {
    return EquipmentTag.parse(tag);
  }
}
