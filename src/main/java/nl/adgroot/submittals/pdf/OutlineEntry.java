package nl.adgroot.submittals.pdf;

import java.util.List;

/** A bookmark as written to the output; {@code page} is one based. */
public record OutlineEntry(String title, int page, List<OutlineEntry> children) {

  public OutlineEntry {
    children = List.copyOf(children);
  }
}
