package nl.adgroot.submittals.structure;

import nl.adgroot.submittals.classify.DocumentRole;
import nl.adgroot.submittals.tags.MatchSource;
import nl.adgroot.submittals.tags.RawFile;

/** One document inside a group. */
public record DocumentEntry(
    RawFile file,
    DocumentRole role,
    String documentType,
    double confidence,
    MatchSource source
) {

  static DocumentEntry of(ClassifiedDocument doc) {
    return new DocumentEntry(
        doc.file(),
        doc.role(),
        doc.match().documentType(),
        doc.match().confidence(),
        doc.match().source()
    );
  }

  public String filename() {
    return file.filename();
  }
}
