package nl.adgroot.submittals.structure;

import nl.adgroot.submittals.classify.DocumentRole;
import nl.adgroot.submittals.tags.RawFile;
import nl.adgroot.submittals.tags.TagMatch;

/** Input of the structure builder: a file, its tag and its role. */
public record ClassifiedDocument(RawFile file, TagMatch match, DocumentRole role) {}
