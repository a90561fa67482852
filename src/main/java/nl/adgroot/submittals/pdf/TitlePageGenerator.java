package nl.adgroot.submittals.pdf;

import java.io.IOException;
import java.nio.file.Path;

/** Produces a one-page PDF announcing a section of the submittal. */
@FunctionalInterface
public interface TitlePageGenerator {

  Path generateTitlePage(String tag, String heading) throws IOException;
}
