package nl.adgroot.submittals.pdf;

import java.util.List;

/** Not a single page could be assembled, so there is no submittal to write. */
public class AssemblyFatalException extends RuntimeException {

  private final List<AssemblyWarning> warnings;

  public AssemblyFatalException(String message, List<AssemblyWarning> warnings) {
    super(message);
    this.warnings = List.copyOf(warnings);
  }

  public List<AssemblyWarning> getWarnings() {
    return warnings;
  }
}
