package nl.adgroot.submittals.structure;

/** A persisted structure that cannot be used as-is. */
public class StructureFormatException extends RuntimeException {

  public StructureFormatException(String message) {
    super(message);
  }

  public StructureFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
