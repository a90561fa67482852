package nl.adgroot.submittals.convert;

import java.io.IOException;

/** Conversion of a single document failed; other documents are unaffected. */
public class DocumentConversionException extends IOException {

  public DocumentConversionException(String message) {
    super(message);
  }

  public DocumentConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
