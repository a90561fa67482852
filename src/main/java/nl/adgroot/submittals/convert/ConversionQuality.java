package nl.adgroot.submittals.convert;

import java.util.LinkedHashMap;
import java.util.Map;

/** Gotenberg PDF export presets, from small and quick to print quality. */
public enum ConversionQuality {
  FAST(80, 150, false, true),
  BALANCED(90, 300, false, false),
  HIGH(100, 600, true, false),
  MAXIMUM(100, 1200, true, false);

  private final int jpegQuality;
  private final int maxImageResolution;
  private final boolean losslessImageCompression;
  private final boolean reduceImageResolution;

  ConversionQuality(int jpegQuality, int maxImageResolution, boolean losslessImageCompression, boolean reduceImageResolution) {
    this.jpegQuality = jpegQuality;
    this.maxImageResolution = maxImageResolution;
    this.losslessImageCompression = losslessImageCompression;
    this.reduceImageResolution = reduceImageResolution;
  }

  /** Form fields sent along with the file to the LibreOffice route. */
  public Map<String, String> formFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("quality", String.valueOf(jpegQuality));
    fields.put("maxImageResolution", String.valueOf(maxImageResolution));
    fields.put("losslessImageCompression", String.valueOf(losslessImageCompression));
    fields.put("reduceImageResolution", String.valueOf(reduceImageResolution));
    return fields;
  }
}
