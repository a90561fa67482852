package nl.adgroot.submittals.config;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import nl.adgroot.submittals.convert.ConversionQuality;
import nl.adgroot.submittals.tags.ContentTagExtractor;
import nl.adgroot.submittals.tags.ExtractionMode;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public ExtractionConfig extraction = new ExtractionConfig();
  public ConversionConfig conversion = new ConversionConfig();
  public TitlePageConfig titlePages = new TitlePageConfig();
  public AssemblyConfig assembly = new AssemblyConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ExtractionConfig {
    public ExtractionMode mode = ExtractionMode.FILENAME;

    // bare tags in document text only count for these prefixes
    public List<String> equipmentPrefixes = new ArrayList<>(ContentTagExtractor.DEFAULT_PREFIXES);

    public List<String> supportedExtensions = new ArrayList<>(List.of(".pdf", ".doc", ".docx", ".jpg", ".jpeg", ".png"));

    // per-file extraction runs on this many threads
    public int threads = 4;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ConversionConfig {
    public String gotenbergUrl = "http://localhost:3000";
    public String convertPath = "/forms/libreoffice/convert";
    public int timeoutSeconds = 300;
    public ConversionQuality quality = ConversionQuality.HIGH;

    // max documents converted at the same time
    public int concurrency = 3;

    public String outputDir = "converted_pdfs";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TitlePageConfig {
    public String outputDir = "title_pages";
    public float fontSize = 48f;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class AssemblyConfig {
    public boolean filterPricing = true;
    public boolean writeManifest = true;
  }
}
