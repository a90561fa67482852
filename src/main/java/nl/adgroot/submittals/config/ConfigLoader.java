package nl.adgroot.submittals.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import nl.adgroot.submittals.tags.ExtractionMode;

/**
 * Loads {@link AppConfig} from JSON, then applies {@code SUBMITTALS_*} environment overrides.
 */
public final class ConfigLoader {

  public static final String DEFAULT_RESOURCE = "/config.json";

  static final String ENV_GOTENBERG_URL = "SUBMITTALS_GOTENBERG_URL";
  static final String ENV_CONVERSION_CONCURRENCY = "SUBMITTALS_CONVERSION_CONCURRENCY";
  static final String ENV_FILTER_PRICING = "SUBMITTALS_FILTER_PRICING";
  static final String ENV_EXTRACTION_MODE = "SUBMITTALS_EXTRACTION_MODE";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ConfigLoader() {
    // utility class
  }

  public static AppConfig load(Path configPath) {
    try (InputStream is = Files.newInputStream(configPath)) {
      return applyEnvironment(read(is), System.getenv());
    } catch (IOException e) {
      throw new ConfigurationException("Could not read config " + configPath, e);
    }
  }

  /** Bundled {@code config.json}; plain defaults when the resource is absent. */
  public static AppConfig loadDefault() {
    try (InputStream is = ConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      AppConfig cfg = is == null ? new AppConfig() : read(is);
      return applyEnvironment(cfg, System.getenv());
    } catch (IOException e) {
      throw new ConfigurationException("Could not read bundled config " + DEFAULT_RESOURCE, e);
    }
  }

  static AppConfig read(InputStream is) throws IOException {
    AppConfig cfg = MAPPER.readValue(is, AppConfig.class);
    validate(cfg);
    return cfg;
  }

  static AppConfig applyEnvironment(AppConfig cfg, Map<String, String> env) {
    String url = env.get(ENV_GOTENBERG_URL);
    if (url != null && !url.isBlank()) {
      cfg.conversion.gotenbergUrl = url.trim();
    }

    String concurrency = env.get(ENV_CONVERSION_CONCURRENCY);
    if (concurrency != null && !concurrency.isBlank()) {
      try {
        cfg.conversion.concurrency = Integer.parseInt(concurrency.trim());
      } catch (NumberFormatException e) {
        throw new ConfigurationException(ENV_CONVERSION_CONCURRENCY + " is not a number: " + concurrency, e);
      }
    }

    String filter = env.get(ENV_FILTER_PRICING);
    if (filter != null && !filter.isBlank()) {
      cfg.assembly.filterPricing = Boolean.parseBoolean(filter.trim());
    }

    String mode = env.get(ENV_EXTRACTION_MODE);
    if (mode != null && !mode.isBlank()) {
      try {
        cfg.extraction.mode = ExtractionMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Unknown extraction mode: " + mode, e);
      }
    }

    validate(cfg);
    return cfg;
  }

  static void validate(AppConfig cfg) {
    if (cfg.conversion.concurrency < 1) {
      throw new ConfigurationException("conversion.concurrency must be at least 1");
    }
    if (cfg.extraction.threads < 1) {
      throw new ConfigurationException("extraction.threads must be at least 1");
    }
    if (cfg.extraction.equipmentPrefixes == null || cfg.extraction.equipmentPrefixes.isEmpty()) {
      throw new ConfigurationException("extraction.equipmentPrefixes must not be empty");
    }
    if (cfg.extraction.mode == null) {
      throw new ConfigurationException("extraction.mode must be set");
    }
  }
}
