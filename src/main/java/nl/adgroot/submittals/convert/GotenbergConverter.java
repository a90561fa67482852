package nl.adgroot.submittals.convert;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

import nl.adgroot.submittals.config.AppConfig;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts office documents and images to PDF through a Gotenberg service
 * ({@code POST /forms/libreoffice/convert}, one file per request).
 */
public class GotenbergConverter implements DocumentConverter {

  private static final Logger log = LoggerFactory.getLogger(GotenbergConverter.class);

  private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");
  private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);

  private final OkHttpClient http;
  private final String baseUrl;
  private final String url;
  private final ConversionQuality quality;

  public GotenbergConverter(AppConfig.ConversionConfig cfg) {
    this(cfg, defaultClient(cfg));
  }

  /** Injectable client for tests. */
  public GotenbergConverter(AppConfig.ConversionConfig cfg, OkHttpClient http) {
    this.http = http;
    this.baseUrl = stripTrailingSlash(cfg.gotenbergUrl);
    this.url = baseUrl + cfg.convertPath;
    this.quality = cfg.quality == null ? ConversionQuality.HIGH : cfg.quality;
  }

  private static OkHttpClient defaultClient(AppConfig.ConversionConfig cfg) {
    Duration t = Duration.ofSeconds(cfg.timeoutSeconds);
    return new OkHttpClient.Builder()
        .connectTimeout(Duration.ofSeconds(Math.min(30, cfg.timeoutSeconds)))
        .readTimeout(t)
        .writeTimeout(t)
        .callTimeout(t)
        .build();
  }

  @Override
  public Path convert(Path source, Path targetDir) throws DocumentConversionException {
    String filename = source.getFileName().toString();

    MultipartBody.Builder form = new MultipartBody.Builder()
        .setType(MultipartBody.FORM)
        .addFormDataPart("files", filename, RequestBody.create(source.toFile(), OCTET_STREAM));
    quality.formFields().forEach(form::addFormDataPart);
    RequestBody body = form.build();

    Request request = new Request.Builder()
        .url(url)
        .post(body)
        .build();

    Path target = targetDir.resolve(pdfName(filename));

    try (Response r = http.newCall(request).execute()) {
      if (!r.isSuccessful()) {
        throw new DocumentConversionException(
            "Gotenberg error for " + filename + ": " + r.code() + " " + r.message() + "\n" + readBodySafely(r.body()));
      }
      ResponseBody responseBody = r.body();
      if (responseBody == null) {
        throw new DocumentConversionException("Gotenberg returned no body for " + filename);
      }

      Files.createDirectories(targetDir);
      try (InputStream in = responseBody.byteStream()) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (DocumentConversionException e) {
      throw e;
    } catch (IOException e) {
      throw new DocumentConversionException("Could not convert " + filename + ": " + e.getMessage(), e);
    }

    if (!isPdf(target)) {
      throw new DocumentConversionException("Gotenberg response for " + filename + " is not a PDF");
    }
    return target;
  }

  /** {@code GET /health}; false when the service is down or unreachable. */
  @Override
  public boolean isAvailable() {
    Request request = new Request.Builder()
        .url(baseUrl + "/health")
        .get()
        .build();
    OkHttpClient healthClient = http.newBuilder().callTimeout(HEALTH_TIMEOUT).build();

    try (Response r = healthClient.newCall(request).execute()) {
      if (!r.isSuccessful()) {
        log.warn("Gotenberg at {} is unhealthy: {} {}", baseUrl, r.code(), r.message());
        return false;
      }
      return true;
    } catch (IOException e) {
      log.warn("Gotenberg at {} is unreachable: {}", baseUrl, e.getMessage());
      return false;
    }
  }

  // "AHU-1 - Drawing.docx" -> "AHU-1 - Drawing_docx.pdf", so a .jpg and a .docx of the same name don't collide
  static String pdfName(String filename) {
    int dot = filename.lastIndexOf('.');
    if (dot <= 0) return filename + ".pdf";
    return filename.substring(0, dot) + "_" + filename.substring(dot + 1) + ".pdf";
  }

  private static boolean isPdf(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      byte[] head = in.readNBytes(5);
      return new String(head, java.nio.charset.StandardCharsets.US_ASCII).equals("%PDF-");
    } catch (IOException e) {
      return false;
    }
  }

  private static String readBodySafely(ResponseBody body) {
    if (body == null) return "";
    try {
      return body.string();
    } catch (IOException ignored) {
      return "";
    }
  }

  private static String stripTrailingSlash(String s) {
    return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }

  public String getUrl() {
    return url;
  }

  public ConversionQuality getQuality() {
    return quality;
  }
}
