package nl.adgroot.submittals.convert;

import static org.junit.jupiter.api.Assertions.*;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import nl.adgroot.submittals.config.AppConfig;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GotenbergConverterTest {

  private static final MediaType PDF = MediaType.parse("application/pdf");

  @TempDir
  Path dir;

  private final AtomicReference<Request> lastRequest = new AtomicReference<>();

  private OkHttpClient respondingWith(int code, String body) {
    return new OkHttpClient.Builder()
        .addInterceptor(chain -> {
          lastRequest.set(chain.request());
          return new Response.Builder()
              .request(chain.request())
              .protocol(Protocol.HTTP_1_1)
              .code(code)
              .message(code == 200 ? "OK" : "Error")
              .body(ResponseBody.create(body.getBytes(StandardCharsets.US_ASCII), PDF))
              .build();
        })
        .build();
  }

  private static AppConfig.ConversionConfig config() {
    AppConfig.ConversionConfig cfg = new AppConfig.ConversionConfig();
    cfg.gotenbergUrl = "http://gotenberg:3000/";
    return cfg;
  }

  @Test
  void postsTheFileAndWritesThePdf() throws Exception {
    Path source = Files.writeString(dir.resolve("AHU-1 - Item Summary.docx"), "docx bytes");
    GotenbergConverter converter = new GotenbergConverter(config(), respondingWith(200, "%PDF-1.7 fake"));

    Path pdf = converter.convert(source, dir.resolve("converted"));

    assertEquals("AHU-1 - Item Summary_docx.pdf", pdf.getFileName().toString());
    assertTrue(Files.readString(pdf).startsWith("%PDF-"));

    Request request = lastRequest.get();
    assertEquals("http://gotenberg:3000/forms/libreoffice/convert", request.url().toString());
    assertEquals("POST", request.method());
    MultipartBody body = (MultipartBody) request.body();
    assertNotNull(body);
    assertEquals(5, body.size());
    String disposition = body.part(0).headers().get("Content-Disposition");
    assertTrue(disposition.contains("name=\"files\""), disposition);
  }

  @Test
  void qualityPresetIsSentAsFormFields() throws Exception {
    // GIVEN
    Path source = Files.writeString(dir.resolve("EF-1 - Drawing.jpg"), "jpg bytes");
    AppConfig.ConversionConfig cfg = config();
    cfg.quality = ConversionQuality.FAST;
    GotenbergConverter converter = new GotenbergConverter(cfg, respondingWith(200, "%PDF-1.7 fake"));

    // WHEN
    converter.convert(source, dir.resolve("converted"));

    // THEN
    MultipartBody body = (MultipartBody) lastRequest.get().body();
    assertNotNull(body);
    assertEquals("80", fieldValue(body, "quality"));
    assertEquals("150", fieldValue(body, "maxImageResolution"));
    assertEquals("false", fieldValue(body, "losslessImageCompression"));
    assertEquals("true", fieldValue(body, "reduceImageResolution"));
  }

  @Test
  void defaultPresetIsHigh() {
    GotenbergConverter converter = new GotenbergConverter(config(), respondingWith(200, ""));

    assertEquals(ConversionQuality.HIGH, converter.getQuality());
    assertEquals("600", ConversionQuality.HIGH.formFields().get("maxImageResolution"));
  }

  @Test
  void healthyServiceIsAvailable() {
    GotenbergConverter converter = new GotenbergConverter(config(), respondingWith(200, "{\"status\":\"up\"}"));

    assertTrue(converter.isAvailable());
    assertEquals("http://gotenberg:3000/health", lastRequest.get().url().toString());
    assertEquals("GET", lastRequest.get().method());
  }

  @Test
  void unhealthyServiceIsNotAvailable() {
    GotenbergConverter converter = new GotenbergConverter(config(), respondingWith(503, "down"));

    assertFalse(converter.isAvailable());
  }

  @Test
  void unreachableServiceIsNotAvailable() {
    OkHttpClient refusing = new OkHttpClient.Builder()
        .addInterceptor(chain -> {
          throw new ConnectException("Connection refused");
        })
        .build();
    GotenbergConverter converter = new GotenbergConverter(config(), refusing);

    assertFalse(converter.isAvailable());
  }

  private static String fieldValue(MultipartBody body, String name) throws Exception {
    for (MultipartBody.Part part : body.parts()) {
      String disposition = part.headers().get("Content-Disposition");
      if (disposition != null && disposition.contains("name=\"" + name + "\"")) {
        Buffer buffer = new Buffer();
        part.body().writeTo(buffer);
        return buffer.readUtf8();
      }
    }
    return null;
  }

  @Test
  void httpErrorBecomesConversionException() throws Exception {
    Path source = Files.writeString(dir.resolve("broken.docx"), "x");
    GotenbergConverter converter = new GotenbergConverter(config(), respondingWith(500, "LibreOffice failed"));

    DocumentConversionException e = assertThrows(DocumentConversionException.class,
        () -> converter.convert(source, dir));

    assertTrue(e.getMessage().contains("500"), e.getMessage());
    assertTrue(e.getMessage().contains("LibreOffice failed"), e.getMessage());
  }

  @Test
  void nonPdfResponseIsRejected() throws Exception {
    Path source = Files.writeString(dir.resolve("photo.jpg"), "x");
    GotenbergConverter converter = new GotenbergConverter(config(), respondingWith(200, "<html>oops</html>"));

    assertThrows(DocumentConversionException.class, () -> converter.convert(source, dir));
  }

  @Test
  void pdfNameKeepsTheOriginalExtension() {
    assertEquals("Drawing_jpg.pdf", GotenbergConverter.pdfName("Drawing.jpg"));
    assertEquals("Drawing_docx.pdf", GotenbergConverter.pdfName("Drawing.docx"));
    assertEquals("README.pdf", GotenbergConverter.pdfName("README"));
  }
}
