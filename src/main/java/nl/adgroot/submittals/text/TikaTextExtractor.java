package nl.adgroot.submittals.text;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.tika.exception.TikaException;
import org.apache.tika.exception.WriteLimitReachedException;
import org.apache.tika.extractor.EmbeddedDocumentExtractor;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

/**
 * Text of office documents (.doc, .docx) and plain text files through Tika.
 *
 * <p>Only the first {@code maxChars} characters are kept; tags sit near the top of a data sheet.
 */
public class TikaTextExtractor implements TextSource {

  public static final int DEFAULT_MAX_CHARS = 100_000;

  private final AutoDetectParser parser = new AutoDetectParser();
  private final int maxChars;

  public TikaTextExtractor() {
    this(DEFAULT_MAX_CHARS);
  }

  public TikaTextExtractor(int maxChars) {
    this.maxChars = maxChars;
  }

  @Override
  public String extractText(Path path) throws IOException {
    Metadata md = new Metadata();
    md.set(TikaCoreProperties.RESOURCE_NAME_KEY, path.getFileName().toString());

    BodyContentHandler handler = new BodyContentHandler(maxChars);
    ParseContext ctx = new ParseContext();
    ctx.set(EmbeddedDocumentExtractor.class, new SkipEmbedded());

    try (InputStream is = Files.newInputStream(path)) {
      parser.parse(is, handler, md, ctx);
    } catch (SAXException sax) {
      // hitting the write limit still leaves the text read so far in the handler
      if (!WriteLimitReachedException.isWriteLimitReached(sax)) {
        throw new IOException("Could not read text of " + path.getFileName(), sax);
      }
    } catch (TikaException e) {
      if (WriteLimitReachedException.isWriteLimitReached(e)) {
        return handler.toString();
      }
      throw new IOException("Could not read text of " + path.getFileName(), e);
    }
    return handler.toString();
  }

  private static final class SkipEmbedded implements EmbeddedDocumentExtractor {
    @Override
    public boolean shouldParseEmbedded(Metadata metadata) {
      return false;
    }

    @Override
    public void parseEmbedded(InputStream stream, ContentHandler handler, Metadata metadata, boolean outputHtml) {
      // embedded objects (logos, OLE drawings) carry no tag text
    }
  }
}
