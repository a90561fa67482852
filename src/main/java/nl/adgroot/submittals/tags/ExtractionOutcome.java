package nl.adgroot.submittals.tags;

/** Result of extracting one file: exactly one of {@code match} and {@code failure} is set. */
public record ExtractionOutcome(RawFile file, TagMatch match, ExtractionFailure failure) {

  public static ExtractionOutcome matched(RawFile file, TagMatch match) {
    return new ExtractionOutcome(file, match, null);
  }

  public static ExtractionOutcome failed(RawFile file, String reason) {
    return new ExtractionOutcome(file, null, new ExtractionFailure(file.filename(), reason));
  }

  public boolean isMatched() {
    return match != null;
  }
}
